/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package co.layertrace.apm.agent.converter;

import co.layertrace.apm.agent.impl.layer.Layer;
import co.layertrace.apm.agent.impl.request.TrackedRequest;
import co.layertrace.apm.agent.metrics.MetricMeta;
import co.layertrace.apm.agent.metrics.MetricStats;
import co.layertrace.apm.agent.policy.SlowRequestPolicy;
import co.layertrace.apm.agent.report.SlowTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts a web request into a detailed {@link SlowTransaction}.
 * <p>
 * The score is computed when the converter is created, so that the store can decide whether the request is interesting
 * enough without paying for the conversion.
 * </p>
 */
public class SlowRequestConverter extends ConverterBase {

    /**
     * The score of requests which are not web requests, so that they never displace a web request
     */
    public static final double NON_WEB_SCORE = -1;
    private static final Logger logger = LoggerFactory.getLogger(SlowRequestConverter.class);

    private final SlowRequestPolicy slowRequestPolicy;
    private final double score;

    public SlowRequestConverter(TrackedRequest request) {
        super(request);
        this.slowRequestPolicy = request.getTracer().getSlowRequestPolicy();
        this.score = request.isWeb() ? slowRequestPolicy.score(request) : NON_WEB_SCORE;
    }

    public String getName() {
        return request.getUniqueName();
    }

    public double getScore() {
        return score;
    }

    /**
     * Unconditionally converts the request.
     *
     * @return the slow transaction, or {@code null} if the request has no scope layer or its URI matches an
     * {@link co.layertrace.apm.agent.configuration.CoreConfiguration#IGNORE_TRACES ignore_traces} pattern
     */
    @Nullable
    public SlowTransaction call() {
        final Layer scope = getScopeLayer();
        if (scope == null || rootLayer == null) {
            return null;
        }
        slowRequestPolicy.stored(request);

        final Object uriAnnotation = request.getAnnotations().get(TrackedRequest.ANNOTATION_URI);
        final String uri = uriAnnotation != null ? uriAnnotation.toString() : "";
        for (Pattern pattern : request.getTracer().getCoreConfiguration().getIgnoreTracePatterns()) {
            if (pattern.matcher(uri).find()) {
                logger.debug("Skipped recording a trace for {} due to ignore_traces pattern: {}", uri, pattern);
                return null;
            }
        }

        final Map<MetricMeta, MetricStats> metrics = createMetrics(scope, true);
        return new SlowTransaction(uri,
            scope.getLegacyMetricName(),
            rootLayer.getTotalCallTime(),
            metrics,
            request.getContext(),
            rootLayer.getStopTimestamp(),
            Collections.emptyList(),
            score);
    }
}
