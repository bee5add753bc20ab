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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Measures how long a web request waited between a front end proxy and the application,
 * based on the timestamp the proxy put into the {@code X-Queue-Start} or {@code X-Request-Start} header.
 */
public class RequestQueueTimeConverter extends ConverterBase {

    public static final String METRIC_NAME = "QueueTime/Request";
    static final List<String> HEADERS = Arrays.asList("X-Queue-Start", "X-Request-Start");

    private static final Logger logger = LoggerFactory.getLogger(RequestQueueTimeConverter.class);
    private static final int EPOCH_SECONDS_DIGITS = 10;

    public RequestQueueTimeConverter(TrackedRequest request) {
        super(request);
    }

    public Map<MetricMeta, MetricStats> call() {
        final Map<String, String> headers = request.getHeaders();
        final Layer scope = getScopeLayer();
        if (headers == null || scope == null || rootLayer == null) {
            return Collections.emptyMap();
        }
        final String rawStart = locateTimestamp(headers);
        if (rawStart == null) {
            return Collections.emptyMap();
        }
        final long queueStart = parse(rawStart);
        if (queueStart < 0) {
            return Collections.emptyMap();
        }
        final long queueTime = rootLayer.getStartTimestamp() - queueStart;
        if (queueTime < 0) {
            logger.debug("Ignoring queue start {} which is after the start of {}", rawStart, rootLayer);
            return Collections.emptyMap();
        }
        return Collections.singletonMap(new MetricMeta(METRIC_NAME, scope.getLegacyMetricName()), new MetricStats(true).update(queueTime));
    }

    /**
     * @return the header value without the {@code t=} prefix and the decimal point, or {@code null}
     */
    @Nullable
    static String locateTimestamp(Map<String, String> headers) {
        for (String header : HEADERS) {
            final String value = headers.get(header);
            if (value != null) {
                return value.trim().replace("t=", "").replace(".", "");
            }
        }
        return null;
    }

    /**
     * Parses a timestamp of which the first ten digits are seconds since epoch and the remaining digits are the fraction.
     *
     * @return the timestamp in µs since epoch, or {@code -1} if it can't be parsed
     */
    static long parse(String digits) {
        if (digits.length() < EPOCH_SECONDS_DIGITS) {
            logger.debug("Queue start '{}' is too short", digits);
            return -1;
        }
        try {
            final double seconds = Double.parseDouble(digits.substring(0, EPOCH_SECONDS_DIGITS) + "." + digits.substring(EPOCH_SECONDS_DIGITS));
            return Math.round(seconds * 1_000_000);
        } catch (NumberFormatException e) {
            logger.debug("Unable to parse queue start '{}'", digits);
            return -1;
        }
    }
}
