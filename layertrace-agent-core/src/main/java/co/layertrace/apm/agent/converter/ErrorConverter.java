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

import java.util.Collections;
import java.util.Map;

/**
 * Counts the request as an error of its scope layer, if it has been {@link TrackedRequest#error() marked} as errored.
 */
public class ErrorConverter extends ConverterBase {

    public static final String ERRORS_PREFIX = "Errors/";

    public ErrorConverter(TrackedRequest request) {
        super(request);
    }

    public Map<MetricMeta, MetricStats> call() {
        final Layer scope = getScopeLayer();
        if (scope == null || !request.isError()) {
            return Collections.emptyMap();
        }
        return Collections.singletonMap(new MetricMeta(ERRORS_PREFIX + scope.getLegacyMetricName()), new MetricStats(false).update(1));
    }
}
