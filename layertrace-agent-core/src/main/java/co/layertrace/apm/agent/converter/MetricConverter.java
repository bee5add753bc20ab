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
 * Converts a request into the metrics which are aggregated across all requests.
 */
public class MetricConverter extends ConverterBase {

    public MetricConverter(TrackedRequest request) {
        super(request);
    }

    /**
     * @return the metrics, empty if the request has no scope layer
     */
    public Map<MetricMeta, MetricStats> call() {
        final Layer scope = getScopeLayer();
        // TODO: track requests that never reach a controller, like those answered by a servlet filter
        if (scope == null) {
            return Collections.emptyMap();
        }
        return createMetrics(scope, false);
    }
}
