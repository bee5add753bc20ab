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

import co.layertrace.apm.agent.MockClock;
import co.layertrace.apm.agent.MockStore;
import co.layertrace.apm.agent.MockTracer;
import co.layertrace.apm.agent.impl.layer.Layer;
import co.layertrace.apm.agent.impl.request.TrackedRequest;
import co.layertrace.apm.agent.metrics.MetricMeta;
import co.layertrace.apm.agent.metrics.MetricStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorConverterTest {

    private MockStore store;
    private TrackedRequest request;

    @BeforeEach
    void setUp() {
        store = new MockStore();
        request = MockTracer.createTracer(new MockClock(), store).newRequest();
        request.web();
    }

    @Test
    void testErroredRequest() {
        request.startLayer(Layer.TYPE_CONTROLLER, "Users#index");
        request.error();
        request.stopLayer();

        Map<MetricMeta, MetricStats> errors = new ErrorConverter(request).call();

        assertThat(errors).containsOnlyKeys(new MetricMeta("Errors/Controller/Users#index"));
        MetricStats stats = errors.values().iterator().next();
        assertThat(stats.getCallCount()).isEqualTo(1);
        assertThat(stats.isScoped()).isFalse();
        assertThat(store.getMetrics()).containsKey(new MetricMeta("Errors/Controller/Users#index"));
    }

    @Test
    void testSuccessfulRequest() {
        request.startLayer(Layer.TYPE_CONTROLLER, "Users#index");
        request.stopLayer();

        assertThat(new ErrorConverter(request).call()).isEmpty();
    }
}
