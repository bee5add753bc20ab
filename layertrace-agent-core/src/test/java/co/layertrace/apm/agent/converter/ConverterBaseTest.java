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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConverterBaseTest {

    private TrackedRequest request;

    @BeforeEach
    void setUp() {
        request = MockTracer.createTracer(new MockClock(), new MockStore()).newRequest();
    }

    @Test
    void testControllerIsPreferredOverEarlierJob() {
        request.startLayer(Layer.TYPE_JOB, "Import");
        Layer controller = request.startLayer(Layer.TYPE_CONTROLLER, "Imports#create");
        request.stopLayer();
        request.stopLayer();

        assertThat(new ConverterBase(request).getScopeLayer()).isSameAs(controller);
    }

    @Test
    void testOuterControllerWins() {
        Layer outer = request.startLayer(Layer.TYPE_CONTROLLER, "Users#index");
        request.startLayer(Layer.TYPE_CONTROLLER, "Users#show");
        request.stopLayer();
        request.stopLayer();

        assertThat(new ConverterBase(request).getScopeLayer()).isSameAs(outer);
    }

    @Test
    void testJobIsScopeWithoutController() {
        request.startLayer(Layer.TYPE_QUEUE, "default");
        Layer job = request.startLayer(Layer.TYPE_JOB, "Import");
        request.stopLayer();
        request.stopLayer();

        assertThat(new ConverterBase(request).getScopeLayer()).isSameAs(job);
    }

    @Test
    void testNoScopeLayer() {
        request.startLayer("Custom", "work");
        request.stopLayer();

        assertThat(new ConverterBase(request).getScopeLayer()).isNull();
        assertThat(new MetricConverter(request).call()).isEmpty();
        assertThat(new ErrorConverter(request).call()).isEmpty();
    }

    @Test
    void testEmptyRequest() {
        assertThat(new ConverterBase(request).getScopeLayer()).isNull();
        assertThat(new MetricConverter(request).call()).isEmpty();
    }
}
