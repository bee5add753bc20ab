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
import co.layertrace.apm.agent.configuration.CoreConfiguration;
import co.layertrace.apm.agent.configuration.SpyConfiguration;
import co.layertrace.apm.agent.configuration.converter.RegexListValueConverter;
import co.layertrace.apm.agent.impl.LayerTracer;
import co.layertrace.apm.agent.impl.LayerTracerBuilder;
import co.layertrace.apm.agent.impl.layer.Layer;
import co.layertrace.apm.agent.impl.request.TrackedRequest;
import co.layertrace.apm.agent.metrics.MetricMeta;
import co.layertrace.apm.agent.policy.DurationSlowRequestPolicy;
import co.layertrace.apm.agent.policy.SlowRequestPolicy;
import co.layertrace.apm.agent.report.SlowTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.ConfigurationRegistry;

import java.util.Collections;
import java.util.regex.Pattern;

import static co.layertrace.apm.agent.converter.LayerMetricsAggregatorTest.backtrace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class SlowRequestConverterTest {

    private ConfigurationRegistry config;
    private MockClock clock;
    private MockStore store;
    private SlowRequestPolicy slowRequestPolicy;
    private LayerTracer tracer;

    @BeforeEach
    void setUp() {
        config = SpyConfiguration.createSpyConfig();
        clock = new MockClock(1_500_000_000_000_000L);
        store = new MockStore();
        slowRequestPolicy = spy(new DurationSlowRequestPolicy());
        tracer = new LayerTracerBuilder()
            .configurationRegistry(config)
            .clock(clock)
            .store(store)
            .slowRequestPolicy(slowRequestPolicy)
            .build();
    }

    @Test
    void testSlowTransaction() {
        TrackedRequest request = webRequest("/users?page=2");

        SlowRequestConverter converter = store.getSlowTransactions().get(0);
        assertThat(converter.getName()).isEqualTo("Controller/Users#index");
        assertThat(converter.getScore()).isEqualTo(250.0);
        verify(slowRequestPolicy, never()).stored(request);

        SlowTransaction slowTransaction = converter.call();

        verify(slowRequestPolicy).stored(request);
        assertThat(slowTransaction).isNotNull();
        assertThat(slowTransaction.getUri()).isEqualTo("/users?page=2");
        assertThat(slowTransaction.getMetricName()).isEqualTo("Controller/Users#index");
        assertThat(slowTransaction.getTotalCallTime()).isEqualTo(250_000);
        assertThat(slowTransaction.getTimestamp()).isEqualTo(1_500_000_000_250_000L);
        assertThat(slowTransaction.getScore()).isEqualTo(250.0);
        assertThat(slowTransaction.getContext()).isSameAs(request.getContext());
        assertThat(slowTransaction.getProfileSamples()).isEmpty();
        assertThat(slowTransaction.getMetrics()).containsKey(new MetricMeta("ActiveRecord/User/find", "Controller/Users#index"));
    }

    @Test
    void testBacktracesAreAttached() {
        TrackedRequest request = tracer.newRequest();
        request.web();
        request.startLayer(Layer.TYPE_CONTROLLER, "Users#index");
        request.startLayer(new Layer("ActiveRecord", "User/find", clock.getEpochMicros())
            .withBacktrace(backtrace("com.example.UsersController")));
        request.stopLayer();
        request.stopLayer();

        SlowTransaction slowTransaction = store.getSlowTransactions().get(0).call();

        assertThat(slowTransaction).isNotNull();
        assertThat(slowTransaction.getMetrics().keySet())
            .filteredOn(MetricMeta::hasBacktrace)
            .extracting(MetricMeta::getMetricName)
            .containsExactly("ActiveRecord/User/find");
    }

    @Test
    void testIgnoredUri() {
        doReturn(Collections.singletonList(Pattern.compile("^/health$"))).when(config.getConfig(CoreConfiguration.class)).getIgnoreTracePatterns();
        webRequest("/health");

        assertThat(store.getSlowTransactions().get(0).call()).isNull();
        // metrics are still tracked
        assertThat(store.getMetrics()).containsKey(new MetricMeta("Controller/Users#index"));
    }

    @Test
    void testIgnorePatternIsFoundAnywhereInTheUri() {
        doReturn(RegexListValueConverter.INSTANCE.convert("[invalid, /assets/")).when(config.getConfig(CoreConfiguration.class)).getIgnoreTracePatterns();

        webRequest("/public/assets/app.js");
        webRequest("/healthcheck");

        assertThat(store.getSlowTransactions().get(0).call()).isNull();
        assertThat(store.getSlowTransactions().get(1).call()).isNotNull();
    }

    @Test
    void testMissingUri() {
        TrackedRequest request = tracer.newRequest();
        request.web();
        request.startLayer(Layer.TYPE_CONTROLLER, "Users#index");
        request.stopLayer();

        SlowTransaction slowTransaction = new SlowRequestConverter(request).call();

        assertThat(slowTransaction).isNotNull();
        assertThat(slowTransaction.getUri()).isEmpty();
    }

    @Test
    void testNoScopeLayer() {
        TrackedRequest request = tracer.newRequest();
        request.web();
        request.startLayer("Custom", "work");
        request.stopLayer();

        assertThat(store.getSlowTransactions().get(0).call()).isNull();
        verify(slowRequestPolicy, never()).stored(request);
    }

    @Test
    void testNonWebScore() {
        TrackedRequest request = tracer.newRequest();
        request.startLayer(Layer.TYPE_CONTROLLER, "Users#index");
        clock.advanceMillis(100);
        request.stopLayer();

        assertThat(new SlowRequestConverter(request).getScore()).isEqualTo(SlowRequestConverter.NON_WEB_SCORE);
    }

    private TrackedRequest webRequest(String uri) {
        TrackedRequest request = tracer.newRequest();
        request.web();
        request.annotate(Collections.singletonMap(TrackedRequest.ANNOTATION_URI, uri));
        request.startLayer(Layer.TYPE_CONTROLLER, "Users#index");
        request.startLayer("ActiveRecord", "User/find");
        clock.advanceMillis(200);
        request.stopLayer();
        clock.advanceMillis(50);
        request.stopLayer();
        return request;
    }
}
