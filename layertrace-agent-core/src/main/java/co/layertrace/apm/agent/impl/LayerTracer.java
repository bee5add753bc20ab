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
package co.layertrace.apm.agent.impl;

import co.layertrace.apm.agent.configuration.CoreConfiguration;
import co.layertrace.apm.agent.impl.request.TrackedRequest;
import co.layertrace.apm.agent.impl.stacktrace.BacktraceParser;
import co.layertrace.apm.agent.impl.stacktrace.StacktraceConfiguration;
import co.layertrace.apm.agent.metrics.RequestHistograms;
import co.layertrace.apm.agent.metrics.RequestHistogramsByTime;
import co.layertrace.apm.agent.policy.SlowRequestPolicy;
import co.layertrace.apm.agent.report.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;

/**
 * Holds the collaborators of {@link TrackedRequest}s and their converters and hands out requests.
 * <p>
 * Use {@link LayerTracerBuilder} to create an instance.
 * </p>
 */
public class LayerTracer {
    private static final Logger logger = LoggerFactory.getLogger(LayerTracer.class);

    private final ConfigurationRegistry configurationRegistry;
    private final CoreConfiguration coreConfiguration;
    private final StacktraceConfiguration stacktraceConfiguration;
    private final SystemClock clock;
    private final Store store;
    private final RequestHistograms requestHistograms;
    private final RequestHistogramsByTime requestHistogramsByTime;
    private final SlowRequestPolicy slowRequestPolicy;
    private final SlowRequestPolicy slowJobPolicy;
    private final BacktraceParser backtraceParser;
    private final ThreadLocal<TrackedRequest> currentRequest = new ThreadLocal<>();

    LayerTracer(ConfigurationRegistry configurationRegistry, SystemClock clock, Store store,
                RequestHistograms requestHistograms, RequestHistogramsByTime requestHistogramsByTime,
                SlowRequestPolicy slowRequestPolicy, SlowRequestPolicy slowJobPolicy, BacktraceParser backtraceParser) {
        this.configurationRegistry = configurationRegistry;
        this.coreConfiguration = configurationRegistry.getConfig(CoreConfiguration.class);
        this.stacktraceConfiguration = configurationRegistry.getConfig(StacktraceConfiguration.class);
        this.clock = clock;
        this.store = store;
        this.requestHistograms = requestHistograms;
        this.requestHistogramsByTime = requestHistogramsByTime;
        this.slowRequestPolicy = slowRequestPolicy;
        this.slowJobPolicy = slowJobPolicy;
        this.backtraceParser = backtraceParser;
    }

    /**
     * Creates a request which is not bound to the current thread.
     * If the agent is not {@link CoreConfiguration#isActive() active}, the request does not record anything.
     */
    public TrackedRequest newRequest() {
        return new TrackedRequest(this, !coreConfiguration.isActive());
    }

    /**
     * Returns the request of the current thread.
     * A new one is created if there is none, if the existing one has already been recorded,
     * or if the existing one is a no-op request of a time when the agent was inactive and the agent is active again.
     */
    public TrackedRequest currentRequest() {
        TrackedRequest request = currentRequest.get();
        if (request == null || request.isRecorded() || (request.isNoop() && coreConfiguration.isActive())) {
            request = newRequest();
            currentRequest.set(request);
            logger.trace("Created {} for thread {}", request, Thread.currentThread().getName());
        }
        return request;
    }

    public void clearCurrentRequest() {
        currentRequest.remove();
    }

    public ConfigurationRegistry getConfigurationRegistry() {
        return configurationRegistry;
    }

    public <T extends ConfigurationOptionProvider> T getConfig(Class<T> pluginClass) {
        return configurationRegistry.getConfig(pluginClass);
    }

    public CoreConfiguration getCoreConfiguration() {
        return coreConfiguration;
    }

    public StacktraceConfiguration getStacktraceConfiguration() {
        return stacktraceConfiguration;
    }

    public SystemClock getClock() {
        return clock;
    }

    public Store getStore() {
        return store;
    }

    public RequestHistograms getRequestHistograms() {
        return requestHistograms;
    }

    public RequestHistogramsByTime getRequestHistogramsByTime() {
        return requestHistogramsByTime;
    }

    public SlowRequestPolicy getSlowRequestPolicy() {
        return slowRequestPolicy;
    }

    public SlowRequestPolicy getSlowJobPolicy() {
        return slowJobPolicy;
    }

    public BacktraceParser getBacktraceParser() {
        return backtraceParser;
    }

    /**
     * Called when the application shuts down.
     */
    public void stop() {
        try {
            configurationRegistry.close();
        } catch (Exception e) {
            logger.warn("Suppressed exception while calling stop()", e);
        }
    }
}
