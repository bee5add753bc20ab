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
import co.layertrace.apm.agent.configuration.source.ConfigSources;
import co.layertrace.apm.agent.configuration.source.PrefixingConfigurationSourceWrapper;
import co.layertrace.apm.agent.configuration.source.SystemPropertyConfigurationSource;
import co.layertrace.apm.agent.impl.stacktrace.ApplicationPackagesBacktraceParser;
import co.layertrace.apm.agent.impl.stacktrace.BacktraceParser;
import co.layertrace.apm.agent.impl.stacktrace.StacktraceConfiguration;
import co.layertrace.apm.agent.metrics.RequestHistograms;
import co.layertrace.apm.agent.metrics.RequestHistogramsByTime;
import co.layertrace.apm.agent.policy.DurationSlowRequestPolicy;
import co.layertrace.apm.agent.policy.SlowRequestPolicy;
import co.layertrace.apm.agent.report.NoopStore;
import co.layertrace.apm.agent.report.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.AbstractConfigurationSource;
import org.stagemonitor.configuration.source.ConfigurationSource;
import org.stagemonitor.configuration.source.EnvironmentVariableConfigurationSource;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.TimeUnit;

public class LayerTracerBuilder {

    public static final String PROPERTIES_FILE = "layertrace.properties";
    private static final Logger logger = LoggerFactory.getLogger(LayerTracerBuilder.class);

    @Nullable
    private ConfigurationRegistry configurationRegistry;
    @Nullable
    private SystemClock clock;
    @Nullable
    private Store store;
    @Nullable
    private RequestHistograms requestHistograms;
    @Nullable
    private RequestHistogramsByTime requestHistogramsByTime;
    @Nullable
    private SlowRequestPolicy slowRequestPolicy;
    @Nullable
    private SlowRequestPolicy slowJobPolicy;
    @Nullable
    private BacktraceParser backtraceParser;
    private final Map<String, String> inlineConfig = new HashMap<>();

    public LayerTracerBuilder configurationRegistry(ConfigurationRegistry configurationRegistry) {
        this.configurationRegistry = configurationRegistry;
        return this;
    }

    public LayerTracerBuilder clock(SystemClock clock) {
        this.clock = clock;
        return this;
    }

    public LayerTracerBuilder store(Store store) {
        this.store = store;
        return this;
    }

    public LayerTracerBuilder requestHistograms(RequestHistograms requestHistograms, RequestHistogramsByTime requestHistogramsByTime) {
        this.requestHistograms = requestHistograms;
        this.requestHistogramsByTime = requestHistogramsByTime;
        return this;
    }

    public LayerTracerBuilder slowRequestPolicy(SlowRequestPolicy slowRequestPolicy) {
        this.slowRequestPolicy = slowRequestPolicy;
        return this;
    }

    public LayerTracerBuilder slowJobPolicy(SlowRequestPolicy slowJobPolicy) {
        this.slowJobPolicy = slowJobPolicy;
        return this;
    }

    public LayerTracerBuilder backtraceParser(BacktraceParser backtraceParser) {
        this.backtraceParser = backtraceParser;
        return this;
    }

    /**
     * Adds a configuration value with a higher precedence than the properties file,
     * but a lower one than system properties and environment variables.
     * Only has an effect if no {@link #configurationRegistry(ConfigurationRegistry) registry} is set.
     */
    public LayerTracerBuilder withConfig(String key, String value) {
        inlineConfig.put(key, value);
        return this;
    }

    public LayerTracer build() {
        if (configurationRegistry == null) {
            configurationRegistry = getDefaultConfigurationRegistry(getConfigSources());
        }
        if (clock == null) {
            clock = SystemClock.ForCurrentVM.INSTANCE;
        }
        if (store == null) {
            logger.info("No store configured, metrics are discarded");
            store = NoopStore.INSTANCE;
        }
        if (requestHistograms == null || requestHistogramsByTime == null) {
            requestHistograms = RequestHistograms.NOOP;
            requestHistogramsByTime = RequestHistogramsByTime.NOOP;
        }
        if (slowRequestPolicy == null) {
            slowRequestPolicy = new DurationSlowRequestPolicy();
        }
        if (slowJobPolicy == null) {
            slowJobPolicy = new DurationSlowRequestPolicy();
        }
        if (backtraceParser == null) {
            backtraceParser = new ApplicationPackagesBacktraceParser(configurationRegistry.getConfig(StacktraceConfiguration.class));
        }
        return new LayerTracer(configurationRegistry, clock, store, requestHistograms, requestHistogramsByTime,
            slowRequestPolicy, slowJobPolicy, backtraceParser);
    }

    private ConfigurationRegistry getDefaultConfigurationRegistry(List<ConfigurationSource> configSources) {
        final ConfigurationRegistry registry = ConfigurationRegistry.builder()
            .configSources(configSources)
            .optionProviders(ServiceLoader.load(ConfigurationOptionProvider.class, LayerTracer.class.getClassLoader()))
            .build();
        registry.scheduleReloadAtRate(30, TimeUnit.SECONDS);
        if (logger.isDebugEnabled()) {
            logger.debug("{}: {}, {}: {}", CoreConfiguration.ACTIVE, registry.getConfig(CoreConfiguration.class).isActive(),
                CoreConfiguration.IGNORE_TRACES, registry.getConfig(CoreConfiguration.class).getIgnoreTracePatterns());
        }
        return registry;
    }

    private List<ConfigurationSource> getConfigSources() {
        List<ConfigurationSource> result = new ArrayList<>();
        result.add(new PrefixingConfigurationSourceWrapper(new SystemPropertyConfigurationSource(), "layertrace."));
        result.add(new PrefixingConfigurationSourceWrapper(new EnvironmentVariableConfigurationSource(), "LAYERTRACE_"));
        result.add(new AbstractConfigurationSource() {
            @Override
            public String getValue(String key) {
                return inlineConfig.get(key);
            }

            @Override
            public String getName() {
                return "Inline configuration";
            }
        });
        ConfigurationSource propertiesFile = ConfigSources.fromClasspath(PROPERTIES_FILE, LayerTracer.class.getClassLoader());
        if (propertiesFile != null) {
            result.add(propertiesFile);
        }
        return result;
    }
}
