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
import co.layertrace.apm.agent.impl.stacktrace.BacktraceParser;
import co.layertrace.apm.agent.impl.stacktrace.StackFrame;
import co.layertrace.apm.agent.impl.walker.DepthFirstWalker;
import co.layertrace.apm.agent.metrics.MetricMeta;
import co.layertrace.apm.agent.metrics.MetricStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the layers of a tree into metrics.
 * <p>
 * Layers with the same name, scope and description are merged into one {@link MetricStats}, so that repeated calls to
 * the same query or view add up. In addition, there is one unscoped {@code <type>/all} metric per layer type.
 * </p>
 * <p>
 * Each layer is scoped under the outermost enclosing {@link Layer#isSubscopable() subscopable} layer, or if there is none,
 * under the scope layer of the request. Nested subscopable layers, and the outermost one itself, are scoped under
 * the outermost subscopable layer resp. the scope layer. The scope layer itself is not scoped.
 * </p>
 */
public class LayerMetricsAggregator {

    public static final String ALL_SUFFIX = "/all";
    private static final Logger logger = LoggerFactory.getLogger(LayerMetricsAggregator.class);

    @Nullable
    private final Layer rootLayer;
    @Nullable
    private final Layer scopeLayer;
    @Nullable
    private final BacktraceParser backtraceParser;

    /**
     * @param backtraceParser used to attach captured backtraces to the metrics, {@code null} to drop them
     */
    public LayerMetricsAggregator(@Nullable Layer rootLayer, @Nullable Layer scopeLayer, @Nullable BacktraceParser backtraceParser) {
        this.rootLayer = rootLayer;
        this.scopeLayer = scopeLayer;
        this.backtraceParser = backtraceParser;
    }

    public Map<MetricMeta, MetricStats> createMetrics() {
        final Map<MetricMeta, MetricStats> metrics = new LinkedHashMap<>();
        final List<MetricMeta> metasWithBacktrace = new ArrayList<>();
        // the outermost subscope is the last element, as layers are pushed to the front
        final Deque<Layer> subscopeLayers = new ArrayDeque<>();

        new DepthFirstWalker(rootLayer)
            .before(layer -> {
                if (layer.isSubscopable()) {
                    subscopeLayers.push(layer);
                }
            })
            .after(layer -> {
                if (layer.isSubscopable()) {
                    subscopeLayers.pop();
                }
            })
            .forEach(layer -> {
                final String scope = getScope(layer, subscopeLayers.peekLast());
                final MetricMeta meta = new MetricMeta(layer.getLegacyMetricName(), scope, layer.getDescription());
                if (backtraceParser != null && layer.getBacktrace() != null) {
                    attachBacktrace(meta, layer.getBacktrace(), metasWithBacktrace);
                }
                getOrCreate(metrics, meta, scope != null).update(layer.getTotalCallTime(), layer.getTotalExclusiveTime());
                getOrCreate(metrics, new MetricMeta(layer.getType() + ALL_SUFFIX), false)
                    .update(layer.getTotalCallTime(), layer.getTotalExclusiveTime());
            });

        reattachBacktraces(metrics, metasWithBacktrace);
        return metrics;
    }

    @Nullable
    private String getScope(Layer layer, @Nullable Layer subscope) {
        if (subscope != null && subscope != layer) {
            return subscope.getLegacyMetricName();
        } else if (layer == scopeLayer || scopeLayer == null) {
            return null;
        } else {
            return scopeLayer.getLegacyMetricName();
        }
    }

    private void attachBacktrace(MetricMeta meta, Throwable backtrace, List<MetricMeta> metasWithBacktrace) {
        final List<StackFrame> frames = backtraceParser.parse(backtrace);
        if (!frames.isEmpty()) {
            meta.setBacktrace(frames);
            metasWithBacktrace.add(meta);
        } else {
            logger.debug("Unable to capture an app-specific backtrace for {}", meta, backtrace);
        }
    }

    private static MetricStats getOrCreate(Map<MetricMeta, MetricStats> metrics, MetricMeta meta, boolean scoped) {
        MetricStats stats = metrics.get(meta);
        if (stats == null) {
            stats = new MetricStats(scoped);
            metrics.put(meta, stats);
        }
        return stats;
    }

    /*
     * A map keeps the first of two equal keys. If a layer without a backtrace created the key,
     * the backtrace of a later layer with an equal meta would be lost.
     */
    private static void reattachBacktraces(Map<MetricMeta, MetricStats> metrics, List<MetricMeta> metasWithBacktrace) {
        for (MetricMeta metaWithBacktrace : metasWithBacktrace) {
            for (MetricMeta key : metrics.keySet()) {
                if (key.equals(metaWithBacktrace)) {
                    key.setBacktrace(metaWithBacktrace.getBacktrace());
                    break;
                }
            }
        }
    }
}
