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
import co.layertrace.apm.agent.impl.walker.DepthFirstWalker;
import co.layertrace.apm.agent.metrics.MetricMeta;
import co.layertrace.apm.agent.metrics.MetricStats;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Base class of everything a finished {@link TrackedRequest} is converted into.
 * Converters only read the layer tree.
 */
public class ConverterBase {

    protected final TrackedRequest request;
    @Nullable
    protected final Layer rootLayer;
    protected final DepthFirstWalker walker;
    private boolean scopeLayerResolved;
    @Nullable
    private Layer scopeLayer;

    public ConverterBase(TrackedRequest request) {
        this.request = request;
        this.rootLayer = request.getRootLayer();
        this.walker = new DepthFirstWalker(rootLayer);
    }

    /**
     * The layer the whole request is named after: the first {@code Controller} layer, or if there is none,
     * the first {@code Job} layer.
     * <p>
     * Most of the time there is only one controller, but a controller action may call another one,
     * in which case the outer controller wins.
     * </p>
     *
     * @return the scope layer, or {@code null} if the request has neither a {@code Controller} nor a {@code Job} layer
     */
    @Nullable
    public Layer getScopeLayer() {
        if (!scopeLayerResolved) {
            scopeLayer = findFirstLayerOfType(Layer.TYPE_CONTROLLER);
            if (scopeLayer == null) {
                scopeLayer = findFirstLayerOfType(Layer.TYPE_JOB);
            }
            scopeLayerResolved = true;
        }
        return scopeLayer;
    }

    @Nullable
    protected Layer findFirstLayerOfType(String type) {
        return walker.findFirst(layer -> type.equals(layer.getType()));
    }

    /**
     * @param scope          the layer all other layers are scoped under
     * @param withBacktraces whether captured backtraces should be parsed and attached to the metrics
     */
    protected Map<MetricMeta, MetricStats> createMetrics(@Nullable Layer scope, boolean withBacktraces) {
        return new LayerMetricsAggregator(rootLayer, scope,
            withBacktraces ? request.getTracer().getBacktraceParser() : null).createMetrics();
    }
}
