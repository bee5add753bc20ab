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
package co.layertrace.apm.agent.impl.request;

import co.layertrace.apm.agent.converter.ConverterBase;
import co.layertrace.apm.agent.converter.ErrorConverter;
import co.layertrace.apm.agent.converter.JobConverter;
import co.layertrace.apm.agent.converter.MetricConverter;
import co.layertrace.apm.agent.converter.RequestQueueTimeConverter;
import co.layertrace.apm.agent.converter.SlowJobConverter;
import co.layertrace.apm.agent.converter.SlowRequestConverter;
import co.layertrace.apm.agent.impl.LayerTracer;
import co.layertrace.apm.agent.impl.layer.Layer;
import co.layertrace.apm.agent.report.JobRecord;
import co.layertrace.apm.agent.report.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The stack of currently open layers of a single web request or background job.
 * <p>
 * Each started layer becomes a child of the innermost open layer, building a tree below the first layer of the request,
 * the {@link #getRootLayer() root layer}. Layers which are stopped are popped off the stack.
 * When the last layer has been stopped, the request is finished and the tree is converted and handed to the
 * {@link Store}, exactly once.
 * </p>
 * <p>
 * A request belongs to a single logical flow of execution and must not be used by multiple threads concurrently.
 * Instrumentation is responsible for balancing {@link #startLayer} and {@link #stopLayer} calls,
 * the request itself does not validate that.
 * </p>
 */
public class TrackedRequest {

    /**
     * Annotation key of the full URI requested by the user
     */
    public static final String ANNOTATION_URI = "uri";
    /**
     * Annotation key of how long a background job waited in its queue before it started
     */
    public static final String ANNOTATION_QUEUE_LATENCY = "queue_latency";
    /**
     * The unique name of requests without a {@code Controller} or {@code Job} layer
     */
    public static final String UNKNOWN_NAME = "unknown";

    /**
     * The backtrace of these layers is always 100% framework code
     */
    private static final Set<String> BACKTRACE_EXCLUDED_TYPES = Collections.unmodifiableSet(
        new HashSet<>(Arrays.asList(Layer.TYPE_CONTROLLER, Layer.TYPE_JOB)));

    private static final Logger logger = LoggerFactory.getLogger(TrackedRequest.class);

    private final LayerTracer tracer;
    private final boolean noop;
    private final Deque<Layer> layers = new ArrayDeque<>();
    /**
     * The first layer registered with this request. All other layers are descendants of it.
     */
    @Nullable
    private Layer rootLayer;
    private final Map<String, Object> annotations = new LinkedHashMap<>();
    private final Context context = new Context();
    /**
     * Maps layer names to their call counts, used to trigger backtraces for N+1 calls.
     * Layers of different types with the same name share an entry.
     */
    private final Map<String, CallSet> callCounts = new HashMap<>();
    @Nullable
    private RequestType requestType;
    /**
     * Headers of a web request. {@code null} if the request never reached a controller.
     */
    @Nullable
    private Map<String, String> headers;
    private boolean error;
    private int ignoringChildrenDepth;
    private boolean recorded;
    @Nullable
    private String uniqueName;

    public TrackedRequest(LayerTracer tracer) {
        this(tracer, false);
    }

    /**
     * @param noop whether the request should silently drop every layer, used when the agent is inactive
     */
    public TrackedRequest(LayerTracer tracer, boolean noop) {
        this.tracer = tracer;
        this.noop = noop;
    }

    /**
     * Creates a layer which starts now and {@link #startLayer(Layer) starts} it.
     */
    public Layer startLayer(String type, String name) {
        final Layer layer = new Layer(type, name, tracer.getClock().getEpochMicros());
        startLayer(layer);
        return layer;
    }

    public void startLayer(Layer layer) {
        if (noop || isIgnoringChildren()) {
            return;
        }
        if (rootLayer == null) {
            rootLayer = layer;
        }
        callSetFor(layer.getName()).update(layer.getDescription());
        final Layer parent = layers.peek();
        if (parent != null) {
            parent.addChild(layer);
        }
        layers.push(layer);
        if (logger.isDebugEnabled()) {
            logger.debug("startLayer {} {", layer);
            if (logger.isTraceEnabled()) {
                logger.trace("starting layer at",
                    new RuntimeException("this exception is just used to record where the layer has been started from"));
            }
        }
    }

    /**
     * Stops the innermost open layer. If it was the last open layer, the request is recorded.
     */
    public void stopLayer() {
        if (noop || isIgnoringChildren()) {
            return;
        }
        final Layer layer = layers.poll();
        if (layer == null) {
            logger.warn("stopLayer called without an open layer on {}", this);
            return;
        }
        layer.recordStopTime(tracer.getClock().getEpochMicros());
        logger.debug("} stopLayer {}", layer);
        if (shouldCaptureBacktrace(layer)) {
            layer.captureBacktrace();
        }
        if (isFinalized()) {
            record();
        }
    }

    boolean shouldCaptureBacktrace(Layer layer) {
        if (BACKTRACE_EXCLUDED_TYPES.contains(layer.getType())) {
            return false;
        }
        // outside of a real request, backtraces of the worker's internals would be thrown away immediately
        if (!isWeb() && !isJob()) {
            return false;
        }
        if (layer.getTotalExclusiveTime() > tracer.getStacktraceConfiguration().getBacktraceThresholdMicros()) {
            return true;
        }
        return callSetFor(layer.getName()).shouldCaptureBacktrace();
    }

    /**
     * Returns the call counts of the given layer name, creating an empty entry if there is none yet.
     */
    public CallSet callSetFor(String layerName) {
        CallSet callSet = callCounts.get(layerName);
        if (callSet == null) {
            callSet = new CallSet(tracer.getStacktraceConfiguration().getNPlusOneCallThreshold());
            callCounts.put(layerName, callSet);
        }
        return callSet;
    }

    /**
     * Whether the request is complete: at least one layer has been started and all layers have been stopped.
     */
    public boolean isFinalized() {
        return rootLayer != null && layers.isEmpty();
    }

    /**
     * Converts the finished request and hands the results to the store.
     * Only the first call has an effect.
     * Exceptions thrown by the store or the other collaborators are not handled.
     */
    void record() {
        if (recorded) {
            logger.warn("{} has already been recorded", this);
            return;
        }
        recorded = true;
        final Layer root = rootLayer;
        if (root == null) {
            return;
        }
        final Store store = tracer.getStore();

        final String name = getUniqueName();
        if (!UNKNOWN_NAME.equals(name)) {
            tracer.getRequestHistograms().add(name, root.getTotalCallTime());
            tracer.getRequestHistogramsByTime().forTimestamp(store.currentTimestamp()).add(name, root.getTotalCallTime());
        }

        store.track(new MetricConverter(this).call());
        store.track(new ErrorConverter(this).call());

        if (isWeb()) {
            // not called here, the store decides based on the score whether to convert it
            store.trackSlowTransaction(new SlowRequestConverter(this));
            store.track(new RequestQueueTimeConverter(this).call());
        }

        if (isJob()) {
            final JobRecord job = new JobConverter(this).call();
            if (job != null) {
                store.trackJob(job);
            }
            store.trackSlowJob(new SlowJobConverter(this));
        }
        logger.debug("Recorded {}", this);
    }

    public boolean isRecorded() {
        return recorded;
    }

    /**
     * The metric name of the request's scope layer, or {@link #UNKNOWN_NAME}.
     * Computed once, on first access.
     *
     * @throws IllegalStateException if the request has not finished yet, as the layer tree might still change
     */
    public String getUniqueName() {
        if (uniqueName == null) {
            if (!isFinalized()) {
                throw new IllegalStateException("The unique name is only available after the request has finished");
            }
            final Layer scopeLayer = new ConverterBase(this).getScopeLayer();
            uniqueName = scopeLayer != null ? scopeLayer.getLegacyMetricName() : UNKNOWN_NAME;
        }
        return uniqueName;
    }

    /**
     * Stops recording new layers, to avoid tracking the internals of a layer which is more specific than its children.
     * Every call has to be balanced with {@link #acknowledgeChildren()}; calls can be nested.
     */
    public void ignoreChildren() {
        ignoringChildrenDepth++;
    }

    public void acknowledgeChildren() {
        if (ignoringChildrenDepth > 0) {
            ignoringChildrenDepth--;
        }
    }

    public boolean isIgnoringChildren() {
        return ignoringChildrenDepth > 0;
    }

    /**
     * Adds internal information about this request, like {@link #ANNOTATION_URI}.
     * Values of existing keys are replaced.
     */
    public void annotate(Map<String, ?> annotations) {
        this.annotations.putAll(annotations);
    }

    public Map<String, Object> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }

    /**
     * Application defined information, see {@link Context}
     */
    public Context getContext() {
        return context;
    }

    public void error() {
        error = true;
    }

    public boolean isError() {
        return error;
    }

    public void setHeaders(Map<String, String> headers) {
        final Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = copy;
    }

    /**
     * @return the headers with case-insensitive keys, or {@code null} if none have been set
     */
    @Nullable
    public Map<String, String> getHeaders() {
        return headers;
    }

    public void web() {
        requestType = RequestType.WEB;
    }

    public boolean isWeb() {
        return requestType == RequestType.WEB;
    }

    public void job() {
        requestType = RequestType.JOB;
    }

    public boolean isJob() {
        return requestType == RequestType.JOB;
    }

    @Nullable
    public RequestType getRequestType() {
        return requestType;
    }

    @Nullable
    public Layer getRootLayer() {
        return rootLayer;
    }

    /**
     * @return the innermost open layer, or {@code null}
     */
    @Nullable
    public Layer getCurrentLayer() {
        return layers.peek();
    }

    public int getOpenLayerCount() {
        return layers.size();
    }

    public boolean isNoop() {
        return noop;
    }

    public LayerTracer getTracer() {
        return tracer;
    }

    @Override
    public String toString() {
        return String.format("TrackedRequest[type=%s, root=%s, recorded=%s]", requestType, rootLayer, recorded);
    }
}
