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
package co.layertrace.apm.agent.impl.layer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * A single traced segment of a request, for example a controller action, a database query or a view rendering.
 * <p>
 * Layers form a tree: a layer owns its children, which are attached by the
 * {@link co.layertrace.apm.agent.impl.request.TrackedRequest} while the layer is the innermost open one.
 * There are no references from a child back to its parent.
 * </p>
 * <p>
 * Timestamps are microseconds since epoch.
 * </p>
 */
public class Layer {

    public static final String TYPE_CONTROLLER = "Controller";
    public static final String TYPE_JOB = "Job";
    public static final String TYPE_QUEUE = "Queue";

    protected static final double MS_IN_MICROS = TimeUnit.MILLISECONDS.toMicros(1);
    private static final Logger logger = LoggerFactory.getLogger(Layer.class);

    /**
     * Category of the layer (eg: 'Controller', 'Job', 'ActiveRecord', 'View')
     */
    private final String type;
    /**
     * Name within the type (eg: 'UsersController#index', 'User/find')
     */
    private final String name;
    /**
     * Optional detail, like a sanitized SQL statement
     */
    @Nullable
    private String description;
    private final long startTimestamp;
    private long stopTimestamp = -1;
    private final List<Layer> children = new ArrayList<>();
    private boolean subscopable;
    @Nullable
    private Throwable backtrace;
    private final Map<String, String> annotations = new HashMap<>();

    public Layer(String type, String name, long startTimestamp) {
        this.type = type;
        this.name = name;
        this.startTimestamp = startTimestamp;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public Layer withDescription(@Nullable String description) {
        this.description = description;
        return this;
    }

    /**
     * The canonical metric name of this layer, {@code type/name}.
     */
    public String getLegacyMetricName() {
        return type + "/" + name;
    }

    public boolean isSubscopable() {
        return subscopable;
    }

    /**
     * Marks this layer as the scope of the metrics of all layers below it.
     */
    public Layer subscopable() {
        this.subscopable = true;
        return this;
    }

    public long getStartTimestamp() {
        return startTimestamp;
    }

    /**
     * @return the stop timestamp, or {@code -1} if the layer is still running
     */
    public long getStopTimestamp() {
        return stopTimestamp;
    }

    public boolean isStopped() {
        return stopTimestamp >= 0;
    }

    /**
     * Stamps the stop time. Only the first call has an effect.
     *
     * @param epochMicros the stop timestamp. Clamped to the start timestamp if it is earlier.
     */
    public void recordStopTime(long epochMicros) {
        if (isStopped()) {
            logger.warn("Stop time of {} has already been recorded", this);
            return;
        }
        this.stopTimestamp = Math.max(epochMicros, startTimestamp);
    }

    /**
     * How long the layer took, children included, in µs.
     * Zero while the layer is still running.
     */
    public long getTotalCallTime() {
        if (!isStopped()) {
            return 0;
        }
        return stopTimestamp - startTimestamp;
    }

    /**
     * How long the layer took, minus the time of its direct children, in µs.
     */
    public long getTotalExclusiveTime() {
        long childTime = 0;
        for (int i = 0; i < children.size(); i++) {
            childTime += children.get(i).getTotalCallTime();
        }
        return Math.max(0, getTotalCallTime() - childTime);
    }

    public double getTotalCallTimeMs() {
        return getTotalCallTime() / MS_IN_MICROS;
    }

    public void addChild(Layer child) {
        children.add(child);
    }

    public List<Layer> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Nullable
    public Throwable getBacktrace() {
        return backtrace;
    }

    /**
     * Captures the current thread's stack as the backtrace of this layer, unless one has already been captured.
     */
    public void captureBacktrace() {
        withBacktrace(new Throwable("backtrace of " + getLegacyMetricName()));
    }

    public Layer withBacktrace(Throwable backtrace) {
        if (this.backtrace == null) {
            this.backtrace = backtrace;
        }
        return this;
    }

    public Layer annotate(String key, String value) {
        annotations.put(key, value);
        return this;
    }

    public Map<String, String> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }

    @Override
    public String toString() {
        return String.format("'%s' (%d children)", getLegacyMetricName(), children.size());
    }
}
