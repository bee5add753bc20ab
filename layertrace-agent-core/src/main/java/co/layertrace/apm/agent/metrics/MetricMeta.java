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
package co.layertrace.apm.agent.metrics;

import co.layertrace.apm.agent.impl.stacktrace.StackFrame;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The identity of a metric: its name, the scope it has been recorded in and an optional description.
 * <p>
 * A backtrace can be attached to a metric identity but is not part of its identity,
 * two metas which only differ in their backtrace are equal.
 * </p>
 */
public class MetricMeta {

    private final String metricName;
    @Nullable
    private final String scope;
    @Nullable
    private final String description;
    private List<StackFrame> backtrace = Collections.emptyList();

    public MetricMeta(String metricName) {
        this(metricName, null, null);
    }

    public MetricMeta(String metricName, @Nullable String scope) {
        this(metricName, scope, null);
    }

    public MetricMeta(String metricName, @Nullable String scope, @Nullable String description) {
        this.metricName = metricName;
        this.scope = scope;
        this.description = description;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * The type part of the metric name, for example {@code ActiveRecord} for {@code ActiveRecord/User/find}
     */
    public String getType() {
        int slash = metricName.indexOf('/');
        return slash < 0 ? metricName : metricName.substring(0, slash);
    }

    @Nullable
    public String getScope() {
        return scope;
    }

    public boolean isScoped() {
        return scope != null;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public List<StackFrame> getBacktrace() {
        return backtrace;
    }

    public boolean hasBacktrace() {
        return !backtrace.isEmpty();
    }

    public void setBacktrace(List<StackFrame> backtrace) {
        this.backtrace = backtrace;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MetricMeta that = (MetricMeta) o;
        return metricName.equals(that.metricName) &&
            Objects.equals(scope, that.scope) &&
            Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        int result = metricName.hashCode();
        result = 31 * result + (scope != null ? scope.hashCode() : 0);
        result = 31 * result + (description != null ? description.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(metricName);
        if (scope != null) {
            sb.append(" [scope=").append(scope).append(']');
        }
        if (description != null) {
            sb.append(" [desc=").append(description).append(']');
        }
        return sb.toString();
    }
}
