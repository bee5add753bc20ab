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
package co.layertrace.apm.agent.report;

import co.layertrace.apm.agent.impl.request.Context;
import co.layertrace.apm.agent.metrics.MetricMeta;
import co.layertrace.apm.agent.metrics.MetricStats;

import java.util.List;
import java.util.Map;

/**
 * The detailed trace of a single web request.
 */
public class SlowTransaction {

    private final String uri;
    private final String metricName;
    private final long totalCallTime;
    private final Map<MetricMeta, MetricStats> metrics;
    private final Context context;
    private final long timestamp;
    private final List<Object> profileSamples;
    private final double score;

    public SlowTransaction(String uri, String metricName, long totalCallTime, Map<MetricMeta, MetricStats> metrics,
                           Context context, long timestamp, List<Object> profileSamples, double score) {
        this.uri = uri;
        this.metricName = metricName;
        this.totalCallTime = totalCallTime;
        this.metrics = metrics;
        this.context = context;
        this.timestamp = timestamp;
        this.profileSamples = profileSamples;
        this.score = score;
    }

    public String getUri() {
        return uri;
    }

    /**
     * Metric name of the scope layer, eg {@code Controller/UsersController#index}
     */
    public String getMetricName() {
        return metricName;
    }

    /**
     * Total time of the root layer, in µs
     */
    public long getTotalCallTime() {
        return totalCallTime;
    }

    public Map<MetricMeta, MetricStats> getMetrics() {
        return metrics;
    }

    public Context getContext() {
        return context;
    }

    /**
     * Stop timestamp of the root layer, in µs since epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Always empty, profiling is not supported
     */
    public List<Object> getProfileSamples() {
        return profileSamples;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return String.format("'%s' %s (%dµs)", metricName, uri, totalCallTime);
    }
}
