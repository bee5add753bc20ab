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

import java.util.Map;

/**
 * The detailed trace of a single background job execution.
 */
public class SlowJobRecord {

    private final String queueName;
    private final String jobName;
    private final long timestamp;
    private final long totalCallTime;
    private final long exclusiveTime;
    private final Context context;
    private final Map<MetricMeta, MetricStats> metrics;
    private final double score;

    public SlowJobRecord(String queueName, String jobName, long timestamp, long totalCallTime, long exclusiveTime,
                         Context context, Map<MetricMeta, MetricStats> metrics, double score) {
        this.queueName = queueName;
        this.jobName = jobName;
        this.timestamp = timestamp;
        this.totalCallTime = totalCallTime;
        this.exclusiveTime = exclusiveTime;
        this.context = context;
        this.metrics = metrics;
        this.score = score;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getJobName() {
        return jobName;
    }

    public String getMetricName() {
        return "Job/" + jobName;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public long getTotalCallTime() {
        return totalCallTime;
    }

    public long getExclusiveTime() {
        return exclusiveTime;
    }

    public Context getContext() {
        return context;
    }

    public Map<MetricMeta, MetricStats> getMetrics() {
        return metrics;
    }

    public double getScore() {
        return score;
    }
}
