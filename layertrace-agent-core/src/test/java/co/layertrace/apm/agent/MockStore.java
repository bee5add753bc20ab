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
package co.layertrace.apm.agent;

import co.layertrace.apm.agent.converter.SlowJobConverter;
import co.layertrace.apm.agent.converter.SlowRequestConverter;
import co.layertrace.apm.agent.metrics.MetricMeta;
import co.layertrace.apm.agent.metrics.MetricStats;
import co.layertrace.apm.agent.report.JobRecord;
import co.layertrace.apm.agent.report.Store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MockStore implements Store {

    public static final long CURRENT_TIMESTAMP = 1_500_000_000L;

    private final List<Map<MetricMeta, MetricStats>> trackedMetrics = new ArrayList<>();
    private final List<SlowRequestConverter> slowTransactions = new ArrayList<>();
    private final List<JobRecord> jobs = new ArrayList<>();
    private final List<SlowJobConverter> slowJobs = new ArrayList<>();

    @Override
    public synchronized void track(Map<MetricMeta, MetricStats> metrics) {
        trackedMetrics.add(metrics);
    }

    @Override
    public synchronized void trackSlowTransaction(SlowRequestConverter slowRequestConverter) {
        slowTransactions.add(slowRequestConverter);
    }

    @Override
    public synchronized void trackJob(JobRecord job) {
        jobs.add(job);
    }

    @Override
    public synchronized void trackSlowJob(SlowJobConverter slowJobConverter) {
        slowJobs.add(slowJobConverter);
    }

    @Override
    public long currentTimestamp() {
        return CURRENT_TIMESTAMP;
    }

    /**
     * @return the number of times {@link #track(Map)} has been called
     */
    public synchronized int getTrackCount() {
        return trackedMetrics.size();
    }

    /**
     * @return all tracked metrics, merged into one map
     */
    public synchronized Map<MetricMeta, MetricStats> getMetrics() {
        Map<MetricMeta, MetricStats> merged = new LinkedHashMap<>();
        for (Map<MetricMeta, MetricStats> metrics : trackedMetrics) {
            for (Map.Entry<MetricMeta, MetricStats> entry : metrics.entrySet()) {
                MetricStats stats = merged.get(entry.getKey());
                if (stats == null) {
                    stats = new MetricStats(entry.getValue().isScoped());
                    merged.put(entry.getKey(), stats);
                }
                stats.combine(entry.getValue());
            }
        }
        return merged;
    }

    public synchronized List<SlowRequestConverter> getSlowTransactions() {
        return Collections.unmodifiableList(new ArrayList<>(slowTransactions));
    }

    public synchronized List<JobRecord> getJobs() {
        return Collections.unmodifiableList(new ArrayList<>(jobs));
    }

    public synchronized List<SlowJobConverter> getSlowJobs() {
        return Collections.unmodifiableList(new ArrayList<>(slowJobs));
    }

    public synchronized void reset() {
        trackedMetrics.clear();
        slowTransactions.clear();
        jobs.clear();
        slowJobs.clear();
    }
}
