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

import java.util.concurrent.TimeUnit;

/**
 * Tracks the number of calls, the total and the exclusive time of a metric, so that it allows for calculating weighted averages.
 * Times are in µs.
 */
public class MetricStats {
    private static final double MS_IN_MICROS = TimeUnit.MILLISECONDS.toMicros(1);

    private final boolean scoped;
    private long callCount;
    private long totalCallTime;
    private long totalExclusiveTime;
    private long minCallTime = Long.MAX_VALUE;
    private long maxCallTime;

    public MetricStats(boolean scoped) {
        this.scoped = scoped;
    }

    /**
     * Records a single call.
     */
    public MetricStats update(long callTimeUs, long exclusiveTimeUs) {
        callCount++;
        totalCallTime += callTimeUs;
        totalExclusiveTime += exclusiveTimeUs;
        minCallTime = Math.min(minCallTime, callTimeUs);
        maxCallTime = Math.max(maxCallTime, callTimeUs);
        return this;
    }

    /**
     * Records a single call whose exclusive time equals its total time.
     */
    public MetricStats update(long callTimeUs) {
        return update(callTimeUs, callTimeUs);
    }

    /**
     * Merges the calls of another instance of the same metric into this one.
     * Merging is commutative and associative.
     */
    public MetricStats combine(MetricStats other) {
        callCount += other.callCount;
        totalCallTime += other.totalCallTime;
        totalExclusiveTime += other.totalExclusiveTime;
        minCallTime = Math.min(minCallTime, other.minCallTime);
        maxCallTime = Math.max(maxCallTime, other.maxCallTime);
        return this;
    }

    public boolean isScoped() {
        return scoped;
    }

    public long getCallCount() {
        return callCount;
    }

    public long getTotalCallTime() {
        return totalCallTime;
    }

    public double getTotalCallTimeMs() {
        return totalCallTime / MS_IN_MICROS;
    }

    public long getTotalExclusiveTime() {
        return totalExclusiveTime;
    }

    /**
     * @return the shortest call, or {@code 0} if nothing has been recorded yet
     */
    public long getMinCallTime() {
        return callCount == 0 ? 0 : minCallTime;
    }

    public long getMaxCallTime() {
        return maxCallTime;
    }

    public boolean hasContent() {
        return callCount > 0;
    }

    @Override
    public String toString() {
        return "MetricStats{" +
            "callCount=" + callCount +
            ", totalCallTime=" + totalCallTime +
            ", totalExclusiveTime=" + totalExclusiveTime +
            ", scoped=" + scoped +
            '}';
    }
}
