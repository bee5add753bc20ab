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
import co.layertrace.apm.agent.policy.SlowRequestPolicy;
import co.layertrace.apm.agent.report.SlowJobRecord;

import javax.annotation.Nullable;

/**
 * Converts a background job into a detailed {@link SlowJobRecord}.
 * Like {@link SlowRequestConverter}, the score is computed up front and the conversion is left to the store.
 */
public class SlowJobConverter extends AbstractJobConverter {

    public static final double NON_JOB_SCORE = -1;

    private final SlowRequestPolicy slowJobPolicy;
    private final double score;

    public SlowJobConverter(TrackedRequest request) {
        super(request);
        this.slowJobPolicy = request.getTracer().getSlowJobPolicy();
        this.score = request.isJob() ? slowJobPolicy.score(request) : NON_JOB_SCORE;
    }

    public String getName() {
        return request.getUniqueName();
    }

    public double getScore() {
        return score;
    }

    /**
     * @return the slow job, or {@code null} if the request has no {@code Job} layer
     */
    @Nullable
    public SlowJobRecord call() {
        final Layer jobLayer = getJobLayer();
        if (jobLayer == null || rootLayer == null) {
            return null;
        }
        slowJobPolicy.stored(request);
        return new SlowJobRecord(getQueueName(),
            jobLayer.getName(),
            rootLayer.getStopTimestamp(),
            jobLayer.getTotalCallTime(),
            jobLayer.getTotalExclusiveTime(),
            request.getContext(),
            createMetrics(jobLayer, true),
            score);
    }
}
