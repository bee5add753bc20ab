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
import co.layertrace.apm.agent.report.JobRecord;

import javax.annotation.Nullable;

/**
 * Converts a background job into the {@link JobRecord} which is aggregated across all executions of the job.
 */
public class JobConverter extends AbstractJobConverter {

    public JobConverter(TrackedRequest request) {
        super(request);
    }

    /**
     * @return the job record, or {@code null} if the request has no {@code Job} layer
     */
    @Nullable
    public JobRecord call() {
        final Layer jobLayer = getJobLayer();
        if (jobLayer == null) {
            return null;
        }
        return new JobRecord(getQueueName(),
            jobLayer.getName(),
            jobLayer.getTotalCallTime(),
            jobLayer.getTotalExclusiveTime(),
            request.isError() ? 1 : 0,
            createMetrics(jobLayer, false));
    }
}
