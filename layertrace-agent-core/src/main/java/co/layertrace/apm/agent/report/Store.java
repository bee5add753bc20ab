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

import co.layertrace.apm.agent.converter.SlowJobConverter;
import co.layertrace.apm.agent.converter.SlowRequestConverter;
import co.layertrace.apm.agent.metrics.MetricMeta;
import co.layertrace.apm.agent.metrics.MetricStats;

import java.util.Map;

/**
 * Receives everything a finished request is converted into.
 * <p>
 * Implementations aggregate the data of many concurrently finishing requests
 * and are therefore responsible for their own synchronization.
 * </p>
 */
public interface Store {

    void track(Map<MetricMeta, MetricStats> metrics);

    /**
     * Slow transactions are expensive to build, so the converter is handed over unconverted.
     * The store decides, based on {@link SlowRequestConverter#getScore()}, whether to {@link SlowRequestConverter#call() call} it.
     */
    void trackSlowTransaction(SlowRequestConverter slowRequestConverter);

    void trackJob(JobRecord job);

    void trackSlowJob(SlowJobConverter slowJobConverter);

    /**
     * @return the timestamp of the reporting period the store is currently collecting data for
     */
    long currentTimestamp();
}
