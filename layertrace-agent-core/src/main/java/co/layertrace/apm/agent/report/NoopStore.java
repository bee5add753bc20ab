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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Discards everything. Used until a real store is configured.
 */
public enum NoopStore implements Store {

    INSTANCE;

    private static final Logger logger = LoggerFactory.getLogger(NoopStore.class);

    @Override
    public void track(Map<MetricMeta, MetricStats> metrics) {
        logger.debug("Discarding {} metrics", metrics.size());
    }

    @Override
    public void trackSlowTransaction(SlowRequestConverter slowRequestConverter) {
        logger.debug("Discarding slow transaction {}", slowRequestConverter.getName());
    }

    @Override
    public void trackJob(JobRecord job) {
        logger.debug("Discarding job {}", job);
    }

    @Override
    public void trackSlowJob(SlowJobConverter slowJobConverter) {
        logger.debug("Discarding slow job {}", slowJobConverter.getName());
    }

    @Override
    public long currentTimestamp() {
        return TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis());
    }
}
