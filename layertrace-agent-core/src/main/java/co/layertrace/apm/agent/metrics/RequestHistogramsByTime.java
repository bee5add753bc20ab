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

/**
 * {@link RequestHistograms} bucketed by reporting period.
 */
public interface RequestHistogramsByTime {

    RequestHistogramsByTime NOOP = timestamp -> RequestHistograms.NOOP;

    /**
     * @param timestamp the reporting period, as returned by {@link co.layertrace.apm.agent.report.Store#currentTimestamp()}
     * @return the histograms of that period, created if necessary
     */
    RequestHistograms forTimestamp(long timestamp);
}
