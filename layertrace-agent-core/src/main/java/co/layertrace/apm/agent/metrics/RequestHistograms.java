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
 * Histograms of request durations, one per unique request name.
 */
public interface RequestHistograms {

    RequestHistograms NOOP = new RequestHistograms() {
        @Override
        public void add(String uniqueName, long totalCallTime) {
        }
    };

    /**
     * @param uniqueName    the unique name of the request, see {@link co.layertrace.apm.agent.impl.request.TrackedRequest#getUniqueName()}
     * @param totalCallTime the total time of the request's root layer, in µs
     */
    void add(String uniqueName, long totalCallTime);
}
