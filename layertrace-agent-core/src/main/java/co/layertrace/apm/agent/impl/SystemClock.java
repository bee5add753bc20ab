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
package co.layertrace.apm.agent.impl;

import java.time.Clock;
import java.time.Instant;

/**
 * Source of the epoch microsecond timestamps used for layer start and stop times.
 */
public interface SystemClock {

    long getEpochMicros();

    enum ForCurrentVM implements SystemClock {
        INSTANCE;

        private static final Clock clock = Clock.systemUTC();

        @Override
        public long getEpochMicros() {
            // escape analysis, plz kick in and allocate the Instant on the stack
            final Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000 + now.getNano() / 1_000;
        }
    }
}
