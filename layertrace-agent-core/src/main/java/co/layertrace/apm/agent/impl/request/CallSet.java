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
package co.layertrace.apm.agent.impl.request;

import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.Set;

/**
 * Counts the calls to layers of the same name within one request.
 * <p>
 * Calls that are individually fast but happen many times, like the queries of an N+1 pattern,
 * are worth a backtrace. Once the number of calls reaches the threshold, every further layer of that name gets one.
 * </p>
 */
public class CallSet {

    private static final int MAX_DESCRIPTIONS = 100;

    private final int captureThreshold;
    private final Set<String> descriptions = new HashSet<>();
    private int callCount;
    private boolean captureBacktrace;

    public CallSet(int captureThreshold) {
        this.captureThreshold = captureThreshold;
    }

    public void update(@Nullable String description) {
        callCount++;
        if (description != null && descriptions.size() < MAX_DESCRIPTIONS) {
            descriptions.add(description);
        }
        if (callCount >= captureThreshold) {
            captureBacktrace = true;
        }
    }

    public boolean shouldCaptureBacktrace() {
        return captureBacktrace;
    }

    public int getCallCount() {
        return callCount;
    }

    /**
     * The number of distinct descriptions seen, capped at {@value #MAX_DESCRIPTIONS}
     */
    public int getUniqueDescriptionCount() {
        return descriptions.size();
    }
}
