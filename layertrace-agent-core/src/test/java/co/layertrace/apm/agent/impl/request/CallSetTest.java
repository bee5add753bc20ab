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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CallSetTest {

    @Test
    void testCaptureAfterThreshold() {
        CallSet callSet = new CallSet(3);
        callSet.update("SELECT 1");
        callSet.update("SELECT 2");
        assertThat(callSet.shouldCaptureBacktrace()).isFalse();

        callSet.update(null);

        assertThat(callSet.shouldCaptureBacktrace()).isTrue();
        assertThat(callSet.getCallCount()).isEqualTo(3);
        assertThat(callSet.getUniqueDescriptionCount()).isEqualTo(2);
    }

    @Test
    void testCaptureStaysOn() {
        CallSet callSet = new CallSet(1);
        for (int i = 0; i < 10; i++) {
            callSet.update(null);
            assertThat(callSet.shouldCaptureBacktrace()).isTrue();
        }
    }

    @Test
    void testDescriptionsAreBounded() {
        CallSet callSet = new CallSet(5);
        for (int i = 0; i < 150; i++) {
            callSet.update("SELECT " + i);
        }

        assertThat(callSet.getCallCount()).isEqualTo(150);
        assertThat(callSet.getUniqueDescriptionCount()).isEqualTo(100);
    }
}
