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

import co.layertrace.apm.agent.MockClock;
import co.layertrace.apm.agent.MockStore;
import co.layertrace.apm.agent.MockTracer;
import co.layertrace.apm.agent.impl.layer.Layer;
import co.layertrace.apm.agent.impl.request.TrackedRequest;
import co.layertrace.apm.agent.metrics.MetricMeta;
import co.layertrace.apm.agent.report.JobRecord;
import co.layertrace.apm.agent.report.SlowJobRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class JobConverterTest {

    private MockClock clock;
    private MockStore store;
    private TrackedRequest request;

    @BeforeEach
    void setUp() {
        clock = new MockClock(1_000_000);
        store = new MockStore();
        request = MockTracer.createTracer(clock, store).newRequest();
        request.job();
    }

    @Test
    void testJob() {
        runJob(true);

        JobRecord job = new JobConverter(request).call();

        assertThat(job).isNotNull();
        assertThat(job.getQueueName()).isEqualTo("mailers");
        assertThat(job.getJobName()).isEqualTo("WelcomeMailer");
        assertThat(job.getTotalCallTime()).isEqualTo(10_000);
        assertThat(job.getExclusiveTime()).isEqualTo(6_000);
        assertThat(job.getErrors()).isZero();
        assertThat(job.getMetrics()).containsKeys(
            new MetricMeta("Job/WelcomeMailer"),
            new MetricMeta("ActiveRecord/User/find", "Job/WelcomeMailer"));
    }

    @Test
    void testDefaultQueue() {
        runJob(false);
        request.error();

        JobRecord job = new JobConverter(request).call();

        assertThat(job).isNotNull();
        assertThat(job.getQueueName()).isEqualTo(AbstractJobConverter.DEFAULT_QUEUE);
        assertThat(job.getErrors()).isEqualTo(1);
    }

    @Test
    void testSlowJob() {
        request.getContext().add(Collections.singletonMap("user_id", 42));
        runJob(true);

        SlowJobConverter converter = store.getSlowJobs().get(0);
        assertThat(converter.getScore()).isEqualTo(10.0);
        assertThat(converter.getName()).isEqualTo("Job/WelcomeMailer");

        SlowJobRecord slowJob = converter.call();

        assertThat(slowJob).isNotNull();
        assertThat(slowJob.getQueueName()).isEqualTo("mailers");
        assertThat(slowJob.getMetricName()).isEqualTo("Job/WelcomeMailer");
        assertThat(slowJob.getTimestamp()).isEqualTo(1_010_000);
        assertThat(slowJob.getTotalCallTime()).isEqualTo(10_000);
        assertThat(slowJob.getExclusiveTime()).isEqualTo(6_000);
        assertThat(slowJob.getScore()).isEqualTo(10.0);
        assertThat(slowJob.getContext().getExtra()).containsEntry("user_id", 42);
    }

    @Test
    void testNonJobScore() {
        TrackedRequest webRequest = MockTracer.createTracer(clock, store).newRequest();
        webRequest.web();
        webRequest.startLayer(Layer.TYPE_CONTROLLER, "Users#index");
        webRequest.stopLayer();

        assertThat(new SlowJobConverter(webRequest).getScore()).isEqualTo(SlowJobConverter.NON_JOB_SCORE);
    }

    private void runJob(boolean withQueue) {
        if (withQueue) {
            request.startLayer(Layer.TYPE_QUEUE, "mailers");
        }
        request.startLayer(Layer.TYPE_JOB, "WelcomeMailer");
        clock.advanceMillis(2);
        request.startLayer("ActiveRecord", "User/find");
        clock.advanceMillis(4);
        request.stopLayer();
        clock.advanceMillis(4);
        request.stopLayer();
        if (withQueue) {
            request.stopLayer();
        }
    }
}
