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

import javax.annotation.Nullable;

abstract class AbstractJobConverter extends ConverterBase {

    static final String DEFAULT_QUEUE = "default";

    AbstractJobConverter(TrackedRequest request) {
        super(request);
    }

    @Nullable
    protected Layer getJobLayer() {
        return findFirstLayerOfType(Layer.TYPE_JOB);
    }

    /**
     * The name of the first {@code Queue} layer, or {@value #DEFAULT_QUEUE}
     */
    protected String getQueueName() {
        final Layer queueLayer = findFirstLayerOfType(Layer.TYPE_QUEUE);
        return queueLayer != null ? queueLayer.getName() : DEFAULT_QUEUE;
    }
}
