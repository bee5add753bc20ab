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
package co.layertrace.apm.agent.impl.walker;

import co.layertrace.apm.agent.impl.layer.Layer;

import javax.annotation.Nullable;

/**
 * The primary callback of a {@link DepthFirstWalker}.
 *
 * @param <T> the type of the result which terminates the walk
 */
public interface LayerVisitor<T> {

    /**
     * @param layer the layer being visited
     * @return {@code null} to continue the walk, any other value to stop it and return that value
     */
    @Nullable
    T visit(Layer layer);
}
