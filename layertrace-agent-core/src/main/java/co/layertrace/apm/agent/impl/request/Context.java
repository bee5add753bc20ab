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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application defined information about a request, like the current user, their plan or locale.
 */
public class Context {

    private final Map<String, Object> extra = new LinkedHashMap<>();
    private final Map<String, Object> user = new LinkedHashMap<>();

    public Context add(Map<String, ?> values) {
        extra.putAll(values);
        return this;
    }

    public Context addUser(Map<String, ?> values) {
        user.putAll(values);
        return this;
    }

    public Map<String, Object> getExtra() {
        return Collections.unmodifiableMap(extra);
    }

    public Map<String, Object> getUser() {
        return Collections.unmodifiableMap(user);
    }

    public boolean hasContent() {
        return !extra.isEmpty() || !user.isEmpty();
    }

    /**
     * @return the extra values, plus the user values nested under the {@code user} key if there are any
     */
    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(extra);
        if (!user.isEmpty()) {
            result.put("user", getUser());
        }
        return result;
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
