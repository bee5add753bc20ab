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
package co.layertrace.apm.agent.configuration.source;

import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.source.ConfigurationSource;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigSourcesTest {

    @Test
    void loadFromClasspath() {
        ConfigurationSource source = ConfigSources.fromClasspath("test.layertrace.properties", ClassLoader.getSystemClassLoader());
        assertThat(source).isNotNull();

        assertThat(source.getName()).isEqualTo("classpath:test.layertrace.properties");
        assertThat(source.getValue("application_packages")).isEqualTo("com.example");
        assertThat(source.getValue("backtrace_threshold")).isEqualTo("250ms");
    }

    @Test
    void missingFileOnClasspath() {
        assertThat(ConfigSources.fromClasspath("does-not-exist.properties", ClassLoader.getSystemClassLoader())).isNull();
    }
}
