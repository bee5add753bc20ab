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
package co.layertrace.apm.agent.configuration;

import co.layertrace.apm.agent.configuration.converter.RegexListValueConverter;
import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

public class CoreConfiguration extends ConfigurationOptionProvider {

    public static final String ACTIVE = "active";
    public static final String IGNORE_TRACES = "ignore_traces";

    private static final String CORE_CATEGORY = "Core";

    private final ConfigurationOption<Boolean> active = ConfigurationOption.booleanOption()
        .key(ACTIVE)
        .configurationCategory(CORE_CATEGORY)
        .description("A boolean specifying if the agent should be active or not.\n" +
            "When inactive, requests are still handed out to the instrumentation but they never record anything.")
        .dynamic(true)
        .buildWithDefault(true);

    private final ConfigurationOption<List<Pattern>> ignoreTraces = ConfigurationOption.<List<Pattern>>builder(RegexListValueConverter.INSTANCE, List.class)
        .key(IGNORE_TRACES)
        .configurationCategory(CORE_CATEGORY)
        .description("A comma separated list of regular expressions.\n" +
            "A slow transaction is not recorded if any of the expressions is found in the request URI.\n" +
            "Aggregated metrics are still collected for these requests.\n" +
            "Commas separate the expressions unless they are inside curly braces, like in `{1,3}`. " +
            "Expressions which are not valid regular expressions are ignored.\n" +
            "\n" +
            "Example: `^/health$,^/assets/`")
        .dynamic(true)
        .buildWithDefault(Collections.<Pattern>emptyList());

    public boolean isActive() {
        return active.get();
    }

    /**
     * The compiled {@value #IGNORE_TRACES} expressions. They are compiled once, whenever the option changes.
     */
    public List<Pattern> getIgnoreTracePatterns() {
        return ignoreTraces.get();
    }
}
