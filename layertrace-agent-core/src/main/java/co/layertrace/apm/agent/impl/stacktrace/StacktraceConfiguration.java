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
package co.layertrace.apm.agent.impl.stacktrace;

import co.layertrace.apm.agent.configuration.converter.TimeDuration;
import co.layertrace.apm.agent.configuration.converter.TimeDurationValueConverter;
import co.layertrace.apm.agent.configuration.validation.RangeValidator;
import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

import java.util.Collection;
import java.util.Collections;

public class StacktraceConfiguration extends ConfigurationOptionProvider {

    private static final String STACKTRACE_CATEGORY = "Stacktrace";
    public static final String APPLICATION_PACKAGES = "application_packages";
    public static final String STACK_TRACE_LIMIT = "stack_trace_limit";
    public static final String BACKTRACE_THRESHOLD = "backtrace_threshold";
    public static final String N_PLUS_ONE_CALL_THRESHOLD = "n_plus_one_call_threshold";

    private final ConfigurationOption<Collection<String>> applicationPackages = ConfigurationOption.stringsOption()
        .key(APPLICATION_PACKAGES)
        .configurationCategory(STACKTRACE_CATEGORY)
        .description("Used to determine whether a stack trace frame is an 'in-app frame' or a 'library frame'.\n" +
            "Only in-app frames are kept when a backtrace of a layer is attached to its metric.\n" +
            "Multiple root packages can be set as a comma-separated list;\n" +
            "there's no need to configure sub-packages.\n" +
            "\n" +
            "When not set, every frame outside of the JDK and the agent is considered an in-app frame.")
        .dynamic(true)
        .buildWithDefault(Collections.<String>emptyList());

    private final ConfigurationOption<Integer> stackTraceLimit = ConfigurationOption.integerOption()
        .key(STACK_TRACE_LIMIT)
        .tags("performance")
        .configurationCategory(STACKTRACE_CATEGORY)
        .description("The maximum number of in-app frames kept per backtrace. " +
            "Setting it to -1 means that all frames will be kept.")
        .dynamic(true)
        .buildWithDefault(50);

    private final ConfigurationOption<TimeDuration> backtraceThreshold = TimeDurationValueConverter.durationOption("ms")
        .key(BACKTRACE_THRESHOLD)
        .tags("performance")
        .configurationCategory(STACKTRACE_CATEGORY)
        .description("Capturing a backtrace has some overhead, so it is only done for layers which are interesting.\n" +
            "A layer of a web request or a background job whose exclusive time is longer than this threshold " +
            "always gets a backtrace.\n" +
            "Controller and Job layers never get one, their backtrace is framework code only.")
        .dynamic(true)
        .buildWithDefault(TimeDuration.of("500ms"));

    private final ConfigurationOption<Integer> nPlusOneCallThreshold = ConfigurationOption.integerOption()
        .key(N_PLUS_ONE_CALL_THRESHOLD)
        .tags("performance")
        .configurationCategory(STACKTRACE_CATEGORY)
        .description("The number of calls to layers of the same name within one request " +
            "after which a backtrace is captured even though no single call is slow.\n" +
            "This surfaces N+1 query patterns.")
        .addValidator(RangeValidator.min(1))
        .dynamic(true)
        .buildWithDefault(5);

    public Collection<String> getApplicationPackages() {
        return applicationPackages.get();
    }

    public int getStackTraceLimit() {
        return stackTraceLimit.get();
    }

    public long getBacktraceThresholdMicros() {
        return backtraceThreshold.get().getMicros();
    }

    public int getNPlusOneCallThreshold() {
        return nPlusOneCallThreshold.get();
    }
}
