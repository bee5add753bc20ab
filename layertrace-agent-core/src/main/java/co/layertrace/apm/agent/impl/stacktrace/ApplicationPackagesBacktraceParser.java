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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Keeps the frames of the configured {@link StacktraceConfiguration#APPLICATION_PACKAGES application packages}.
 * <p>
 * If no application package is configured, every frame which is neither JDK nor agent code is kept.
 * </p>
 */
public class ApplicationPackagesBacktraceParser implements BacktraceParser {

    private static final String[] EXCLUDED_PACKAGES = {
        "java.", "javax.", "jdk.", "sun.", "com.sun.", "co.layertrace.apm.agent."
    };

    private final StacktraceConfiguration stacktraceConfiguration;

    public ApplicationPackagesBacktraceParser(StacktraceConfiguration stacktraceConfiguration) {
        this.stacktraceConfiguration = stacktraceConfiguration;
    }

    @Override
    public List<StackFrame> parse(Throwable backtrace) {
        final Collection<String> applicationPackages = stacktraceConfiguration.getApplicationPackages();
        final int limit = stacktraceConfiguration.getStackTraceLimit();
        final List<StackFrame> frames = new ArrayList<>();
        for (StackTraceElement element : backtrace.getStackTrace()) {
            if (limit >= 0 && frames.size() >= limit) {
                break;
            }
            if (isApplicationFrame(element.getClassName(), applicationPackages)) {
                frames.add(StackFrame.of(element));
            }
        }
        return frames;
    }

    private static boolean isApplicationFrame(String className, Collection<String> applicationPackages) {
        if (applicationPackages.isEmpty()) {
            for (String excludedPackage : EXCLUDED_PACKAGES) {
                if (className.startsWith(excludedPackage)) {
                    return false;
                }
            }
            return true;
        }
        for (String applicationPackage : applicationPackages) {
            if (className.startsWith(applicationPackage)) {
                return true;
            }
        }
        return false;
    }
}
