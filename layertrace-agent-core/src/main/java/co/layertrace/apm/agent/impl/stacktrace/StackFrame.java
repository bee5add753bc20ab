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

import javax.annotation.Nullable;
import java.util.Objects;

public class StackFrame {
    private final String className;
    private final String methodName;
    @Nullable
    private final String fileName;
    private final int lineNumber;

    public static StackFrame of(StackTraceElement element) {
        return new StackFrame(element.getClassName(), element.getMethodName(), element.getFileName(), element.getLineNumber());
    }

    public StackFrame(String className, String methodName, @Nullable String fileName, int lineNumber) {
        this.className = className;
        this.methodName = methodName;
        this.fileName = fileName;
        this.lineNumber = lineNumber;
    }

    public String getClassName() {
        return className;
    }

    public String getMethodName() {
        return methodName;
    }

    @Nullable
    public String getFileName() {
        return fileName;
    }

    /**
     * @return the line number, or a negative value if it is unknown
     */
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        StackFrame that = (StackFrame) o;

        return lineNumber == that.lineNumber &&
            className.equals(that.className) &&
            methodName.equals(that.methodName) &&
            Objects.equals(fileName, that.fileName);
    }

    @Override
    public int hashCode() {
        int result = className.hashCode();
        result = 31 * result + methodName.hashCode();
        result = 31 * result + lineNumber;
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(className).append('.').append(methodName).append('(');
        sb.append(fileName != null ? fileName : "Unknown Source");
        if (lineNumber > 0) {
            sb.append(':').append(lineNumber);
        }
        return sb.append(')').toString();
    }
}
