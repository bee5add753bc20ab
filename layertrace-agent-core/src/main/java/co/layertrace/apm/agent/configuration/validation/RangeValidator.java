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
package co.layertrace.apm.agent.configuration.validation;

import org.stagemonitor.configuration.ConfigurationOption;

import javax.annotation.Nullable;

public class RangeValidator<T extends Comparable<T>> implements ConfigurationOption.Validator<T> {

    @Nullable
    private final T min;
    @Nullable
    private final T max;

    private RangeValidator(@Nullable T min, @Nullable T max) {
        this.min = min;
        this.max = max;
    }

    public static <T extends Comparable<T>> RangeValidator<T> isInRange(T min, T max) {
        return new RangeValidator<>(min, max);
    }

    public static <T extends Comparable<T>> RangeValidator<T> min(T min) {
        return new RangeValidator<>(min, null);
    }

    public static <T extends Comparable<T>> RangeValidator<T> max(T max) {
        return new RangeValidator<>(null, max);
    }

    @Override
    public void assertValid(@Nullable T value) {
        if (value != null) {
            boolean isInRange = true;
            if (min != null) {
                isInRange = min.compareTo(value) <= 0;
            }
            if (max != null) {
                isInRange &= value.compareTo(max) <= 0;
            }
            if (!isInRange) {
                throw new IllegalArgumentException(value + " must be in the range [" + min + "," + max + "]");
            }
        }
    }

    @Nullable
    public T getMin() {
        return min;
    }

    @Nullable
    public T getMax() {
        return max;
    }
}
