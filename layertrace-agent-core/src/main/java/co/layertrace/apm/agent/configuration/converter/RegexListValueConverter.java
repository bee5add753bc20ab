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
package co.layertrace.apm.agent.configuration.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.converter.AbstractValueConverter;

import javax.annotation.Nullable;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Converts a comma separated list of regular expressions.
 * Expressions which don't compile are left out, so that one typo does not disable the whole list.
 */
public class RegexListValueConverter extends ListValueConverter<Pattern> {

    public static final RegexListValueConverter INSTANCE = new RegexListValueConverter();

    private static final Logger logger = LoggerFactory.getLogger(RegexListValueConverter.class);

    private RegexListValueConverter() {
        super(new AbstractValueConverter<Pattern>() {
            @Override
            public Pattern convert(String s) throws IllegalArgumentException {
                return Pattern.compile(s);
            }

            @Override
            public String toString(Pattern value) {
                return value.pattern();
            }
        }, COMMA_OUT_OF_BRACES);
    }

    @Nullable
    @Override
    protected Pattern convertElement(String element) {
        try {
            return valueConverter.convert(element);
        } catch (PatternSyntaxException e) {
            logger.warn("Ignoring invalid regular expression '{}': {}", element, e.getDescription());
            return null;
        }
    }
}
