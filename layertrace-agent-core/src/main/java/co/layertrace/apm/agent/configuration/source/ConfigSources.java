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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.source.ConfigurationSource;
import org.stagemonitor.configuration.source.SimpleSource;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Static factory class for configuration sources
 */
public class ConfigSources {

    private static final Logger logger = LoggerFactory.getLogger(ConfigSources.class);

    private ConfigSources() {
    }

    /**
     * @return a source backed by the properties file at the given classpath location,
     * or {@code null} if there is no such file
     */
    @Nullable
    public static ConfigurationSource fromClasspath(String location, ClassLoader classLoader) {
        Properties properties = getPropertiesFromClasspath(location, classLoader);
        if (properties == null) {
            return null;
        }
        SimpleSource source = new SimpleSource("classpath:" + location);
        for (String key : properties.stringPropertyNames()) {
            source.add(key, properties.getProperty(key));
        }
        return source;
    }

    @Nullable
    private static Properties getPropertiesFromClasspath(String classpathLocation, ClassLoader classLoader) {
        final Properties props = new Properties();
        try (InputStream resourceStream = classLoader.getResourceAsStream(classpathLocation)) {
            if (resourceStream != null) {
                props.load(resourceStream);
                return props;
            }
        } catch (IOException e) {
            logger.warn("Could not read configuration from classpath:{}", classpathLocation, e);
        }
        return null;
    }
}
