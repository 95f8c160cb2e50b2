/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.raftkv.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Resolves configuration values from the layered sources shared by every
 * raftkv configuration class.
 * <p>
 * Priority (highest first):
 * <ol>
 *   <li>System properties (e.g., {@code -Draftkv.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code RAFTKV_DATA_DIR})</li>
 *   <li>Properties file ({@code raftkv.properties} on classpath or in working directory)</li>
 *   <li>The default supplied by the caller</li>
 * </ol>
 * Programmatic builder values sit above all of these and never reach this class.
 */
public final class ConfigSource {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigSource.class);

    /** Name of the optional properties file. */
    public static final String PROPERTIES_FILE = "raftkv.properties";

    private final Properties fileProperties;

    private ConfigSource(Properties fileProperties) {
        this.fileProperties = fileProperties;
    }

    /**
     * Creates a source backed by system properties, environment and the
     * {@code raftkv.properties} file (loaded once).
     */
    public static ConfigSource load() {
        return new ConfigSource(loadPropertiesFile());
    }

    /**
     * Creates a source whose file layer is the given properties instead of
     * {@code raftkv.properties}.
     */
    public static ConfigSource of(Properties fileProperties) {
        return new ConfigSource(fileProperties);
    }

    /**
     * Returns the raw value for a property, or null when no source defines it.
     *
     * @param sysProp the system property / file key (e.g. {@code raftkv.dataDir})
     * @param envVar  the environment variable (e.g. {@code RAFTKV_DATA_DIR})
     */
    public String resolve(String sysProp, String envVar) {
        // 1. System property
        String value = System.getProperty(sysProp);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }

        // 2. Environment variable
        value = System.getenv(envVar);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }

        // 3. Properties file
        value = fileProperties.getProperty(sysProp);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }

        return null;
    }

    public Path resolvePath(String sysProp, String envVar, Path defaultValue) {
        String value = resolve(sysProp, envVar);
        return value != null ? Path.of(value) : defaultValue;
    }

    public boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
        String value = resolve(sysProp, envVar);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }

    public int resolveInt(String sysProp, String envVar, int defaultValue) {
        String value = resolve(sysProp, envVar);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring non-numeric value for {}: '{}', using default {}", sysProp, value, defaultValue);
            return defaultValue;
        }
    }

    public long resolveLong(String sysProp, String envVar, long defaultValue) {
        String value = resolve(sysProp, envVar);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring non-numeric value for {}: '{}', using default {}", sysProp, value, defaultValue);
            return defaultValue;
        }
    }

    private static Properties loadPropertiesFile() {
        Properties props = new Properties();

        // Try classpath first
        try (InputStream is = ConfigSource.class.getClassLoader()
                .getResourceAsStream(PROPERTIES_FILE)) {
            if (is != null) {
                props.load(is);
                LOG.debug("Loaded {} from classpath", PROPERTIES_FILE);
                return props;
            }
        } catch (IOException e) {
            LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
        }

        // Try working directory
        Path localFile = Path.of(PROPERTIES_FILE);
        if (Files.exists(localFile)) {
            try (InputStream is = Files.newInputStream(localFile)) {
                props.load(is);
                LOG.debug("Loaded {} from working directory", PROPERTIES_FILE);
            } catch (IOException e) {
                LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
            }
        }

        return props;
    }
}
