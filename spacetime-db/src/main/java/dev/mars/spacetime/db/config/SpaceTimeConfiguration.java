package dev.mars.spacetime.db.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * Configuration management for the space-time engine.
 * <p>
 * Properties are layered: {@code /spacetime-default.properties}, then the profile file
 * {@code /spacetime-<profile>.properties}, then {@code SPACETIME_*} environment
 * variables, then {@code spacetime.*} system properties, then explicit overrides.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class SpaceTimeConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SpaceTimeConfiguration.class);

    private final Properties properties;
    private final String profile;

    public SpaceTimeConfiguration() {
        this(getActiveProfile());
    }

    public SpaceTimeConfiguration(String profile) {
        this(profile, Map.of());
    }

    /**
     * Constructor for programmatic configuration. Overrides win over every other source
     * and never touch the JVM system properties.
     *
     * @param profile   the configuration profile to use
     * @param overrides explicit property values, keyed by full property name
     */
    public SpaceTimeConfiguration(String profile, Map<String, String> overrides) {
        this.profile = profile;
        this.properties = loadProperties(profile);
        overrides.forEach(properties::setProperty);
        validateConfiguration();
        logger.info("Loaded space-time configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("spacetime.profile",
               System.getenv("SPACETIME_PROFILE") != null ? System.getenv("SPACETIME_PROFILE") : "default");
    }

    private Properties loadProperties(String profile) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/spacetime-default.properties");

        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/spacetime-" + profile + ".properties");
        }

        // Environment first, system properties after so -D wins
        System.getenv().forEach((key, value) -> {
            if (key.startsWith("SPACETIME_")) {
                String propKey = key.toLowerCase(Locale.ROOT).replace("_", ".");
                props.setProperty(propKey, value);
            }
        });

        System.getProperties().forEach((key, value) -> {
            String keyStr = key.toString();
            if (keyStr.startsWith("spacetime.")) {
                props.setProperty(keyStr, value.toString());
            }
        });

        return props;
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from: {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties from: {}", resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        validateDatabaseConfig(errors);
        validateAlgebraConfig(errors);

        if (getString("spacetime.mapset", "").isEmpty()) {
            errors.add("Current mapset is required");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }

        logger.debug("Configuration validation passed");
    }

    private void validateDatabaseConfig(List<String> errors) {
        String backend = getString("spacetime.database.backend", "h2");
        if (!"h2".equals(backend) && !"postgresql".equals(backend)) {
            errors.add("Database backend must be h2 or postgresql");
        }
        if (getString("spacetime.database.url", "").isEmpty()) {
            errors.add("Database url is required");
        }
    }

    private void validateAlgebraConfig(List<String> errors) {
        if (getInt("spacetime.algebra.nprocs", 1) < 1) {
            errors.add("Number of algebra worker processes must be at least 1");
        }
        if (getString("spacetime.algebra.mapcalc-command", "").isEmpty()) {
            errors.add("Map calculator command is required");
        }
    }

    // Configuration getters with defaults
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public String getString(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalArgumentException("Required configuration property not found: " + key);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public String getProfile() {
        return profile;
    }

    public String getMapset() {
        return getString("spacetime.mapset", "PERMANENT");
    }

    // Specific configuration builders
    public DatabaseConfig getDatabaseConfig() {
        return new DatabaseConfig(
            getString("spacetime.database.backend", "h2"),
            getString("spacetime.database.url", ""),
            getString("spacetime.database.username", "sa"),
            getString("spacetime.database.password", "")
        );
    }

    public AlgebraConfig getAlgebraConfig() {
        return new AlgebraConfig(
            getInt("spacetime.algebra.nprocs", 1),
            getString("spacetime.algebra.mapcalc-command", "r.mapcalc"),
            getBoolean("spacetime.algebra.register-null", false),
            getBoolean("spacetime.algebra.spatial", false)
        );
    }

    public MetricsConfig getMetricsConfig() {
        return new MetricsConfig(
            getBoolean("spacetime.metrics.enabled", true),
            getString("spacetime.metrics.instance-id", "spacetime-" + UUID.randomUUID().toString().substring(0, 8))
        );
    }

    // Configuration data classes
    public static class DatabaseConfig {
        private final String backend;
        private final String url;
        private final String username;
        private final String password;

        public DatabaseConfig(String backend, String url, String username, String password) {
            this.backend = backend;
            this.url = url;
            this.username = username;
            this.password = password;
        }

        public String getBackend() { return backend; }
        public String getUrl() { return url; }
        public String getUsername() { return username; }
        public String getPassword() { return password; }

        @Override
        public String toString() {
            return "DatabaseConfig{backend='" + backend + "', url='" + url + "', username='" + username + "'}";
        }
    }

    public static class AlgebraConfig {
        private final int nprocs;
        private final String mapcalcCommand;
        private final boolean registerNull;
        private final boolean spatial;

        public AlgebraConfig(int nprocs, String mapcalcCommand, boolean registerNull, boolean spatial) {
            this.nprocs = nprocs;
            this.mapcalcCommand = mapcalcCommand;
            this.registerNull = registerNull;
            this.spatial = spatial;
        }

        public int getNprocs() { return nprocs; }
        public String getMapcalcCommand() { return mapcalcCommand; }
        public boolean isRegisterNull() { return registerNull; }
        public boolean isSpatial() { return spatial; }
    }

    public static class MetricsConfig {
        private final boolean enabled;
        private final String instanceId;

        public MetricsConfig(boolean enabled, String instanceId) {
            this.enabled = enabled;
            this.instanceId = instanceId;
        }

        public boolean isEnabled() { return enabled; }
        public String getInstanceId() { return instanceId; }
    }
}
