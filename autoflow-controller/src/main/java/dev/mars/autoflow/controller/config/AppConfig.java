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

package dev.mars.autoflow.controller.config;

import dev.mars.autoflow.core.config.AutoflowConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Controller configuration.
 *
 * <p>Values are resolved per key, highest priority first:
 * <ol>
 *   <li>Environment variable (e.g. AUTOFLOW_SCHEDULE_TICK_INTERVAL_MS)</li>
 *   <li>System property (e.g. -Dautoflow.schedule.tick.interval-ms=1000)</li>
 *   <li>Properties file ({@value #CONFIG_FILE} on the classpath)</li>
 *   <li>Default value</li>
 * </ol>
 *
 * <p>Engine keys ({@code autoflow.engine.*}, {@code autoflow.defaults.*}) go through the
 * same resolution and are handed to the engine via {@link #toEngineConfiguration()}.
 */
public final class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final String CONFIG_FILE = "autoflow-controller.properties";

    public static final String SCHEDULE_TICK_INTERVAL_MS = "autoflow.schedule.tick.interval-ms";
    public static final String SCHEDULE_ENABLED = "autoflow.schedule.enabled";
    public static final String STORAGE_TYPE = "autoflow.storage.type";
    public static final String STORAGE_PATH = "autoflow.storage.path";
    public static final String STORAGE_FSYNC = "autoflow.storage.fsync";
    public static final String RECOVERY_ENABLED = "autoflow.recovery.enabled";
    public static final String TELEMETRY_ENABLED = "autoflow.telemetry.enabled";
    public static final String TELEMETRY_OTLP_ENDPOINT = "autoflow.telemetry.otlp.endpoint";
    public static final String TELEMETRY_EXPORT_INTERVAL_MS = "autoflow.telemetry.export.interval-ms";
    public static final String TELEMETRY_SERVICE_NAME = "autoflow.telemetry.service.name";
    public static final String SHUTDOWN_DRAIN_TIMEOUT_MS = "autoflow.shutdown.drain-timeout-ms";
    public static final String SHUTDOWN_TIMEOUT_MS = "autoflow.shutdown.timeout-ms";

    private static final String[] ENGINE_KEYS = {
            AutoflowConfiguration.ENGINE_WORKER_THREADS,
            AutoflowConfiguration.ENGINE_STEP_THREADS,
            AutoflowConfiguration.ENGINE_CONFLICT_RETRIES,
            AutoflowConfiguration.ENGINE_SHUTDOWN_TIMEOUT_MS,
            AutoflowConfiguration.DEFAULT_MAX_RETRIES,
            AutoflowConfiguration.DEFAULT_RETRY_DELAY_SECONDS,
            AutoflowConfiguration.DEFAULT_BACKOFF,
            AutoflowConfiguration.DEFAULT_MAX_RETRY_DELAY_SECONDS,
            AutoflowConfiguration.DEFAULT_TIMEOUT_SECONDS,
            AutoflowConfiguration.DEFAULT_TIMEZONE
    };

    private final Properties properties;
    private final Function<String, String> environment;

    /**
     * Creates a configuration over the given file properties, the process environment
     * and system properties.
     */
    public AppConfig(Properties properties) {
        this(properties, System::getenv);
    }

    AppConfig(Properties properties, Function<String, String> environment) {
        this.properties = new Properties();
        if (properties != null) {
            this.properties.putAll(properties);
        }
        this.environment = Objects.requireNonNull(environment, "environment cannot be null");
    }

    /**
     * Loads {@value #CONFIG_FILE} from the classpath. A missing file leaves every key at its default.
     */
    public static AppConfig load() {
        Properties properties = new Properties();
        try (InputStream input = AppConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
        return new AppConfig(properties);
    }

    // ==================== Scheduling ====================

    public long getScheduleTickIntervalMs() {
        return getLong(SCHEDULE_TICK_INTERVAL_MS, 60_000);
    }

    public boolean isSchedulingEnabled() {
        return getBoolean(SCHEDULE_ENABLED, true);
    }

    // ==================== Storage ====================

    /**
     * Storage backend: "file" (default) or "memory" (testing only).
     */
    public String getStorageType() {
        return getString(STORAGE_TYPE, "file");
    }

    public String getStoragePath() {
        return getString(STORAGE_PATH, "./data/autoflow");
    }

    /**
     * Whether to fsync after each document write.
     * Defaults to true for durability; set to false only for testing.
     */
    public boolean getStorageFsync() {
        return getBoolean(STORAGE_FSYNC, true);
    }

    /**
     * Whether non-terminal runs found in the store are re-driven at startup.
     */
    public boolean isRecoveryEnabled() {
        return getBoolean(RECOVERY_ENABLED, true);
    }

    // ==================== Telemetry ====================

    public boolean isTelemetryEnabled() {
        return getBoolean(TELEMETRY_ENABLED, true);
    }

    public String getOtlpEndpoint() {
        return getString(TELEMETRY_OTLP_ENDPOINT, "http://localhost:4317");
    }

    public long getTelemetryExportIntervalMs() {
        return getLong(TELEMETRY_EXPORT_INTERVAL_MS, 60_000);
    }

    public String getServiceName() {
        return getString(TELEMETRY_SERVICE_NAME, "autoflow-controller");
    }

    // ==================== Shutdown ====================

    public long getShutdownDrainTimeoutMs() {
        return getLong(SHUTDOWN_DRAIN_TIMEOUT_MS, 5_000);
    }

    public long getShutdownTimeoutMs() {
        return getLong(SHUTDOWN_TIMEOUT_MS, 30_000);
    }

    // ==================== Engine ====================

    /**
     * Engine settings resolved through the same environment, system property and file layers.
     */
    public AutoflowConfiguration toEngineConfiguration() {
        Properties overrides = new Properties();
        for (String key : ENGINE_KEYS) {
            String value = getString(key, null);
            if (value != null) {
                overrides.setProperty(key, value);
            }
        }
        return new AutoflowConfiguration(overrides);
    }

    // ==================== Core Property Accessors ====================

    public String getString(String key, String defaultValue) {
        String envValue = environment.apply(environmentKey(key));
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    static String environmentKey(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }

    public void logConfiguration() {
        logger.info("=== Autoflow Controller Configuration ===");
        logger.info("  Service Name:         {}", getServiceName());
        logger.info("  --- Storage ---");
        logger.info("  Type:                 {}", getStorageType());
        logger.info("  Path:                 {}", getStoragePath());
        logger.info("  Fsync:                {}", getStorageFsync());
        logger.info("  Recovery:             {}", isRecoveryEnabled());
        logger.info("  --- Scheduling ---");
        logger.info("  Enabled:              {}", isSchedulingEnabled());
        logger.info("  Tick Interval:        {}ms", getScheduleTickIntervalMs());
        logger.info("  --- Telemetry ---");
        logger.info("  Enabled:              {}", isTelemetryEnabled());
        logger.info("  OTLP Endpoint:        {}", getOtlpEndpoint());
        logger.info("  Export Interval:      {}ms", getTelemetryExportIntervalMs());
        logger.info("  --- Shutdown ---");
        logger.info("  Drain Timeout:        {}ms", getShutdownDrainTimeoutMs());
        logger.info("  Shutdown Timeout:     {}ms", getShutdownTimeoutMs());
        logger.info("==========================================");
    }
}
