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

package dev.mars.autoflow.core.config;

import dev.mars.autoflow.core.BackoffStrategy;
import dev.mars.autoflow.core.WorkflowSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * Engine-level configuration: worker pool sizing, the bound on optimistic
 * conflict retries and the settings given to definitions created without any.
 *
 * <p>Sources, later ones winning: built-in defaults, the first readable
 * {@code autoflow.properties} (working directory, {@code config/},
 * {@code ~/.autoflow/}, {@code /etc/autoflow/}, then the classpath), and
 * system properties starting with {@code autoflow.}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-04
 * @version 1.0
 */
public class AutoflowConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AutoflowConfiguration.class);

    public static final String ENGINE_WORKER_THREADS = "autoflow.engine.worker.threads";
    public static final String ENGINE_STEP_THREADS = "autoflow.engine.step.threads";
    public static final String ENGINE_CONFLICT_RETRIES = "autoflow.engine.conflict.retries";
    public static final String ENGINE_SHUTDOWN_TIMEOUT_MS = "autoflow.engine.shutdown.timeout.ms";
    public static final String DEFAULT_MAX_RETRIES = "autoflow.defaults.max.retries";
    public static final String DEFAULT_RETRY_DELAY_SECONDS = "autoflow.defaults.retry.delay.seconds";
    public static final String DEFAULT_BACKOFF = "autoflow.defaults.backoff";
    public static final String DEFAULT_MAX_RETRY_DELAY_SECONDS = "autoflow.defaults.max.retry.delay.seconds";
    public static final String DEFAULT_TIMEOUT_SECONDS = "autoflow.defaults.timeout.seconds";
    public static final String DEFAULT_TIMEZONE = "autoflow.defaults.timezone";

    private final Properties properties;

    public AutoflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public AutoflowConfiguration(Properties overrides) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (overrides != null) {
            this.properties.putAll(overrides);
        }
    }

    // Engine

    public int getWorkerThreads() {
        return Math.max(1, getIntProperty(ENGINE_WORKER_THREADS, 8));
    }

    public int getStepThreads() {
        return Math.max(1, getIntProperty(ENGINE_STEP_THREADS, 16));
    }

    public int getConflictRetryLimit() {
        return Math.max(1, getIntProperty(ENGINE_CONFLICT_RETRIES, 5));
    }

    public long getShutdownTimeoutMs() {
        return getLongProperty(ENGINE_SHUTDOWN_TIMEOUT_MS, 30000);
    }

    // Definition defaults

    public String getDefaultTimezone() {
        return properties.getProperty(DEFAULT_TIMEZONE, "Europe/Rome");
    }

    /**
     * Settings applied to a definition that is created without its own.
     */
    public WorkflowSettings getDefaultSettings() {
        BackoffStrategy backoff;
        String configured = properties.getProperty(DEFAULT_BACKOFF, BackoffStrategy.FIXED.name());
        try {
            backoff = BackoffStrategy.valueOf(configured.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid backoff strategy for property {}: {}. Using FIXED", DEFAULT_BACKOFF, configured);
            backoff = BackoffStrategy.FIXED;
        }
        return new WorkflowSettings(
                getIntProperty(DEFAULT_MAX_RETRIES, WorkflowSettings.DEFAULT_MAX_RETRIES),
                getLongProperty(DEFAULT_RETRY_DELAY_SECONDS, WorkflowSettings.DEFAULT_RETRY_DELAY_SECONDS),
                backoff,
                getLongProperty(DEFAULT_MAX_RETRY_DELAY_SECONDS, WorkflowSettings.DEFAULT_MAX_RETRY_DELAY_SECONDS),
                getLongProperty(DEFAULT_TIMEOUT_SECONDS, WorkflowSettings.DEFAULT_TIMEOUT_SECONDS));
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(ENGINE_WORKER_THREADS, "8");
        properties.setProperty(ENGINE_STEP_THREADS, "16");
        properties.setProperty(ENGINE_CONFLICT_RETRIES, "5");
        properties.setProperty(ENGINE_SHUTDOWN_TIMEOUT_MS, "30000");
        properties.setProperty(DEFAULT_MAX_RETRIES, String.valueOf(WorkflowSettings.DEFAULT_MAX_RETRIES));
        properties.setProperty(DEFAULT_RETRY_DELAY_SECONDS, String.valueOf(WorkflowSettings.DEFAULT_RETRY_DELAY_SECONDS));
        properties.setProperty(DEFAULT_BACKOFF, BackoffStrategy.FIXED.name());
        properties.setProperty(DEFAULT_MAX_RETRY_DELAY_SECONDS, String.valueOf(WorkflowSettings.DEFAULT_MAX_RETRY_DELAY_SECONDS));
        properties.setProperty(DEFAULT_TIMEOUT_SECONDS, String.valueOf(WorkflowSettings.DEFAULT_TIMEOUT_SECONDS));
        properties.setProperty(DEFAULT_TIMEZONE, "Europe/Rome");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "autoflow.properties",
                "config/autoflow.properties",
                System.getProperty("user.home") + "/.autoflow/autoflow.properties",
                "/etc/autoflow/autoflow.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("autoflow.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("autoflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "AutoflowConfiguration{" +
                "workerThreads=" + getWorkerThreads() +
                ", stepThreads=" + getStepThreads() +
                ", conflictRetryLimit=" + getConflictRetryLimit() +
                ", defaultSettings=" + getDefaultSettings() +
                '}';
    }
}
