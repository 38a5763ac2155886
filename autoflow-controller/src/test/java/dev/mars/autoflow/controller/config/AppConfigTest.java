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

import dev.mars.autoflow.core.BackoffStrategy;
import dev.mars.autoflow.core.config.AutoflowConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigTest {

    private static Properties properties(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    @DisplayName("Defaults apply when nothing is configured")
    void defaultsApply() {
        AppConfig config = new AppConfig(new Properties(), key -> null);

        assertEquals(60_000, config.getScheduleTickIntervalMs());
        assertEquals("file", config.getStorageType());
        assertEquals("./data/autoflow", config.getStoragePath());
        assertTrue(config.getStorageFsync());
        assertTrue(config.isRecoveryEnabled());
        assertTrue(config.isTelemetryEnabled());
        assertEquals("autoflow-controller", config.getServiceName());
        assertEquals(5_000, config.getShutdownDrainTimeoutMs());
    }

    @Test
    @DisplayName("Environment variables win over file properties")
    void environmentOverridesFile() {
        Map<String, String> env = Map.of("AUTOFLOW_SCHEDULE_TICK_INTERVAL_MS", "250");
        AppConfig config = new AppConfig(properties(
                AppConfig.SCHEDULE_TICK_INTERVAL_MS, "1000",
                AppConfig.STORAGE_TYPE, "memory"), env::get);

        assertEquals(250, config.getScheduleTickIntervalMs());
        assertEquals("memory", config.getStorageType());
    }

    @Test
    @DisplayName("System properties win over file properties")
    void systemPropertyOverridesFile() {
        String key = "autoflow.test.sysprop";
        System.setProperty(key, "from-system");
        try {
            AppConfig config = new AppConfig(properties(key, "from-file"), k -> null);
            assertEquals("from-system", config.getString(key, "default"));
        } finally {
            System.clearProperty(key);
        }
    }

    @Test
    @DisplayName("Invalid numbers fall back to the default")
    void invalidNumbersFallBack() {
        AppConfig config = new AppConfig(properties(
                AppConfig.SCHEDULE_TICK_INTERVAL_MS, "soon",
                "autoflow.test.int", "x"), key -> null);

        assertEquals(60_000, config.getScheduleTickIntervalMs());
        assertEquals(7, config.getInt("autoflow.test.int", 7));
        assertFalse(config.getBoolean("autoflow.test.missing", false));
    }

    @Test
    void environmentKeyFormat() {
        assertEquals("AUTOFLOW_SHUTDOWN_DRAIN_TIMEOUT_MS", AppConfig.environmentKey("autoflow.shutdown.drain-timeout-ms"));
    }

    @Test
    @DisplayName("Engine settings resolve through the same layers")
    void engineConfigurationUsesOverrides() {
        Map<String, String> env = Map.of("AUTOFLOW_ENGINE_WORKER_THREADS", "3");
        AppConfig config = new AppConfig(properties(
                AutoflowConfiguration.DEFAULT_MAX_RETRIES, "5",
                AutoflowConfiguration.DEFAULT_BACKOFF, "EXPONENTIAL",
                AutoflowConfiguration.DEFAULT_TIMEZONE, "UTC"), env::get);

        AutoflowConfiguration engine = config.toEngineConfiguration();

        assertEquals(3, engine.getWorkerThreads());
        assertEquals(5, engine.getDefaultSettings().maxRetries());
        assertEquals(BackoffStrategy.EXPONENTIAL, engine.getDefaultSettings().backoff());
        assertEquals("UTC", engine.getDefaultTimezone());
        assertEquals(5, engine.getConflictRetryLimit());
    }

    @Test
    @DisplayName("Bundled properties file is found on the class path")
    void bundledFileLoads() {
        AppConfig config = AppConfig.load();

        assertEquals("./data/autoflow", config.getStoragePath());
        assertEquals("autoflow-controller", config.getServiceName());
    }
}
