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

package dev.mars.autoflow.controller;

import dev.mars.autoflow.controller.config.AppConfig;
import dev.mars.autoflow.controller.lifecycle.ShutdownCoordinator;
import dev.mars.autoflow.controller.observability.TelemetryConfig;
import dev.mars.autoflow.controller.schedule.ScheduleManager;
import dev.mars.autoflow.controller.storage.WorkflowStateStoreFactory;
import dev.mars.autoflow.core.config.AutoflowConfiguration;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.TriggerRejectedException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.autoflow.core.step.StepExecutor;
import dev.mars.autoflow.core.storage.WorkflowStateStore;
import dev.mars.autoflow.workflow.StepExecutorRegistry;
import dev.mars.autoflow.workflow.WorkflowCompiler;
import dev.mars.autoflow.workflow.definition.SimpleWorkflowDefinitionStore;
import dev.mars.autoflow.workflow.definition.WorkflowDefinitionStore;
import dev.mars.autoflow.workflow.engine.DurableWorkflowEngine;
import dev.mars.autoflow.workflow.engine.WorkflowEngine;
import dev.mars.autoflow.workflow.observability.WorkflowMetrics;
import dev.mars.autoflow.workflow.trigger.RunRequest;
import dev.mars.autoflow.workflow.trigger.TriggerDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Wires the state store, definition store, engine, trigger dispatcher and
 * schedule manager together and owns their lifecycle.
 *
 * <p>Step executors are taken from the explicit list given to {@link #create}
 * plus every implementation published through {@link java.util.ServiceLoader}.
 */
public class AutoflowController {

    private static final Logger logger = LoggerFactory.getLogger(AutoflowController.class);

    private final AppConfig config;
    private final TelemetryConfig telemetry;
    private final WorkflowStateStore store;
    private final StepExecutorRegistry registry;
    private final WorkflowDefinitionStore definitions;
    private final DurableWorkflowEngine engine;
    private final TriggerDispatcher dispatcher;
    private final ScheduleManager scheduleManager;
    private final ShutdownCoordinator shutdownCoordinator;

    private volatile boolean started = false;

    private AutoflowController(AppConfig config, TelemetryConfig telemetry, WorkflowStateStore store,
                               StepExecutorRegistry registry, Clock clock) {
        this.config = config;
        this.telemetry = telemetry;
        this.store = store;
        this.registry = registry;

        AutoflowConfiguration engineConfig = config.toEngineConfiguration();
        WorkflowCompiler compiler = new WorkflowCompiler(registry);
        this.definitions = new SimpleWorkflowDefinitionStore(store, compiler, engineConfig.getDefaultSettings(),
                engineConfig.getConflictRetryLimit(), clock);
        this.engine = DurableWorkflowEngine.builder()
                .stateStore(store)
                .definitionStore(definitions)
                .compiler(compiler)
                .metrics(WorkflowMetrics.create(telemetry.getOpenTelemetry()))
                .configuration(engineConfig)
                .clock(clock)
                .build();
        this.dispatcher = new TriggerDispatcher(definitions, engine);
        this.scheduleManager = new ScheduleManager(store, definitions, dispatcher, engine,
                Duration.ofMillis(config.getScheduleTickIntervalMs()), engineConfig.getConflictRetryLimit(),
                engineConfig.getDefaultTimezone(), clock);
        this.shutdownCoordinator = new ShutdownCoordinator(config.getShutdownDrainTimeoutMs(),
                config.getShutdownTimeoutMs());
        registerShutdownHooks();
    }

    /**
     * Builds a controller: opens the configured state store, registers the given
     * executors and those installed on the class path, and assembles the engine.
     *
     * @throws IOException if the state store cannot be opened
     */
    public static AutoflowController create(AppConfig config, Clock clock,
                                            Collection<? extends StepExecutor<?>> executors) throws IOException {
        TelemetryConfig telemetry = TelemetryConfig.configure(config);
        WorkflowStateStore store;
        try {
            store = WorkflowStateStoreFactory.create(config.getStorageType(),
                    Path.of(config.getStoragePath()), config.getStorageFsync());
        } catch (IOException | RuntimeException e) {
            telemetry.close();
            throw e;
        }

        StepExecutorRegistry registry = new StepExecutorRegistry();
        executors.forEach(registry::register);
        registry.loadInstalled(AutoflowController.class.getClassLoader());
        logger.info("Step executor types: {}", registry.types());

        return new AutoflowController(config, telemetry, store, registry, clock != null ? clock : Clock.systemUTC());
    }

    private void registerShutdownHooks() {
        shutdownCoordinator
                .onDrain("schedule-manager", () -> CompletableFuture.runAsync(scheduleManager::stop))
                .onAwaitCompletion("workflow-engine", () -> CompletableFuture.runAsync(engine::shutdown))
                .onResourceClose("state-store", () -> CompletableFuture.runAsync(store::close))
                .onResourceClose("telemetry", () -> CompletableFuture.runAsync(telemetry::close));
    }

    /**
     * Re-drives the runs left unfinished by a previous process and starts firing schedules.
     */
    public synchronized void start() {
        if (started) {
            logger.warn("Autoflow controller is already running");
            return;
        }
        if (!shutdownCoordinator.isAcceptingWork()) {
            throw new IllegalStateException("Autoflow controller has been shut down");
        }
        logger.info("Starting Autoflow controller...");
        if (config.isRecoveryEnabled()) {
            int recovered = engine.recoverInFlight();
            logger.info("Recovered {} in-flight execution(s)", recovered);
        }
        if (config.isSchedulingEnabled()) {
            scheduleManager.start();
        }
        started = true;
        logger.info("Autoflow controller started");
    }

    public CompletableFuture<Void> shutdown() {
        return shutdownCoordinator.shutdown();
    }

    // ==================== Trigger ingestion ====================

    /**
     * Starts a run after admission checks.
     *
     * @throws TriggerRejectedException if the controller is draining or the request is not admitted
     */
    public String createRun(RunRequest request)
            throws TriggerRejectedException, WorkflowNotFoundException, DefinitionValidationException {
        if (!shutdownCoordinator.isAcceptingWork()) {
            throw new TriggerRejectedException(request.definitionId(), "controller is shutting down");
        }
        return dispatcher.createRun(request);
    }

    public List<String> publishEvent(String accountId, String eventType, Map<String, Object> payload) {
        if (!shutdownCoordinator.isAcceptingWork()) {
            logger.info("Dropped event {} for account {}: controller is shutting down", eventType, accountId);
            return List.of();
        }
        return dispatcher.publishEvent(accountId, eventType, payload);
    }

    // ==================== Accessors ====================

    public WorkflowDefinitionStore getDefinitions() {
        return definitions;
    }

    public WorkflowEngine getEngine() {
        return engine;
    }

    public TriggerDispatcher getDispatcher() {
        return dispatcher;
    }

    public ScheduleManager getScheduleManager() {
        return scheduleManager;
    }

    public StepExecutorRegistry getRegistry() {
        return registry;
    }

    public WorkflowStateStore getStateStore() {
        return store;
    }

    public ShutdownCoordinator getShutdownCoordinator() {
        return shutdownCoordinator;
    }

    /**
     * Main entry point for the Autoflow controller.
     */
    public static void main(String[] args) {
        AppConfig config = AppConfig.load();
        config.logConfiguration();

        AutoflowController controller;
        try {
            controller = create(config, Clock.systemUTC(), List.of());
            controller.start();
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to start Autoflow controller", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping Autoflow controller...");
            controller.shutdown().join();
        }, "autoflow-shutdown"));

        // daemon worker threads; keep the JVM alive until shutdown has run
        controller.shutdownCoordinator.whenStopped().join();
    }
}
