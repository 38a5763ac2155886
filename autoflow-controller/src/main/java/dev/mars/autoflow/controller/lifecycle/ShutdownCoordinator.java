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

package dev.mars.autoflow.controller.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Stops the controller in four phases:
 * <ol>
 *   <li>{@link Phase#DRAIN}: stop the scheduler tick and refuse new triggers</li>
 *   <li>{@link Phase#AWAIT_COMPLETION}: let the engine finish the steps it has in flight</li>
 *   <li>{@link Phase#STOP_SERVICES}: stop remaining services</li>
 *   <li>{@link Phase#CLOSE_RESOURCES}: close the state store and telemetry</li>
 * </ol>
 *
 * <p>Hooks run one after the other in registration order, each bounded by the
 * drain timeout (first phase) or the shutdown timeout (later phases). A hook that
 * fails or times out is logged and the next one still runs. Runs interrupted by
 * the timeout stay open in the state store and are picked up by recovery on the
 * next start.
 */
public class ShutdownCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    public enum Phase {
        DRAIN("stop scheduling and admitting runs"),
        AWAIT_COMPLETION("wait for in-flight steps"),
        STOP_SERVICES("stop services"),
        CLOSE_RESOURCES("close storage and telemetry");

        private final String description;

        Phase(String description) {
            this.description = description;
        }
    }

    public enum State {
        RUNNING,
        /** Triggers are refused; runs already admitted continue. */
        DRAINING,
        SHUTTING_DOWN,
        STOPPED
    }

    private final long drainTimeoutMs;
    private final long shutdownTimeoutMs;

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final CompletableFuture<Void> completion = new CompletableFuture<>();
    private final Map<Phase, List<ShutdownHook>> hooks = new EnumMap<>(Phase.class);

    /**
     * @param drainTimeoutMs    maximum time for each drain hook
     * @param shutdownTimeoutMs maximum time for each hook of the later phases
     */
    public ShutdownCoordinator(long drainTimeoutMs, long shutdownTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        for (Phase phase : Phase.values()) {
            hooks.put(phase, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * 5 s drain, 30 s for the other phases.
     */
    public ShutdownCoordinator() {
        this(5000, 30000);
    }

    public State getState() {
        return state.get();
    }

    public boolean isAcceptingWork() {
        return state.get() == State.RUNNING;
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    /**
     * Future completed once shutdown has finished, without initiating it.
     */
    public CompletableFuture<Void> whenStopped() {
        return completion;
    }

    public ShutdownCoordinator onDrain(String name, Supplier<CompletableFuture<Void>> hook) {
        return register(Phase.DRAIN, name, hook);
    }

    /**
     * Registers a hook whose future completes when active work has finished.
     */
    public ShutdownCoordinator onAwaitCompletion(String name, Supplier<CompletableFuture<Void>> hook) {
        return register(Phase.AWAIT_COMPLETION, name, hook);
    }

    public ShutdownCoordinator onServiceStop(String name, Supplier<CompletableFuture<Void>> hook) {
        return register(Phase.STOP_SERVICES, name, hook);
    }

    public ShutdownCoordinator onResourceClose(String name, Supplier<CompletableFuture<Void>> hook) {
        return register(Phase.CLOSE_RESOURCES, name, hook);
    }

    /**
     * Starts the shutdown sequence. Later calls return the same future.
     *
     * @return a future that completes when every phase has run
     */
    public CompletableFuture<Void> shutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            logger.info("Shutdown already in progress");
            return completion;
        }
        logger.info("Shutting down (drain timeout {} ms, phase timeout {} ms)", drainTimeoutMs, shutdownTimeoutMs);

        CompletableFuture<Void> sequence = CompletableFuture.completedFuture(null);
        for (Phase phase : Phase.values()) {
            sequence = sequence.thenCompose(v -> runPhase(phase));
        }
        sequence.whenComplete((v, err) -> {
            state.set(State.STOPPED);
            if (err == null) {
                logger.info("Shutdown complete");
            } else {
                logger.warn("Shutdown finished with errors", err);
            }
            completion.complete(null);
        });
        return completion;
    }

    private ShutdownCoordinator register(Phase phase, String name, Supplier<CompletableFuture<Void>> hook) {
        hooks.get(phase).add(new ShutdownHook(name, hook));
        return this;
    }

    private CompletableFuture<Void> runPhase(Phase phase) {
        if (phase == Phase.DRAIN) {
            state.compareAndSet(State.RUNNING, State.DRAINING);
        } else if (phase == Phase.STOP_SERVICES) {
            state.set(State.SHUTTING_DOWN);
        }
        List<ShutdownHook> phaseHooks = hooks.get(phase);
        logger.info("Phase {}/{} {}: {} ({} hook(s))", phase.ordinal() + 1, Phase.values().length,
                phase, phase.description, phaseHooks.size());
        long timeoutMs = phase == Phase.DRAIN ? drainTimeoutMs : shutdownTimeoutMs;

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (ShutdownHook hook : phaseHooks) {
            chain = chain.thenCompose(v -> runHook(phase, hook, timeoutMs));
        }
        return chain;
    }

    private CompletableFuture<Void> runHook(Phase phase, ShutdownHook hook, long timeoutMs) {
        CompletableFuture<Void> started;
        try {
            started = hook.action().get();
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }
        return started
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .thenRun(() -> logger.debug("{} hook '{}' done", phase, hook.name()))
                .exceptionally(err -> {
                    logger.warn("{} hook '{}' failed: {}", phase, hook.name(), err.toString());
                    return null;
                });
    }

    private record ShutdownHook(String name, Supplier<CompletableFuture<Void>> action) {
    }
}
