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

package dev.mars.autoflow.controller.schedule;

import dev.mars.autoflow.core.DefinitionStatus;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowSchedule;
import dev.mars.autoflow.core.exceptions.ConcurrencyConflictException;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.autoflow.core.storage.WorkflowStateStore;
import dev.mars.autoflow.workflow.definition.WorkflowDefinitionStore;
import dev.mars.autoflow.workflow.engine.ExecutionListener;
import dev.mars.autoflow.workflow.engine.WorkflowEngine;
import dev.mars.autoflow.workflow.trigger.RunRequest;
import dev.mars.autoflow.workflow.trigger.TriggerDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires cron schedules.
 *
 * <p>Every tick scans the active schedules whose next run is due. Each one is first
 * claimed by moving its next run to the following occurrence after now, so a
 * schedule that missed several occurrences (controller down, long tick) fires a
 * single catch-up run. Schedules of paused or draft definitions are advanced
 * without firing; schedules of archived or deleted definitions are deactivated.
 *
 * <p>When a scheduled run finishes, the schedule's last run time and status are
 * updated from the engine's completion callback.
 */
public class ScheduleManager {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleManager.class);

    private final WorkflowStateStore store;
    private final WorkflowDefinitionStore definitions;
    private final TriggerDispatcher dispatcher;
    private final WorkflowEngine engine;
    private final Duration tickInterval;
    private final int conflictRetryLimit;
    private final String defaultTimezone;
    private final Clock clock;
    private final ExecutionListener completionListener = this::onExecutionFinished;

    private ScheduledExecutorService scheduler;

    public ScheduleManager(WorkflowStateStore store, WorkflowDefinitionStore definitions,
                           TriggerDispatcher dispatcher, WorkflowEngine engine, Duration tickInterval,
                           int conflictRetryLimit, String defaultTimezone, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.definitions = Objects.requireNonNull(definitions, "definitions cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval cannot be null");
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive: " + tickInterval);
        }
        this.conflictRetryLimit = Math.max(1, conflictRetryLimit);
        this.defaultTimezone = defaultTimezone != null ? defaultTimezone : WorkflowSchedule.DEFAULT_TIMEZONE;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @FunctionalInterface
    private interface ScheduleMutation {
        /**
         * @return the updated schedule, or null to leave the stored one untouched
         */
        WorkflowSchedule apply(WorkflowSchedule current) throws DefinitionValidationException;
    }

    // ==================== Lifecycle ====================

    public synchronized void start() {
        if (scheduler != null) {
            logger.warn("Schedule manager is already running");
            return;
        }
        engine.addListener(completionListener);
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "autoflow-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = tickInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::safeTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("Schedule manager started (tick interval {} ms)", intervalMs);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(tickInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        scheduler = null;
        engine.removeListener(completionListener);
        logger.info("Schedule manager stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    // ==================== Ticking ====================

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task.
            logger.error("Schedule tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Processes every due schedule once.
     *
     * @return number of runs started
     */
    public int tick() {
        Instant now = clock.instant();
        List<WorkflowSchedule> due = store.findDueSchedules(now);
        if (due.isEmpty()) {
            return 0;
        }
        logger.debug("{} schedule(s) due at {}", due.size(), now);

        int fired = 0;
        for (WorkflowSchedule schedule : due) {
            try {
                if (fire(schedule.getId(), now)) {
                    fired++;
                }
            } catch (ConcurrencyConflictException e) {
                logger.warn("Skipping schedule {} this tick after {} conflicting updates",
                        schedule.getId(), conflictRetryLimit);
            } catch (WorkflowNotFoundException e) {
                logger.debug("Schedule {} was removed during the tick", schedule.getId());
            } catch (DefinitionValidationException e) {
                logger.error("Schedule {} could not be fired: {}", schedule.getId(), e.getMessage());
            }
        }
        return fired;
    }

    private boolean fire(String scheduleId, Instant now)
            throws ConcurrencyConflictException, WorkflowNotFoundException, DefinitionValidationException {
        AtomicReference<DefinitionStatus> statusAtClaim = new AtomicReference<>();
        WorkflowSchedule claimed = mutate(scheduleId, current -> {
            statusAtClaim.set(null);
            if (!current.isDue(now)) {
                // claimed by a concurrent tick
                return null;
            }
            Optional<WorkflowDefinition> definition = definitions.get(current.getDefinitionId());
            if (definition.isEmpty() || definition.get().getStatus() == DefinitionStatus.ARCHIVED) {
                logger.info("Deactivating schedule {}: definition {} is {}", current.getId(),
                        current.getDefinitionId(), definition.isEmpty() ? "gone" : "archived");
                return current.toBuilder().active(false).nextRunAt(null).updatedAt(now).build();
            }
            Instant next;
            try {
                next = CronSchedule.parse(current.getDefinitionId(), current.getCronExpression(),
                        current.getTimezone()).nextAfter(now).orElse(null);
            } catch (DefinitionValidationException e) {
                logger.error("Deactivating schedule {}: {}", current.getId(), e.getMessage());
                return current.toBuilder().active(false).nextRunAt(null).updatedAt(now).build();
            }
            statusAtClaim.set(definition.get().getStatus());
            // a cron without further occurrences fires this last one and goes inactive
            return current.toBuilder()
                    .active(next != null)
                    .nextRunAt(next)
                    .updatedAt(now)
                    .build();
        });
        if (claimed == null || statusAtClaim.get() == null) {
            return false;
        }
        if (statusAtClaim.get() != DefinitionStatus.ACTIVE) {
            logger.debug("Schedule {} not fired: definition {} is {}; next run {}", scheduleId,
                    claimed.getDefinitionId(), statusAtClaim.get(), claimed.getNextRunAt());
            return false;
        }

        Optional<String> executionId = dispatcher.submit(RunRequest.scheduled(claimed.getDefinitionId(), scheduleId));
        executionId.ifPresent(id -> logger.info("Schedule {} started execution {} of {}; next run {}",
                scheduleId, id, claimed.getDefinitionId(), claimed.getNextRunAt()));
        return executionId.isPresent();
    }

    private void onExecutionFinished(WorkflowExecution execution) {
        String scheduleId = RunRequest.scheduleIdOf(execution.getTriggeredBy());
        if (scheduleId == null) {
            return;
        }
        Instant finishedAt = execution.getCompletedAt() != null ? execution.getCompletedAt() : clock.instant();
        try {
            mutate(scheduleId, current -> current.toBuilder()
                    .lastRunAt(finishedAt)
                    .lastRunStatus(execution.getStatus())
                    .updatedAt(clock.instant())
                    .build());
        } catch (WorkflowNotFoundException e) {
            logger.debug("Schedule {} was removed before execution {} finished", scheduleId, execution.getId());
        } catch (ConcurrencyConflictException | DefinitionValidationException e) {
            logger.warn("Could not record last run of schedule {}: {}", scheduleId, e.getMessage());
        }
    }

    // ==================== CRUD ====================

    /**
     * Adds a cron schedule to a definition. The first run is the next occurrence after now.
     *
     * @param timezone IANA zone id, the default zone when null
     * @throws WorkflowNotFoundException     if the definition does not exist
     * @throws DefinitionValidationException if the cron expression or zone is invalid, the
     *                                       expression never fires, or the definition already
     *                                       has a schedule with the same expression
     */
    public WorkflowSchedule addSchedule(String definitionId, String cronExpression, String timezone)
            throws WorkflowNotFoundException, DefinitionValidationException {
        WorkflowDefinition definition = definitions.require(definitionId);
        String zone = timezone != null && !timezone.isBlank() ? timezone : defaultTimezone;
        CronSchedule cron = CronSchedule.parse(definitionId, cronExpression, zone);
        Instant now = clock.instant();
        Instant first = cron.nextAfter(now).orElseThrow(() -> new DefinitionValidationException(definitionId,
                "cron expression '" + cron.getExpression() + "' has no future occurrence"));

        WorkflowSchedule schedule = WorkflowSchedule.builder()
                .id(UUID.randomUUID().toString())
                .definitionId(definition.getId())
                .cronExpression(cron.getExpression())
                .timezone(cron.getZone().getId())
                .active(true)
                .nextRunAt(first)
                .createdAt(now)
                .updatedAt(now)
                .build();
        WorkflowSchedule stored = store.insertSchedule(schedule).orElseThrow(() ->
                new DefinitionValidationException(definitionId,
                        "a schedule with cron expression '" + cron.getExpression() + "' already exists"));
        logger.info("Added schedule {} ({}) to {}; first run {}", stored.getId(), cron, definitionId, first);
        return stored;
    }

    public boolean removeSchedule(String scheduleId) {
        boolean removed = store.deleteSchedule(scheduleId);
        if (removed) {
            logger.info("Removed schedule {}", scheduleId);
        }
        return removed;
    }

    /**
     * Enables or disables a schedule. Enabling recomputes the next run from now, so
     * occurrences missed while disabled are not fired.
     */
    public WorkflowSchedule setActive(String scheduleId, boolean active)
            throws WorkflowNotFoundException, DefinitionValidationException, ConcurrencyConflictException {
        Instant now = clock.instant();
        WorkflowSchedule updated = mutate(scheduleId, current -> {
            if (current.isActive() == active) {
                return null;
            }
            WorkflowSchedule.Builder builder = current.toBuilder().active(active).updatedAt(now);
            if (active) {
                Instant next = CronSchedule.parse(current.getDefinitionId(), current.getCronExpression(),
                        current.getTimezone()).nextAfter(now).orElse(null);
                if (next == null) {
                    throw new DefinitionValidationException(current.getDefinitionId(),
                            "cron expression '" + current.getCronExpression() + "' has no future occurrence");
                }
                builder.nextRunAt(next);
            }
            return builder.build();
        });
        if (updated == null) {
            return store.findSchedule(scheduleId)
                    .orElseThrow(() -> new WorkflowNotFoundException("WorkflowSchedule", scheduleId));
        }
        logger.info("Schedule {} {}", scheduleId, active ? "activated" : "deactivated");
        return updated;
    }

    public List<WorkflowSchedule> listSchedules(String definitionId) {
        return store.listSchedules(definitionId);
    }

    public Optional<WorkflowSchedule> getSchedule(String scheduleId) {
        return store.findSchedule(scheduleId);
    }

    // ==================== Helpers ====================

    private WorkflowSchedule mutate(String scheduleId, ScheduleMutation mutation)
            throws WorkflowNotFoundException, ConcurrencyConflictException, DefinitionValidationException {
        ConcurrencyConflictException lastConflict = null;
        for (int attempt = 1; attempt <= conflictRetryLimit; attempt++) {
            WorkflowSchedule current = store.findSchedule(scheduleId)
                    .orElseThrow(() -> new WorkflowNotFoundException("WorkflowSchedule", scheduleId));
            WorkflowSchedule updated = mutation.apply(current);
            if (updated == null) {
                return null;
            }
            try {
                return store.updateSchedule(updated);
            } catch (ConcurrencyConflictException e) {
                lastConflict = e;
                logger.debug("Conflict updating schedule {} (attempt {}/{})", scheduleId, attempt, conflictRetryLimit);
            }
        }
        throw lastConflict;
    }
}
