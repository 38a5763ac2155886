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

package dev.mars.autoflow.core.storage;

import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowSchedule;
import dev.mars.autoflow.core.WorkflowStepLog;
import dev.mars.autoflow.core.exceptions.ConcurrencyConflictException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * {@link WorkflowStateStore} kept in concurrent maps. State is lost when the
 * process exits; suitable for tests and single-process development.
 *
 * <p>Revision checks and schedule uniqueness are enforced under one lock per
 * record type. Counter increments take the definition lock too, so an edit
 * racing with a finishing run never loses an increment.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-04
 */
public class InMemoryWorkflowStateStore implements WorkflowStateStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWorkflowStateStore.class);

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, WorkflowStepLog> stepLogs = new ConcurrentHashMap<>();
    private final Map<String, WorkflowSchedule> schedules = new ConcurrentHashMap<>();

    private final Object definitionLock = new Object();
    private final Object executionLock = new Object();
    private final Object stepLogLock = new Object();
    private final Object scheduleLock = new Object();

    @Override
    public WorkflowDefinition insertDefinition(WorkflowDefinition definition) {
        synchronized (definitionLock) {
            if (definitions.containsKey(definition.getId())) {
                throw new IllegalArgumentException("Workflow definition already exists: " + definition.getId());
            }
            WorkflowDefinition stored = definition.toBuilder().revision(1).build();
            definitions.put(stored.getId(), stored);
            logger.debug("Inserted workflow definition {}", stored.getId());
            return stored;
        }
    }

    @Override
    public WorkflowDefinition updateDefinition(WorkflowDefinition definition) throws ConcurrencyConflictException {
        synchronized (definitionLock) {
            WorkflowDefinition current = definitions.get(definition.getId());
            long actual = current != null ? current.getRevision() : 0;
            if (current == null || actual != definition.getRevision()) {
                throw new ConcurrencyConflictException("WorkflowDefinition", definition.getId(),
                        definition.getRevision(), actual);
            }
            // Counters are owned by incrementExecutionCounters and survive stale copies.
            WorkflowDefinition stored = definition.toBuilder()
                    .revision(actual + 1)
                    .totalExecutions(current.getTotalExecutions())
                    .successfulExecutions(current.getSuccessfulExecutions())
                    .failedExecutions(current.getFailedExecutions())
                    .lastExecutionAt(current.getLastExecutionAt())
                    .build();
            definitions.put(stored.getId(), stored);
            return stored;
        }
    }

    @Override
    public Optional<WorkflowDefinition> findDefinition(String definitionId) {
        return Optional.ofNullable(definitions.get(definitionId));
    }

    @Override
    public List<WorkflowDefinition> listDefinitions() {
        return definitions.values().stream()
                .sorted(Comparator.comparing(WorkflowDefinition::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    @Override
    public WorkflowDefinition incrementExecutionCounters(String definitionId, ExecutionStatus outcome, Instant at)
            throws WorkflowNotFoundException {
        synchronized (definitionLock) {
            WorkflowDefinition updated = definitions.computeIfPresent(definitionId,
                    (id, current) -> withIncrementedCounters(current, outcome, at));
            if (updated == null) {
                throw new WorkflowNotFoundException("WorkflowDefinition", definitionId);
            }
            return updated;
        }
    }

    /**
     * Counter increments leave the revision alone so that they never conflict
     * with a concurrent edit of the definition.
     */
    protected static WorkflowDefinition withIncrementedCounters(WorkflowDefinition current,
                                                                ExecutionStatus outcome, Instant at) {
        WorkflowDefinition.Builder builder = current.toBuilder()
                .totalExecutions(current.getTotalExecutions() + 1)
                .lastExecutionAt(at);
        if (outcome == ExecutionStatus.COMPLETED) {
            builder.successfulExecutions(current.getSuccessfulExecutions() + 1);
        } else if (outcome == ExecutionStatus.FAILED) {
            builder.failedExecutions(current.getFailedExecutions() + 1);
        }
        return builder.build();
    }

    @Override
    public WorkflowExecution insertExecution(WorkflowExecution execution) {
        synchronized (executionLock) {
            if (executions.containsKey(execution.getId())) {
                throw new IllegalArgumentException("Workflow execution already exists: " + execution.getId());
            }
            WorkflowExecution stored = execution.toBuilder().revision(1).build();
            executions.put(stored.getId(), stored);
            return stored;
        }
    }

    @Override
    public WorkflowExecution updateExecution(WorkflowExecution execution) throws ConcurrencyConflictException {
        synchronized (executionLock) {
            WorkflowExecution current = executions.get(execution.getId());
            long actual = current != null ? current.getRevision() : 0;
            if (current == null || actual != execution.getRevision()) {
                throw new ConcurrencyConflictException("WorkflowExecution", execution.getId(),
                        execution.getRevision(), actual);
            }
            WorkflowExecution stored = execution.toBuilder().revision(actual + 1).build();
            executions.put(stored.getId(), stored);
            return stored;
        }
    }

    @Override
    public Optional<WorkflowExecution> findExecution(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<WorkflowExecution> listExecutions(String definitionId) {
        return executions.values().stream()
                .filter(e -> e.getDefinitionId().equals(definitionId))
                .sorted(Comparator.comparing(WorkflowExecution::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findExecutionsByStatus(Set<ExecutionStatus> statuses) {
        return executions.values().stream()
                .filter(e -> statuses.contains(e.getStatus()))
                .collect(Collectors.toList());
    }

    @Override
    public WorkflowStepLog saveStepLog(WorkflowStepLog log) {
        synchronized (stepLogLock) {
            WorkflowStepLog current = stepLogs.get(log.getId());
            if (current != null && current.isTerminal()) {
                throw new IllegalStateException("Step log " + log.getId() + " is already " + current.getStatus());
            }
            stepLogs.put(log.getId(), log);
            return log;
        }
    }

    @Override
    public Optional<WorkflowStepLog> findStepLog(String stepLogId) {
        return Optional.ofNullable(stepLogs.get(stepLogId));
    }

    @Override
    public List<WorkflowStepLog> listStepLogs(String executionId) {
        return stepLogs.values().stream()
                .filter(l -> l.getExecutionId().equals(executionId))
                .sorted(Comparator.comparingInt(WorkflowStepLog::getAttempt))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<WorkflowSchedule> insertSchedule(WorkflowSchedule schedule) {
        synchronized (scheduleLock) {
            boolean duplicate = schedules.values().stream()
                    .anyMatch(s -> s.getDefinitionId().equals(schedule.getDefinitionId())
                            && s.getCronExpression().equals(schedule.getCronExpression()));
            if (duplicate || schedules.containsKey(schedule.getId())) {
                return Optional.empty();
            }
            WorkflowSchedule stored = schedule.toBuilder().revision(1).build();
            schedules.put(stored.getId(), stored);
            return Optional.of(stored);
        }
    }

    @Override
    public WorkflowSchedule updateSchedule(WorkflowSchedule schedule) throws ConcurrencyConflictException {
        synchronized (scheduleLock) {
            WorkflowSchedule current = schedules.get(schedule.getId());
            long actual = current != null ? current.getRevision() : 0;
            if (current == null || actual != schedule.getRevision()) {
                throw new ConcurrencyConflictException("WorkflowSchedule", schedule.getId(),
                        schedule.getRevision(), actual);
            }
            WorkflowSchedule stored = schedule.toBuilder().revision(actual + 1).build();
            schedules.put(stored.getId(), stored);
            return stored;
        }
    }

    @Override
    public boolean deleteSchedule(String scheduleId) {
        synchronized (scheduleLock) {
            return schedules.remove(scheduleId) != null;
        }
    }

    @Override
    public Optional<WorkflowSchedule> findSchedule(String scheduleId) {
        return Optional.ofNullable(schedules.get(scheduleId));
    }

    @Override
    public List<WorkflowSchedule> listSchedules(String definitionId) {
        return schedules.values().stream()
                .filter(s -> s.getDefinitionId().equals(definitionId))
                .sorted(Comparator.comparing(WorkflowSchedule::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowSchedule> findDueSchedules(Instant now) {
        return schedules.values().stream()
                .filter(s -> s.isDue(now))
                .sorted(Comparator.comparing(WorkflowSchedule::getNextRunAt))
                .collect(Collectors.toList());
    }

    /**
     * Puts previously persisted records back verbatim, revisions included.
     * Used by subclasses that reload their state on startup.
     */
    protected void restoreDefinition(WorkflowDefinition definition) {
        definitions.put(definition.getId(), definition);
    }

    protected void restoreExecution(WorkflowExecution execution) {
        executions.put(execution.getId(), execution);
    }

    protected void restoreStepLog(WorkflowStepLog log) {
        stepLogs.put(log.getId(), log);
    }

    protected void restoreSchedule(WorkflowSchedule schedule) {
        schedules.put(schedule.getId(), schedule);
    }

    protected void discardDefinition(String definitionId) {
        definitions.remove(definitionId);
    }

    protected void discardExecution(String executionId) {
        executions.remove(executionId);
    }

    protected void discardStepLog(String stepLogId) {
        stepLogs.remove(stepLogId);
    }

    protected void discardSchedule(String scheduleId) {
        schedules.remove(scheduleId);
    }

    @Override
    public void close() {
        logger.debug("Closing in-memory state store ({} definitions, {} executions)",
                definitions.size(), executions.size());
    }
}
