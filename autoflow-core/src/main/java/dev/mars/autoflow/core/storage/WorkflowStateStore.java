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

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence SPI for the four Autoflow record types.
 *
 * <h3>Revisions:</h3>
 * <p>Definitions, executions and schedules carry a storage revision. An insert
 * stores the record with revision 1. An update succeeds only when the record
 * passed in carries the revision currently stored; the stored copy then gets
 * the next revision and is returned. A stale revision raises
 * {@link ConcurrencyConflictException} and leaves the stored record untouched.</p>
 *
 * <h3>Step logs:</h3>
 * <p>Step logs are keyed by {@code executionId:attempt}. A RUNNING log may be
 * overwritten; a terminal log may not.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-04
 * @version 1.0
 */
public interface WorkflowStateStore extends AutoCloseable {

    // Definitions

    /**
     * @throws IllegalArgumentException if a definition with the same id exists
     */
    WorkflowDefinition insertDefinition(WorkflowDefinition definition);

    WorkflowDefinition updateDefinition(WorkflowDefinition definition) throws ConcurrencyConflictException;

    Optional<WorkflowDefinition> findDefinition(String definitionId);

    List<WorkflowDefinition> listDefinitions();

    /**
     * Atomically adds one to the total counter and to the counter matching
     * {@code outcome}, and sets {@code lastExecutionAt}. Not subject to revision checks.
     */
    WorkflowDefinition incrementExecutionCounters(String definitionId, ExecutionStatus outcome, Instant at)
            throws WorkflowNotFoundException;

    // Executions

    /**
     * @throws IllegalArgumentException if an execution with the same id exists
     */
    WorkflowExecution insertExecution(WorkflowExecution execution);

    WorkflowExecution updateExecution(WorkflowExecution execution) throws ConcurrencyConflictException;

    Optional<WorkflowExecution> findExecution(String executionId);

    /**
     * Executions of one definition, oldest first.
     */
    List<WorkflowExecution> listExecutions(String definitionId);

    List<WorkflowExecution> findExecutionsByStatus(Set<ExecutionStatus> statuses);

    // Step logs

    /**
     * Inserts or replaces a step log.
     *
     * @throws IllegalStateException if the stored log for the same id is already terminal
     */
    WorkflowStepLog saveStepLog(WorkflowStepLog log);

    Optional<WorkflowStepLog> findStepLog(String stepLogId);

    /**
     * Step logs of one execution in attempt order.
     */
    List<WorkflowStepLog> listStepLogs(String executionId);

    // Schedules

    /**
     * Inserts a schedule unless one with the same definition id and cron
     * expression exists.
     *
     * @return the stored schedule, or empty if it would duplicate an existing one
     */
    Optional<WorkflowSchedule> insertSchedule(WorkflowSchedule schedule);

    WorkflowSchedule updateSchedule(WorkflowSchedule schedule) throws ConcurrencyConflictException;

    boolean deleteSchedule(String scheduleId);

    Optional<WorkflowSchedule> findSchedule(String scheduleId);

    List<WorkflowSchedule> listSchedules(String definitionId);

    /**
     * Active schedules whose next run is at or before {@code now}.
     */
    List<WorkflowSchedule> findDueSchedules(Instant now);

    @Override
    void close();
}
