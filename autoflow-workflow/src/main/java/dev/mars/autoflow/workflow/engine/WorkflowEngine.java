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

package dev.mars.autoflow.workflow.engine;

import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowSnapshot;
import dev.mars.autoflow.core.WorkflowStepLog;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives workflow runs through their steps and persists every transition.
 */
public interface WorkflowEngine {

    /** Page size callers use when they have no preference. */
    int DEFAULT_LIST_LIMIT = 50;

    /**
     * Creates an execution for the snapshot, moves it to RUNNING and hands it to
     * the worker pool.
     *
     * @param snapshot    steps and settings captured from the definition
     * @param inputData   run input, visible to steps as {@code input}
     * @param triggerType what started the run
     * @param triggeredBy user, schedule or producer that started the run, may be null
     * @return the new execution id
     * @throws DefinitionValidationException if the step graph or a step config is invalid
     */
    String start(WorkflowSnapshot snapshot, Map<String, Object> inputData, TriggerType triggerType,
                 String triggeredBy) throws DefinitionValidationException;

    /**
     * Executes the current step of a run once and applies its outcome.
     * A no-op for terminal runs and for runs still waiting out a retry delay.
     *
     * @return the execution status after the call
     */
    ExecutionStatus advance(String executionId) throws WorkflowNotFoundException;

    /**
     * Completes a run with the given output (the accumulated step outputs when null).
     *
     * @return false if the run was already terminal
     */
    boolean complete(String executionId, Map<String, Object> output) throws WorkflowNotFoundException;

    /**
     * Cancels a PENDING, RUNNING or RETRYING run. A step already in flight
     * finishes but its result is discarded.
     *
     * @return false if the run was already terminal
     */
    boolean cancel(String executionId) throws WorkflowNotFoundException;

    /**
     * Starts a fresh run of a FAILED or CANCELLED execution's definition, using the
     * definition as it is now, the same input and the same trigger.
     *
     * @return the new execution id
     * @throws IllegalStateException if the execution is not FAILED or CANCELLED, or
     *                               its definition has been archived
     */
    String rerun(String executionId) throws WorkflowNotFoundException, DefinitionValidationException;

    Optional<WorkflowExecution> getExecution(String executionId);

    Optional<ExecutionProgress> getProgress(String executionId);

    /**
     * Executions of one definition, oldest first.
     */
    List<WorkflowExecution> listExecutions(String definitionId);

    /**
     * Most recently started executions first.
     *
     * @param definitionId only runs of this definition, or all runs when null
     * @param status       only runs in this status, or any status when null
     * @param limit        maximum number of runs returned, see {@link #DEFAULT_LIST_LIMIT}
     */
    List<WorkflowExecution> listExecutions(String definitionId, ExecutionStatus status, int limit);

    List<WorkflowStepLog> getStepLogs(String executionId);

    /**
     * Re-drives every non-terminal run found in the state store, typically after a restart.
     *
     * @return number of runs picked up
     */
    int recoverInFlight();

    void addListener(ExecutionListener listener);

    void removeListener(ExecutionListener listener);

    void shutdown();
}
