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

package dev.mars.autoflow.workflow.definition;

import dev.mars.autoflow.core.DefinitionStatus;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowSnapshot;
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned CRUD and lifecycle management for workflow definitions.
 * Definitions are never deleted; {@link #archive(String)} is the soft delete.
 */
public interface WorkflowDefinitionStore {

    /**
     * Create a new definition in DRAFT with version 1 and zeroed counters.
     *
     * @param draft the definition to create; id, status, version and timestamps are assigned here
     * @return the stored definition with its generated id
     * @throws DefinitionValidationException if the account or name is missing
     */
    WorkflowDefinition create(WorkflowDefinition.Builder draft) throws DefinitionValidationException;

    /**
     * Instantiate a reusable template as a new DRAFT definition.
     */
    WorkflowDefinition createFromTemplate(WorkflowTemplate template, String accountId, String name)
            throws DefinitionValidationException;

    Optional<WorkflowDefinition> get(String definitionId);

    WorkflowDefinition require(String definitionId) throws WorkflowNotFoundException;

    /**
     * @param accountId owning account
     * @param status    lifecycle filter, or null for every status
     */
    List<WorkflowDefinition> list(String accountId, DefinitionStatus status);

    /**
     * Apply an update. The content version grows when steps or trigger change.
     * Updates to an ACTIVE definition are validated like an activation.
     *
     * @throws AutoflowException if the definition is missing or archived, the
     *                           result is invalid, or concurrent writers keep conflicting
     */
    WorkflowDefinition update(String definitionId, DefinitionUpdate update) throws AutoflowException;

    /**
     * DRAFT or PAUSED to ACTIVE after validating the step graph and step configs.
     */
    WorkflowDefinition activate(String definitionId) throws AutoflowException;

    /**
     * ACTIVE to PAUSED. Paused definitions reject every trigger.
     */
    WorkflowDefinition pause(String definitionId) throws AutoflowException;

    /**
     * Any non-archived status to ARCHIVED. Permanent.
     */
    WorkflowDefinition archive(String definitionId) throws AutoflowException;

    WorkflowSnapshot snapshot(String definitionId) throws WorkflowNotFoundException;

    /**
     * Atomically count a finished run against its definition.
     */
    WorkflowDefinition recordExecutionOutcome(String definitionId, ExecutionStatus outcome, Instant at)
            throws WorkflowNotFoundException;
}
