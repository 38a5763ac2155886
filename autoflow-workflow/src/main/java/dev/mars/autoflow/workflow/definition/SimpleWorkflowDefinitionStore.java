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
import dev.mars.autoflow.core.WorkflowSettings;
import dev.mars.autoflow.core.WorkflowSnapshot;
import dev.mars.autoflow.core.exceptions.AutoflowException;
import dev.mars.autoflow.core.exceptions.ConcurrencyConflictException;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.InvalidTransitionException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.autoflow.core.storage.WorkflowStateStore;
import dev.mars.autoflow.workflow.WorkflowCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * {@link WorkflowDefinitionStore} on top of a {@link WorkflowStateStore}.
 *
 * <p>Every mutation is a read, transform, conditional write cycle against the
 * definition's storage revision. A conflicting write is retried against the
 * fresh record up to {@code conflictRetryLimit} times before the
 * {@link ConcurrencyConflictException} reaches the caller.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-06
 */
public class SimpleWorkflowDefinitionStore implements WorkflowDefinitionStore {

    private static final Logger logger = LoggerFactory.getLogger(SimpleWorkflowDefinitionStore.class);

    private final WorkflowStateStore store;
    private final WorkflowCompiler compiler;
    private final WorkflowSettings defaultSettings;
    private final int conflictRetryLimit;
    private final Clock clock;

    public SimpleWorkflowDefinitionStore(WorkflowStateStore store, WorkflowCompiler compiler,
                                         WorkflowSettings defaultSettings, int conflictRetryLimit, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler cannot be null");
        this.defaultSettings = defaultSettings != null ? defaultSettings : WorkflowSettings.defaults();
        this.conflictRetryLimit = Math.max(1, conflictRetryLimit);
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @FunctionalInterface
    private interface Mutation {
        WorkflowDefinition apply(WorkflowDefinition current) throws AutoflowException;
    }

    @Override
    public WorkflowDefinition create(WorkflowDefinition.Builder draft) throws DefinitionValidationException {
        Instant now = clock.instant();
        String id = UUID.randomUUID().toString();
        List<String> missing = draft.missingRequiredFields();
        if (!missing.isEmpty()) {
            throw new DefinitionValidationException(id, missing.stream()
                    .map(field -> field + " is required")
                    .collect(Collectors.toList()));
        }
        WorkflowDefinition candidate = draft.id(id)
                .status(DefinitionStatus.DRAFT)
                .version(1)
                .revision(0)
                .totalExecutions(0)
                .successfulExecutions(0)
                .failedExecutions(0)
                .lastExecutionAt(null)
                .createdAt(now)
                .updatedAt(now)
                .archivedAt(null)
                .build();
        if (candidate.getSettings().equals(WorkflowSettings.defaults())) {
            candidate = candidate.toBuilder().settings(defaultSettings).build();
        }

        WorkflowDefinition stored = store.insertDefinition(candidate);
        logger.info("Created workflow definition {} ({}) for account {}", stored.getId(), stored.getName(),
                stored.getAccountId());
        return stored;
    }

    @Override
    public WorkflowDefinition createFromTemplate(WorkflowTemplate template, String accountId, String name)
            throws DefinitionValidationException {
        WorkflowDefinition.Builder draft = template.toDraft(accountId, name);
        if (template.settings() == null) {
            draft.settings(defaultSettings);
        }
        WorkflowDefinition created = create(draft);
        logger.info("Instantiated template {} as workflow definition {}", template.templateId(), created.getId());
        return created;
    }

    @Override
    public Optional<WorkflowDefinition> get(String definitionId) {
        return store.findDefinition(definitionId);
    }

    @Override
    public WorkflowDefinition require(String definitionId) throws WorkflowNotFoundException {
        return store.findDefinition(definitionId)
                .orElseThrow(() -> new WorkflowNotFoundException("WorkflowDefinition", definitionId));
    }

    @Override
    public List<WorkflowDefinition> list(String accountId, DefinitionStatus status) {
        return store.listDefinitions().stream()
                .filter(d -> accountId == null || accountId.equals(d.getAccountId()))
                .filter(d -> status == null || d.getStatus() == status)
                .collect(Collectors.toList());
    }

    @Override
    public WorkflowDefinition update(String definitionId, DefinitionUpdate update) throws AutoflowException {
        WorkflowDefinition updated = mutate(definitionId, current -> {
            if (current.getStatus() == DefinitionStatus.ARCHIVED) {
                throw new DefinitionValidationException(definitionId, "archived definitions cannot be updated");
            }
            WorkflowDefinition.Builder builder = current.toBuilder().updatedAt(clock.instant());
            if (update.getName() != null) {
                builder.name(update.getName()).slug(null);
            }
            if (update.getDescription() != null) {
                builder.description(update.getDescription());
            }
            if (update.getTags() != null) {
                builder.tags(update.getTags());
            }
            if (update.getSettings() != null) {
                builder.settings(update.getSettings());
            }

            boolean contentChanged = false;
            if (update.getSteps() != null && !update.getSteps().equals(current.getSteps())) {
                builder.steps(update.getSteps());
                contentChanged = true;
            }
            if (update.getTriggerType() != null && update.getTriggerType() != current.getTriggerType()) {
                builder.triggerType(update.getTriggerType());
                contentChanged = true;
            }
            if (update.getTriggerConfig() != null && !update.getTriggerConfig().equals(current.getTriggerConfig())) {
                builder.triggerConfig(update.getTriggerConfig());
                contentChanged = true;
            }
            if (contentChanged) {
                builder.version(current.getVersion() + 1);
            }

            WorkflowDefinition candidate = builder.build();
            if (candidate.getStatus() == DefinitionStatus.ACTIVE) {
                compiler.compile(candidate.snapshot());
            }
            return candidate;
        });
        logger.info("Updated workflow definition {} (version {})", updated.getId(), updated.getVersion());
        return updated;
    }

    @Override
    public WorkflowDefinition activate(String definitionId) throws AutoflowException {
        WorkflowDefinition activated = mutate(definitionId, current -> {
            WorkflowDefinition candidate = transition(current, DefinitionStatus.ACTIVE);
            compiler.compile(candidate.snapshot());
            return candidate;
        });
        logger.info("Activated workflow definition {} (version {})", activated.getId(), activated.getVersion());
        return activated;
    }

    @Override
    public WorkflowDefinition pause(String definitionId) throws AutoflowException {
        WorkflowDefinition paused = mutate(definitionId, current -> transition(current, DefinitionStatus.PAUSED));
        logger.info("Paused workflow definition {}", paused.getId());
        return paused;
    }

    @Override
    public WorkflowDefinition archive(String definitionId) throws AutoflowException {
        WorkflowDefinition archived = mutate(definitionId, current -> transition(current, DefinitionStatus.ARCHIVED));
        compiler.evict(archived.getId());
        logger.info("Archived workflow definition {}", archived.getId());
        return archived;
    }

    @Override
    public WorkflowSnapshot snapshot(String definitionId) throws WorkflowNotFoundException {
        return require(definitionId).snapshot();
    }

    @Override
    public WorkflowDefinition recordExecutionOutcome(String definitionId, ExecutionStatus outcome, Instant at)
            throws WorkflowNotFoundException {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Only terminal outcomes are counted: " + outcome);
        }
        return store.incrementExecutionCounters(definitionId, outcome, at);
    }

    private WorkflowDefinition transition(WorkflowDefinition current, DefinitionStatus target)
            throws InvalidTransitionException {
        if (!current.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException(current.getId(), current.getStatus(), target,
                    current.getStatus().validTransitions());
        }
        return current.withStatus(target, clock.instant());
    }

    private WorkflowDefinition mutate(String definitionId, Mutation mutation) throws AutoflowException {
        ConcurrencyConflictException lastConflict = null;
        for (int attempt = 1; attempt <= conflictRetryLimit; attempt++) {
            WorkflowDefinition current = require(definitionId);
            WorkflowDefinition candidate = mutation.apply(current);
            try {
                return store.updateDefinition(candidate);
            } catch (ConcurrencyConflictException e) {
                lastConflict = e;
                logger.debug("Conflict updating workflow definition {} (attempt {}/{})",
                        definitionId, attempt, conflictRetryLimit);
            }
        }
        logger.warn("Giving up on workflow definition {} after {} conflicting writes", definitionId, conflictRetryLimit);
        throw lastConflict;
    }
}
