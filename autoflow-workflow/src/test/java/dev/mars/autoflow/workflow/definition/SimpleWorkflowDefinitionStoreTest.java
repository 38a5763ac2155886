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

import dev.mars.autoflow.core.BackoffStrategy;
import dev.mars.autoflow.core.DefinitionStatus;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowSettings;
import dev.mars.autoflow.core.WorkflowSnapshot;
import dev.mars.autoflow.core.WorkflowStep;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.InvalidTransitionException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.autoflow.core.storage.InMemoryWorkflowStateStore;
import dev.mars.autoflow.workflow.MutableClock;
import dev.mars.autoflow.workflow.ScriptedStepExecutor;
import dev.mars.autoflow.workflow.StepExecutorRegistry;
import dev.mars.autoflow.workflow.WorkflowCompiler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SimpleWorkflowDefinitionStore")
class SimpleWorkflowDefinitionStoreTest {

    private static final Instant START = Instant.parse("2026-09-10T10:00:00Z");
    private static final WorkflowSettings CONFIGURED_DEFAULTS =
            WorkflowSettings.defaults().withMaxRetries(5).withRetryDelay(10, BackoffStrategy.EXPONENTIAL);

    private InMemoryWorkflowStateStore stateStore;
    private MutableClock clock;
    private SimpleWorkflowDefinitionStore store;

    @BeforeEach
    void setUp() {
        stateStore = new InMemoryWorkflowStateStore();
        clock = new MutableClock(START);
        WorkflowCompiler compiler = new WorkflowCompiler(new StepExecutorRegistry().register(new ScriptedStepExecutor()));
        store = new SimpleWorkflowDefinitionStore(stateStore, compiler, CONFIGURED_DEFAULTS, 3, clock);
    }

    private static WorkflowStep step(String id) {
        return WorkflowStep.of(id, ScriptedStepExecutor.TYPE, Map.of());
    }

    private WorkflowDefinition draft(String name, WorkflowStep... steps) throws Exception {
        return store.create(WorkflowDefinition.builder()
                .accountId("acct-1")
                .name(name)
                .steps(List.of(steps)));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("stores a DRAFT at version 1 with timestamps and a slug")
        void createsDraft() throws Exception {
            WorkflowDefinition created = draft("Welcome New Leads", step("a"));

            assertThat(created.getId()).isNotBlank();
            assertThat(created.getStatus()).isEqualTo(DefinitionStatus.DRAFT);
            assertThat(created.getVersion()).isEqualTo(1);
            assertThat(created.getRevision()).isEqualTo(1);
            assertThat(created.getSlug()).isEqualTo("welcome-new-leads");
            assertThat(created.getCreatedAt()).isEqualTo(START);
            assertThat(store.get(created.getId())).contains(created);
        }

        @Test
        @DisplayName("applies the configured default settings when none are given")
        void appliesConfiguredDefaults() throws Exception {
            WorkflowDefinition created = draft("Flow", step("a"));

            assertThat(created.getSettings()).isEqualTo(CONFIGURED_DEFAULTS);
        }

        @Test
        @DisplayName("keeps explicit settings")
        void keepsExplicitSettings() throws Exception {
            WorkflowSettings custom = WorkflowSettings.defaults().withMaxRetries(0);
            WorkflowDefinition created = store.create(WorkflowDefinition.builder()
                    .accountId("acct-1").name("Flow").settings(custom).addStep(step("a")));

            assertThat(created.getSettings()).isEqualTo(custom);
        }

        @Test
        @DisplayName("rejects a draft without a name or account")
        void rejectsIncompleteDraft() {
            assertThatThrownBy(() -> store.create(WorkflowDefinition.builder().accountId("acct-1").name("  ")))
                    .isInstanceOf(DefinitionValidationException.class)
                    .extracting(e -> ((DefinitionValidationException) e).getViolations())
                    .isEqualTo(List.of("name is required"));
            assertThatThrownBy(() -> store.create(WorkflowDefinition.builder().triggerType(null)))
                    .isInstanceOf(DefinitionValidationException.class)
                    .extracting(e -> ((DefinitionValidationException) e).getViolations())
                    .isEqualTo(List.of("accountId is required", "name is required", "triggerType is required"));
            assertThat(store.list(null, null)).isEmpty();
        }

        @Test
        @DisplayName("instantiates a template as a new draft")
        void fromTemplate() throws Exception {
            WorkflowTemplate template = new WorkflowTemplate("lead-nurture", "Nurture new leads",
                    List.of("crm"), TriggerType.EVENT, Map.of("event_types", List.of("lead.created")),
                    List.of(step("welcome"), step("follow_up")), null);

            WorkflowDefinition created = store.createFromTemplate(template, "acct-9", "Nurture");

            assertThat(created.getAccountId()).isEqualTo("acct-9");
            assertThat(created.getStatus()).isEqualTo(DefinitionStatus.DRAFT);
            assertThat(created.getTriggerType()).isEqualTo(TriggerType.EVENT);
            assertThat(created.getSteps()).extracting(WorkflowStep::id).containsExactly("welcome", "follow_up");
            assertThat(created.getSettings()).isEqualTo(CONFIGURED_DEFAULTS);
            assertThat(created.getTags()).containsExactly("crm");
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("bumps the version when steps change but not for metadata")
        void versionBumps() throws Exception {
            WorkflowDefinition created = draft("Flow", step("a"));

            WorkflowDefinition renamed = store.update(created.getId(),
                    DefinitionUpdate.builder().name("Renamed Flow").description("desc").build());
            assertThat(renamed.getVersion()).isEqualTo(1);
            assertThat(renamed.getSlug()).isEqualTo("renamed-flow");

            WorkflowDefinition restepped = store.update(created.getId(),
                    DefinitionUpdate.builder().steps(List.of(step("a"), step("b"))).build());
            assertThat(restepped.getVersion()).isEqualTo(2);

            WorkflowDefinition retriggered = store.update(created.getId(),
                    DefinitionUpdate.builder().triggerType(TriggerType.WEBHOOK).build());
            assertThat(retriggered.getVersion()).isEqualTo(3);
        }

        @Test
        @DisplayName("an unchanged step list does not bump the version")
        void sameStepsNoBump() throws Exception {
            WorkflowDefinition created = draft("Flow", step("a"));

            WorkflowDefinition updated = store.update(created.getId(),
                    DefinitionUpdate.builder().steps(List.of(step("a"))).build());

            assertThat(updated.getVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("active definitions are revalidated on update")
        void activeRevalidated() throws Exception {
            WorkflowDefinition created = draft("Flow", step("a"));
            store.activate(created.getId());

            assertThatThrownBy(() -> store.update(created.getId(), DefinitionUpdate.builder()
                    .steps(List.of(step("a").withOnSuccess("ghost"))).build()))
                    .isInstanceOf(DefinitionValidationException.class);
            assertThat(store.require(created.getId()).getVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("archived definitions cannot be updated")
        void archivedRejected() throws Exception {
            WorkflowDefinition created = draft("Flow", step("a"));
            store.archive(created.getId());

            assertThatThrownBy(() -> store.update(created.getId(), DefinitionUpdate.builder().name("x").build()))
                    .isInstanceOf(DefinitionValidationException.class)
                    .hasMessageContaining("archived");
        }

        @Test
        @DisplayName("snapshots taken before an edit are unaffected by it")
        void snapshotsAreIsolated() throws Exception {
            WorkflowDefinition created = draft("Flow", step("a"));
            WorkflowSnapshot before = store.snapshot(created.getId());

            store.update(created.getId(), DefinitionUpdate.builder().steps(List.of(step("x"), step("y"))).build());

            assertThat(before.version()).isEqualTo(1);
            assertThat(before.steps()).extracting(WorkflowStep::id).containsExactly("a");
            assertThat(store.snapshot(created.getId()).version()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("DRAFT -> ACTIVE -> PAUSED -> ACTIVE -> ARCHIVED")
        void fullLifecycle() throws Exception {
            String id = draft("Flow", step("a")).getId();

            assertThat(store.activate(id).getStatus()).isEqualTo(DefinitionStatus.ACTIVE);
            assertThat(store.pause(id).getStatus()).isEqualTo(DefinitionStatus.PAUSED);
            assertThat(store.activate(id).getStatus()).isEqualTo(DefinitionStatus.ACTIVE);

            clock.advance(Duration.ofHours(1));
            WorkflowDefinition archived = store.archive(id);
            assertThat(archived.getStatus()).isEqualTo(DefinitionStatus.ARCHIVED);
            assertThat(archived.getArchivedAt()).isEqualTo(START.plus(Duration.ofHours(1)));
        }

        @Test
        @DisplayName("archiving is permanent")
        void archivePermanent() throws Exception {
            String id = draft("Flow", step("a")).getId();
            store.archive(id);

            assertThatThrownBy(() -> store.activate(id)).isInstanceOf(InvalidTransitionException.class);
            assertThatThrownBy(() -> store.archive(id)).isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("a draft cannot be paused")
        void draftCannotPause() throws Exception {
            String id = draft("Flow", step("a")).getId();

            assertThatThrownBy(() -> store.pause(id)).isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("activation rejects dangling edges and unknown step types")
        void activationValidates() throws Exception {
            String dangling = draft("Dangling", step("a").withOnFailure("nowhere")).getId();
            String unknown = store.create(WorkflowDefinition.builder().accountId("acct-1").name("Unknown")
                    .addStep(WorkflowStep.of("a", "teleport", Map.of()))).getId();

            assertThatThrownBy(() -> store.activate(dangling))
                    .isInstanceOf(DefinitionValidationException.class)
                    .hasMessageContaining("nowhere");
            assertThatThrownBy(() -> store.activate(unknown))
                    .isInstanceOf(DefinitionValidationException.class)
                    .hasMessageContaining("teleport");
            assertThat(store.require(dangling).getStatus()).isEqualTo(DefinitionStatus.DRAFT);
        }

        @Test
        @DisplayName("unknown ids raise WorkflowNotFoundException")
        void unknownId() {
            assertThatThrownBy(() -> store.activate("missing")).isInstanceOf(WorkflowNotFoundException.class);
            assertThat(store.get("missing")).isEmpty();
        }
    }

    @Test
    @DisplayName("lists by account and status")
    void listFilters() throws Exception {
        String active = draft("A", step("a")).getId();
        draft("B", step("a"));
        store.create(WorkflowDefinition.builder().accountId("acct-2").name("C").addStep(step("a")));
        store.activate(active);

        assertThat(store.list("acct-1", null)).hasSize(2);
        assertThat(store.list("acct-1", DefinitionStatus.ACTIVE)).extracting(WorkflowDefinition::getId)
                .containsExactly(active);
        assertThat(store.list(null, null)).hasSize(3);
    }

    @Test
    @DisplayName("records execution outcomes as counters")
    void recordsOutcomes() throws Exception {
        String id = draft("Flow", step("a")).getId();

        store.recordExecutionOutcome(id, ExecutionStatus.COMPLETED, START);
        store.recordExecutionOutcome(id, ExecutionStatus.FAILED, START);
        WorkflowDefinition counted = store.recordExecutionOutcome(id, ExecutionStatus.COMPLETED, START.plusSeconds(5));

        assertThat(counted.getTotalExecutions()).isEqualTo(3);
        assertThat(counted.getSuccessfulExecutions()).isEqualTo(2);
        assertThat(counted.getFailedExecutions()).isEqualTo(1);
        assertThat(counted.getLastExecutionAt()).isEqualTo(START.plusSeconds(5));
        assertThatThrownBy(() -> store.recordExecutionOutcome(id, ExecutionStatus.RUNNING, START))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
