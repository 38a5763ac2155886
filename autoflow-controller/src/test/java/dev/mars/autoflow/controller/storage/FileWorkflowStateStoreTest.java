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

package dev.mars.autoflow.controller.storage;

import dev.mars.autoflow.controller.EchoStepExecutor;
import dev.mars.autoflow.controller.MutableClock;
import dev.mars.autoflow.core.DefinitionStatus;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.StepResult;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowSchedule;
import dev.mars.autoflow.core.WorkflowSettings;
import dev.mars.autoflow.core.WorkflowStep;
import dev.mars.autoflow.core.WorkflowStepLog;
import dev.mars.autoflow.core.exceptions.ConcurrencyConflictException;
import dev.mars.autoflow.core.storage.WorkflowStateStore;
import dev.mars.autoflow.workflow.StepExecutorRegistry;
import dev.mars.autoflow.workflow.WorkflowCompiler;
import dev.mars.autoflow.workflow.definition.SimpleWorkflowDefinitionStore;
import dev.mars.autoflow.workflow.engine.DurableWorkflowEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class FileWorkflowStateStoreTest {

    private static final Instant NOW = Instant.parse("2026-09-10T10:00:00Z");

    @TempDir
    Path dataDir;

    private FileWorkflowStateStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = FileWorkflowStateStore.open(dataDir, false);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private FileWorkflowStateStore reopen() throws IOException {
        store.close();
        store = FileWorkflowStateStore.open(dataDir, false);
        return store;
    }

    private WorkflowDefinition definition(String id) {
        return WorkflowDefinition.builder()
                .id(id)
                .accountId("acct")
                .name("Flow " + id)
                .triggerType(TriggerType.MANUAL)
                .addStep(WorkflowStep.of("a", EchoStepExecutor.TYPE, Map.of("message", "hi")))
                .createdAt(NOW)
                .build();
    }

    @Nested
    @DisplayName("document layout")
    class Layout {

        @Test
        void eachRecordIsWrittenAsItsOwnDocument() throws Exception {
            store.insertDefinition(definition("wf-1"));
            store.insertExecution(WorkflowExecution.builder().id("e1").definitionId("wf-1").createdAt(NOW).build());
            store.saveStepLog(WorkflowStepLog.builder().executionId("e1").stepId("a").attempt(2).build());
            WorkflowSchedule schedule = store.insertSchedule(WorkflowSchedule.builder()
                    .id("s1").definitionId("wf-1").cronExpression("0 * * * *").createdAt(NOW).build()).orElseThrow();

            assertThat(dataDir.resolve("definitions/wf-1.json")).exists();
            assertThat(dataDir.resolve("executions/e1.json")).exists();
            assertThat(dataDir.resolve("step-logs/e1/2.json")).exists();
            assertThat(dataDir.resolve("schedules/s1.json")).exists();

            assertThat(store.deleteSchedule(schedule.getId())).isTrue();
            assertThat(dataDir.resolve("schedules/s1.json")).doesNotExist();
        }

        @Test
        void documentsAreReplacedWithoutTempFilesLeftBehind() throws Exception {
            WorkflowDefinition stored = store.insertDefinition(definition("wf-1"));
            store.updateDefinition(stored.toBuilder().name("Renamed").build());

            assertThat(Files.readString(dataDir.resolve("definitions/wf-1.json"))).contains("Renamed");
            try (var files = Files.list(dataDir.resolve("definitions"))) {
                assertThat(files.map(p -> p.getFileName().toString())).containsExactly("wf-1.json");
            }
        }

        @Test
        void identifiersThatEscapeTheDirectoryAreRejected() {
            assertThatThrownBy(() -> store.insertDefinition(definition("../outside")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(store.findDefinition("../outside")).isEmpty();
            assertThat(FileWorkflowStateStore.safeName("c0ffee-1")).isEqualTo("c0ffee-1");
        }
    }

    @Nested
    @DisplayName("failed writes")
    class FailedWrites {

        @Test
        void failedUpdateLeavesThePreviousRevisionInMemory() throws Exception {
            WorkflowExecution stored = store.insertExecution(WorkflowExecution.builder()
                    .id("e1").definitionId("wf-1").createdAt(NOW).build());
            // a directory where the temp document goes makes the write fail
            Files.createDirectories(dataDir.resolve("executions/e1.json.tmp/blocked"));

            assertThatThrownBy(() -> store.updateExecution(stored.toBuilder().status(ExecutionStatus.RUNNING).build()))
                    .isInstanceOf(UncheckedIOException.class)
                    .hasMessageContaining("e1.json");

            WorkflowExecution current = store.findExecution("e1").orElseThrow();
            assertThat(current.getRevision()).isEqualTo(stored.getRevision());
            assertThat(current.getStatus()).isEqualTo(stored.getStatus());
            assertThat(store.findExecutionsByStatus(Set.of(ExecutionStatus.RUNNING))).isEmpty();
        }

        @Test
        void failedInsertLeavesNoRecordInMemory() throws Exception {
            Files.createDirectories(dataDir.resolve("definitions/wf-2.json.tmp/blocked"));

            assertThatThrownBy(() -> store.insertDefinition(definition("wf-2")))
                    .isInstanceOf(UncheckedIOException.class);

            assertThat(store.findDefinition("wf-2")).isEmpty();
            assertThat(dataDir.resolve("definitions/wf-2.json")).doesNotExist();
        }

        @Test
        void failedCounterIncrementKeepsTheOldCounters() throws Exception {
            store.insertDefinition(definition("wf-1"));
            Files.createDirectories(dataDir.resolve("definitions/wf-1.json.tmp/blocked"));

            assertThatThrownBy(() -> store.incrementExecutionCounters("wf-1", ExecutionStatus.COMPLETED, NOW))
                    .isInstanceOf(UncheckedIOException.class);

            assertThat(store.findDefinition("wf-1").orElseThrow().getTotalExecutions()).isZero();
        }
    }

    @Nested
    @DisplayName("reopening")
    class Reopening {

        @Test
        void recordsSurviveWithTheirRevisions() throws Exception {
            WorkflowDefinition stored = store.insertDefinition(definition("wf-1"));
            store.updateDefinition(stored.toBuilder().status(DefinitionStatus.ACTIVE).build());
            store.incrementExecutionCounters("wf-1", ExecutionStatus.COMPLETED, NOW);
            WorkflowExecution execution = store.insertExecution(WorkflowExecution.builder()
                    .id("e1").definitionId("wf-1").inputData(Map.of("lead", "ada")).createdAt(NOW).build());
            store.updateExecution(execution.toBuilder().status(ExecutionStatus.RUNNING).currentStepId("a").build());
            WorkflowStepLog log = WorkflowStepLog.builder().executionId("e1").stepId("a").attempt(1).startedAt(NOW).build();
            store.saveStepLog(log);
            store.saveStepLog(log.finish(ExecutionStatus.COMPLETED, NOW.plusSeconds(2)));

            reopen();

            WorkflowDefinition definition = store.findDefinition("wf-1").orElseThrow();
            assertThat(definition.getStatus()).isEqualTo(DefinitionStatus.ACTIVE);
            assertThat(definition.getRevision()).isEqualTo(2);
            assertThat(definition.getSuccessfulExecutions()).isEqualTo(1);
            WorkflowExecution reloaded = store.findExecution("e1").orElseThrow();
            assertThat(reloaded.getRevision()).isEqualTo(2);
            assertThat(reloaded.getInputData()).containsEntry("lead", "ada");
            assertThat(store.findExecutionsByStatus(Set.of(ExecutionStatus.RUNNING))).hasSize(1);
            assertThat(store.listStepLogs("e1")).singleElement()
                    .extracting(WorkflowStepLog::getStatus).isEqualTo(ExecutionStatus.COMPLETED);
        }

        @Test
        void staleRevisionIsStillDetectedAfterReopen() throws Exception {
            WorkflowExecution stale = store.insertExecution(WorkflowExecution.builder()
                    .id("e1").definitionId("wf-1").createdAt(NOW).build());
            store.updateExecution(stale.toBuilder().status(ExecutionStatus.RUNNING).build());

            reopen();

            assertThatThrownBy(() -> store.updateExecution(stale))
                    .isInstanceOf(ConcurrencyConflictException.class);
        }

        @Test
        void incompleteWritesAreDiscarded() throws Exception {
            store.insertDefinition(definition("wf-1"));
            Files.writeString(dataDir.resolve("definitions/wf-2.json.tmp"), "{\"id\":");

            reopen();

            assertThat(store.listDefinitions()).extracting(WorkflowDefinition::getId).containsExactly("wf-1");
            assertThat(dataDir.resolve("definitions/wf-2.json.tmp")).doesNotExist();
        }

        @Test
        void corruptDocumentFailsTheOpen() throws Exception {
            Files.writeString(dataDir.resolve("executions/e9.json"), "not json");

            assertThatThrownBy(() -> FileWorkflowStateStore.open(dataDir, false))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("e9.json");
        }
    }

    @Test
    void unfinishedRunIsCompletedAfterRestart() throws Exception {
        MutableClock clock = new MutableClock(NOW);
        WorkflowCompiler compiler = new WorkflowCompiler(new StepExecutorRegistry().register(new EchoStepExecutor()));

        SimpleWorkflowDefinitionStore definitions =
                new SimpleWorkflowDefinitionStore(store, compiler, WorkflowSettings.defaults(), 3, clock);
        WorkflowDefinition definition = definitions.activate(definitions.create(WorkflowDefinition.builder()
                .accountId("acct")
                .name("Two steps")
                .addStep(WorkflowStep.of("a", EchoStepExecutor.TYPE, Map.of("message", "first")))
                .addStep(WorkflowStep.of("b", EchoStepExecutor.TYPE, Map.of("message", "second")))).getId());
        DurableWorkflowEngine before = engine(store, definitions, compiler, clock, false);
        String executionId = before.start(definition.snapshot(), Map.of(), TriggerType.MANUAL, "ops");
        assertThat(before.advance(executionId)).isEqualTo(ExecutionStatus.RUNNING);
        before.shutdown();

        WorkflowStateStore restarted = reopen();
        SimpleWorkflowDefinitionStore reloadedDefinitions =
                new SimpleWorkflowDefinitionStore(restarted, compiler, WorkflowSettings.defaults(), 3, clock);
        DurableWorkflowEngine after = engine(restarted, reloadedDefinitions, compiler, clock, true);
        try {
            assertThat(after.recoverInFlight()).isEqualTo(1);
            await().atMost(Duration.ofSeconds(5)).until(() ->
                    after.getExecution(executionId).orElseThrow().getStatus() == ExecutionStatus.COMPLETED);
        } finally {
            after.shutdown();
        }

        WorkflowExecution finished = after.getExecution(executionId).orElseThrow();
        assertThat(finished.getStepResults()).extracting(StepResult::stepId).containsExactly("a", "b");
        assertThat(reopen().findDefinition(definition.getId()).orElseThrow().getTotalExecutions()).isEqualTo(1);
    }

    private static DurableWorkflowEngine engine(WorkflowStateStore store, SimpleWorkflowDefinitionStore definitions,
                                                WorkflowCompiler compiler, MutableClock clock, boolean autoDrive) {
        return DurableWorkflowEngine.builder()
                .stateStore(store)
                .definitionStore(definitions)
                .compiler(compiler)
                .clock(clock)
                .autoDrive(autoDrive)
                .build();
    }
}
