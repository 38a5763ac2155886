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

import dev.mars.autoflow.controller.EchoStepExecutor;
import dev.mars.autoflow.controller.MutableClock;
import dev.mars.autoflow.core.BackoffStrategy;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowSchedule;
import dev.mars.autoflow.core.WorkflowSettings;
import dev.mars.autoflow.core.WorkflowStep;
import dev.mars.autoflow.core.exceptions.ConcurrencyConflictException;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.autoflow.core.storage.InMemoryWorkflowStateStore;
import dev.mars.autoflow.workflow.StepExecutorRegistry;
import dev.mars.autoflow.workflow.WorkflowCompiler;
import dev.mars.autoflow.workflow.definition.SimpleWorkflowDefinitionStore;
import dev.mars.autoflow.workflow.engine.DurableWorkflowEngine;
import dev.mars.autoflow.workflow.trigger.TriggerDispatcher;
import org.junit.jupiter.api.AfterEach;
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
import static org.awaitility.Awaitility.await;

class ScheduleManagerTest {

    private static final Instant START = Instant.parse("2026-09-10T10:00:00Z");
    private static final String HOURLY = "0 * * * *";

    /**
     * Fails the next {@code conflicts} schedule updates with a revision conflict.
     */
    static class ConflictingStore extends InMemoryWorkflowStateStore {
        volatile int conflicts;

        @Override
        public WorkflowSchedule updateSchedule(WorkflowSchedule schedule) throws ConcurrencyConflictException {
            if (conflicts > 0) {
                conflicts--;
                throw new ConcurrencyConflictException("WorkflowSchedule", schedule.getId(),
                        schedule.getRevision(), schedule.getRevision() + 1);
            }
            return super.updateSchedule(schedule);
        }
    }

    private ConflictingStore store;
    private MutableClock clock;
    private SimpleWorkflowDefinitionStore definitions;
    private DurableWorkflowEngine engine;
    private TriggerDispatcher dispatcher;
    private ScheduleManager manager;

    @BeforeEach
    void setUp() {
        store = new ConflictingStore();
        clock = new MutableClock(START);
        WorkflowCompiler compiler = new WorkflowCompiler(new StepExecutorRegistry().register(new EchoStepExecutor()));
        definitions = new SimpleWorkflowDefinitionStore(store, compiler, WorkflowSettings.defaults(), 3, clock);
        engine = DurableWorkflowEngine.builder()
                .stateStore(store)
                .definitionStore(definitions)
                .compiler(compiler)
                .clock(clock)
                .autoDrive(false)
                .build();
        dispatcher = new TriggerDispatcher(definitions, engine);
        manager = new ScheduleManager(store, definitions, dispatcher, engine, Duration.ofHours(1), 3, "UTC", clock);
    }

    @AfterEach
    void tearDown() {
        manager.stop();
        engine.shutdown();
    }

    private WorkflowDefinition scheduledDefinition(Map<String, Object> stepConfig) throws Exception {
        WorkflowDefinition created = definitions.create(WorkflowDefinition.builder()
                .accountId("acct")
                .name("Nightly report")
                .triggerType(TriggerType.SCHEDULED)
                .settings(new WorkflowSettings(0, 1, BackoffStrategy.FIXED, 1, 30))
                .addStep(WorkflowStep.of("report", EchoStepExecutor.TYPE, stepConfig)));
        return definitions.activate(created.getId());
    }

    private WorkflowDefinition scheduledDefinition() throws Exception {
        return scheduledDefinition(Map.of("message", "report"));
    }

    private WorkflowSchedule reload(WorkflowSchedule schedule) {
        return manager.getSchedule(schedule.getId()).orElseThrow();
    }

    @Nested
    @DisplayName("schedule CRUD")
    class Crud {

        @Test
        void addScheduleComputesFirstRunInDefaultZone() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();

            WorkflowSchedule schedule = manager.addSchedule(definition.getId(), HOURLY, null);

            assertThat(schedule.getTimezone()).isEqualTo("UTC");
            assertThat(schedule.isActive()).isTrue();
            assertThat(schedule.getNextRunAt()).isEqualTo(Instant.parse("2026-09-10T11:00:00Z"));
            assertThat(schedule.getRevision()).isEqualTo(1);
            assertThat(manager.listSchedules(definition.getId())).containsExactly(schedule);
        }

        @Test
        void duplicateCronForSameDefinitionIsRejected() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();
            manager.addSchedule(definition.getId(), HOURLY, "UTC");

            assertThatThrownBy(() -> manager.addSchedule(definition.getId(), HOURLY, "Europe/Rome"))
                    .isInstanceOf(DefinitionValidationException.class)
                    .hasMessageContaining("already exists");

            manager.addSchedule(definition.getId(), "30 * * * *", "UTC");
            assertThat(manager.listSchedules(definition.getId())).hasSize(2);
        }

        @Test
        void invalidCronAndUnknownDefinitionAreRejected() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();

            assertThatThrownBy(() -> manager.addSchedule(definition.getId(), "every day", "UTC"))
                    .isInstanceOf(DefinitionValidationException.class)
                    .hasMessageContaining("invalid cron expression");
            assertThatThrownBy(() -> manager.addSchedule("missing", HOURLY, "UTC"))
                    .isInstanceOf(WorkflowNotFoundException.class);
            assertThat(manager.listSchedules(definition.getId())).isEmpty();
        }

        @Test
        void removeSchedule() throws Exception {
            WorkflowSchedule schedule = manager.addSchedule(scheduledDefinition().getId(), HOURLY, "UTC");

            assertThat(manager.removeSchedule(schedule.getId())).isTrue();
            assertThat(manager.removeSchedule(schedule.getId())).isFalse();
            assertThat(manager.getSchedule(schedule.getId())).isEmpty();
        }

        @Test
        void reactivationSkipsOccurrencesMissedWhileInactive() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();
            WorkflowSchedule schedule = manager.addSchedule(definition.getId(), HOURLY, "UTC");

            assertThat(manager.setActive(schedule.getId(), false).isActive()).isFalse();
            clock.set(Instant.parse("2026-09-10T15:10:00Z"));
            assertThat(manager.tick()).isZero();

            WorkflowSchedule reactivated = manager.setActive(schedule.getId(), true);

            assertThat(reactivated.getNextRunAt()).isEqualTo(Instant.parse("2026-09-10T16:00:00Z"));
            assertThat(manager.tick()).isZero();
            assertThat(engine.listExecutions(definition.getId())).isEmpty();
        }

        @Test
        void setActiveOnUnknownScheduleFails() {
            assertThatThrownBy(() -> manager.setActive("missing", true))
                    .isInstanceOf(WorkflowNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("ticking")
    class Ticking {

        @Test
        void nothingFiresBeforeNextRun() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();
            manager.addSchedule(definition.getId(), HOURLY, "UTC");
            clock.set(Instant.parse("2026-09-10T10:59:59Z"));

            assertThat(manager.tick()).isZero();
            assertThat(engine.listExecutions(definition.getId())).isEmpty();
        }

        @Test
        void missedOccurrencesFireASingleCatchUpRun() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();
            WorkflowSchedule schedule = manager.addSchedule(definition.getId(), HOURLY, "UTC");
            clock.set(Instant.parse("2026-09-10T13:20:00Z"));

            assertThat(manager.tick()).isEqualTo(1);
            assertThat(manager.tick()).isZero();

            List<WorkflowExecution> runs = engine.listExecutions(definition.getId());
            assertThat(runs).hasSize(1);
            assertThat(runs.get(0).getTriggerType()).isEqualTo(TriggerType.SCHEDULED);
            assertThat(runs.get(0).getTriggeredBy()).isEqualTo("schedule:" + schedule.getId());
            assertThat(reload(schedule).getNextRunAt()).isEqualTo(Instant.parse("2026-09-10T14:00:00Z"));
        }

        @Test
        void finishedRunIsRecordedOnTheSchedule() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();
            WorkflowSchedule schedule = manager.addSchedule(definition.getId(), HOURLY, "UTC");
            manager.start();
            clock.set(Instant.parse("2026-09-10T11:00:00Z"));
            manager.tick();
            String executionId = engine.listExecutions(definition.getId()).get(0).getId();

            clock.advance(Duration.ofSeconds(5));
            assertThat(engine.advance(executionId)).isEqualTo(ExecutionStatus.COMPLETED);

            WorkflowSchedule recorded = reload(schedule);
            assertThat(recorded.getLastRunStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(recorded.getLastRunAt()).isEqualTo(Instant.parse("2026-09-10T11:00:05Z"));
        }

        @Test
        void failedRunIsRecordedOnTheSchedule() throws Exception {
            WorkflowDefinition definition = scheduledDefinition(Map.of("fail", true));
            WorkflowSchedule schedule = manager.addSchedule(definition.getId(), HOURLY, "UTC");
            manager.start();
            clock.set(Instant.parse("2026-09-10T11:00:00Z"));
            manager.tick();
            String executionId = engine.listExecutions(definition.getId()).get(0).getId();

            assertThat(engine.advance(executionId)).isEqualTo(ExecutionStatus.FAILED);
            assertThat(reload(schedule).getLastRunStatus()).isEqualTo(ExecutionStatus.FAILED);
        }

        @Test
        void pausedDefinitionIsResynchronizedWithoutFiring() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();
            WorkflowSchedule schedule = manager.addSchedule(definition.getId(), HOURLY, "UTC");
            definitions.pause(definition.getId());
            clock.set(Instant.parse("2026-09-10T12:30:00Z"));

            assertThat(manager.tick()).isZero();

            WorkflowSchedule after = reload(schedule);
            assertThat(after.isActive()).isTrue();
            assertThat(after.getNextRunAt()).isEqualTo(Instant.parse("2026-09-10T13:00:00Z"));
            assertThat(engine.listExecutions(definition.getId())).isEmpty();
        }

        @Test
        void archivedDefinitionDeactivatesItsSchedules() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();
            WorkflowSchedule schedule = manager.addSchedule(definition.getId(), HOURLY, "UTC");
            definitions.archive(definition.getId());
            clock.set(Instant.parse("2026-09-10T11:00:00Z"));

            assertThat(manager.tick()).isZero();

            WorkflowSchedule after = reload(schedule);
            assertThat(after.isActive()).isFalse();
            assertThat(after.getNextRunAt()).isNull();
        }

        @Test
        void rejectedTriggerStillAdvancesTheSchedule() throws Exception {
            WorkflowDefinition manual = definitions.activate(definitions.create(WorkflowDefinition.builder()
                    .accountId("acct")
                    .name("Manual only")
                    .triggerType(TriggerType.MANUAL)
                    .addStep(WorkflowStep.of("a", EchoStepExecutor.TYPE, Map.of()))).getId());
            WorkflowSchedule schedule = manager.addSchedule(manual.getId(), HOURLY, "UTC");
            clock.set(Instant.parse("2026-09-10T11:00:00Z"));

            assertThat(manager.tick()).isZero();
            assertThat(reload(schedule).getNextRunAt()).isEqualTo(Instant.parse("2026-09-10T12:00:00Z"));
            assertThat(engine.listExecutions(manual.getId())).isEmpty();
        }

        @Test
        void persistentConflictsSkipTheScheduleForThisTick() throws Exception {
            WorkflowDefinition definition = scheduledDefinition();
            WorkflowSchedule schedule = manager.addSchedule(definition.getId(), HOURLY, "UTC");
            clock.set(Instant.parse("2026-09-10T11:00:00Z"));

            store.conflicts = 3;
            assertThat(manager.tick()).isZero();
            assertThat(reload(schedule).getNextRunAt()).isEqualTo(Instant.parse("2026-09-10T11:00:00Z"));

            store.conflicts = 2;
            assertThat(manager.tick()).isEqualTo(1);
            assertThat(reload(schedule).getNextRunAt()).isEqualTo(Instant.parse("2026-09-10T12:00:00Z"));
        }
    }

    @Test
    void startedManagerTicksOnItsOwn() throws Exception {
        ScheduleManager ticking = new ScheduleManager(store, definitions, dispatcher, engine,
                Duration.ofMillis(50), 3, "UTC", clock);
        WorkflowDefinition definition = scheduledDefinition();
        ticking.addSchedule(definition.getId(), HOURLY, "UTC");
        clock.set(Instant.parse("2026-09-10T11:00:00Z"));

        ticking.start();
        try {
            assertThat(ticking.isRunning()).isTrue();
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> engine.listExecutions(definition.getId()).size() == 1);
        } finally {
            ticking.stop();
        }
        assertThat(ticking.isRunning()).isFalse();
    }
}
