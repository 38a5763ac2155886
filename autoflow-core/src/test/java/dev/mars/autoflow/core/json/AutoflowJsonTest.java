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

package dev.mars.autoflow.core.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import dev.mars.autoflow.core.BackoffStrategy;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.StepResult;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowSettings;
import dev.mars.autoflow.core.WorkflowStep;
import dev.mars.autoflow.core.step.StepConfig;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutoflowJsonTest {

    private static final Instant NOW = Instant.parse("2026-09-10T10:00:00Z");

    record EmailConfig(String to, String subject, int priority) implements StepConfig {
    }

    @Test
    void executionDocumentKeepsSnapshotAndResults() throws Exception {
        WorkflowDefinition definition = WorkflowDefinition.builder()
                .id("wf-1").accountId("acct").name("Flow")
                .triggerType(TriggerType.WEBHOOK)
                .triggerConfig(Map.of("secret", "s3cr3t"))
                .addStep(WorkflowStep.of("a", "http", Map.of("url", "https://example.org")).withOnFailure("b"))
                .addStep(WorkflowStep.of("b", "email", Map.of()).withTimeoutSeconds(5))
                .settings(new WorkflowSettings(2, 10, BackoffStrategy.EXPONENTIAL, 120, 30))
                .createdAt(NOW)
                .build();
        WorkflowExecution execution = WorkflowExecution.builder()
                .id("exec-1")
                .definitionId("wf-1")
                .snapshot(definition.snapshot())
                .status(ExecutionStatus.RETRYING)
                .currentStepId("a")
                .totalSteps(2)
                .attemptSequence(1)
                .addStepResult(new StepResult("a", "http", 1, ExecutionStatus.FAILED, NOW, NOW.plusSeconds(1),
                        null, "boom", "STEP_EXECUTION_ERROR", "exec-1:1"))
                .retryCount(1)
                .nextRetryAt(NOW.plusSeconds(10))
                .inputData(Map.of("lead", Map.of("score", 80)))
                .createdAt(NOW)
                .revision(4)
                .build();

        ObjectMapper mapper = AutoflowJson.documentMapper();
        String json = mapper.writeValueAsString(execution);
        WorkflowExecution read = mapper.readValue(json, WorkflowExecution.class);

        assertThat(json).contains("\"2026-09-10T10:00:10Z\"").doesNotContain("\"terminal\"");
        assertThat(read.getSnapshot()).isEqualTo(execution.getSnapshot());
        assertThat(read.getStepResults()).isEqualTo(execution.getStepResults());
        assertThat(read.getNextRetryAt()).isEqualTo(NOW.plusSeconds(10));
        assertThat(read.getRevision()).isEqualTo(4);
        assertThat(read.getInputData()).containsEntry("lead", Map.of("score", 80));
    }

    @Test
    void configMapperBindsTypedConfig() {
        EmailConfig config = AutoflowJson.configMapper()
                .convertValue(Map.of("to", "ops@example.org", "subject", "Hi", "priority", 2), EmailConfig.class);
        assertThat(config).isEqualTo(new EmailConfig("ops@example.org", "Hi", 2));
    }

    @Test
    void configMapperRejectsUnknownKeys() {
        assertThatThrownBy(() -> AutoflowJson.configMapper()
                .convertValue(Map.of("too", "typo", "subject", "Hi", "priority", 1), EmailConfig.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasCauseInstanceOf(UnrecognizedPropertyException.class);
    }
}
