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

package dev.mars.autoflow.workflow;

import dev.mars.autoflow.core.WorkflowSettings;
import dev.mars.autoflow.core.WorkflowSnapshot;
import dev.mars.autoflow.core.WorkflowStep;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.StepExecutionException;
import dev.mars.autoflow.core.step.StepConfig;
import dev.mars.autoflow.core.step.StepContext;
import dev.mars.autoflow.core.step.StepExecutor;
import dev.mars.autoflow.core.step.StepOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WorkflowCompiler")
class WorkflowCompilerTest {

    public record EmailConfig(String to, String subject) implements StepConfig {
    }

    static final class EmailExecutor implements StepExecutor<EmailConfig> {
        @Override
        public String type() {
            return "send_email";
        }

        @Override
        public Class<EmailConfig> configType() {
            return EmailConfig.class;
        }

        @Override
        public StepOutcome invoke(EmailConfig config, StepContext context) {
            return StepOutcome.success(Map.of("sent_to", config.to()));
        }
    }

    private WorkflowCompiler compiler;

    @BeforeEach
    void setUp() {
        StepExecutorRegistry registry = new StepExecutorRegistry()
                .register(new ScriptedStepExecutor())
                .register(new EmailExecutor());
        compiler = new WorkflowCompiler(registry);
    }

    private static WorkflowSnapshot snapshot(WorkflowStep... steps) {
        return new WorkflowSnapshot("wf-1", "acct", "Flow", 1, Arrays.asList(steps),
                WorkflowSettings.defaults().withTimeoutSeconds(120));
    }

    private static WorkflowStep step(String id) {
        return WorkflowStep.of(id, ScriptedStepExecutor.TYPE, Map.of());
    }

    @Test
    @DisplayName("resolves default routing to the next step, then $end and $fail")
    void defaultRouting() throws Exception {
        CompiledWorkflow workflow = compiler.compile(snapshot(step("a"), step("b")));

        assertThat(workflow.firstStep().id()).isEqualTo("a");
        assertThat(workflow.step("a").successTarget()).isEqualTo("b");
        assertThat(workflow.step("a").failureTarget()).isEqualTo(WorkflowStep.FAIL);
        assertThat(workflow.step("b").successTarget()).isEqualTo(WorkflowStep.END);
        assertThat(workflow.step("b").index()).isEqualTo(1);
    }

    @Test
    @DisplayName("per-step timeout overrides the workflow timeout")
    void timeoutOverride() throws Exception {
        CompiledWorkflow workflow = compiler.compile(snapshot(step("a"), step("b").withTimeoutSeconds(5)));

        assertThat(workflow.step("a").timeoutSeconds()).isEqualTo(120);
        assertThat(workflow.step("b").timeoutSeconds()).isEqualTo(5);
    }

    @Test
    @DisplayName("binds step config to the executor's typed config")
    void bindsTypedConfig() throws Exception {
        WorkflowStep email = WorkflowStep.of("notify", "send_email", Map.of("to", "ops@example.com", "subject", "Hi"));
        CompiledWorkflow workflow = compiler.compile(snapshot(email));

        assertThat(workflow.step("notify").config()).isEqualTo(new EmailConfig("ops@example.com", "Hi"));
        StepOutcome outcome = workflow.step("notify").invoke(
                new StepContext("exec", "wf-1", "notify", 1, Map.of(), Map.of()));
        assertThat(outcome.output()).containsEntry("sent_to", "ops@example.com");
    }

    @Test
    @DisplayName("cycles through failure edges are legal")
    void cyclesAllowed() throws Exception {
        CompiledWorkflow workflow = compiler.compile(snapshot(
                step("fetch"),
                step("check").withOnFailure("fetch")));

        assertThat(workflow.step("check").failureTarget()).isEqualTo("fetch");
    }

    @Test
    @DisplayName("rejects an empty workflow")
    void rejectsEmpty() {
        assertThatThrownBy(() -> compiler.compile(snapshot()))
                .isInstanceOf(DefinitionValidationException.class)
                .hasMessageContaining("at least one step");
    }

    @Test
    @DisplayName("collects every violation in one pass")
    void collectsAllViolations() {
        WorkflowSnapshot invalid = snapshot(
                step("a").withOnSuccess("missing"),
                step("a"),
                WorkflowStep.of("b", "no_such_type", Map.of()),
                WorkflowStep.of("c", "send_email", Map.of("to", "x", "unexpected", 1)),
                step(WorkflowStep.END),
                step("d").withTimeoutSeconds(0));

        ValidationResult result = compiler.validate(invalid);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).extracting(ValidationResult.ValidationIssue::fieldPath)
                .containsExactlyInAnyOrder(
                        "steps[0].on_success",
                        "steps[1].id",
                        "steps[2].type",
                        "steps[3].config",
                        "steps[4].id",
                        "steps[5].timeout_seconds");
    }

    @Test
    @DisplayName("reports unreachable steps as warnings only")
    void unreachableIsWarning() throws Exception {
        WorkflowSnapshot snapshot = snapshot(
                step("a").withOnSuccess(WorkflowStep.END),
                step("orphan"));

        ValidationResult result = compiler.validate(snapshot);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).singleElement()
                .satisfies(w -> assertThat(w.message()).contains("orphan"));
        assertThat(compiler.compile(snapshot).steps()).hasSize(2);
    }

    @Test
    @DisplayName("compiling the same snapshot again reuses the bound workflow")
    void reusesLatestCompilation() throws Exception {
        WorkflowSnapshot v1 = snapshot(step("a"));
        WorkflowSnapshot v2 = new WorkflowSnapshot("wf-1", "acct", "Flow", 2, List.of(step("a"), step("b")),
                v1.settings());

        CompiledWorkflow first = compiler.compile(v1);
        assertThat(compiler.compile(v1)).isSameAs(first);

        CompiledWorkflow second = compiler.compile(v2);
        assertThat(second).isNotSameAs(first);
        assertThat(compiler.compile(v2)).isSameAs(second);

        // an older version compiles but does not displace the newer one
        assertThat(compiler.compile(v1)).isNotSameAs(first);
        assertThat(compiler.compile(v2)).isSameAs(second);
        assertThat(compiler.cachedCount()).isEqualTo(1);

        compiler.evict("wf-1");
        assertThat(compiler.cachedCount()).isZero();
        assertThat(compiler.compile(v2)).isNotSameAs(second);
    }

    @Test
    @DisplayName("placeholders in a step config are filled from the run context per attempt")
    void resolvesPlaceholders() throws Exception {
        WorkflowStep email = WorkflowStep.of("notify", "send_email",
                Map.of("to", "{input.email}", "subject", "{draft.title}"));
        CompiledWorkflow.CompiledStep step = compiler.compile(snapshot(email)).step("notify");

        assertThat(step.templated()).isTrue();
        StepOutcome outcome = step.invoke(new StepContext("exec", "wf-1", "notify", 1,
                Map.of("email", "ada@example.com"),
                Map.of("draft", Map.of("title", "Welcome"))));

        assertThat(outcome.output()).containsEntry("sent_to", "ada@example.com");
    }

    @Test
    @DisplayName("the rest of a templated config is still checked when compiling")
    void checksTemplatedConfig() {
        WorkflowStep email = WorkflowStep.of("notify", "send_email",
                Map.of("to", "{input.email}", "unexpected", 1));

        ValidationResult result = compiler.validate(snapshot(email));

        assertThat(result.getErrors()).extracting(ValidationResult.ValidationIssue::fieldPath)
                .containsExactly("steps[0].config");
    }

    @Test
    @DisplayName("a placeholder resolving to the wrong shape fails the attempt")
    void resolvedConfigMustBind() throws Exception {
        WorkflowStep email = WorkflowStep.of("notify", "send_email", Map.of("to", "{input.recipient}"));
        CompiledWorkflow.CompiledStep step = compiler.compile(snapshot(email)).step("notify");
        StepContext context = new StepContext("exec", "wf-1", "notify", 1,
                Map.of("recipient", Map.of("name", "Ada")), Map.of());

        assertThatThrownBy(() -> step.invoke(context))
                .isInstanceOf(StepExecutionException.class)
                .hasMessageContaining("EmailConfig")
                .hasFieldOrPropertyWithValue("errorCode", StepExecutionException.STEP_EXECUTION_ERROR);
    }

    @Test
    @DisplayName("looking up an unknown step fails fast")
    void unknownStepLookup() throws Exception {
        CompiledWorkflow workflow = compiler.compile(snapshot(step("a")));

        assertThatThrownBy(() -> workflow.step("zzz")).isInstanceOf(IllegalArgumentException.class);
        assertThat(workflow.steps()).extracting(CompiledWorkflow.CompiledStep::id).isEqualTo(List.of("a"));
    }
}
