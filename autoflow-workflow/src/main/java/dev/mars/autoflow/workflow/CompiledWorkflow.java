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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.autoflow.core.WorkflowSnapshot;
import dev.mars.autoflow.core.WorkflowStep;
import dev.mars.autoflow.core.exceptions.StepExecutionException;
import dev.mars.autoflow.core.json.AutoflowJson;
import dev.mars.autoflow.core.step.StepConfig;
import dev.mars.autoflow.core.step.StepContext;
import dev.mars.autoflow.core.step.StepExecutor;
import dev.mars.autoflow.core.step.StepOutcome;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A validated snapshot whose steps are bound to their executors and typed configs,
 * with routing targets resolved. Built by {@link WorkflowCompiler}.
 */
public final class CompiledWorkflow {

    private static final ObjectMapper CONFIG_MAPPER = AutoflowJson.configMapper();

    private final WorkflowSnapshot snapshot;
    private final List<CompiledStep> steps;
    private final Map<String, CompiledStep> stepsById;

    CompiledWorkflow(WorkflowSnapshot snapshot, List<CompiledStep> steps) {
        this.snapshot = snapshot;
        this.steps = List.copyOf(steps);
        this.stepsById = steps.stream().collect(Collectors.toMap(CompiledStep::id, Function.identity()));
    }

    public WorkflowSnapshot snapshot() {
        return snapshot;
    }

    public CompiledStep firstStep() {
        return steps.get(0);
    }

    public List<CompiledStep> steps() {
        return steps;
    }

    public CompiledStep step(String stepId) {
        CompiledStep step = stepsById.get(stepId);
        if (step == null) {
            throw new IllegalArgumentException("Step '" + stepId + "' is not part of workflow " + snapshot.definitionId());
        }
        return step;
    }

    /**
     * A step bound to its executor.
     *
     * @param step           the step as defined
     * @param index          array index of the step
     * @param executor       executor registered for the step type
     * @param config         step config bound to the executor's config type; for a templated
     *                       step, the config bound without its placeholder entries
     * @param templated      the config holds placeholders, resolved and bound again per attempt
     * @param successTarget  step id, {@link WorkflowStep#END} or {@link WorkflowStep#FAIL}
     * @param failureTarget  step id or a reserved marker, followed once retries are exhausted
     * @param timeoutSeconds deadline of one attempt
     */
    public record CompiledStep(WorkflowStep step,
                               int index,
                               StepExecutor<?> executor,
                               StepConfig config,
                               boolean templated,
                               String successTarget,
                               String failureTarget,
                               long timeoutSeconds) {

        public String id() {
            return step.id();
        }

        public StepOutcome invoke(StepContext context) throws Exception {
            return invokeTyped(executor, templated ? bindResolved(context) : config, context);
        }

        private StepConfig bindResolved(StepContext context) throws StepExecutionException {
            Map<String, Object> resolved = StepConfigTemplates.resolve(step.config(), context);
            try {
                return CONFIG_MAPPER.convertValue(resolved, executor.configType());
            } catch (IllegalArgumentException e) {
                throw new StepExecutionException(step.id(), StepExecutionException.STEP_EXECUTION_ERROR,
                        "Resolved config does not match " + executor.configType().getSimpleName()
                                + ": " + e.getMessage(), e);
            }
        }

        private static <C extends StepConfig> StepOutcome invokeTyped(StepExecutor<C> executor, StepConfig config,
                                                                      StepContext context) throws Exception {
            return executor.invoke(executor.configType().cast(config), context);
        }
    }
}
