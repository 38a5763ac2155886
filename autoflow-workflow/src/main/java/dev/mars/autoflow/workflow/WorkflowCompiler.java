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
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.json.AutoflowJson;
import dev.mars.autoflow.core.step.StepConfig;
import dev.mars.autoflow.core.step.StepExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates a workflow's step graph and binds each step to its executor.
 *
 * <h3>Rules:</h3>
 * <ul>
 *   <li>at least one step; step ids are unique and are not reserved markers</li>
 *   <li>every on_success and on_failure target is a step id, {@code $end} or {@code $fail}</li>
 *   <li>every step type has a registered executor</li>
 *   <li>every step config binds to the executor's config type</li>
 *   <li>per-step timeout overrides are positive</li>
 * </ul>
 *
 * <p>Cycles are legal: a failure edge may route back to an earlier step.
 * Steps that cannot be reached from the first step are reported as warnings.</p>
 *
 * <p>A step config holding placeholders (see {@link StepConfigTemplates}) is checked
 * without its placeholder entries here and bound in full once per attempt.</p>
 *
 * <p>The latest compiled version of each definition is kept, so activating a
 * definition parses its configs once and later runs of that version reuse them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-05
 * @version 1.0
 */
public class WorkflowCompiler {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final StepExecutorRegistry registry;
    private final ObjectMapper configMapper;
    private final Map<String, CompiledWorkflow> latestByDefinition = new ConcurrentHashMap<>();

    public WorkflowCompiler(StepExecutorRegistry registry) {
        this.registry = registry;
        this.configMapper = AutoflowJson.configMapper();
    }

    /**
     * Validates without binding the result.
     */
    public ValidationResult validate(WorkflowSnapshot snapshot) {
        ValidationResult result = new ValidationResult();
        bind(snapshot, result);
        return result;
    }

    /**
     * @throws DefinitionValidationException listing every violation found
     */
    public CompiledWorkflow compile(WorkflowSnapshot snapshot) throws DefinitionValidationException {
        CompiledWorkflow cached = latestByDefinition.get(snapshot.definitionId());
        if (cached != null && cached.snapshot().equals(snapshot)) {
            return cached;
        }
        CompiledWorkflow compiled = compileUncached(snapshot);
        latestByDefinition.merge(snapshot.definitionId(), compiled,
                (current, fresh) -> fresh.snapshot().version() >= current.snapshot().version() ? fresh : current);
        return compiled;
    }

    /**
     * Drops the cached compilation of a definition that will not run again.
     */
    public void evict(String definitionId) {
        if (latestByDefinition.remove(definitionId) != null) {
            logger.debug("Evicted compiled workflow {}", definitionId);
        }
    }

    int cachedCount() {
        return latestByDefinition.size();
    }

    private CompiledWorkflow compileUncached(WorkflowSnapshot snapshot) throws DefinitionValidationException {
        ValidationResult result = new ValidationResult();
        List<CompiledWorkflow.CompiledStep> compiled = bind(snapshot, result);
        if (!result.isValid()) {
            throw new DefinitionValidationException(snapshot.definitionId(), result.errorMessages());
        }
        result.getWarnings().forEach(w -> logger.warn("Workflow {}: {}", snapshot.definitionId(), w));
        return new CompiledWorkflow(snapshot, compiled);
    }

    private List<CompiledWorkflow.CompiledStep> bind(WorkflowSnapshot snapshot, ValidationResult result) {
        List<WorkflowStep> steps = snapshot.steps();
        List<CompiledWorkflow.CompiledStep> compiled = new ArrayList<>();
        if (steps.isEmpty()) {
            result.addError("steps", "workflow must contain at least one step");
            return compiled;
        }

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            String id = steps.get(i).id();
            if (id.isBlank()) {
                result.addError(path(i, "id"), "step id cannot be blank");
            } else if (WorkflowStep.isReservedMarker(id)) {
                result.addError(path(i, "id"), "step id '" + id + "' is a reserved marker");
            } else if (!ids.add(id)) {
                result.addError(path(i, "id"), "duplicate step id '" + id + "'");
            }
        }

        long defaultTimeout = snapshot.settings().timeoutSeconds();
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            checkTarget(step.onSuccess(), ids, path(i, "on_success"), result);
            checkTarget(step.onFailure(), ids, path(i, "on_failure"), result);

            if (step.timeoutSeconds() != null && step.timeoutSeconds() <= 0) {
                result.addError(path(i, "timeout_seconds"), "timeout must be positive");
            }

            Optional<StepExecutor<?>> executor = registry.find(step.type());
            if (executor.isEmpty()) {
                result.addError(path(i, "type"), "no step executor registered for type '" + step.type() + "'");
                continue;
            }
            boolean templated = StepConfigTemplates.hasPlaceholders(step.config());
            StepConfig config = bindConfig(executor.get(), step, templated, path(i, "config"), result);
            if (config == null) {
                continue;
            }

            String successTarget = step.onSuccess() != null
                    ? step.onSuccess()
                    : (i + 1 < steps.size() ? steps.get(i + 1).id() : WorkflowStep.END);
            String failureTarget = step.onFailure() != null ? step.onFailure() : WorkflowStep.FAIL;
            long timeout = step.timeoutSeconds() != null && step.timeoutSeconds() > 0
                    ? step.timeoutSeconds() : defaultTimeout;
            compiled.add(new CompiledWorkflow.CompiledStep(step, i, executor.get(), config, templated,
                    successTarget, failureTarget, timeout));
        }

        if (result.isValid()) {
            reportUnreachable(compiled, result);
        }
        return compiled;
    }

    private StepConfig bindConfig(StepExecutor<?> executor, WorkflowStep step, boolean templated, String path,
                                  ValidationResult result) {
        Map<String, Object> raw = templated ? StepConfigTemplates.withoutPlaceholders(step.config()) : step.config();
        try {
            StepConfig config = configMapper.convertValue(raw, executor.configType());
            if (config == null) {
                result.addError(path, "config is empty for step type '" + step.type() + "'");
            }
            return config;
        } catch (IllegalArgumentException e) {
            result.addError(path, "config does not match " + executor.configType().getSimpleName()
                    + ": " + rootMessage(e));
            return null;
        }
    }

    private static void checkTarget(String target, Set<String> ids, String path, ValidationResult result) {
        if (target == null || WorkflowStep.isReservedMarker(target)) {
            return;
        }
        if (!ids.contains(target)) {
            result.addError(path, "references unknown step '" + target + "'");
        }
    }

    private static void reportUnreachable(List<CompiledWorkflow.CompiledStep> steps, ValidationResult result) {
        Map<String, CompiledWorkflow.CompiledStep> byId = new HashMap<>();
        steps.forEach(s -> byId.put(s.id(), s));

        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(steps.get(0).id());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!seen.add(id)) {
                continue;
            }
            CompiledWorkflow.CompiledStep step = byId.get(id);
            for (String next : List.of(step.successTarget(), step.failureTarget())) {
                if (byId.containsKey(next)) {
                    queue.add(next);
                }
            }
        }
        for (CompiledWorkflow.CompiledStep step : steps) {
            if (!seen.contains(step.id())) {
                result.addWarning(path(step.index(), "id"), "step '" + step.id() + "' is unreachable");
            }
        }
    }

    private static String path(int index, String field) {
        return "steps[" + index + "]." + field;
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        int newline = message != null ? message.indexOf('\n') : -1;
        return newline > 0 ? message.substring(0, newline) : String.valueOf(message);
    }
}
