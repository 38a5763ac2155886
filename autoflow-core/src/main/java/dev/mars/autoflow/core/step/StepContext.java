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

package dev.mars.autoflow.core.step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accumulated context handed to a step executor.
 *
 * @param executionId id of the running execution
 * @param workflowId  id of the definition the run was started from
 * @param stepId      id of the step being executed
 * @param attempt     attempt number within the run, starting at 1
 * @param input       input data the run was triggered with
 * @param steps       latest successful output of each step visited so far
 */
public record StepContext(String executionId,
                          String workflowId,
                          String stepId,
                          int attempt,
                          Map<String, Object> input,
                          Map<String, Object> steps) {

    public static final String KEY_INPUT = "input";
    public static final String KEY_STEPS = "steps";
    public static final String KEY_EXECUTION_ID = "execution_id";
    public static final String KEY_WORKFLOW_ID = "workflow_id";
    public static final String KEY_ATTEMPT = "attempt";

    public StepContext {
        input = Collections.unmodifiableMap(new LinkedHashMap<>(input != null ? input : Map.of()));
        steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps != null ? steps : Map.of()));
    }

    /**
     * Output of an earlier step, or null if that step has not succeeded in this run.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> outputOf(String earlierStepId) {
        Object value = steps.get(earlierStepId);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    /**
     * The context in its flat map form, as recorded on the step log.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(KEY_INPUT, input);
        map.put(KEY_STEPS, steps);
        map.put(KEY_EXECUTION_ID, executionId);
        map.put(KEY_WORKFLOW_ID, workflowId);
        map.put(KEY_ATTEMPT, attempt);
        return map;
    }
}
