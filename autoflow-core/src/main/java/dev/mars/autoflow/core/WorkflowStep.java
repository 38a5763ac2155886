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

package dev.mars.autoflow.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a workflow's step graph.
 *
 * <p>{@code onSuccess} and {@code onFailure} name the step to route to, or one
 * of the reserved markers {@link #END} and {@link #FAIL}. A null
 * {@code onSuccess} means "the next step in array order"; a null
 * {@code onFailure} means {@link #FAIL}. {@code timeoutSeconds} overrides the
 * workflow-wide step timeout when set.</p>
 *
 * @param id             step id, unique within the definition
 * @param name           display name
 * @param type           type tag resolved against the step executor registry
 * @param config         opaque config payload bound to the executor's config type
 * @param onSuccess      routing target on success, may be null
 * @param onFailure      routing target once retries are exhausted, may be null
 * @param timeoutSeconds per-step timeout override, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowStep(String id,
                           String name,
                           String type,
                           Map<String, Object> config,
                           String onSuccess,
                           String onFailure,
                           Integer timeoutSeconds) {

    /** Reserved routing marker that completes the run. */
    public static final String END = "$end";

    /** Reserved routing marker that fails the run. */
    public static final String FAIL = "$fail";

    public WorkflowStep {
        Objects.requireNonNull(id, "step id cannot be null");
        Objects.requireNonNull(type, "step type cannot be null");
        name = name != null ? name : id;
        config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Map.of();
    }

    public static WorkflowStep of(String id, String type, Map<String, Object> config) {
        return new WorkflowStep(id, id, type, config, null, null, null);
    }

    public WorkflowStep withOnSuccess(String target) {
        return new WorkflowStep(id, name, type, config, target, onFailure, timeoutSeconds);
    }

    public WorkflowStep withOnFailure(String target) {
        return new WorkflowStep(id, name, type, config, onSuccess, target, timeoutSeconds);
    }

    public WorkflowStep withTimeoutSeconds(Integer timeout) {
        return new WorkflowStep(id, name, type, config, onSuccess, onFailure, timeout);
    }

    @JsonIgnore
    public boolean hasExplicitFailureRoute() {
        return onFailure != null && !FAIL.equals(onFailure);
    }

    public static boolean isReservedMarker(String target) {
        return END.equals(target) || FAIL.equals(target);
    }
}
