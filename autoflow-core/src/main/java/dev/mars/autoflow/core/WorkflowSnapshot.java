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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable copy of a definition's steps and settings taken when a run starts.
 * Later edits to the definition never reach a run that already holds a snapshot.
 */
public record WorkflowSnapshot(String definitionId,
                               String accountId,
                               String name,
                               int version,
                               List<WorkflowStep> steps,
                               WorkflowSettings settings) {

    public WorkflowSnapshot {
        Objects.requireNonNull(definitionId, "definitionId cannot be null");
        steps = steps != null ? List.copyOf(steps) : List.of();
        settings = settings != null ? settings : WorkflowSettings.defaults();
    }

    @JsonIgnore
    public Optional<WorkflowStep> findStep(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    /**
     * Array index of the step, or -1 if the id is not part of this snapshot.
     */
    public int indexOf(String stepId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).id().equals(stepId)) {
                return i;
            }
        }
        return -1;
    }
}
