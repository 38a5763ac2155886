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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of one step attempt kept on the execution record, in attempt order.
 * The full attempt detail lives in the corresponding {@link WorkflowStepLog}.
 */
public record StepResult(String stepId,
                         String stepType,
                         int attempt,
                         ExecutionStatus status,
                         Instant startedAt,
                         Instant completedAt,
                         Map<String, Object> output,
                         String errorMessage,
                         String errorCode,
                         String stepLogId) {

    public StepResult {
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
    }

    public static StepResult from(WorkflowStepLog log) {
        return new StepResult(log.getStepId(), log.getStepType(), log.getAttempt(), log.getStatus(),
                log.getStartedAt(), log.getCompletedAt(), log.getOutput(),
                log.getErrorMessage(), log.getErrorCode(), log.getId());
    }
}
