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

package dev.mars.autoflow.workflow.engine;

import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.StepResult;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowStep;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time progress of one run.
 *
 * @param stepsCompleted            successful step attempts so far, at most {@code totalSteps}
 * @param progressPercent           {@code stepsCompleted} over {@code totalSteps}; 100 once COMPLETED
 * @param currentStepName           display name of the current step, null once terminal
 * @param estimatedRemainingSeconds average step time so far times the steps left; null unless
 *                                  RUNNING with at least one step completed
 * @param errorCount                failed step attempts so far
 */
public record ExecutionProgress(String executionId,
                                String workflowName,
                                ExecutionStatus status,
                                int progressPercent,
                                String currentStepId,
                                String currentStepName,
                                int stepsCompleted,
                                int totalSteps,
                                Instant startedAt,
                                Long estimatedRemainingSeconds,
                                int errorCount) {

    static ExecutionProgress of(WorkflowExecution execution, Instant now) {
        int total = execution.getTotalSteps();
        int completed = (int) Math.min(total, execution.getStepResults().stream()
                .filter(r -> r.status() == ExecutionStatus.COMPLETED)
                .count());
        int errors = (int) execution.getStepResults().stream()
                .map(StepResult::status)
                .filter(s -> s == ExecutionStatus.FAILED)
                .count();

        int percent;
        if (execution.getStatus() == ExecutionStatus.COMPLETED) {
            percent = 100;
        } else {
            percent = total > 0 ? Math.min(100, completed * 100 / total) : 0;
        }

        Long remaining = null;
        if (execution.getStatus() == ExecutionStatus.RUNNING && execution.getStartedAt() != null && completed > 0) {
            long elapsed = Math.max(0, Duration.between(execution.getStartedAt(), now).getSeconds());
            remaining = elapsed * (total - completed) / completed;
        }

        String stepId = execution.isTerminal() ? null : execution.getCurrentStepId();
        String stepName = null;
        String workflowName = execution.getDefinitionId();
        if (execution.getSnapshot() != null) {
            workflowName = execution.getSnapshot().name();
            if (stepId != null) {
                stepName = execution.getSnapshot().findStep(stepId).map(WorkflowStep::name).orElse(stepId);
            }
        }
        return new ExecutionProgress(execution.getId(), workflowName, execution.getStatus(), percent,
                stepId, stepName, completed, total, execution.getStartedAt(), remaining, errors);
    }
}
