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

package dev.mars.autoflow.core.exceptions;

/**
 * Failure of a single step attempt, raised by a step executor or by the
 * engine when the step deadline passes. Never escapes the engine: it is
 * recorded on the step log as an error message and code.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-03
 */
public class StepExecutionException extends AutoflowException {

    public static final String STEP_EXECUTION_ERROR = "STEP_EXECUTION_ERROR";
    public static final String STEP_TIMEOUT = "STEP_TIMEOUT";
    public static final String STEP_NOT_STARTED = "STEP_NOT_STARTED";

    private final String stepId;
    private final String errorCode;

    public StepExecutionException(String stepId, String errorCode, String message) {
        super(message);
        this.stepId = stepId;
        this.errorCode = errorCode;
    }

    public StepExecutionException(String stepId, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
        this.errorCode = errorCode;
    }

    public static StepExecutionException timeout(String stepId, long timeoutSeconds) {
        return new StepExecutionException(stepId, STEP_TIMEOUT,
                String.format("Step '%s' did not finish within %d seconds", stepId, timeoutSeconds));
    }

    /** No step thread became free to run the attempt in time. */
    public static StepExecutionException notStarted(String stepId, long waitedSeconds) {
        return new StepExecutionException(stepId, STEP_NOT_STARTED,
                String.format("Step '%s' could not start within %d seconds: all step threads are busy",
                        stepId, waitedSeconds));
    }

    public String getStepId() {
        return stepId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
