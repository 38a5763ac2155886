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
 * A step kept failing after every retry allowed by the workflow settings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-03
 */
public class RetryBudgetExceededException extends AutoflowException {

    public static final String ERROR_CODE = "RetryBudgetExceeded";

    private final String stepId;
    private final int attempts;

    public RetryBudgetExceededException(String stepId, int attempts, String lastError) {
        super(String.format("Step '%s' failed after %d attempt(s): %s", stepId, attempts, lastError));
        this.stepId = stepId;
        this.attempts = attempts;
    }

    public String getStepId() {
        return stepId;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getErrorCode() {
        return ERROR_CODE;
    }
}
