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
 * Result of one step invocation.
 *
 * @param status         SUCCESS or FAILURE
 * @param output         step output, kept in the run context on success
 * @param error          failure description, null on success
 * @param tokensConsumed resource counter reported by the executor
 * @param apiCallsMade   resource counter reported by the executor
 */
public record StepOutcome(Status status,
                          Map<String, Object> output,
                          String error,
                          long tokensConsumed,
                          long apiCallsMade) {

    public enum Status {
        SUCCESS,
        FAILURE
    }

    public StepOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        output = Collections.unmodifiableMap(new LinkedHashMap<>(output != null ? output : Map.of()));
    }

    public static StepOutcome success(Map<String, Object> output) {
        return new StepOutcome(Status.SUCCESS, output, null, 0, 0);
    }

    public static StepOutcome failure(String error) {
        return new StepOutcome(Status.FAILURE, Map.of(), error, 0, 0);
    }

    public StepOutcome withUsage(long tokens, long apiCalls) {
        return new StepOutcome(status, output, error, tokens, apiCalls);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
