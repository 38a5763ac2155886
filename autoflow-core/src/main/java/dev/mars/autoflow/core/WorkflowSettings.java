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

/**
 * Retry and timeout settings shared by every step of a workflow.
 *
 * @param maxRetries             retries allowed per step visit (0 means a single attempt)
 * @param retryDelaySeconds      base delay before a retry
 * @param backoff                how the delay grows between retries
 * @param maxRetryDelaySeconds   upper bound on any single delay
 * @param timeoutSeconds         default deadline of one step attempt
 */
public record WorkflowSettings(int maxRetries,
                               long retryDelaySeconds,
                               BackoffStrategy backoff,
                               long maxRetryDelaySeconds,
                               long timeoutSeconds) {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_DELAY_SECONDS = 60;
    public static final long DEFAULT_MAX_RETRY_DELAY_SECONDS = 3600;
    public static final long DEFAULT_TIMEOUT_SECONDS = 300;

    public WorkflowSettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
        }
        if (retryDelaySeconds < 0) {
            throw new IllegalArgumentException("retryDelaySeconds cannot be negative: " + retryDelaySeconds);
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
        backoff = backoff != null ? backoff : BackoffStrategy.FIXED;
        maxRetryDelaySeconds = Math.max(maxRetryDelaySeconds, retryDelaySeconds);
    }

    public static WorkflowSettings defaults() {
        return new WorkflowSettings(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY_SECONDS,
                BackoffStrategy.FIXED, DEFAULT_MAX_RETRY_DELAY_SECONDS, DEFAULT_TIMEOUT_SECONDS);
    }

    public WorkflowSettings withMaxRetries(int retries) {
        return new WorkflowSettings(retries, retryDelaySeconds, backoff, maxRetryDelaySeconds, timeoutSeconds);
    }

    public WorkflowSettings withRetryDelay(long delaySeconds, BackoffStrategy strategy) {
        return new WorkflowSettings(maxRetries, delaySeconds, strategy, maxRetryDelaySeconds, timeoutSeconds);
    }

    public WorkflowSettings withTimeoutSeconds(long timeout) {
        return new WorkflowSettings(maxRetries, retryDelaySeconds, backoff, maxRetryDelaySeconds, timeout);
    }

    /**
     * Delay before the retry that follows {@code retryCount} earlier retries of the same visit.
     */
    @JsonIgnore
    public long retryDelayFor(int retryCount) {
        if (backoff == BackoffStrategy.FIXED || retryCount <= 0) {
            return Math.min(retryDelaySeconds, maxRetryDelaySeconds);
        }
        int shift = Math.min(retryCount, 30);
        long delay = retryDelaySeconds << shift;
        if (delay < 0 || delay > maxRetryDelaySeconds) {
            return maxRetryDelaySeconds;
        }
        return delay;
    }
}
