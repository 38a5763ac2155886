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
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Audit record of one step attempt. Written RUNNING before the executor is
 * invoked and marked terminal exactly once afterwards; a terminal log is never
 * rewritten, which is what makes replay of an attempt idempotent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-04
 */
@JsonDeserialize(builder = WorkflowStepLog.Builder.class)
public class WorkflowStepLog {

    private final String id;
    private final String executionId;
    private final String stepId;
    private final String stepType;
    private final String stepName;
    private final int attempt;
    private final ExecutionStatus status;
    private final Instant startedAt;
    private final Instant completedAt;
    private final long durationMs;
    private final Map<String, Object> input;
    private final Map<String, Object> output;
    private final String errorMessage;
    private final String errorCode;
    private final long tokensConsumed;
    private final long apiCallsMade;

    private WorkflowStepLog(Builder builder) {
        this.id = builder.id;
        this.executionId = builder.executionId;
        this.stepId = builder.stepId;
        this.stepType = builder.stepType;
        this.stepName = builder.stepName;
        this.attempt = builder.attempt;
        this.status = builder.status;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.durationMs = builder.durationMs;
        this.input = Collections.unmodifiableMap(new LinkedHashMap<>(builder.input));
        this.output = Collections.unmodifiableMap(new LinkedHashMap<>(builder.output));
        this.errorMessage = builder.errorMessage;
        this.errorCode = builder.errorCode;
        this.tokensConsumed = builder.tokensConsumed;
        this.apiCallsMade = builder.apiCallsMade;
    }

    /**
     * Step log ids are derived from the execution id and the attempt number so that
     * a replayed attempt finds the log written by its first invocation.
     */
    public static String idFor(String executionId, int attempt) {
        return executionId + ":" + attempt;
    }

    public String getId() { return id; }
    public String getExecutionId() { return executionId; }
    public String getStepId() { return stepId; }
    public String getStepType() { return stepType; }
    public String getStepName() { return stepName; }
    public int getAttempt() { return attempt; }
    public ExecutionStatus getStatus() { return status; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public long getDurationMs() { return durationMs; }
    public Map<String, Object> getInput() { return input; }
    public Map<String, Object> getOutput() { return output; }
    public String getErrorMessage() { return errorMessage; }
    public String getErrorCode() { return errorCode; }
    public long getTokensConsumed() { return tokensConsumed; }
    public long getApiCallsMade() { return apiCallsMade; }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Returns a terminal copy of this log.
     */
    public WorkflowStepLog finish(ExecutionStatus outcome, Instant at) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Step log can only finish in a terminal status: " + outcome);
        }
        long duration = startedAt != null ? Math.max(0, Duration.between(startedAt, at).toMillis()) : 0;
        return toBuilder().status(outcome).completedAt(at).durationMs(duration).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .executionId(executionId)
                .stepId(stepId)
                .stepType(stepType)
                .stepName(stepName)
                .attempt(attempt)
                .status(status)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationMs(durationMs)
                .input(input)
                .output(output)
                .errorMessage(errorMessage)
                .errorCode(errorCode)
                .tokensConsumed(tokensConsumed)
                .apiCallsMade(apiCallsMade);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String id;
        private String executionId;
        private String stepId;
        private String stepType;
        private String stepName;
        private int attempt;
        private ExecutionStatus status = ExecutionStatus.RUNNING;
        private Instant startedAt;
        private Instant completedAt;
        private long durationMs;
        private Map<String, Object> input = new LinkedHashMap<>();
        private Map<String, Object> output = new LinkedHashMap<>();
        private String errorMessage;
        private String errorCode;
        private long tokensConsumed;
        private long apiCallsMade;

        public Builder id(String id) { this.id = id; return this; }
        public Builder executionId(String executionId) { this.executionId = executionId; return this; }
        public Builder stepId(String stepId) { this.stepId = stepId; return this; }
        public Builder stepType(String stepType) { this.stepType = stepType; return this; }
        public Builder stepName(String stepName) { this.stepName = stepName; return this; }
        public Builder attempt(int attempt) { this.attempt = attempt; return this; }
        public Builder status(ExecutionStatus status) { this.status = status; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder durationMs(long durationMs) { this.durationMs = durationMs; return this; }
        public Builder input(Map<String, Object> input) { this.input = input != null ? new LinkedHashMap<>(input) : new LinkedHashMap<>(); return this; }
        public Builder output(Map<String, Object> output) { this.output = output != null ? new LinkedHashMap<>(output) : new LinkedHashMap<>(); return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder errorCode(String errorCode) { this.errorCode = errorCode; return this; }
        public Builder tokensConsumed(long tokensConsumed) { this.tokensConsumed = tokensConsumed; return this; }
        public Builder apiCallsMade(long apiCallsMade) { this.apiCallsMade = apiCallsMade; return this; }

        public WorkflowStepLog build() {
            Objects.requireNonNull(executionId, "executionId cannot be null");
            Objects.requireNonNull(stepId, "stepId cannot be null");
            Objects.requireNonNull(status, "status cannot be null");
            if (attempt < 1) {
                throw new IllegalArgumentException("attempt must be at least 1: " + attempt);
            }
            if (id == null) {
                id = idFor(executionId, attempt);
            }
            return new WorkflowStepLog(this);
        }
    }

    @Override
    public String toString() {
        return "WorkflowStepLog{" +
                "id='" + id + '\'' +
                ", stepId='" + stepId + '\'' +
                ", status=" + status +
                ", errorCode='" + errorCode + '\'' +
                '}';
    }
}
