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
import dev.mars.autoflow.core.exceptions.InvalidTransitionException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One run of a workflow snapshot.
 *
 * <p>Created by the execution engine once a trigger is admitted and mutated only
 * by the engine afterwards. {@code attemptSequence} counts the step attempts
 * whose outcome has been applied to this record; the attempt in progress, if
 * any, is number {@code attemptSequence + 1}. {@code context} holds the latest
 * successful output of every step visited so far, keyed by step id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-02
 * @version 1.0
 */
@JsonDeserialize(builder = WorkflowExecution.Builder.class)
public class WorkflowExecution {

    private final String id;
    private final String definitionId;
    private final String accountId;
    private final TriggerType triggerType;
    private final String triggeredBy;
    private final WorkflowSnapshot snapshot;
    private final ExecutionStatus status;
    private final String currentStepId;
    private final int currentStepIndex;
    private final int totalSteps;
    private final int attemptSequence;
    private final List<StepResult> stepResults;
    private final int retryCount;
    private final int maxRetries;
    private final Instant nextRetryAt;
    private final Map<String, Object> inputData;
    private final Map<String, Object> context;
    private final Map<String, Object> output;
    private final String errorMessage;
    private final String errorCode;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant updatedAt;
    private final long revision;

    private WorkflowExecution(Builder builder) {
        this.id = builder.id;
        this.definitionId = builder.definitionId;
        this.accountId = builder.accountId;
        this.triggerType = builder.triggerType;
        this.triggeredBy = builder.triggeredBy;
        this.snapshot = builder.snapshot;
        this.status = builder.status;
        this.currentStepId = builder.currentStepId;
        this.currentStepIndex = builder.currentStepIndex;
        this.totalSteps = builder.totalSteps;
        this.attemptSequence = builder.attemptSequence;
        this.stepResults = List.copyOf(builder.stepResults);
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.nextRetryAt = builder.nextRetryAt;
        this.inputData = unmodifiableCopy(builder.inputData);
        this.context = unmodifiableCopy(builder.context);
        this.output = builder.output != null ? unmodifiableCopy(builder.output) : null;
        this.errorMessage = builder.errorMessage;
        this.errorCode = builder.errorCode;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.updatedAt = builder.updatedAt;
        this.revision = builder.revision;
    }

    public String getId() { return id; }
    public String getDefinitionId() { return definitionId; }
    public String getAccountId() { return accountId; }
    public TriggerType getTriggerType() { return triggerType; }
    public String getTriggeredBy() { return triggeredBy; }
    public WorkflowSnapshot getSnapshot() { return snapshot; }
    public ExecutionStatus getStatus() { return status; }
    public String getCurrentStepId() { return currentStepId; }
    public int getCurrentStepIndex() { return currentStepIndex; }
    public int getTotalSteps() { return totalSteps; }
    public int getAttemptSequence() { return attemptSequence; }
    public List<StepResult> getStepResults() { return stepResults; }
    public int getRetryCount() { return retryCount; }
    public int getMaxRetries() { return maxRetries; }
    public Instant getNextRetryAt() { return nextRetryAt; }
    public Map<String, Object> getInputData() { return inputData; }
    public Map<String, Object> getContext() { return context; }
    public Map<String, Object> getOutput() { return output; }
    public String getErrorMessage() { return errorMessage; }
    public String getErrorCode() { return errorCode; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public long getRevision() { return revision; }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Wall-clock duration from start to completion, or null while the run is not terminal.
     */
    @JsonIgnore
    public Duration getDuration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    /**
     * Starts a builder for the transition to {@code target}.
     *
     * @throws InvalidTransitionException if the target is not reachable from the current status
     */
    public Builder transitionTo(ExecutionStatus target, Instant at) throws InvalidTransitionException {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target, status.validTransitions());
        }
        Builder builder = toBuilder().status(target).updatedAt(at);
        if (target.isTerminal()) {
            builder.completedAt(at).nextRetryAt(null);
        }
        return builder;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .definitionId(definitionId)
                .accountId(accountId)
                .triggerType(triggerType)
                .triggeredBy(triggeredBy)
                .snapshot(snapshot)
                .status(status)
                .currentStepId(currentStepId)
                .currentStepIndex(currentStepIndex)
                .totalSteps(totalSteps)
                .attemptSequence(attemptSequence)
                .stepResults(stepResults)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .nextRetryAt(nextRetryAt)
                .inputData(inputData)
                .context(context)
                .output(output)
                .errorMessage(errorMessage)
                .errorCode(errorCode)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .updatedAt(updatedAt)
                .revision(revision);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, Object> unmodifiableCopy(Map<String, Object> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source != null ? source : Map.of()));
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String id;
        private String definitionId;
        private String accountId;
        private TriggerType triggerType = TriggerType.MANUAL;
        private String triggeredBy;
        private WorkflowSnapshot snapshot;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private String currentStepId;
        private int currentStepIndex;
        private int totalSteps;
        private int attemptSequence;
        private List<StepResult> stepResults = new ArrayList<>();
        private int retryCount;
        private int maxRetries;
        private Instant nextRetryAt;
        private Map<String, Object> inputData = new LinkedHashMap<>();
        private Map<String, Object> context = new LinkedHashMap<>();
        private Map<String, Object> output;
        private String errorMessage;
        private String errorCode;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant updatedAt;
        private long revision;

        public Builder id(String id) { this.id = id; return this; }
        public Builder definitionId(String definitionId) { this.definitionId = definitionId; return this; }
        public Builder accountId(String accountId) { this.accountId = accountId; return this; }
        public Builder triggerType(TriggerType triggerType) { this.triggerType = triggerType; return this; }
        public Builder triggeredBy(String triggeredBy) { this.triggeredBy = triggeredBy; return this; }
        public Builder snapshot(WorkflowSnapshot snapshot) { this.snapshot = snapshot; return this; }
        public Builder status(ExecutionStatus status) { this.status = status; return this; }
        public Builder currentStepId(String currentStepId) { this.currentStepId = currentStepId; return this; }
        public Builder currentStepIndex(int currentStepIndex) { this.currentStepIndex = currentStepIndex; return this; }
        public Builder totalSteps(int totalSteps) { this.totalSteps = totalSteps; return this; }
        public Builder attemptSequence(int attemptSequence) { this.attemptSequence = attemptSequence; return this; }
        public Builder stepResults(List<StepResult> stepResults) {
            this.stepResults = stepResults != null ? new ArrayList<>(stepResults) : new ArrayList<>();
            return this;
        }
        public Builder addStepResult(StepResult result) { this.stepResults.add(result); return this; }
        public Builder retryCount(int retryCount) { this.retryCount = retryCount; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder nextRetryAt(Instant nextRetryAt) { this.nextRetryAt = nextRetryAt; return this; }
        public Builder inputData(Map<String, Object> inputData) {
            this.inputData = inputData != null ? new LinkedHashMap<>(inputData) : new LinkedHashMap<>();
            return this;
        }
        public Builder context(Map<String, Object> context) {
            this.context = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
            return this;
        }
        public Builder putContext(String stepId, Object stepOutput) { this.context.put(stepId, stepOutput); return this; }
        public Builder output(Map<String, Object> output) { this.output = output; return this; }
        public Builder errorMessage(String errorMessage) { this.errorMessage = errorMessage; return this; }
        public Builder errorCode(String errorCode) { this.errorCode = errorCode; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
        public Builder completedAt(Instant completedAt) { this.completedAt = completedAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder revision(long revision) { this.revision = revision; return this; }

        public WorkflowExecution build() {
            Objects.requireNonNull(id, "id cannot be null");
            Objects.requireNonNull(definitionId, "definitionId cannot be null");
            Objects.requireNonNull(status, "status cannot be null");
            return new WorkflowExecution(this);
        }
    }

    @Override
    public String toString() {
        return "WorkflowExecution{" +
                "id='" + id + '\'' +
                ", definitionId='" + definitionId + '\'' +
                ", status=" + status +
                ", currentStepId='" + currentStepId + '\'' +
                ", retryCount=" + retryCount +
                ", attempts=" + attemptSequence +
                '}';
    }
}
