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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, versioned workflow template owned by an account.
 *
 * <p>{@code version} is the content version: it starts at 1 and grows whenever
 * the steps or the trigger change. {@code revision} is the storage revision
 * used for optimistic locking and grows on every write.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-02
 * @version 1.0
 */
@JsonDeserialize(builder = WorkflowDefinition.Builder.class)
public class WorkflowDefinition {

    private final String id;
    private final String accountId;
    private final String name;
    private final String slug;
    private final String description;
    private final List<String> tags;
    private final DefinitionStatus status;
    private final TriggerType triggerType;
    private final Map<String, Object> triggerConfig;
    private final List<WorkflowStep> steps;
    private final WorkflowSettings settings;
    private final long totalExecutions;
    private final long successfulExecutions;
    private final long failedExecutions;
    private final Instant lastExecutionAt;
    private final int version;
    private final long revision;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant archivedAt;

    private WorkflowDefinition(Builder builder) {
        this.id = builder.id;
        this.accountId = builder.accountId;
        this.name = builder.name;
        this.slug = builder.slug != null ? builder.slug : slugify(builder.name);
        this.description = builder.description;
        this.tags = List.copyOf(builder.tags);
        this.status = builder.status;
        this.triggerType = builder.triggerType;
        this.triggerConfig = Collections.unmodifiableMap(new LinkedHashMap<>(builder.triggerConfig));
        this.steps = List.copyOf(builder.steps);
        this.settings = builder.settings;
        this.totalExecutions = builder.totalExecutions;
        this.successfulExecutions = builder.successfulExecutions;
        this.failedExecutions = builder.failedExecutions;
        this.lastExecutionAt = builder.lastExecutionAt;
        this.version = builder.version;
        this.revision = builder.revision;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.archivedAt = builder.archivedAt;
    }

    public String getId() { return id; }
    public String getAccountId() { return accountId; }
    public String getName() { return name; }
    public String getSlug() { return slug; }
    public String getDescription() { return description; }
    public List<String> getTags() { return tags; }
    public DefinitionStatus getStatus() { return status; }
    public TriggerType getTriggerType() { return triggerType; }
    public Map<String, Object> getTriggerConfig() { return triggerConfig; }
    public List<WorkflowStep> getSteps() { return steps; }
    public WorkflowSettings getSettings() { return settings; }
    public long getTotalExecutions() { return totalExecutions; }
    public long getSuccessfulExecutions() { return successfulExecutions; }
    public long getFailedExecutions() { return failedExecutions; }
    public Instant getLastExecutionAt() { return lastExecutionAt; }
    public int getVersion() { return version; }
    public long getRevision() { return revision; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getArchivedAt() { return archivedAt; }

    @JsonIgnore
    public boolean isActive() {
        return status == DefinitionStatus.ACTIVE;
    }

    @JsonIgnore
    public Optional<WorkflowStep> findStep(String stepId) {
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    /**
     * Captures the parts of this definition a run depends on.
     */
    public WorkflowSnapshot snapshot() {
        return new WorkflowSnapshot(id, accountId, name, version, steps, settings);
    }

    public WorkflowDefinition withStatus(DefinitionStatus newStatus, Instant at) {
        Builder builder = toBuilder().status(newStatus).updatedAt(at);
        if (newStatus == DefinitionStatus.ARCHIVED) {
            builder.archivedAt(at);
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .accountId(accountId)
                .name(name)
                .slug(slug)
                .description(description)
                .tags(tags)
                .status(status)
                .triggerType(triggerType)
                .triggerConfig(triggerConfig)
                .steps(steps)
                .settings(settings)
                .totalExecutions(totalExecutions)
                .successfulExecutions(successfulExecutions)
                .failedExecutions(failedExecutions)
                .lastExecutionAt(lastExecutionAt)
                .version(version)
                .revision(revision)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .archivedAt(archivedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    static String slugify(String value) {
        if (value == null) {
            return null;
        }
        String slug = value.toLowerCase().replaceAll("[^a-z0-9]+", "-");
        return slug.replaceAll("(^-+)|(-+$)", "");
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String id;
        private String accountId;
        private String name;
        private String slug;
        private String description;
        private List<String> tags = new ArrayList<>();
        private DefinitionStatus status = DefinitionStatus.DRAFT;
        private TriggerType triggerType = TriggerType.MANUAL;
        private Map<String, Object> triggerConfig = new LinkedHashMap<>();
        private List<WorkflowStep> steps = new ArrayList<>();
        private WorkflowSettings settings = WorkflowSettings.defaults();
        private long totalExecutions;
        private long successfulExecutions;
        private long failedExecutions;
        private Instant lastExecutionAt;
        private int version = 1;
        private long revision;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant archivedAt;

        public Builder id(String id) { this.id = id; return this; }
        public Builder accountId(String accountId) { this.accountId = accountId; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder slug(String slug) { this.slug = slug; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder tags(List<String> tags) { this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>(); return this; }
        public Builder status(DefinitionStatus status) { this.status = status; return this; }
        public Builder triggerType(TriggerType triggerType) { this.triggerType = triggerType; return this; }
        public Builder triggerConfig(Map<String, Object> triggerConfig) {
            this.triggerConfig = triggerConfig != null ? new LinkedHashMap<>(triggerConfig) : new LinkedHashMap<>();
            return this;
        }
        public Builder steps(List<WorkflowStep> steps) { this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>(); return this; }
        public Builder addStep(WorkflowStep step) { this.steps.add(step); return this; }
        public Builder settings(WorkflowSettings settings) { this.settings = settings; return this; }
        public Builder totalExecutions(long totalExecutions) { this.totalExecutions = totalExecutions; return this; }
        public Builder successfulExecutions(long successfulExecutions) { this.successfulExecutions = successfulExecutions; return this; }
        public Builder failedExecutions(long failedExecutions) { this.failedExecutions = failedExecutions; return this; }
        public Builder lastExecutionAt(Instant lastExecutionAt) { this.lastExecutionAt = lastExecutionAt; return this; }
        public Builder version(int version) { this.version = version; return this; }
        public Builder revision(long revision) { this.revision = revision; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder archivedAt(Instant archivedAt) { this.archivedAt = archivedAt; return this; }

        /**
         * Names of the caller-supplied fields that are still missing or blank.
         */
        public List<String> missingRequiredFields() {
            List<String> missing = new ArrayList<>();
            if (accountId == null || accountId.isBlank()) {
                missing.add("accountId");
            }
            if (name == null || name.isBlank()) {
                missing.add("name");
            }
            if (triggerType == null) {
                missing.add("triggerType");
            }
            return missing;
        }

        public WorkflowDefinition build() {
            Objects.requireNonNull(id, "id cannot be null");
            Objects.requireNonNull(accountId, "accountId cannot be null");
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(status, "status cannot be null");
            Objects.requireNonNull(triggerType, "triggerType cannot be null");
            if (settings == null) {
                settings = WorkflowSettings.defaults();
            }
            return new WorkflowDefinition(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(id, that.id) && revision == that.revision;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, revision);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", status=" + status +
                ", triggerType=" + triggerType +
                ", version=" + version +
                ", steps=" + steps.size() +
                '}';
    }
}
