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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Objects;

/**
 * A cron schedule attached to a definition. At most one schedule exists per
 * (definition id, cron expression) pair.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-05
 */
@JsonDeserialize(builder = WorkflowSchedule.Builder.class)
public class WorkflowSchedule {

    public static final String DEFAULT_TIMEZONE = "Europe/Rome";

    private final String id;
    private final String definitionId;
    private final String cronExpression;
    private final String timezone;
    private final boolean active;
    private final Instant nextRunAt;
    private final Instant lastRunAt;
    private final ExecutionStatus lastRunStatus;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long revision;

    private WorkflowSchedule(Builder builder) {
        this.id = builder.id;
        this.definitionId = builder.definitionId;
        this.cronExpression = builder.cronExpression;
        this.timezone = builder.timezone;
        this.active = builder.active;
        this.nextRunAt = builder.nextRunAt;
        this.lastRunAt = builder.lastRunAt;
        this.lastRunStatus = builder.lastRunStatus;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.revision = builder.revision;
    }

    public String getId() { return id; }
    public String getDefinitionId() { return definitionId; }
    public String getCronExpression() { return cronExpression; }
    public String getTimezone() { return timezone; }
    public boolean isActive() { return active; }
    public Instant getNextRunAt() { return nextRunAt; }
    public Instant getLastRunAt() { return lastRunAt; }
    public ExecutionStatus getLastRunStatus() { return lastRunStatus; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public long getRevision() { return revision; }

    public boolean isDue(Instant now) {
        return active && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .definitionId(definitionId)
                .cronExpression(cronExpression)
                .timezone(timezone)
                .active(active)
                .nextRunAt(nextRunAt)
                .lastRunAt(lastRunAt)
                .lastRunStatus(lastRunStatus)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .revision(revision);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String id;
        private String definitionId;
        private String cronExpression;
        private String timezone = DEFAULT_TIMEZONE;
        private boolean active = true;
        private Instant nextRunAt;
        private Instant lastRunAt;
        private ExecutionStatus lastRunStatus;
        private Instant createdAt;
        private Instant updatedAt;
        private long revision;

        public Builder id(String id) { this.id = id; return this; }
        public Builder definitionId(String definitionId) { this.definitionId = definitionId; return this; }
        public Builder cronExpression(String cronExpression) { this.cronExpression = cronExpression; return this; }
        public Builder timezone(String timezone) { this.timezone = timezone; return this; }
        public Builder active(boolean active) { this.active = active; return this; }
        public Builder nextRunAt(Instant nextRunAt) { this.nextRunAt = nextRunAt; return this; }
        public Builder lastRunAt(Instant lastRunAt) { this.lastRunAt = lastRunAt; return this; }
        public Builder lastRunStatus(ExecutionStatus lastRunStatus) { this.lastRunStatus = lastRunStatus; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder revision(long revision) { this.revision = revision; return this; }

        public WorkflowSchedule build() {
            Objects.requireNonNull(id, "id cannot be null");
            Objects.requireNonNull(definitionId, "definitionId cannot be null");
            Objects.requireNonNull(cronExpression, "cronExpression cannot be null");
            if (timezone == null || timezone.isBlank()) {
                timezone = DEFAULT_TIMEZONE;
            }
            return new WorkflowSchedule(this);
        }
    }

    @Override
    public String toString() {
        return "WorkflowSchedule{" +
                "id='" + id + '\'' +
                ", definitionId='" + definitionId + '\'' +
                ", cron='" + cronExpression + '\'' +
                ", timezone='" + timezone + '\'' +
                ", active=" + active +
                ", nextRunAt=" + nextRunAt +
                '}';
    }
}
