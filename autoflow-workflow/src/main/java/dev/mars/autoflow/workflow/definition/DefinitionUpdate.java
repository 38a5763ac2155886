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

package dev.mars.autoflow.workflow.definition;

import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowSettings;
import dev.mars.autoflow.core.WorkflowStep;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a workflow definition. Fields left null keep their current value.
 */
public final class DefinitionUpdate {

    private final String name;
    private final String description;
    private final List<String> tags;
    private final TriggerType triggerType;
    private final Map<String, Object> triggerConfig;
    private final List<WorkflowStep> steps;
    private final WorkflowSettings settings;

    private DefinitionUpdate(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.tags = builder.tags != null ? List.copyOf(builder.tags) : null;
        this.triggerType = builder.triggerType;
        this.triggerConfig = builder.triggerConfig;
        this.steps = builder.steps != null ? List.copyOf(builder.steps) : null;
        this.settings = builder.settings;
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<String> getTags() { return tags; }
    public TriggerType getTriggerType() { return triggerType; }
    public Map<String, Object> getTriggerConfig() { return triggerConfig; }
    public List<WorkflowStep> getSteps() { return steps; }
    public WorkflowSettings getSettings() { return settings; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description;
        private List<String> tags;
        private TriggerType triggerType;
        private Map<String, Object> triggerConfig;
        private List<WorkflowStep> steps;
        private WorkflowSettings settings;

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder triggerType(TriggerType triggerType) { this.triggerType = triggerType; return this; }
        public Builder triggerConfig(Map<String, Object> triggerConfig) { this.triggerConfig = triggerConfig; return this; }
        public Builder steps(List<WorkflowStep> steps) { this.steps = steps; return this; }
        public Builder settings(WorkflowSettings settings) { this.settings = settings; return this; }

        public DefinitionUpdate build() {
            return new DefinitionUpdate(this);
        }
    }
}
