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
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowSettings;
import dev.mars.autoflow.core.WorkflowStep;

import java.util.List;
import java.util.Map;

/**
 * A reusable workflow blueprint, instantiated per account as a new draft definition.
 */
public record WorkflowTemplate(String templateId,
                               String description,
                               List<String> tags,
                               TriggerType triggerType,
                               Map<String, Object> triggerConfig,
                               List<WorkflowStep> steps,
                               WorkflowSettings settings) {

    public WorkflowTemplate {
        tags = tags != null ? List.copyOf(tags) : List.of();
        triggerType = triggerType != null ? triggerType : TriggerType.MANUAL;
        triggerConfig = triggerConfig != null ? triggerConfig : Map.of();
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    WorkflowDefinition.Builder toDraft(String accountId, String name) {
        WorkflowDefinition.Builder builder = WorkflowDefinition.builder()
                .accountId(accountId)
                .name(name)
                .description(description)
                .tags(tags)
                .triggerType(triggerType)
                .triggerConfig(triggerConfig)
                .steps(steps);
        if (settings != null) {
            builder.settings(settings);
        }
        return builder;
    }
}
