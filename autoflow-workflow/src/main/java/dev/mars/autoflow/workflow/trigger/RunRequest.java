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

package dev.mars.autoflow.workflow.trigger;

import dev.mars.autoflow.core.TriggerType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request to start one run of a workflow definition, as handed to the
 * {@link TriggerDispatcher} by whatever produced the trigger.
 *
 * @param definitionId definition to run
 * @param triggerType  how the run was triggered
 * @param inputData    run input, never null
 * @param triggeredBy  free-form origin, recorded on the execution
 * @param eventType    event name for EVENT requests
 * @param secret       shared secret presented by WEBHOOK requests
 */
public record RunRequest(String definitionId,
                         TriggerType triggerType,
                         Map<String, Object> inputData,
                         String triggeredBy,
                         String eventType,
                         String secret) {

    static final String SCHEDULE_PREFIX = "schedule:";

    public RunRequest {
        Objects.requireNonNull(definitionId, "definitionId cannot be null");
        Objects.requireNonNull(triggerType, "triggerType cannot be null");
        inputData = Collections.unmodifiableMap(new LinkedHashMap<>(inputData != null ? inputData : Map.of()));
    }

    public static RunRequest manual(String definitionId, Map<String, Object> inputData, String triggeredBy) {
        return new RunRequest(definitionId, TriggerType.MANUAL, inputData, triggeredBy, null, null);
    }

    public static RunRequest api(String definitionId, Map<String, Object> inputData, String triggeredBy) {
        return new RunRequest(definitionId, TriggerType.API, inputData, triggeredBy, null, null);
    }

    public static RunRequest scheduled(String definitionId, String scheduleId) {
        return new RunRequest(definitionId, TriggerType.SCHEDULED, Map.of(), SCHEDULE_PREFIX + scheduleId, null, null);
    }

    public static RunRequest event(String definitionId, String eventType, Map<String, Object> payload) {
        return new RunRequest(definitionId, TriggerType.EVENT, payload, "event:" + eventType, eventType, null);
    }

    public static RunRequest webhook(String definitionId, Map<String, Object> payload, String secret) {
        return new RunRequest(definitionId, TriggerType.WEBHOOK, payload, "webhook", null, secret);
    }

    /**
     * Schedule id encoded in {@code triggeredBy} by {@link #scheduled}, or null.
     */
    public static String scheduleIdOf(String triggeredBy) {
        if (triggeredBy == null || !triggeredBy.startsWith(SCHEDULE_PREFIX)) {
            return null;
        }
        return triggeredBy.substring(SCHEDULE_PREFIX.length());
    }

    @Override
    public String toString() {
        // secret stays out of logs
        return "RunRequest{" +
                "definitionId='" + definitionId + '\'' +
                ", triggerType=" + triggerType +
                ", triggeredBy='" + triggeredBy + '\'' +
                ", eventType='" + eventType + '\'' +
                '}';
    }
}
