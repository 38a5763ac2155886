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
 * Thrown by the trigger dispatcher when a run request fails admission.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-03
 */
public class TriggerRejectedException extends AutoflowException {

    private final String definitionId;
    private final String reason;

    public TriggerRejectedException(String definitionId, String reason) {
        super(String.format("Trigger rejected for workflow '%s': %s", definitionId, reason));
        this.definitionId = definitionId;
        this.reason = reason;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public String getReason() {
        return reason;
    }
}
