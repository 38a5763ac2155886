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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a workflow definition.
 *
 * <pre>
 * DRAFT → ACTIVE ←→ PAUSED
 *   ↓       ↓         ↓
 *        ARCHIVED
 * </pre>
 *
 * <p>Only ACTIVE definitions admit triggers. ARCHIVED is permanent and
 * replaces hard deletion.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-02
 */
public enum DefinitionStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    ARCHIVED;

    public boolean isTerminal() {
        return this == ARCHIVED;
    }

    public Set<DefinitionStatus> validTransitions() {
        return switch (this) {
            case DRAFT -> EnumSet.of(ACTIVE, ARCHIVED);
            case ACTIVE -> EnumSet.of(PAUSED, ARCHIVED);
            case PAUSED -> EnumSet.of(ACTIVE, ARCHIVED);
            case ARCHIVED -> EnumSet.noneOf(DefinitionStatus.class);
        };
    }

    public boolean canTransitionTo(DefinitionStatus target) {
        return validTransitions().contains(target);
    }
}
