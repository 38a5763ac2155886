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
 * Lifecycle states of a workflow execution. Step logs reuse the same values
 * (a step attempt is RUNNING, COMPLETED, FAILED or CANCELLED).
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * PENDING → RUNNING → {COMPLETED | FAILED | CANCELLED}
 *              ↓ ↑
 *            RETRYING → {FAILED | CANCELLED}
 * </pre>
 *
 * <p>COMPLETED, FAILED and CANCELLED are terminal. PENDING and RETRYING may be
 * cancelled directly.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-02
 * @version 1.0
 */
public enum ExecutionStatus {
    /** Created and persisted, not yet picked up by a worker. */
    PENDING,
    /** A worker is driving the current step. */
    RUNNING,
    /** The current step failed and is waiting for its backoff delay to elapse. */
    RETRYING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Returns true if the execution still occupies engine capacity.
     */
    public boolean isActive() {
        return this == RUNNING || this == RETRYING;
    }

    /**
     * The states that may legally follow this one.
     */
    public Set<ExecutionStatus> validTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, CANCELLED, FAILED);
            case RUNNING -> EnumSet.of(RUNNING, RETRYING, COMPLETED, FAILED, CANCELLED);
            case RETRYING -> EnumSet.of(RUNNING, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(ExecutionStatus.class);
        };
    }

    public boolean canTransitionTo(ExecutionStatus target) {
        return validTransitions().contains(target);
    }
}
