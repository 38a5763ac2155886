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

import java.util.Set;
import java.util.TreeSet;

/**
 * A definition or execution was asked to move to a status that its current
 * status does not lead to, for example activating an archived definition or
 * resuming a completed run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-02
 * @version 1.0
 */
public class InvalidTransitionException extends AutoflowException {

    private final String recordId;
    private final Enum<?> from;
    private final Enum<?> to;
    private final Set<? extends Enum<?>> reachable;

    /**
     * @param recordId  id of the definition or execution
     * @param from      its current status
     * @param to        the rejected target status
     * @param reachable statuses the current one may move to
     */
    public InvalidTransitionException(String recordId, Enum<?> from, Enum<?> to, Set<? extends Enum<?>> reachable) {
        super("Invalid transition for '" + recordId + "': " + from + " -> " + to
                + (reachable.isEmpty() ? " (" + from + " is final)" : "; allowed: " + names(reachable)));
        this.recordId = recordId;
        this.from = from;
        this.to = to;
        this.reachable = Set.copyOf(reachable);
    }

    public String getRecordId() {
        return recordId;
    }

    public Enum<?> getFrom() {
        return from;
    }

    public Enum<?> getTo() {
        return to;
    }

    public Set<? extends Enum<?>> getReachable() {
        return reachable;
    }

    private static Set<String> names(Set<? extends Enum<?>> statuses) {
        Set<String> names = new TreeSet<>();
        statuses.forEach(s -> names.add(s.name()));
        return names;
    }
}
