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

import java.util.List;

/**
 * Thrown when a workflow definition or snapshot cannot be run: a step edge
 * points at an unknown step, a step type has no registered executor, or a
 * step config does not bind to its executor's config type.
 *
 * <p>All violations found in one validation pass are carried together.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-02
 * @version 1.0
 */
public class DefinitionValidationException extends AutoflowException {

    private final String definitionId;
    private final List<String> violations;

    public DefinitionValidationException(String definitionId, List<String> violations) {
        super(String.format("Workflow definition '%s' is invalid: %s", definitionId, violations));
        this.definitionId = definitionId;
        this.violations = List.copyOf(violations);
    }

    public DefinitionValidationException(String definitionId, String violation) {
        this(definitionId, List.of(violation));
    }

    public String getDefinitionId() {
        return definitionId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
