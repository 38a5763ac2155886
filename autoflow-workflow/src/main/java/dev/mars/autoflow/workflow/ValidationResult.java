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

package dev.mars.autoflow.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Errors and warnings collected while validating a step graph. Errors block
 * activation and run start; warnings (such as an unreachable step) are logged.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();

    void addError(String fieldPath, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, fieldPath, message));
    }

    void addWarning(String fieldPath, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, fieldPath, message));
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Errors rendered as "[path]: message" strings.
     */
    public List<String> errorMessages() {
        return errors.stream().map(ValidationIssue::toString).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return isValid() ? "valid (" + warnings.size() + " warning(s))" : "invalid: " + String.join("; ", errorMessages());
    }

    /**
     * One problem found in a step graph. {@code fieldPath} points into the
     * snapshot, for example {@code steps[2].on_failure}, and may be null for
     * graph-wide issues.
     */
    public record ValidationIssue(Severity severity, String fieldPath, String message) {

        public enum Severity {
            ERROR, WARNING
        }

        public ValidationIssue {
            Objects.requireNonNull(severity, "severity cannot be null");
            Objects.requireNonNull(message, "message cannot be null");
        }

        @Override
        public String toString() {
            return fieldPath == null ? message : "[" + fieldPath + "]: " + message;
        }
    }
}
