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
 * Thrown when a definition, execution or schedule id does not resolve.
 */
public class WorkflowNotFoundException extends AutoflowException {

    private final String recordType;
    private final String recordId;

    public WorkflowNotFoundException(String recordType, String recordId) {
        super(String.format("%s not found: %s", recordType, recordId));
        this.recordType = recordType;
        this.recordId = recordId;
    }

    public String getRecordType() {
        return recordType;
    }

    public String getRecordId() {
        return recordId;
    }
}
