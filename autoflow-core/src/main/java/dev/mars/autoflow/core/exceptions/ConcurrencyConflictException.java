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
 * Raised by a state store when a write carries a stale revision.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-03
 */
public class ConcurrencyConflictException extends AutoflowException {

    private final String recordType;
    private final String recordId;
    private final long expectedRevision;
    private final long actualRevision;

    public ConcurrencyConflictException(String recordType, String recordId,
                                        long expectedRevision, long actualRevision) {
        super(String.format("%s '%s' was modified concurrently (expected revision %d, found %d)",
                recordType, recordId, expectedRevision, actualRevision));
        this.recordType = recordType;
        this.recordId = recordId;
        this.expectedRevision = expectedRevision;
        this.actualRevision = actualRevision;
    }

    public String getRecordType() {
        return recordType;
    }

    public String getRecordId() {
        return recordId;
    }

    public long getExpectedRevision() {
        return expectedRevision;
    }

    public long getActualRevision() {
        return actualRevision;
    }
}
