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

package dev.mars.autoflow.controller.storage;

import dev.mars.autoflow.core.storage.InMemoryWorkflowStateStore;
import dev.mars.autoflow.core.storage.WorkflowStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Factory for creating {@link WorkflowStateStore} implementations from configuration.
 */
public final class WorkflowStateStoreFactory {

    private static final Logger LOG = LoggerFactory.getLogger(WorkflowStateStoreFactory.class);

    /**
     * Supported storage backend types.
     */
    public enum StorageType {
        /** JSON documents on the local file system (default) */
        FILE,
        /** In-memory storage (testing only, not durable) */
        MEMORY
    }

    private WorkflowStateStoreFactory() {
        // Utility class
    }

    /**
     * Creates and opens a state store.
     *
     * @param storageType the storage type ("file" or "memory")
     * @param storagePath the data directory (ignored for memory)
     * @param fsync       whether to fsync after writes (ignored for memory)
     * @return the opened store
     * @throws IllegalArgumentException if the storage type is unknown
     * @throws IOException if the file store cannot be opened
     */
    public static WorkflowStateStore create(String storageType, Path storagePath, boolean fsync) throws IOException {
        StorageType type = parseStorageType(storageType);

        LOG.info("Creating WorkflowStateStore: type={}, path={}, fsync={}", type, storagePath, fsync);

        return switch (type) {
            case FILE -> FileWorkflowStateStore.open(storagePath, fsync);
            case MEMORY -> {
                LOG.warn("Using InMemoryWorkflowStateStore - DATA WILL NOT SURVIVE RESTART!");
                yield new InMemoryWorkflowStateStore();
            }
        };
    }

    static StorageType parseStorageType(String type) {
        if (type == null || type.isBlank()) {
            return StorageType.FILE;
        }

        return switch (type.toLowerCase().trim()) {
            case "file", "json" -> StorageType.FILE;
            case "memory", "inmemory", "in-memory", "test" -> StorageType.MEMORY;
            default -> throw new IllegalArgumentException(
                    "Unknown storage type: '" + type + "'. Valid options: file, memory");
        };
    }
}
