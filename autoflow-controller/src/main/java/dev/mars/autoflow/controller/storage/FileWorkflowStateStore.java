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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.autoflow.core.ExecutionStatus;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.WorkflowExecution;
import dev.mars.autoflow.core.WorkflowSchedule;
import dev.mars.autoflow.core.WorkflowStepLog;
import dev.mars.autoflow.core.exceptions.ConcurrencyConflictException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.autoflow.core.json.AutoflowJson;
import dev.mars.autoflow.core.storage.InMemoryWorkflowStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * State store that keeps every record as a JSON document on disk and serves reads
 * from memory.
 *
 * <p>Layout under the data directory:
 * <pre>
 *   definitions/{id}.json
 *   executions/{id}.json
 *   schedules/{id}.json
 *   step-logs/{executionId}/{attempt}.json
 * </pre>
 *
 * <p>Each write goes to a temp file which is then renamed over the target, so a
 * crash leaves either the old or the new document. Writes are serialized so that
 * the document on disk always carries the latest revision.
 */
public class FileWorkflowStateStore extends InMemoryWorkflowStateStore {

    private static final Logger logger = LoggerFactory.getLogger(FileWorkflowStateStore.class);

    static final String DEFINITIONS = "definitions";
    static final String EXECUTIONS = "executions";
    static final String SCHEDULES = "schedules";
    static final String STEP_LOGS = "step-logs";
    private static final String JSON = ".json";
    private static final String TMP = ".tmp";

    private final Path dataDir;
    private final boolean fsyncEnabled;
    private final ObjectMapper mapper = AutoflowJson.documentMapper();
    private final Object writeLock = new Object();

    private FileWorkflowStateStore(Path dataDir, boolean fsyncEnabled) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir cannot be null");
        this.fsyncEnabled = fsyncEnabled;
    }

    /**
     * Opens the store at the given directory, creating it if needed, and loads
     * every document found there.
     *
     * @throws IOException if the directory cannot be created or a document cannot be read
     */
    public static FileWorkflowStateStore open(Path dataDir, boolean fsyncEnabled) throws IOException {
        FileWorkflowStateStore store = new FileWorkflowStateStore(dataDir, fsyncEnabled);
        store.load();
        return store;
    }

    public Path getDataDir() {
        return dataDir;
    }

    // ==================== Writes ====================
    // Each write updates memory, then the document. If the document cannot be
    // written the memory update is undone so both keep the previous record.

    @Override
    public WorkflowDefinition insertDefinition(WorkflowDefinition definition) {
        synchronized (writeLock) {
            Path target = documentPath(DEFINITIONS, definition.getId());
            WorkflowDefinition stored = super.insertDefinition(definition);
            persist(target, stored, () -> discardDefinition(stored.getId()));
            return stored;
        }
    }

    @Override
    public WorkflowDefinition updateDefinition(WorkflowDefinition definition) throws ConcurrencyConflictException {
        synchronized (writeLock) {
            Optional<WorkflowDefinition> previous = findDefinition(definition.getId());
            WorkflowDefinition stored = super.updateDefinition(definition);
            persist(documentPath(DEFINITIONS, stored.getId()), stored, () -> previous.ifPresent(this::restoreDefinition));
            return stored;
        }
    }

    @Override
    public WorkflowDefinition incrementExecutionCounters(String definitionId, ExecutionStatus outcome, Instant at)
            throws WorkflowNotFoundException {
        synchronized (writeLock) {
            Optional<WorkflowDefinition> previous = findDefinition(definitionId);
            WorkflowDefinition stored = super.incrementExecutionCounters(definitionId, outcome, at);
            persist(documentPath(DEFINITIONS, stored.getId()), stored, () -> previous.ifPresent(this::restoreDefinition));
            return stored;
        }
    }

    @Override
    public WorkflowExecution insertExecution(WorkflowExecution execution) {
        synchronized (writeLock) {
            Path target = documentPath(EXECUTIONS, execution.getId());
            WorkflowExecution stored = super.insertExecution(execution);
            persist(target, stored, () -> discardExecution(stored.getId()));
            return stored;
        }
    }

    @Override
    public WorkflowExecution updateExecution(WorkflowExecution execution) throws ConcurrencyConflictException {
        synchronized (writeLock) {
            Optional<WorkflowExecution> previous = findExecution(execution.getId());
            WorkflowExecution stored = super.updateExecution(execution);
            persist(documentPath(EXECUTIONS, stored.getId()), stored, () -> previous.ifPresent(this::restoreExecution));
            return stored;
        }
    }

    @Override
    public WorkflowStepLog saveStepLog(WorkflowStepLog log) {
        synchronized (writeLock) {
            Path target = stepLogPath(log);
            Optional<WorkflowStepLog> previous = findStepLog(log.getId());
            WorkflowStepLog stored = super.saveStepLog(log);
            persist(target, stored, () -> previous.ifPresentOrElse(this::restoreStepLog,
                    () -> discardStepLog(stored.getId())));
            return stored;
        }
    }

    @Override
    public Optional<WorkflowSchedule> insertSchedule(WorkflowSchedule schedule) {
        synchronized (writeLock) {
            Path target = documentPath(SCHEDULES, schedule.getId());
            Optional<WorkflowSchedule> stored = super.insertSchedule(schedule);
            stored.ifPresent(s -> persist(target, s, () -> discardSchedule(s.getId())));
            return stored;
        }
    }

    @Override
    public WorkflowSchedule updateSchedule(WorkflowSchedule schedule) throws ConcurrencyConflictException {
        synchronized (writeLock) {
            Optional<WorkflowSchedule> previous = findSchedule(schedule.getId());
            WorkflowSchedule stored = super.updateSchedule(schedule);
            persist(documentPath(SCHEDULES, stored.getId()), stored, () -> previous.ifPresent(this::restoreSchedule));
            return stored;
        }
    }

    @Override
    public boolean deleteSchedule(String scheduleId) {
        synchronized (writeLock) {
            Path target = documentPath(SCHEDULES, scheduleId);
            Optional<WorkflowSchedule> previous = findSchedule(scheduleId);
            boolean removed = super.deleteSchedule(scheduleId);
            if (removed) {
                try {
                    Files.deleteIfExists(target);
                } catch (IOException e) {
                    previous.ifPresent(this::restoreSchedule);
                    throw new UncheckedIOException("Failed to delete schedule " + scheduleId, e);
                }
            }
            return removed;
        }
    }

    @Override
    public void close() {
        logger.info("Closing file state store at {}", dataDir);
        super.close();
    }

    // ==================== Loading ====================

    private void load() throws IOException {
        for (String dir : new String[]{DEFINITIONS, EXECUTIONS, SCHEDULES, STEP_LOGS}) {
            Files.createDirectories(dataDir.resolve(dir));
        }

        int definitions = 0;
        for (Path file : documents(dataDir.resolve(DEFINITIONS))) {
            restoreDefinition(read(file, WorkflowDefinition.class));
            definitions++;
        }
        int executions = 0;
        for (Path file : documents(dataDir.resolve(EXECUTIONS))) {
            restoreExecution(read(file, WorkflowExecution.class));
            executions++;
        }
        int schedules = 0;
        for (Path file : documents(dataDir.resolve(SCHEDULES))) {
            restoreSchedule(read(file, WorkflowSchedule.class));
            schedules++;
        }
        int stepLogs = 0;
        try (DirectoryStream<Path> perExecution = Files.newDirectoryStream(dataDir.resolve(STEP_LOGS),
                Files::isDirectory)) {
            for (Path dir : perExecution) {
                for (Path file : documents(dir)) {
                    restoreStepLog(read(file, WorkflowStepLog.class));
                    stepLogs++;
                }
            }
        }

        logger.info("Loaded file state store at {}: {} definitions, {} executions, {} schedules, {} step logs",
                dataDir, definitions, executions, schedules, stepLogs);
    }

    /**
     * Lists the JSON documents of a directory, discarding temp files left by an interrupted write.
     */
    private List<Path> documents(Path dir) throws IOException {
        try (DirectoryStream<Path> leftovers = Files.newDirectoryStream(dir, "*" + TMP)) {
            for (Path tmp : leftovers) {
                logger.warn("Discarding incomplete write {}", tmp);
                Files.deleteIfExists(tmp);
            }
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + JSON)) {
            stream.forEach(files::add);
        }
        files.sort(null);
        return files;
    }

    private <T> T read(Path file, Class<T> type) throws IOException {
        try {
            return mapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new IOException("Unreadable " + type.getSimpleName() + " document " + file + ": "
                    + e.getMessage(), e);
        }
    }

    // ==================== Writing ====================

    private void persist(Path target, Object document, Runnable undo) {
        try {
            write(target, document);
        } catch (UncheckedIOException e) {
            undo.run();
            logger.error("Write of {} failed; in-memory record rolled back", target.getFileName(), e);
            throw e;
        }
    }

    private void write(Path target, Object document) {
        Path tmp = target.resolveSibling(target.getFileName() + TMP);
        try {
            Files.createDirectories(target.getParent());
            ByteBuffer buf = ByteBuffer.wrap(mapper.writeValueAsBytes(document));

            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (fsyncEnabled) {
                    ch.force(true);
                }
            }

            Files.move(tmp, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);

            if (fsyncEnabled) {
                syncDirectory(target.getParent());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    private Path documentPath(String kind, String id) {
        return dataDir.resolve(kind).resolve(safeName(id) + JSON);
    }

    private Path stepLogPath(WorkflowStepLog log) {
        return dataDir.resolve(STEP_LOGS).resolve(safeName(log.getExecutionId())).resolve(log.getAttempt() + JSON);
    }

    static String safeName(String id) {
        if (id == null || id.isEmpty() || id.contains("/") || id.contains("\\") || id.contains("..")) {
            throw new IllegalArgumentException("Identifier cannot be used as a file name: " + id);
        }
        return id;
    }

    private void syncDirectory(Path dir) throws IOException {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            // Windows doesn't support directory fsync
            return;
        }
        try (FileChannel dirChannel = FileChannel.open(dir, StandardOpenOption.READ)) {
            dirChannel.force(true);
        }
    }
}
