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

package dev.mars.autoflow.workflow.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per execution id. An entry lives only while some thread holds or
 * waits for it, so the map is empty whenever no execution is being touched.
 */
final class ExecutionLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    Held acquire(String executionId) {
        Entry entry = locks.compute(executionId, (id, current) -> {
            Entry e = current != null ? current : new Entry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        return new Held(executionId, entry);
    }

    int size() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }

    /** A held execution lock; {@link #unlock()} must be called exactly once. */
    final class Held {
        private final String executionId;
        private final Entry entry;

        private Held(String executionId, Entry entry) {
            this.executionId = executionId;
            this.entry = entry;
        }

        void unlock() {
            entry.lock.unlock();
            locks.computeIfPresent(executionId, (id, e) -> --e.users == 0 ? null : e);
        }
    }
}
