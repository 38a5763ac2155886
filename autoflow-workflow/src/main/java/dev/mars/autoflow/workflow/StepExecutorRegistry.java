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

import dev.mars.autoflow.core.step.StepExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps step type tags to the executors that perform them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-05
 */
public class StepExecutorRegistry {

    private static final Logger logger = LoggerFactory.getLogger(StepExecutorRegistry.class);

    private final Map<String, StepExecutor<?>> executors = new ConcurrentHashMap<>();

    /**
     * Registers an executor under its type tag.
     *
     * @throws IllegalStateException if another executor already handles the same type
     */
    public StepExecutorRegistry register(StepExecutor<?> executor) {
        String type = executor.type();
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Step executor " + executor.getClass().getName() + " has no type");
        }
        StepExecutor<?> existing = executors.putIfAbsent(type, executor);
        if (existing != null && existing != executor) {
            throw new IllegalStateException(String.format("Step type '%s' is already handled by %s",
                    type, existing.getClass().getName()));
        }
        logger.info("Registered step executor {} for type '{}'", executor.getClass().getSimpleName(), type);
        return this;
    }

    /**
     * Registers every {@link StepExecutor} published through {@link ServiceLoader}
     * on the given class loader.
     *
     * @return number of executors registered
     */
    public int loadInstalled(ClassLoader classLoader) {
        int loaded = 0;
        for (StepExecutor<?> executor : ServiceLoader.load(StepExecutor.class, classLoader)) {
            register(executor);
            loaded++;
        }
        logger.info("Loaded {} step executor(s) from the class path", loaded);
        return loaded;
    }

    public Optional<StepExecutor<?>> find(String type) {
        return Optional.ofNullable(type != null ? executors.get(type) : null);
    }

    public boolean supports(String type) {
        return type != null && executors.containsKey(type);
    }

    public Set<String> types() {
        return new TreeSet<>(executors.keySet());
    }
}
