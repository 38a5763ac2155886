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

package dev.mars.autoflow.core.step;

/**
 * Pluggable capability that performs the side effect of one step type.
 *
 * <p>Implementations are registered explicitly or discovered through
 * {@link java.util.ServiceLoader} under this interface name. The engine invokes
 * an executor from its own worker threads under the step's deadline; an
 * executor that exceeds it is interrupted and its attempt recorded as timed
 * out. Any exception thrown here is captured as a failed attempt.</p>
 *
 * <h3>Contract:</h3>
 * <ul>
 *   <li>{@link #type()} is the tag steps use in their {@code type} field</li>
 *   <li>{@link #configType()} must be bindable from a JSON-style map</li>
 *   <li>{@link #invoke} may be called more than once for the same attempt after a crash</li>
 * </ul>
 *
 * @param <C> the config type this executor accepts
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-04
 * @version 1.0
 */
public interface StepExecutor<C extends StepConfig> {

    /**
     * Step type tag handled by this executor, for example {@code "send_email"}.
     */
    String type();

    /**
     * Class the step's config map is bound to.
     */
    Class<C> configType();

    /**
     * Performs the step.
     *
     * @param config  the step's bound config
     * @param context run input, previous step outputs and attempt metadata
     * @return the outcome of this attempt
     * @throws Exception any failure; it becomes a failed attempt
     */
    StepOutcome invoke(C config, StepContext context) throws Exception;
}
