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

package dev.mars.autoflow.workflow.trigger;

import dev.mars.autoflow.core.DefinitionStatus;
import dev.mars.autoflow.core.TriggerType;
import dev.mars.autoflow.core.WorkflowDefinition;
import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import dev.mars.autoflow.core.exceptions.TriggerRejectedException;
import dev.mars.autoflow.core.exceptions.WorkflowNotFoundException;
import dev.mars.autoflow.workflow.definition.WorkflowDefinitionStore;
import dev.mars.autoflow.workflow.engine.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Admits trigger requests and turns them into engine runs.
 *
 * <p>Admission rules:</p>
 * <ul>
 *   <li>the definition exists and is ACTIVE;</li>
 *   <li>SCHEDULED, EVENT and WEBHOOK requests match the definition's trigger type
 *       (MANUAL and API requests may start any active definition);</li>
 *   <li>EVENT requests match the {@code event_types} list and {@code filters} of the
 *       trigger config;</li>
 *   <li>WEBHOOK requests present the configured {@code secret}.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-09-08
 * @version 1.0
 */
public class TriggerDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(TriggerDispatcher.class);

    public static final String CONFIG_EVENT_TYPES = "event_types";
    public static final String CONFIG_FILTERS = "filters";
    public static final String CONFIG_SECRET = "secret";
    static final String MIN_PREFIX = "min_";

    private final WorkflowDefinitionStore definitions;
    private final WorkflowEngine engine;

    public TriggerDispatcher(WorkflowDefinitionStore definitions, WorkflowEngine engine) {
        this.definitions = Objects.requireNonNull(definitions, "definitions cannot be null");
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    /**
     * Admits the request and starts a run from a snapshot taken now.
     *
     * @return the new execution id
     * @throws TriggerRejectedException      if admission fails
     * @throws WorkflowNotFoundException     if the definition does not exist
     * @throws DefinitionValidationException if the active definition no longer compiles
     */
    public String createRun(RunRequest request)
            throws TriggerRejectedException, WorkflowNotFoundException, DefinitionValidationException {
        WorkflowDefinition definition = definitions.require(request.definitionId());
        admit(definition, request);
        return engine.start(definition.snapshot(), request.inputData(), request.triggerType(), request.triggeredBy());
    }

    public String createRun(String definitionId, TriggerType triggerType, Map<String, Object> inputData,
                            String triggeredBy)
            throws TriggerRejectedException, WorkflowNotFoundException, DefinitionValidationException {
        return createRun(new RunRequest(definitionId, triggerType, inputData, triggeredBy, null, null));
    }

    /**
     * Like {@link #createRun(RunRequest)}, but rejections are logged and dropped.
     */
    public Optional<String> submit(RunRequest request) {
        try {
            return Optional.of(createRun(request));
        } catch (TriggerRejectedException e) {
            logger.info("Dropped {}: {}", request, e.getReason());
        } catch (WorkflowNotFoundException e) {
            logger.warn("Dropped {}: definition not found", request);
        } catch (DefinitionValidationException e) {
            logger.error("Dropped {}: definition is invalid {}", request, e.getViolations());
        }
        return Optional.empty();
    }

    /**
     * Starts every active EVENT definition of the account whose filter matches the event.
     *
     * @return ids of the runs started, possibly empty
     */
    public List<String> publishEvent(String accountId, String eventType, Map<String, Object> payload) {
        List<String> started = new ArrayList<>();
        for (WorkflowDefinition definition : definitions.list(accountId, DefinitionStatus.ACTIVE)) {
            if (definition.getTriggerType() != TriggerType.EVENT) {
                continue;
            }
            RunRequest request = RunRequest.event(definition.getId(), eventType, payload);
            if (rejection(definition, request) == null) {
                submit(request).ifPresent(started::add);
            }
        }
        logger.debug("Event {} for account {} started {} run(s)", eventType, accountId, started.size());
        return started;
    }

    private void admit(WorkflowDefinition definition, RunRequest request) throws TriggerRejectedException {
        String reason = rejection(definition, request);
        if (reason != null) {
            throw new TriggerRejectedException(definition.getId(), reason);
        }
    }

    /**
     * Reason the request may not start the definition, or null when it is admitted.
     */
    String rejection(WorkflowDefinition definition, RunRequest request) {
        if (definition.getStatus() != DefinitionStatus.ACTIVE) {
            return "definition is " + definition.getStatus();
        }
        TriggerType requested = request.triggerType();
        if (!requested.isUnrestricted() && requested != definition.getTriggerType()) {
            return requested + " trigger does not match definition trigger " + definition.getTriggerType();
        }
        Map<String, Object> config = definition.getTriggerConfig();
        if (requested == TriggerType.EVENT) {
            return eventRejection(config, request);
        }
        if (requested == TriggerType.WEBHOOK) {
            Object expected = config.get(CONFIG_SECRET);
            if (expected != null && !secretMatches(expected.toString(), request.secret())) {
                return "webhook secret mismatch";
            }
        }
        return null;
    }

    private String eventRejection(Map<String, Object> config, RunRequest request) {
        Object eventTypes = config.get(CONFIG_EVENT_TYPES);
        if (eventTypes instanceof Collection<?> accepted && !accepted.isEmpty()
                && !accepted.contains(request.eventType())) {
            return "event type '" + request.eventType() + "' is not subscribed";
        }
        Object filters = config.get(CONFIG_FILTERS);
        if (!(filters instanceof Map<?, ?> filterMap)) {
            return null;
        }
        Map<String, Object> input = request.inputData();
        for (Map.Entry<?, ?> filter : filterMap.entrySet()) {
            String key = String.valueOf(filter.getKey());
            Object expected = filter.getValue();
            if (key.startsWith(MIN_PREFIX)) {
                String field = key.substring(MIN_PREFIX.length());
                Double actual = asNumber(input.get(field));
                Double threshold = asNumber(expected);
                if (threshold == null) {
                    return "filter " + key + " is not numeric";
                }
                if (actual == null || actual < threshold) {
                    return "field '" + field + "' below minimum " + expected;
                }
            } else if (!valueEquals(expected, input.get(key))) {
                return "field '" + key + "' does not match filter";
            }
        }
        return null;
    }

    private static boolean valueEquals(Object expected, Object actual) {
        if (expected instanceof Number left && actual instanceof Number right) {
            return Double.compare(left.doubleValue(), right.doubleValue()) == 0;
        }
        return Objects.equals(expected, actual);
    }

    private static Double asNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean secretMatches(String expected, String presented) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
