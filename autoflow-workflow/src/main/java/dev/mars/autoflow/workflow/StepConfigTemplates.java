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

import dev.mars.autoflow.core.step.StepContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholders in step configs, filled in from the run context just before a
 * step is invoked.
 *
 * <p>A placeholder is a string value that consists of nothing but a dotted path
 * in braces, such as {@code "{input.topic}"} or {@code "{draft.title}"}. The first
 * segment is looked up among the context roots ({@code input}, {@code steps},
 * {@code execution_id}, {@code workflow_id}, {@code attempt}), then among step
 * outputs, then in the run input. The resolved value keeps its type, so a
 * placeholder may become a number, a list or a map. A path that does not resolve
 * leaves the string as written.</p>
 *
 * <p>Map values are resolved recursively, list elements only when they are
 * strings. Text that merely contains braces is not a placeholder.</p>
 */
public final class StepConfigTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("^\\{([A-Za-z0-9_-]+(?:\\.[A-Za-z0-9_-]+)*)\\}$");

    private StepConfigTemplates() {
    }

    public static boolean isPlaceholder(Object value) {
        return value instanceof String && PLACEHOLDER.matcher((String) value).matches();
    }

    /**
     * True if any value in the config, at any depth, is a placeholder.
     */
    public static boolean hasPlaceholders(Map<?, ?> config) {
        for (Object value : config.values()) {
            if (isPlaceholder(value)) {
                return true;
            }
            if (value instanceof Map && hasPlaceholders((Map<?, ?>) value)) {
                return true;
            }
            if (value instanceof List && ((List<?>) value).stream().anyMatch(StepConfigTemplates::isPlaceholder)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The config with every placeholder entry removed, for checking the rest of
     * it before any run context exists. Placeholders inside lists are kept.
     */
    public static Map<String, Object> withoutPlaceholders(Map<?, ?> config) {
        Map<String, Object> stripped = new LinkedHashMap<>();
        config.forEach((key, value) -> {
            if (isPlaceholder(value)) {
                return;
            }
            stripped.put(String.valueOf(key), value instanceof Map ? withoutPlaceholders((Map<?, ?>) value) : value);
        });
        return stripped;
    }

    public static Map<String, Object> resolve(Map<String, Object> config, StepContext context) {
        return resolveMap(config, context.asMap());
    }

    private static Map<String, Object> resolveMap(Map<?, ?> config, Map<?, ?> context) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        config.forEach((rawKey, value) -> {
            String key = String.valueOf(rawKey);
            if (value instanceof String) {
                resolved.put(key, resolveString((String) value, context));
            } else if (value instanceof Map) {
                resolved.put(key, resolveMap((Map<?, ?>) value, context));
            } else if (value instanceof List) {
                List<Object> items = new ArrayList<>();
                for (Object item : (List<?>) value) {
                    items.add(item instanceof String ? resolveString((String) item, context) : item);
                }
                resolved.put(key, items);
            } else {
                resolved.put(key, value);
            }
        });
        return resolved;
    }

    private static Object resolveString(String value, Map<?, ?> context) {
        Matcher matcher = PLACEHOLDER.matcher(value);
        if (!matcher.matches()) {
            return value;
        }
        String[] path = matcher.group(1).split("\\.");
        Object root;
        if (context.containsKey(path[0])) {
            root = context;
        } else if (asMap(context.get(StepContext.KEY_STEPS)).containsKey(path[0])) {
            root = context.get(StepContext.KEY_STEPS);
        } else {
            root = context.get(StepContext.KEY_INPUT);
        }
        Object current = root;
        for (String segment : path) {
            if (!(current instanceof Map) || !asMap(current).containsKey(segment)) {
                return value;
            }
            current = asMap(current).get(segment);
        }
        return current;
    }

    private static Map<?, ?> asMap(Object value) {
        return value instanceof Map ? (Map<?, ?>) value : Map.of();
    }
}
