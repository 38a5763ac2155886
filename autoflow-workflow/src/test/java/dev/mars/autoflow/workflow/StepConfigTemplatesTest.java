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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StepConfigTemplatesTest {

    private static final StepContext CONTEXT = new StepContext("exec-1", "wf-1", "publish", 3,
            Map.of("topic", "pricing", "count", 4),
            Map.of("draft", Map.of("title", "New plans", "tags", List.of("saas", "b2b"))));

    @Test
    void testContextRootsResolve() {
        Map<String, Object> resolved = StepConfigTemplates.resolve(Map.of(
                "topic", "{input.topic}",
                "title", "{steps.draft.title}",
                "run", "{execution_id}",
                "attempt", "{attempt}"), CONTEXT);

        assertEquals("pricing", resolved.get("topic"));
        assertEquals("New plans", resolved.get("title"));
        assertEquals("exec-1", resolved.get("run"));
        assertEquals(3, resolved.get("attempt"));
    }

    @Test
    void testShortPathsLookInStepOutputsThenInput() {
        Map<String, Object> resolved = StepConfigTemplates.resolve(Map.of(
                "title", "{draft.title}",
                "topic", "{topic}"), CONTEXT);

        assertEquals("New plans", resolved.get("title"));
        assertEquals("pricing", resolved.get("topic"));
    }

    @Test
    void testResolvedValuesKeepTheirType() {
        Map<String, Object> resolved = StepConfigTemplates.resolve(Map.of(
                "count", "{input.count}",
                "tags", "{draft.tags}"), CONTEXT);

        assertEquals(4, resolved.get("count"));
        assertEquals(List.of("saas", "b2b"), resolved.get("tags"));
    }

    @Test
    void testNestedMapsAndListElementsResolve() {
        Map<String, Object> resolved = StepConfigTemplates.resolve(Map.of(
                "message", Map.of("subject", "{draft.title}", "priority", 2),
                "labels", List.of("{input.topic}", "static", 7)), CONTEXT);

        assertEquals(Map.of("subject", "New plans", "priority", 2), resolved.get("message"));
        assertEquals(List.of("pricing", "static", 7), resolved.get("labels"));
    }

    @Test
    void testUnresolvedAndEmbeddedTextIsLeftAlone() {
        Map<String, Object> resolved = StepConfigTemplates.resolve(Map.of(
                "missing", "{draft.body}",
                "unknown", "{nothing.here}",
                "sentence", "About {input.topic} today",
                "braces", "{}"), CONTEXT);

        assertEquals("{draft.body}", resolved.get("missing"));
        assertEquals("{nothing.here}", resolved.get("unknown"));
        assertEquals("About {input.topic} today", resolved.get("sentence"));
        assertEquals("{}", resolved.get("braces"));
    }

    @Test
    void testDetectsAndStripsPlaceholders() {
        Map<String, Object> config = Map.of(
                "to", "{input.email}",
                "subject", "Hello",
                "body", Map.of("text", "{draft.title}", "format", "plain"));

        assertTrue(StepConfigTemplates.hasPlaceholders(config));
        assertTrue(StepConfigTemplates.hasPlaceholders(Map.of("cc", List.of("{input.manager}"))));
        assertFalse(StepConfigTemplates.hasPlaceholders(Map.of("subject", "Hello {name}")));
        assertEquals(Map.of("subject", "Hello", "body", Map.of("format", "plain")),
                StepConfigTemplates.withoutPlaceholders(config));
    }
}
