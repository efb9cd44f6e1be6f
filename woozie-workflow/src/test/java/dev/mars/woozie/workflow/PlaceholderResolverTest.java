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

package dev.mars.woozie.workflow;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlaceholderResolverTest {

    private static final String SYSTEM_KEY = "woozie.test.placeholder";

    @AfterEach
    void tearDown() {
        System.clearProperty(SYSTEM_KEY);
    }

    @Test
    void testResolveFromGlobalVariables() {
        PlaceholderResolver resolver = new PlaceholderResolver(Map.of("queue", "etl"));

        assertEquals("queue=etl", resolver.resolve("queue={{ queue }}"));
        assertEquals("etl-etl", resolver.resolve("{{queue}}-{{  queue  }}"));
    }

    @Test
    void testContextTakesPrecedence() {
        PlaceholderResolver resolver = new PlaceholderResolver(Map.of("script", "global.sh"))
                .withContext(Map.of("script", "local.sh"));

        assertEquals("local.sh", resolver.resolve("{{ script }}"));
    }

    @Test
    void testWithContextLeavesOriginalUntouched() {
        PlaceholderResolver resolver = new PlaceholderResolver(Map.of());
        resolver.withContext(Map.of("x", "1"));

        assertThrows(PlaceholderResolver.PlaceholderResolutionException.class, () -> resolver.resolve("{{ x }}"));
    }

    @Test
    void testSystemPropertyFallback() {
        System.setProperty(SYSTEM_KEY, "from-system");

        assertEquals("from-system", new PlaceholderResolver().resolve("{{ " + SYSTEM_KEY + " }}"));
    }

    @Test
    void testUnresolvedPlaceholder() {
        PlaceholderResolver.PlaceholderResolutionException e = assertThrows(
                PlaceholderResolver.PlaceholderResolutionException.class,
                () -> new PlaceholderResolver().resolve("{{ woozie_undefined_value }}"));
        assertTrue(e.getMessage().contains("woozie_undefined_value"));
    }

    @Test
    void testTextWithoutPlaceholders() {
        PlaceholderResolver resolver = new PlaceholderResolver();

        assertEquals("${nameNode}/apps", resolver.resolve("${nameNode}/apps"));
        assertNull(resolver.resolve((String) null));
        assertTrue(resolver.getPlaceholderNames("${nameNode}").isEmpty());
    }

    @Test
    void testReplacementWithSpecialCharacters() {
        PlaceholderResolver resolver = new PlaceholderResolver(Map.of("path", "$HOME\\bin"));

        assertEquals("$HOME\\bin", resolver.resolve("{{ path }}"));
    }

    @Test
    void testNonStringValues() {
        PlaceholderResolver resolver = new PlaceholderResolver(Map.of("retries", 3, "enabled", true));

        assertEquals("3/true", resolver.resolve("{{ retries }}/{{ enabled }}"));
    }

    @Test
    void testResolveNestedTemplate() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("mapred.job.queue.name", "{{ queue }}");
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("shell", Map.of("xmlns", "uri:oozie:shell-action:1.0"));
        template.put("exec", "{{ script }}");
        template.put("argument", List.of("--queue", "{{ queue }}"));
        template.put("configuration", Map.of("properties", properties));
        template.put("capture-output", null);

        Map<String, Object> resolved = new PlaceholderResolver(Map.of("queue", "etl"))
                .withContext(Map.of("script", "run.sh"))
                .resolve(template);

        assertEquals(List.of("shell", "exec", "argument", "configuration", "capture-output"),
                List.copyOf(resolved.keySet()));
        assertEquals("run.sh", resolved.get("exec"));
        assertEquals(List.of("--queue", "etl"), resolved.get("argument"));
        @SuppressWarnings("unchecked")
        Map<String, Object> configuration = (Map<String, Object>) resolved.get("configuration");
        @SuppressWarnings("unchecked")
        Map<String, Object> resolvedProperties = (Map<String, Object>) configuration.get("properties");
        assertEquals("etl", resolvedProperties.get("mapred.job.queue.name"));
        assertNull(resolved.get("capture-output"));
        assertTrue(resolved.containsKey("capture-output"));
    }

    @Test
    void testPlaceholderNames() {
        assertEquals(Set.of("a", "b"), new PlaceholderResolver().getPlaceholderNames("{{ a }} {{b}} {{ a }}"));
    }

    @Test
    void testUnresolvedPlaceholders() {
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("shell", Map.of("xmlns", "uri:oozie:shell-action:1.0"));
        template.put("exec", "{{ script }}");
        template.put("argument", List.of("--queue", "{{ queue }}", "{{ woozie_undefined_value }}"));
        template.put("configuration", Map.of("properties", Map.of("owner", "{{ owner }}")));
        template.put("capture-output", null);

        PlaceholderResolver resolver = new PlaceholderResolver(Map.of("queue", "etl"));

        assertEquals(List.of("script", "woozie_undefined_value", "owner"),
                List.copyOf(resolver.getUnresolvedPlaceholders(template)));
        assertEquals(Set.of("woozie_undefined_value"),
                resolver.withContext(Map.of("script", "run.sh", "owner", "etl-team"))
                        .getUnresolvedPlaceholders(template));
    }
}
