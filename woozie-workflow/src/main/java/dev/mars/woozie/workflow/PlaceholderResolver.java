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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code {{ placeholder }}} references in action-type configuration
 * templates.
 *
 * <p>Lookup order: context variables (action parameters), global variables
 * (workflow variables), environment variables, system properties.</p>
 */
public class PlaceholderResolver {

    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private final Map<String, Object> globalVariables;
    private final Map<String, Object> contextVariables;

    public PlaceholderResolver() {
        this(Map.of());
    }

    public PlaceholderResolver(Map<String, Object> globalVariables) {
        this.globalVariables = new HashMap<>(globalVariables != null ? globalVariables : Map.of());
        this.contextVariables = new HashMap<>();
    }

    /**
     * Creates a new resolver with additional context variables.
     * Context variables take precedence over global variables.
     */
    public PlaceholderResolver withContext(Map<String, Object> contextVariables) {
        PlaceholderResolver resolver = new PlaceholderResolver(this.globalVariables);
        resolver.contextVariables.putAll(this.contextVariables);
        if (contextVariables != null) {
            resolver.contextVariables.putAll(contextVariables);
        }
        return resolver;
    }

    /**
     * Resolves placeholders in a string template.
     *
     * @param template the template, may be null
     * @return the template with every placeholder substituted
     * @throws PlaceholderResolutionException if a placeholder has no value
     */
    public String resolve(String template) {
        if (template == null) {
            return null;
        }

        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String placeholder = matcher.group(1).trim();
            Object value = lookup(placeholder);

            if (value == null) {
                throw new PlaceholderResolutionException("No value for placeholder: " + placeholder);
            }

            matcher.appendReplacement(result, Matcher.quoteReplacement(value.toString()));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolves placeholders in every string of a configuration template,
     * recursing through nested maps and lists. Key order is preserved.
     */
    public Map<String, Object> resolve(Map<String, Object> template) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : template.entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getValue()));
        }
        return resolved;
    }

    /**
     * Gets all placeholder names referenced in a template.
     */
    public Set<String> getPlaceholderNames(String template) {
        if (template == null) {
            return Set.of();
        }

        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1).trim());
        }
        return names;
    }

    /**
     * Lists the placeholders of a configuration template that have no value,
     * in the order they first appear.
     */
    public Set<String> getUnresolvedPlaceholders(Map<String, Object> template) {
        Set<String> unresolved = new LinkedHashSet<>();
        collectUnresolved(template, unresolved);
        return unresolved;
    }

    private void collectUnresolved(Object value, Set<String> unresolved) {
        if (value instanceof String) {
            for (String name : getPlaceholderNames((String) value)) {
                if (lookup(name) == null) {
                    unresolved.add(name);
                }
            }
        } else if (value instanceof Map) {
            for (Object item : ((Map<?, ?>) value).values()) {
                collectUnresolved(item, unresolved);
            }
        } else if (value instanceof List) {
            for (Object item : (List<?>) value) {
                collectUnresolved(item, unresolved);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private Object resolveValue(Object value) {
        if (value instanceof String) {
            return resolve((String) value);
        }
        if (value instanceof Map) {
            return resolve((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> resolved = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                resolved.add(resolveValue(item));
            }
            return resolved;
        }
        return value;
    }

    private Object lookup(String placeholder) {
        if (contextVariables.containsKey(placeholder)) {
            return contextVariables.get(placeholder);
        }

        if (globalVariables.containsKey(placeholder)) {
            return globalVariables.get(placeholder);
        }

        String envValue = System.getenv(placeholder);
        if (envValue != null) {
            return envValue;
        }

        return System.getProperty(placeholder);
    }

    /**
     * Exception thrown when a placeholder cannot be resolved.
     */
    public static class PlaceholderResolutionException extends RuntimeException {
        public PlaceholderResolutionException(String message) {
            super(message);
        }
    }
}
