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

import dev.mars.woozie.core.ControlNodeType;
import dev.mars.woozie.core.Workflow;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses workflow and configuration files using SnakeYAML.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    public static final String ERROR_HANDLER_NAME = "error_handler";

    private final Yaml yaml;
    private final String errorHandlerName;

    public YamlWorkflowDefinitionParser() {
        this(ERROR_HANDLER_NAME);
    }

    public YamlWorkflowDefinitionParser(String errorHandlerName) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.errorHandlerName = errorHandlerName != null ? errorHandlerName : ERROR_HANDLER_NAME;
    }

    @Override
    public WorkflowDefinition parseDefinition(Path workflowFile) throws WorkflowParseException {
        String content = readFile(workflowFile);
        try {
            return parseDefinitionFromString(content);
        } catch (WorkflowParseException e) {
            throw e.withSource(workflowFile.toString());
        }
    }

    @Override
    public WorkflowDefinition parseDefinitionFromString(String content) throws WorkflowParseException {
        Map<String, Object> data = load(content);

        String name = getStringValue(data, "name");
        if (name == null || name.trim().isEmpty()) {
            throw new WorkflowParseException("name", "Workflow name is required");
        }

        Map<String, Object> variables = getMapValue(data, "variables");
        if (data.containsKey("variables") && data.get("variables") != null && variables == null) {
            throw new WorkflowParseException("variables", "Expected a mapping of variable names to values");
        }

        Object actionsValue = data.get("actions");
        if (actionsValue == null) {
            throw new WorkflowParseException("actions", "Workflow must declare at least one action");
        }
        if (!(actionsValue instanceof Map)) {
            throw new WorkflowParseException("actions", "Expected a mapping of action names to action entries");
        }

        List<WorkflowDefinition.ActionDefinition> actions = new ArrayList<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) actionsValue).entrySet()) {
            String actionName = String.valueOf(entry.getKey());
            actions.add(parseAction(actionName, entry.getValue()));
        }

        return new WorkflowDefinition(name.trim(), variables, actions);
    }

    @Override
    public ActionTypeCatalog parseCatalog(Path configFile) throws WorkflowParseException {
        String content = readFile(configFile);
        try {
            return parseCatalogFromString(content);
        } catch (WorkflowParseException e) {
            throw e.withSource(configFile.toString());
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public ActionTypeCatalog parseCatalogFromString(String content) throws WorkflowParseException {
        Map<String, Object> data = load(content);

        Object typesValue = data.get("action_types");
        if (!(typesValue instanceof Map)) {
            throw new WorkflowParseException("action_types",
                    "Configuration must contain an 'action_types' mapping");
        }

        Map<String, Map<String, Object>> actionTypes = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) typesValue).entrySet()) {
            String typeName = String.valueOf(entry.getKey());
            if (ControlNodeType.isControlType(typeName)) {
                throw new WorkflowParseException("action_types." + typeName,
                        "Action type '" + typeName + "' is reserved for control nodes");
            }
            if (!(entry.getValue() instanceof Map)) {
                throw new WorkflowParseException("action_types." + typeName,
                        "Expected a mapping describing the action payload");
            }
            Map<?, ?> template = (Map<?, ?>) entry.getValue();
            if (template.isEmpty()) {
                throw new WorkflowParseException("action_types." + typeName,
                        "Action payload must name its element");
            }
            actionTypes.put(typeName, (Map<String, Object>) stringKeys(template));
        }

        return new ActionTypeCatalog(actionTypes);
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();

        if (definition.getName().trim().isEmpty()) {
            result.addError("name", "Workflow name is required");
        }

        Map<String, WorkflowDefinition.ActionDefinition> actions = definition.getActions();
        if (actions.isEmpty()) {
            result.addWarning("actions", "Workflow declares no actions");
        }

        for (WorkflowDefinition.ActionDefinition action : actions.values()) {
            String path = "actions." + action.getName();

            if (Workflow.isReservedName(action.getName())) {
                result.addError(path, "Action name '" + action.getName() + "' is reserved for control nodes");
            }
            if (ControlNodeType.isControlType(action.getType())) {
                result.addError(path + ".type", "Action type '" + action.getType() + "' is reserved for control nodes");
            }

            for (String dependency : action.getDependencies()) {
                if (dependency.equals(action.getName())) {
                    result.addError(path + ".dependencies", "Action cannot depend on itself");
                } else if (dependency.equals(errorHandlerName)) {
                    result.addError(path + ".dependencies",
                            "Action cannot depend on the error handler '" + errorHandlerName + "'");
                } else if (!actions.containsKey(dependency)) {
                    result.addError(path + ".dependencies", "Unknown dependency: " + dependency);
                }
            }

            if (action.getName().equals(errorHandlerName) && !action.getDependencies().isEmpty()) {
                result.addWarning(path + ".dependencies",
                        "Dependencies of the error handler are ignored; it runs after the last action");
            }
        }

        return result;
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition, ActionTypeCatalog catalog) {
        ValidationResult result = validate(definition);

        PlaceholderResolver resolver = new PlaceholderResolver(definition.getVariables());
        for (WorkflowDefinition.ActionDefinition action : definition.getActions().values()) {
            Optional<Map<String, Object>> template = catalog.find(action.getType());
            if (template.isEmpty()) {
                result.addError("actions." + action.getName() + ".type",
                        "Action type '" + action.getType() + "' is not defined in the configuration");
                continue;
            }
            Set<String> unresolved = resolver.withContext(action.getParameters())
                    .getUnresolvedPlaceholders(template.get());
            if (!unresolved.isEmpty()) {
                result.addError("actions." + action.getName() + ".parameters",
                        "No value for placeholders " + unresolved + " of action type '" + action.getType() + "'");
            }
        }

        Set<String> used = new HashSet<>();
        for (WorkflowDefinition.ActionDefinition action : definition.getActions().values()) {
            used.add(action.getType());
        }
        for (String typeName : catalog.getActionTypeNames()) {
            if (!used.contains(typeName)) {
                result.addWarning("action_types." + typeName, "Action type is never used");
            }
        }

        return result;
    }

    private WorkflowDefinition.ActionDefinition parseAction(String actionName, Object value)
            throws WorkflowParseException {
        String path = "actions." + actionName;
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path, "Expected a mapping with at least a 'type'");
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) stringKeys((Map<?, ?>) value);

        String type = getStringValue(data, "type");
        if (type == null || type.trim().isEmpty()) {
            throw new WorkflowParseException(path + ".type", "Action type is required");
        }

        List<String> dependencies = parseDependencies(path, data.get("dependencies"));

        // 'vars' is the older spelling of 'parameters'
        Object rawParameters = data.containsKey("parameters") ? data.get("parameters") : data.get("vars");
        if (rawParameters != null && !(rawParameters instanceof Map)) {
            throw new WorkflowParseException(path + ".parameters", "Expected a mapping of parameter names to values");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> parameters = (Map<String, Object>) rawParameters;

        return new WorkflowDefinition.ActionDefinition(actionName, type.trim(), dependencies, parameters);
    }

    private List<String> parseDependencies(String path, Object value) throws WorkflowParseException {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String) {
            return List.of((String) value);
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(path + ".dependencies", "Expected a list of action names");
        }

        List<String> dependencies = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item == null || item instanceof Map || item instanceof List) {
                throw new WorkflowParseException(path + ".dependencies", "Dependency must be an action name");
            }
            dependencies.add(item.toString());
        }
        return dependencies;
    }

    private Map<String, Object> load(String content) throws WorkflowParseException {
        Object data;
        try {
            data = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (data == null) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        if (!(data instanceof Map)) {
            throw new WorkflowParseException("YAML document must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) stringKeys((Map<?, ?>) data);
        return map;
    }

    private String readFile(Path file) throws WorkflowParseException {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + file, e);
        }
    }

    // SnakeYAML keeps insertion order (LinkedHashMap) but keys may be numbers or booleans
    private static Object stringKeys(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(entry.getKey()), stringKeys(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(stringKeys(item));
            }
            return copy;
        }
        return value;
    }

    private String getStringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
}
