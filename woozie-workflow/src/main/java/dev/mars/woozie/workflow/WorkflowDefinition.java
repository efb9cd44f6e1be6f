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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The contents of a workflow definition file: the workflow name, optional
 * workflow-wide variables and the actions keyed by name in declaration order.
 */
public class WorkflowDefinition {

    private final String name;
    private final Map<String, Object> variables;
    private final Map<String, ActionDefinition> actions;

    public WorkflowDefinition(String name, Map<String, Object> variables, List<ActionDefinition> actions) {
        this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
        this.variables = variables != null ? Collections.unmodifiableMap(new LinkedHashMap<>(variables)) : Map.of();

        Map<String, ActionDefinition> byName = new LinkedHashMap<>();
        if (actions != null) {
            for (ActionDefinition action : actions) {
                byName.put(action.getName(), action);
            }
        }
        this.actions = Collections.unmodifiableMap(byName);
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public Map<String, ActionDefinition> getActions() {
        return actions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(variables, that.variables) &&
               Objects.equals(actions, that.actions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, variables, actions);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "name='" + name + '\'' +
               ", variables=" + variables.keySet() +
               ", actions=" + actions.keySet() +
               '}';
    }

    /**
     * One entry of the {@code actions} section: the user action type, the
     * names it depends on and the parameters used to fill the type's placeholders.
     */
    public static class ActionDefinition {
        private final String name;
        private final String type;
        private final List<String> dependencies;
        private final Map<String, Object> parameters;

        public ActionDefinition(String name, String type, List<String> dependencies, Map<String, Object> parameters) {
            this.name = Objects.requireNonNull(name, "Action name cannot be null");
            this.type = Objects.requireNonNull(type, "Action type cannot be null");
            this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
            this.parameters = parameters != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                    : Map.of();
        }

        public String getName() {
            return name;
        }

        public String getType() {
            return type;
        }

        public List<String> getDependencies() {
            return dependencies;
        }

        public Map<String, Object> getParameters() {
            return parameters;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ActionDefinition that = (ActionDefinition) o;
            return Objects.equals(name, that.name) &&
                   Objects.equals(type, that.type) &&
                   Objects.equals(dependencies, that.dependencies) &&
                   Objects.equals(parameters, that.parameters);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type, dependencies, parameters);
        }

        @Override
        public String toString() {
            return "ActionDefinition{" +
                   "name='" + name + '\'' +
                   ", type='" + type + '\'' +
                   ", dependencies=" + dependencies +
                   '}';
        }
    }
}
