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
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The {@code action_types} section of a configuration file: for each user
 * action type, the configuration template projected into the workflow
 * document once its placeholders are filled.
 */
public class ActionTypeCatalog {

    private final Map<String, Map<String, Object>> actionTypes;

    public ActionTypeCatalog(Map<String, Map<String, Object>> actionTypes) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        if (actionTypes != null) {
            for (Map.Entry<String, Map<String, Object>> entry : actionTypes.entrySet()) {
                Map<String, Object> template = entry.getValue() != null ? entry.getValue() : Map.of();
                copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(template)));
            }
        }
        this.actionTypes = Collections.unmodifiableMap(copy);
    }

    public Set<String> getActionTypeNames() {
        return actionTypes.keySet();
    }

    public boolean contains(String actionType) {
        return actionTypes.containsKey(actionType);
    }

    public Optional<Map<String, Object>> find(String actionType) {
        return Optional.ofNullable(actionTypes.get(actionType));
    }

    /**
     * Fetches the configuration template of an action type.
     *
     * @param actionType the user action type
     * @return the template, in declaration order
     * @throws WorkflowParseException if the type is not in the catalog
     */
    public Map<String, Object> fetch(String actionType) throws WorkflowParseException {
        return find(actionType).orElseThrow(() -> new WorkflowParseException("action_types",
                "Action type '" + actionType + "' is not defined in the configuration; known types: "
                + actionTypes.keySet()));
    }

    @Override
    public String toString() {
        return "ActionTypeCatalog{" +
               "actionTypes=" + actionTypes.keySet() +
               '}';
    }
}
