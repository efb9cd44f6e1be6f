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

package dev.mars.woozie.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named unit of work in a workflow.
 *
 * <p>An action carries its type, the names of the actions it depends on and the
 * ordered configuration payload that is projected into the workflow document.
 * Instances are immutable.</p>
 *
 * <p>Equality and hash code are defined over {@link #getName()} only. Actions
 * are the node keys of every graph the compiler builds, so two actions with
 * the same name are the same node regardless of type or payload.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class Action {

    private final String name;
    private final String actionType;
    private final Set<String> dependencies;
    private final Map<String, Object> config;

    public Action(String name, String actionType, Collection<String> dependencies, Map<String, ?> config) {
        Objects.requireNonNull(name, "Action name cannot be null");
        Objects.requireNonNull(actionType, "Action type cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Action name cannot be empty");
        }
        if (actionType.isEmpty()) {
            throw new IllegalArgumentException("Action type cannot be empty for action '" + name + "'");
        }
        this.name = name;
        this.actionType = actionType;
        this.dependencies = dependencies != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(dependencies))
                : Set.of();
        this.config = config != null ? copyMap(config) : Map.of();
    }

    public Action(String name, String actionType) {
        this(name, actionType, null, null);
    }

    public static Action start() {
        return new Action("start", ControlNodeType.START.getTypeName());
    }

    public static Action end() {
        return new Action("end", ControlNodeType.END.getTypeName());
    }

    public static Action fork(int index) {
        return new Action("fork-" + index, ControlNodeType.FORK.getTypeName());
    }

    public static Action join(int index) {
        return new Action("join-" + index, ControlNodeType.JOIN.getTypeName());
    }

    public String getName() {
        return name;
    }

    public String getActionType() {
        return actionType;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    /**
     * The ordered configuration payload. The first entry names the schema element
     * of the action, the remaining entries become its child fields.
     */
    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * Gets the control type of this action.
     *
     * @return the control type, or null for an ordinary action
     */
    public ControlNodeType getControlType() {
        return ControlNodeType.fromTypeName(actionType);
    }

    public boolean isControlNode() {
        return getControlType() != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Action that = (Action) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Action{" +
               "name='" + name + '\'' +
               ", actionType='" + actionType + '\'' +
               ", dependencies=" + dependencies +
               '}';
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return copyMap((Map<?, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                copy.add(copyValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
