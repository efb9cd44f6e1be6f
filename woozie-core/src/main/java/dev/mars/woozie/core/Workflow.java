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

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A resolved workflow ready for compilation: its name, the ordered actions and
 * the optional global error handler.
 *
 * <p>The error handler is held apart from the action list. No action may list
 * it as a dependency; the compiler wires its incoming transition itself.
 * Control node names and types are reserved for the nodes the compiler
 * synthesizes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class Workflow {

    private static final Pattern RESERVED_NAME_PATTERN = Pattern.compile("^(start|end|fork-[0-9]+|join-[0-9]+)$");

    private final String name;
    private final List<Action> actions;
    private final Action errorHandler;

    public Workflow(String name, List<Action> actions, Action errorHandler) {
        this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Workflow name cannot be empty");
        }
        this.actions = actions != null ? List.copyOf(actions) : List.of();
        this.errorHandler = errorHandler;
        validateNames();
    }

    public Workflow(String name, List<Action> actions) {
        this(name, actions, null);
    }

    public String getName() {
        return name;
    }

    public List<Action> getActions() {
        return actions;
    }

    public Optional<Action> getErrorHandler() {
        return Optional.ofNullable(errorHandler);
    }

    /**
     * Checks whether a name is taken by one of the control nodes the compiler synthesizes.
     */
    public static boolean isReservedName(String actionName) {
        return actionName != null && RESERVED_NAME_PATTERN.matcher(actionName).matches();
    }

    private void validateNames() {
        Set<String> names = new HashSet<>();
        for (Action action : actions) {
            checkName(action, names);
        }
        if (errorHandler != null) {
            checkName(errorHandler, names);
        }
    }

    private void checkName(Action action, Set<String> names) {
        Objects.requireNonNull(action, "Workflow '" + name + "' contains a null action");
        if (isReservedName(action.getName())) {
            throw new IllegalArgumentException("Workflow '" + name + "': action name '" + action.getName()
                    + "' is reserved for control nodes");
        }
        if (ControlNodeType.isControlType(action.getActionType())) {
            throw new IllegalArgumentException("Workflow '" + name + "': action '" + action.getName()
                    + "' uses the control node type '" + action.getActionType() + "'");
        }
        if (!names.add(action.getName())) {
            throw new IllegalArgumentException("Workflow '" + name + "': duplicate action name '"
                    + action.getName() + "'");
        }
    }

    @Override
    public String toString() {
        return "Workflow{" +
               "name='" + name + '\'' +
               ", actions=" + actions.size() +
               ", errorHandler=" + (errorHandler != null ? errorHandler.getName() : "none") +
               '}';
    }
}
