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

package dev.mars.woozie.graph;

import dev.mars.woozie.core.Action;
import dev.mars.woozie.core.exceptions.AmbiguousBoundaryException;
import dev.mars.woozie.core.exceptions.AmbiguousTransitionException;
import dev.mars.woozie.core.exceptions.MultipleErrorTargetsException;

import java.util.List;
import java.util.Objects;

/**
 * Composes the structured component graphs into the final control-flow graph.
 *
 * <p>Several components run as parallel top-level branches under one fork/join
 * pair. The error handler, when present, is spliced after the composed exit so
 * it is always the node right before {@code end}. Finally the {@code start}
 * and {@code end} control nodes are attached.</p>
 */
public class ControlFlowFinalizer {

    private final SynchronizationInserter inserter;

    public ControlFlowFinalizer(SynchronizationInserter inserter) {
        this.inserter = Objects.requireNonNull(inserter, "Synchronization inserter cannot be null");
    }

    /**
     * @param components structured component graphs, in component order
     * @param errorHandler the global error handler, or null
     * @return the final graph with exactly one {@code start} and one {@code end}
     */
    public ActionGraph complete(List<ActionGraph> components, Action errorHandler)
            throws AmbiguousTransitionException, MultipleErrorTargetsException, AmbiguousBoundaryException {
        ActionGraph composed;
        if (components.size() > 1) {
            composed = inserter.synchronize(components);
        } else {
            composed = new ActionGraph();
            for (ActionGraph component : components) {
                composed.compose(component);
            }
        }

        if (errorHandler != null) {
            List<Action> exits = composed.exitNodes();
            if (exits.size() != 1) {
                throw new MultipleErrorTargetsException(
                        "Error handler '" + errorHandler.getName() + "' needs exactly one exit node to attach to",
                        names(exits));
            }
            composed.addEdge(exits.get(0), errorHandler);
        }

        List<Action> entries = composed.entryNodes();
        if (entries.size() != 1) {
            throw new AmbiguousBoundaryException("Start node needs exactly one entry node", names(entries));
        }
        List<Action> exits = composed.exitNodes();
        if (exits.size() != 1) {
            throw new AmbiguousBoundaryException("End node needs exactly one exit node", names(exits));
        }

        composed.addEdge(Action.start(), entries.get(0));
        composed.addEdge(exits.get(0), Action.end());
        return composed;
    }

    private static List<String> names(List<Action> actions) {
        return actions.stream().map(Action::getName).toList();
    }
}
