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

import java.util.List;

/**
 * A maximal sequence of actions linked without branching or joining.
 */
public class ForklessChain {

    private final List<Action> actions;

    public ForklessChain(List<Action> actions) {
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("A forkless chain needs at least one action");
        }
        this.actions = List.copyOf(actions);
    }

    public List<Action> getActions() {
        return actions;
    }

    public Action head() {
        return actions.get(0);
    }

    /**
     * The chain as a path graph: one edge between each pair of consecutive actions.
     */
    public ActionGraph toGraph() {
        ActionGraph graph = new ActionGraph();
        graph.addNode(head());
        for (int i = 1; i < actions.size(); i++) {
            graph.addEdge(actions.get(i - 1), actions.get(i));
        }
        return graph;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Action action : actions) {
            if (sb.length() > 0) {
                sb.append(" -> ");
            }
            sb.append(action.getName());
        }
        return sb.toString();
    }
}
