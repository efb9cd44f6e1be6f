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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits a dependency graph into its weakly-connected components.
 *
 * <p>Connectivity ignores edge direction; each component is returned as an
 * independent induced subgraph that keeps the original directions. Components
 * are ordered by the first node of each in the source graph's node order.</p>
 */
public class ComponentDecomposer {

    public List<ActionGraph> decompose(ActionGraph graph) {
        List<ActionGraph> components = new ArrayList<>();
        Set<Action> visited = new HashSet<>();

        for (Action seed : graph.getNodes()) {
            if (visited.contains(seed)) {
                continue;
            }

            List<Action> members = new ArrayList<>();
            Deque<Action> stack = new ArrayDeque<>();
            stack.push(seed);
            visited.add(seed);

            while (!stack.isEmpty()) {
                Action current = stack.pop();
                members.add(current);
                for (Action neighbour : neighbours(graph, current)) {
                    if (visited.add(neighbour)) {
                        stack.push(neighbour);
                    }
                }
            }

            components.add(graph.subgraph(members));
        }

        return components;
    }

    private List<Action> neighbours(ActionGraph graph, Action action) {
        List<Action> neighbours = new ArrayList<>(graph.successors(action));
        neighbours.addAll(graph.predecessors(action));
        return neighbours;
    }
}
