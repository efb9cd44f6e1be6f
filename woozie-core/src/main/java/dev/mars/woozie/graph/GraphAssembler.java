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
import dev.mars.woozie.core.exceptions.MissingDependencyException;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the raw dependency graph of a workflow: one node per action and one
 * edge {@code dependency -> action} per declared dependency.
 *
 * <p>Acyclicity is not checked here; see {@link AcyclicityGate}.</p>
 */
public class GraphAssembler {

    /**
     * @param actions the workflow actions, error handler excluded
     * @return the dependency graph
     * @throws MissingDependencyException if any dependency does not name an action
     */
    public ActionGraph assemble(List<Action> actions) throws MissingDependencyException {
        Map<String, Action> byName = new LinkedHashMap<>();
        for (Action action : actions) {
            byName.put(action.getName(), action);
        }

        Set<String> missing = new LinkedHashSet<>();
        for (Action action : actions) {
            for (String dependency : action.getDependencies()) {
                if (!byName.containsKey(dependency)) {
                    missing.add(dependency);
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingDependencyException("Missing action for dependencies", missing);
        }

        ActionGraph graph = new ActionGraph();
        for (Action action : actions) {
            graph.addNode(action);
        }
        for (Action action : actions) {
            for (String dependency : action.getDependencies()) {
                graph.addEdge(byName.get(dependency), action);
            }
        }
        return graph;
    }
}
