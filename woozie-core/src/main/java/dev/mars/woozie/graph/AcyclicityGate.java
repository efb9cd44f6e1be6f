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

import dev.mars.woozie.core.exceptions.CyclicDependencyException;

/**
 * Precondition check run once on the fully assembled dependency graph.
 */
public class AcyclicityGate {

    /**
     * @param dependencyGraph the assembled graph
     * @throws CyclicDependencyException if the graph is not a DAG; the exception
     *         names every action that could not be ordered
     */
    public void requireAcyclic(ActionGraph dependencyGraph) throws CyclicDependencyException {
        dependencyGraph.topologicalOrder();
    }
}
