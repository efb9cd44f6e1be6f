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
import dev.mars.woozie.core.exceptions.AmbiguousTransitionException;
import dev.mars.woozie.core.exceptions.CyclicDependencyException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Converts one weakly-connected component into a sequence of parallel groups,
 * each group being a bundle of independent forkless chains.
 *
 * <p>Each pass takes the current roots of the remaining component and walks
 * forward from every root while the current node has a single successor whose
 * only predecessor is the current node. The chains found in one pass are
 * siblings: a single chain is appended sequentially, two or more are wrapped
 * in a fork/join pair. Consumed nodes are removed and the next pass starts,
 * until the component is empty.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PathLinearizer {

    private static final Logger logger = Logger.getLogger(PathLinearizer.class.getName());

    /**
     * Builds the structured subgraph for a component.
     *
     * @param component the component; left untouched, passes run on a copy
     * @param inserter the run's synchronization inserter
     * @return a structured graph with a unique entry and a unique exit
     */
    public ActionGraph linearize(ActionGraph component, SynchronizationInserter inserter)
            throws AmbiguousTransitionException, CyclicDependencyException {
        ActionGraph structured = new ActionGraph();

        for (List<ForklessChain> group : extractGroups(component)) {
            ActionGraph segment;
            if (group.size() > 1) {
                List<ActionGraph> branches = new ArrayList<>();
                for (ForklessChain chain : group) {
                    branches.add(chain.toGraph());
                }
                segment = inserter.synchronize(branches);
            } else {
                segment = group.get(0).toGraph();
            }
            inserter.append(structured, segment);
        }

        return structured;
    }

    /**
     * Runs every extraction pass over a copy of the component.
     *
     * @return one list of sibling chains per pass, in pass order
     * @throws CyclicDependencyException if a pass finds no root, which only
     *         happens when the component is not acyclic
     */
    public List<List<ForklessChain>> extractGroups(ActionGraph component) throws CyclicDependencyException {
        ActionGraph remaining = component.copy();
        List<List<ForklessChain>> groups = new ArrayList<>();

        while (!remaining.isEmpty()) {
            List<Action> roots = remaining.entryNodes();
            if (roots.isEmpty()) {
                List<String> names = remaining.getNodes().stream().map(Action::getName).toList();
                throw new CyclicDependencyException("No root left while linearizing component", names);
            }

            List<ForklessChain> pass = new ArrayList<>();
            for (Action root : roots) {
                pass.add(walk(remaining, root));
            }
            for (ForklessChain chain : pass) {
                remaining.removeNodes(chain.getActions());
            }

            logger.fine("Extracted forkless chains " + pass);
            groups.add(pass);
        }

        return groups;
    }

    /**
     * Walks the maximal non-branching, non-joining path starting at a root.
     */
    ForklessChain walk(ActionGraph graph, Action root) {
        List<Action> chain = new ArrayList<>();
        chain.add(root);

        Action current = root;
        while (graph.outDegree(current) == 1) {
            Action next = graph.successors(current).get(0);
            if (graph.inDegree(next) != 1) {
                break;
            }
            chain.add(next);
            current = next;
        }

        return new ForklessChain(chain);
    }
}
