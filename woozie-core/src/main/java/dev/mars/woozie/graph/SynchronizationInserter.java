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

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Wraps parallel branches with generated fork/join pairs and splices segments
 * sequentially onto a structure under construction.
 *
 * <p>Every branch handed to {@link #synchronize(List)} must have exactly one
 * entry and one exit node. The resulting segment has the fork as its only
 * entry and the join as its only exit, so it composes sequentially with
 * whatever follows. Pair indices come from the run's {@link ForkJoinCounter}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class SynchronizationInserter {

    private static final Logger logger = Logger.getLogger(SynchronizationInserter.class.getName());

    private final ForkJoinCounter counter;

    public SynchronizationInserter(ForkJoinCounter counter) {
        this.counter = Objects.requireNonNull(counter, "Fork/join counter cannot be null");
    }

    /**
     * Builds a fork/join segment around two or more sibling branches.
     *
     * @param branches the parallel branches, each with a unique entry and exit
     * @return a new graph containing the fork, all branches and the join
     * @throws AmbiguousTransitionException if a branch has no unique entry or exit
     */
    public ActionGraph synchronize(List<ActionGraph> branches) throws AmbiguousTransitionException {
        if (branches == null || branches.size() < 2) {
            throw new IllegalArgumentException("A fork/join pair needs at least two branches");
        }

        for (ActionGraph branch : branches) {
            requireSingle(branch.entryNodes(), "Parallel branch has no unique entry node");
            requireSingle(branch.exitNodes(), "Parallel branch has no unique exit node");
        }

        int index = counter.next();
        Action fork = Action.fork(index);
        Action join = Action.join(index);

        ActionGraph segment = new ActionGraph();
        segment.addNode(fork);
        for (ActionGraph branch : branches) {
            segment.compose(branch);
            segment.addEdge(fork, branch.entryNodes().get(0));
        }
        for (ActionGraph branch : branches) {
            segment.addEdge(branch.exitNodes().get(0), join);
        }

        logger.fine("Synthesized " + fork.getName() + "/" + join.getName() + " around " + branches.size() + " branches");
        return segment;
    }

    /**
     * Appends a segment after the unique exit of the target graph. An empty
     * target simply absorbs the segment.
     *
     * @param target the structure built so far, modified in place
     * @param segment the segment to splice in
     * @throws AmbiguousTransitionException if the splice point is not a single exit
     *         followed by a single entry
     */
    public void append(ActionGraph target, ActionGraph segment) throws AmbiguousTransitionException {
        if (target.isEmpty()) {
            target.compose(segment);
            return;
        }

        Action exit = requireSingle(target.exitNodes(), "Structure has no unique exit to append to");
        Action entry = requireSingle(segment.entryNodes(), "Appended segment has no unique entry node");

        target.compose(segment);
        target.addEdge(exit, entry);
    }

    private Action requireSingle(List<Action> candidates, String message) throws AmbiguousTransitionException {
        if (candidates.size() != 1) {
            throw new AmbiguousTransitionException(message, names(candidates));
        }
        return candidates.get(0);
    }

    private static List<String> names(List<Action> actions) {
        return actions.stream().map(Action::getName).toList();
    }
}
