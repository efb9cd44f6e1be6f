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

import java.util.Objects;
import java.util.Optional;

/**
 * The finalized control-flow graph of one workflow, with the facts the emitter
 * needs alongside it.
 */
public class StructuredWorkflowGraph {

    private final String workflowName;
    private final ActionGraph graph;
    private final Action errorHandler;
    private final int forkJoinPairs;

    public StructuredWorkflowGraph(String workflowName, ActionGraph graph, Action errorHandler, int forkJoinPairs) {
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        this.errorHandler = errorHandler;
        this.forkJoinPairs = forkJoinPairs;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public ActionGraph getGraph() {
        return graph;
    }

    public Optional<Action> getErrorHandler() {
        return Optional.ofNullable(errorHandler);
    }

    public int getForkJoinPairs() {
        return forkJoinPairs;
    }

    @Override
    public String toString() {
        return "StructuredWorkflowGraph{" +
               "workflowName='" + workflowName + '\'' +
               ", nodes=" + graph.size() +
               ", forkJoinPairs=" + forkJoinPairs +
               '}';
    }
}
