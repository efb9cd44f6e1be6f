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

/**
 * Observer of the graphs produced by the major pipeline stages, used for
 * visualisation. Implementations must not modify the graphs they receive.
 */
public interface GraphStageListener {

    enum Stage {
        /** The raw dependency graph, after the acyclicity check. */
        DEPENDENCY_GRAPH,
        /** The final structured control-flow graph. */
        STRUCTURED_GRAPH
    }

    void onStageCompleted(String workflowName, Stage stage, ActionGraph graph);

    GraphStageListener NONE = (workflowName, stage, graph) -> { };
}
