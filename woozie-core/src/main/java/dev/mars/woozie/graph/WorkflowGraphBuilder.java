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

import dev.mars.woozie.core.Workflow;
import dev.mars.woozie.core.exceptions.WorkflowGraphException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs the graph stages of a compilation: assembly, acyclicity check,
 * component decomposition, per-component linearization and finalization.
 *
 * <p>Every call to {@link #build(Workflow)} uses a fresh {@link ForkJoinCounter},
 * so a builder can be reused for many workflows and fork/join names always
 * start at 0 for each of them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class WorkflowGraphBuilder {

    private static final Logger logger = Logger.getLogger(WorkflowGraphBuilder.class.getName());

    private final GraphAssembler assembler;
    private final AcyclicityGate acyclicityGate;
    private final ComponentDecomposer decomposer;
    private final PathLinearizer linearizer;
    private final GraphStageListener listener;

    public WorkflowGraphBuilder() {
        this(GraphStageListener.NONE);
    }

    public WorkflowGraphBuilder(GraphStageListener listener) {
        this.assembler = new GraphAssembler();
        this.acyclicityGate = new AcyclicityGate();
        this.decomposer = new ComponentDecomposer();
        this.linearizer = new PathLinearizer();
        this.listener = Objects.requireNonNull(listener, "Graph stage listener cannot be null");
    }

    /**
     * Builds the structured control-flow graph for a workflow.
     *
     * @param workflow the resolved workflow
     * @return the structured graph
     * @throws WorkflowGraphException if any structural invariant is violated
     */
    public StructuredWorkflowGraph build(Workflow workflow) throws WorkflowGraphException {
        Objects.requireNonNull(workflow, "Workflow cannot be null");

        ActionGraph dependencyGraph = assembler.assemble(workflow.getActions());
        acyclicityGate.requireAcyclic(dependencyGraph);
        logger.fine("Workflow '" + workflow.getName() + "': dependency graph has "
                + dependencyGraph.size() + " actions and " + dependencyGraph.edgeCount() + " dependencies");
        listener.onStageCompleted(workflow.getName(), GraphStageListener.Stage.DEPENDENCY_GRAPH, dependencyGraph);

        ForkJoinCounter counter = new ForkJoinCounter();
        SynchronizationInserter inserter = new SynchronizationInserter(counter);

        List<ActionGraph> components = decomposer.decompose(dependencyGraph);
        logger.fine("Workflow '" + workflow.getName() + "': " + components.size() + " independent components");

        List<ActionGraph> structuredComponents = new ArrayList<>();
        for (ActionGraph component : components) {
            structuredComponents.add(linearizer.linearize(component, inserter));
        }

        ControlFlowFinalizer finalizer = new ControlFlowFinalizer(inserter);
        ActionGraph structured = finalizer.complete(structuredComponents, workflow.getErrorHandler().orElse(null));
        listener.onStageCompleted(workflow.getName(), GraphStageListener.Stage.STRUCTURED_GRAPH, structured);

        return new StructuredWorkflowGraph(workflow.getName(), structured,
                workflow.getErrorHandler().orElse(null), counter.issued());
    }
}
