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

package dev.mars.woozie.compiler;

import dev.mars.woozie.config.WoozieConfiguration;
import dev.mars.woozie.core.Workflow;
import dev.mars.woozie.core.exceptions.WorkflowGraphException;
import dev.mars.woozie.emit.TopologicalEmitter;
import dev.mars.woozie.graph.GraphStageListener;
import dev.mars.woozie.graph.StructuredWorkflowGraph;
import dev.mars.woozie.graph.WorkflowGraphBuilder;
import dev.mars.woozie.observability.CompilationMetrics;
import org.w3c.dom.Document;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the compiler: turns a resolved {@link Workflow} into a
 * structured control-flow graph and its workflow document.
 *
 * <p>Compilation is synchronous and keeps no state between calls, so one
 * compiler may serve any number of workflows.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class WorkflowCompiler {

    private static final Logger logger = Logger.getLogger(WorkflowCompiler.class.getName());

    private final WorkflowGraphBuilder graphBuilder;
    private final TopologicalEmitter emitter;
    private final CompilationMetrics metrics;

    public WorkflowCompiler() {
        this(new WoozieConfiguration(), GraphStageListener.NONE);
    }

    public WorkflowCompiler(WoozieConfiguration configuration, GraphStageListener listener) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.graphBuilder = new WorkflowGraphBuilder(listener);
        this.emitter = new TopologicalEmitter(configuration.getWorkflowNamespace());
        this.metrics = CompilationMetrics.getInstance();
    }

    /**
     * Compiles a workflow.
     *
     * @param workflow the resolved workflow
     * @return the compiled workflow
     * @throws WorkflowGraphException if the workflow violates a structural invariant
     */
    public CompiledWorkflow compile(Workflow workflow) throws WorkflowGraphException {
        Objects.requireNonNull(workflow, "Workflow cannot be null");

        long startNanos = System.nanoTime();
        metrics.recordCompilationStarted(workflow.getName());
        try {
            StructuredWorkflowGraph structured = graphBuilder.build(workflow);
            Document document = emitter.emit(structured);

            int actionCount = workflow.getActions().size() + (workflow.getErrorHandler().isPresent() ? 1 : 0);
            double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
            metrics.recordCompilationCompleted(workflow.getName(), seconds, actionCount, structured.getForkJoinPairs());

            logger.info("Compiled workflow '" + workflow.getName() + "': " + actionCount + " actions, "
                    + structured.getForkJoinPairs() + " fork/join pairs");
            return new CompiledWorkflow(structured, document);
        } catch (WorkflowGraphException e) {
            metrics.recordCompilationFailed(workflow.getName(), e.getKind().name());
            logger.log(Level.WARNING, "Unable to compile workflow '" + workflow.getName() + "': " + e.getMessage());
            throw e;
        }
    }

    /**
     * Compiles a workflow without throwing for structural failures.
     *
     * @param workflow the resolved workflow
     * @return a result holding either the compiled workflow or the failure
     */
    public CompilationResult tryCompile(Workflow workflow) {
        try {
            return CompilationResult.success(compile(workflow));
        } catch (WorkflowGraphException e) {
            return CompilationResult.failure(e);
        }
    }
}
