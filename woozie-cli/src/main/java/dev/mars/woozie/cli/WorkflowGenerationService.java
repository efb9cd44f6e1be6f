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

package dev.mars.woozie.cli;

import dev.mars.woozie.compiler.CompiledWorkflow;
import dev.mars.woozie.compiler.WorkflowCompiler;
import dev.mars.woozie.config.WoozieConfiguration;
import dev.mars.woozie.core.Workflow;
import dev.mars.woozie.core.exceptions.WorkflowGraphException;
import dev.mars.woozie.emit.WorkflowXmlWriter;
import dev.mars.woozie.graph.ActionGraph;
import dev.mars.woozie.graph.DotGraphExporter;
import dev.mars.woozie.graph.GraphStageListener;
import dev.mars.woozie.workflow.ActionTypeCatalog;
import dev.mars.woozie.workflow.ValidationResult;
import dev.mars.woozie.workflow.WorkflowDefinition;
import dev.mars.woozie.workflow.WorkflowDefinitionParser;
import dev.mars.woozie.workflow.WorkflowFactory;
import dev.mars.woozie.workflow.WorkflowParseException;
import dev.mars.woozie.workflow.YamlWorkflowDefinitionParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Loads a workflow definition and its action-type configuration, compiles
 * them and writes the workflow document (plus DOT graphs when enabled) into
 * an output directory.
 */
public class WorkflowGenerationService {

    private static final Logger logger = Logger.getLogger(WorkflowGenerationService.class.getName());

    private final WoozieConfiguration configuration;
    private final WorkflowDefinitionParser parser;
    private final WorkflowFactory factory;
    private final WorkflowXmlWriter xmlWriter;
    private final DotGraphExporter dotExporter;

    public WorkflowGenerationService(WoozieConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.parser = new YamlWorkflowDefinitionParser(configuration.getErrorHandlerName());
        this.factory = new WorkflowFactory(configuration.getErrorHandlerName());
        this.xmlWriter = new WorkflowXmlWriter(configuration.getOutputIndent());
        this.dotExporter = new DotGraphExporter();
    }

    /**
     * Runs the full generation.
     *
     * @param workflowFile the workflow definition
     * @param configFile   the action-type configuration
     * @param outputDir    directory receiving the generated files; created if missing
     * @return what was generated
     * @throws WorkflowParseException if either file is malformed or names an unknown action type
     * @throws WorkflowGraphException if the workflow cannot be compiled
     * @throws IOException            if the output cannot be written
     */
    public GenerationReport generate(Path workflowFile, Path configFile, Path outputDir)
            throws WorkflowParseException, WorkflowGraphException, IOException {
        Files.createDirectories(outputDir);

        WorkflowDefinition definition = parser.parseDefinition(workflowFile);
        ActionTypeCatalog catalog = parser.parseCatalog(configFile);

        // structural problems are reported by the factory and compiler with their own error kinds
        ValidationResult validation = parser.validate(definition, catalog);
        for (ValidationResult.ValidationIssue issue : validation.getErrors()) {
            logger.warning(workflowFile + ": " + issue);
        }
        for (ValidationResult.ValidationIssue issue : validation.getWarnings()) {
            logger.warning(workflowFile + ": " + issue);
        }

        Workflow workflow = factory.build(definition, catalog);

        CapturingListener listener = new CapturingListener();
        WorkflowCompiler compiler = new WorkflowCompiler(configuration,
                configuration.isGraphExportEnabled() ? listener : GraphStageListener.NONE);

        List<Path> graphFiles = new ArrayList<>();
        CompiledWorkflow compiled;
        try {
            compiled = compiler.compile(workflow);
        } catch (WorkflowGraphException e) {
            // the dependency graph is still useful when structuring fails
            try {
                writeGraphs(workflow.getName(), listener.graphs, outputDir, graphFiles);
            } catch (IOException writeFailure) {
                logger.warning("Unable to write graphs for workflow '" + workflow.getName() + "': "
                        + writeFailure.getMessage());
                e.addSuppressed(writeFailure);
            }
            throw e;
        }
        writeGraphs(workflow.getName(), listener.graphs, outputDir, graphFiles);

        Path xmlFile = outputDir.resolve(configuration.getOutputFileName());
        xmlWriter.write(compiled.getDocument(), xmlFile);
        logger.info("Wrote workflow '" + compiled.getWorkflowName() + "' to " + xmlFile);

        return new GenerationReport(compiled.getWorkflowName(), xmlFile, graphFiles, compiled.getForkJoinPairs());
    }

    private void writeGraphs(String workflowName, Map<GraphStageListener.Stage, ActionGraph> graphs,
                             Path outputDir, List<Path> written) throws IOException {
        for (Map.Entry<GraphStageListener.Stage, ActionGraph> entry : graphs.entrySet()) {
            String fileName = entry.getKey() == GraphStageListener.Stage.DEPENDENCY_GRAPH
                    ? configuration.getRawGraphFileName()
                    : configuration.getStructuredGraphFileName();
            Path target = outputDir.resolve(fileName);
            Files.writeString(target, dotExporter.toDot(workflowName, entry.getValue()), StandardCharsets.UTF_8);
            written.add(target);
            logger.fine("Wrote " + entry.getKey() + " graph to " + target);
        }
    }

    private static final class CapturingListener implements GraphStageListener {
        private final Map<Stage, ActionGraph> graphs = new EnumMap<>(Stage.class);

        @Override
        public void onStageCompleted(String workflowName, Stage stage, ActionGraph graph) {
            graphs.put(stage, graph.copy());
        }
    }

    /**
     * Summary of one generation run.
     */
    public static class GenerationReport {
        private final String workflowName;
        private final Path workflowXml;
        private final List<Path> graphFiles;
        private final int forkJoinPairs;

        public GenerationReport(String workflowName, Path workflowXml, List<Path> graphFiles, int forkJoinPairs) {
            this.workflowName = workflowName;
            this.workflowXml = workflowXml;
            this.graphFiles = Collections.unmodifiableList(new ArrayList<>(graphFiles));
            this.forkJoinPairs = forkJoinPairs;
        }

        public String getWorkflowName() {
            return workflowName;
        }

        public Path getWorkflowXml() {
            return workflowXml;
        }

        public List<Path> getGraphFiles() {
            return graphFiles;
        }

        public int getForkJoinPairs() {
            return forkJoinPairs;
        }

        @Override
        public String toString() {
            return "GenerationReport{" +
                   "workflowName='" + workflowName + '\'' +
                   ", workflowXml=" + workflowXml +
                   ", graphFiles=" + graphFiles +
                   ", forkJoinPairs=" + forkJoinPairs +
                   '}';
        }
    }
}
