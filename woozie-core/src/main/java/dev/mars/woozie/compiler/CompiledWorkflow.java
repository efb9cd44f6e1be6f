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

import dev.mars.woozie.graph.StructuredWorkflowGraph;
import org.w3c.dom.Document;

import java.util.Objects;

/**
 * Output of a successful compilation: the structured graph and the workflow
 * document generated from it.
 */
public class CompiledWorkflow {

    private final StructuredWorkflowGraph structuredGraph;
    private final Document document;

    public CompiledWorkflow(StructuredWorkflowGraph structuredGraph, Document document) {
        this.structuredGraph = Objects.requireNonNull(structuredGraph, "Structured graph cannot be null");
        this.document = Objects.requireNonNull(document, "Document cannot be null");
    }

    public String getWorkflowName() {
        return structuredGraph.getWorkflowName();
    }

    public StructuredWorkflowGraph getStructuredGraph() {
        return structuredGraph;
    }

    public Document getDocument() {
        return document;
    }

    public int getForkJoinPairs() {
        return structuredGraph.getForkJoinPairs();
    }

    @Override
    public String toString() {
        return "CompiledWorkflow{" +
               "workflowName='" + getWorkflowName() + '\'' +
               ", elements=" + document.getDocumentElement().getChildNodes().getLength() +
               ", forkJoinPairs=" + getForkJoinPairs() +
               '}';
    }
}
