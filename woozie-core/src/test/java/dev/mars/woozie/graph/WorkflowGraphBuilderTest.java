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
import dev.mars.woozie.core.ControlNodeType;
import dev.mars.woozie.core.Workflow;
import dev.mars.woozie.core.exceptions.CyclicDependencyException;
import dev.mars.woozie.core.exceptions.MissingDependencyException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class WorkflowGraphBuilderTest {

    private final WorkflowGraphBuilder builder = new WorkflowGraphBuilder();

    @Nested
    @DisplayName("Structural properties")
    class StructuralProperties {

        @Test
        void testFanOutFanInWithIndependentComponent() throws Exception {
            Workflow workflow = new Workflow("wide", List.of(
                    action("extract"),
                    action("clean", "extract"),
                    action("enrich", "extract"),
                    action("audit", "extract"),
                    action("load", "clean", "enrich"),
                    action("report", "load", "audit"),
                    action("archive"),
                    action("purge", "archive")));

            StructuredWorkflowGraph structured = builder.build(workflow);
            ActionGraph graph = structured.getGraph();

            assertFalse(graph.hasCycles());
            assertEquals(List.of(Action.start()), graph.entryNodes());
            assertEquals(List.of(Action.end()), graph.exitNodes());
            assertForksAndJoinsPaired(graph, structured.getForkJoinPairs());

            Set<String> ordinary = new HashSet<>();
            for (Action node : graph.getNodes()) {
                if (!node.isControlNode()) {
                    ordinary.add(node.getName());
                }
            }
            assertEquals(Set.of("extract", "clean", "enrich", "audit", "load", "report", "archive", "purge"),
                    ordinary);

            List<Action> order = graph.topologicalOrder();
            for (Action action : workflow.getActions()) {
                for (String dependency : action.getDependencies()) {
                    assertTrue(indexOf(order, dependency) < indexOf(order, action.getName()),
                            dependency + " must precede " + action.getName());
                }
            }
        }

        @Test
        void testEveryNodeButEndHasOneSuccessorExceptForks() throws Exception {
            Workflow workflow = new Workflow("diamond", List.of(
                    action("a"), action("b", "a"), action("c", "a"), action("d", "b", "c")),
                    new Action("error_handler", "email"));

            ActionGraph graph = builder.build(workflow).getGraph();

            for (Action node : graph.getNodes()) {
                if (node.getControlType() == ControlNodeType.END) {
                    assertEquals(0, graph.outDegree(node));
                } else if (node.getControlType() != ControlNodeType.FORK) {
                    assertEquals(1, graph.outDegree(node), node.getName());
                }
            }
            assertEquals(List.of(new Action("error_handler", "email")), graph.predecessors(Action.end()));
        }

        @Test
        void testForkJoinIndicesAreSharedAcrossComponents() throws Exception {
            Workflow workflow = new Workflow("two-diamonds", List.of(
                    action("a"), action("b", "a"), action("c", "a"),
                    action("x"), action("y", "x"), action("z", "x")));

            StructuredWorkflowGraph structured = builder.build(workflow);

            assertEquals(3, structured.getForkJoinPairs());
            assertTrue(structured.getGraph().containsNode(Action.fork(0)));
            assertTrue(structured.getGraph().containsNode(Action.fork(1)));
            assertTrue(structured.getGraph().hasEdge(Action.start(), Action.fork(2)));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void testCycleRejected() {
            Workflow workflow = new Workflow("cyclic", List.of(action("a", "b"), action("b", "a")));
            assertThrows(CyclicDependencyException.class, () -> builder.build(workflow));
        }

        @Test
        void testMissingDependencyRejected() {
            Workflow workflow = new Workflow("missing", List.of(action("a", "ghost")));
            MissingDependencyException e = assertThrows(MissingDependencyException.class,
                    () -> builder.build(workflow));
            assertEquals(List.of("ghost"), e.getNodeNames());
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class Listener {

        @Mock
        private GraphStageListener listener;

        @Test
        void testListenerReceivesBothStages() throws Exception {
            WorkflowGraphBuilder observed = new WorkflowGraphBuilder(listener);
            Workflow workflow = new Workflow("observed", List.of(action("a"), action("b", "a")));

            StructuredWorkflowGraph structured = observed.build(workflow);

            ArgumentCaptor<ActionGraph> raw = ArgumentCaptor.forClass(ActionGraph.class);
            verify(listener).onStageCompleted(eq("observed"), eq(GraphStageListener.Stage.DEPENDENCY_GRAPH),
                    raw.capture());
            assertEquals(2, raw.getValue().size());
            verify(listener).onStageCompleted("observed", GraphStageListener.Stage.STRUCTURED_GRAPH,
                    structured.getGraph());
        }

        @Test
        void testListenerNotNotifiedOfStructureOnCycle() {
            WorkflowGraphBuilder observed = new WorkflowGraphBuilder(listener);
            Workflow workflow = new Workflow("cyclic", List.of(action("a", "b"), action("b", "a")));

            assertThrows(CyclicDependencyException.class, () -> observed.build(workflow));
            verify(listener, never()).onStageCompleted(any(), any(), any());
        }
    }

    private static void assertForksAndJoinsPaired(ActionGraph graph, int pairs) {
        List<String> forks = new ArrayList<>();
        List<String> joins = new ArrayList<>();
        for (Action node : graph.getNodes()) {
            if (node.getControlType() == ControlNodeType.FORK) {
                forks.add(node.getName().substring("fork-".length()));
            } else if (node.getControlType() == ControlNodeType.JOIN) {
                joins.add(node.getName().substring("join-".length()));
            }
        }
        assertEquals(pairs, forks.size());
        assertEquals(new HashSet<>(forks), new HashSet<>(joins));
        assertEquals(forks.size(), new HashSet<>(forks).size());
    }

    private static int indexOf(List<Action> order, String name) {
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private static Action action(String name, String... dependencies) {
        return new Action(name, "shell", List.of(dependencies), null);
    }
}
