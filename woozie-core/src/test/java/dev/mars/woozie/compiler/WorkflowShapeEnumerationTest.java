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

import dev.mars.woozie.core.Action;
import dev.mars.woozie.core.ControlNodeType;
import dev.mars.woozie.core.Workflow;
import dev.mars.woozie.emit.TopologicalEmitter;
import dev.mars.woozie.graph.ActionGraph;
import dev.mars.woozie.graph.StructuredWorkflowGraph;
import dev.mars.woozie.graph.WorkflowGraphBuilder;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Compiles every dependency shape on up to five actions, with and without an
 * error handler, and checks the structural guarantees of the graph and the
 * emitted document for each of them.
 *
 * <p>Shapes are enumerated in topological-index form: action {@code a<j>} may
 * depend on any {@code a<i>} with {@code i < j}, so every labelled DAG is
 * covered exactly once.</p>
 */
class WorkflowShapeEnumerationTest {

    private static final int MAX_ACTIONS = 5;
    private static final String HANDLER = "error_handler";

    private final WorkflowGraphBuilder builder = new WorkflowGraphBuilder();
    private final TopologicalEmitter emitter = new TopologicalEmitter();

    static Stream<Arguments> allWorkflowShapes() {
        List<Arguments> shapes = new ArrayList<>();
        for (int size = 1; size <= MAX_ACTIONS; size++) {
            List<int[]> pairs = new ArrayList<>();
            for (int j = 1; j < size; j++) {
                for (int i = 0; i < j; i++) {
                    pairs.add(new int[]{i, j});
                }
            }
            for (int mask = 0; mask < (1 << pairs.size()); mask++) {
                List<Action> actions = actionsFor(size, pairs, mask);
                String label = "size=" + size + " edges=" + Integer.toBinaryString(mask);
                shapes.add(Arguments.of(label + " no-handler", new Workflow("shape", actions)));
                shapes.add(Arguments.of(label + " handler", new Workflow("shape", actions, handler())));
            }
        }
        return shapes.stream();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allWorkflowShapes")
    void testStructuredGraphGuarantees(String label, Workflow workflow) throws Exception {
        StructuredWorkflowGraph structured = builder.build(workflow);
        ActionGraph graph = structured.getGraph();

        assertFalse(graph.hasCycles());
        assertEquals(List.of(Action.start()), graph.entryNodes());
        assertEquals(List.of(Action.end()), graph.exitNodes());

        Set<String> expected = new HashSet<>();
        for (Action action : workflow.getActions()) {
            expected.add(action.getName());
        }
        workflow.getErrorHandler().ifPresent(handler -> expected.add(handler.getName()));
        Set<String> ordinary = new HashSet<>();
        int ordinaryCount = 0;
        for (Action node : graph.getNodes()) {
            if (!node.isControlNode()) {
                ordinary.add(node.getName());
                ordinaryCount++;
            }
        }
        assertEquals(expected, ordinary);
        assertEquals(expected.size(), ordinaryCount);

        int pairs = structured.getForkJoinPairs();
        for (int index = 0; index < pairs; index++) {
            Action fork = Action.fork(index);
            Action join = Action.join(index);
            assertTrue(graph.containsNode(fork), fork.getName());
            assertTrue(graph.containsNode(join), join.getName());
            assertTrue(graph.outDegree(fork) >= 2, fork.getName());
            assertTrue(graph.inDegree(join) >= 2, join.getName());
            assertEquals(1, graph.outDegree(join), join.getName());
        }
        for (Action node : graph.getNodes()) {
            ControlNodeType type = node.getControlType();
            if (type == ControlNodeType.FORK || type == ControlNodeType.JOIN) {
                int index = Integer.parseInt(node.getName().substring(node.getName().indexOf('-') + 1));
                assertTrue(index < pairs, node.getName() + " outside the issued range");
            } else if (type == null) {
                assertEquals(1, graph.outDegree(node), node.getName());
            }
        }

        for (Action action : workflow.getActions()) {
            for (String dependency : action.getDependencies()) {
                assertTrue(reachable(graph, node(dependency), action),
                        dependency + " must run before " + action.getName());
            }
        }

        if (workflow.getErrorHandler().isPresent()) {
            assertEquals(List.of(handler()), graph.predecessors(Action.end()));
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allWorkflowShapes")
    void testEmittedDocumentGuarantees(String label, Workflow workflow) throws Exception {
        Document document = emitter.emit(builder.build(workflow));
        List<Element> elements = children(document.getDocumentElement());

        int starts = 0;
        int ends = 0;
        Set<String> emittedActions = new HashSet<>();
        for (Element element : elements) {
            switch (element.getLocalName()) {
                case "start":
                    starts++;
                    break;
                case "end":
                    ends++;
                    break;
                case "fork":
                    assertTrue(children(element).size() >= 2, element.getAttribute("name"));
                    break;
                case "join":
                    assertFalse(element.getAttribute("to").isEmpty(), element.getAttribute("name"));
                    break;
                case "action": {
                    String name = element.getAttribute("name");
                    assertTrue(emittedActions.add(name), "duplicate action element " + name);
                    assertEquals(1, count(element, "ok"), name);
                    assertEquals(HANDLER.equals(name) ? 0 : 1, count(element, "error"), name);
                    break;
                }
                default:
                    fail("Unexpected element " + element.getLocalName());
            }
        }

        assertEquals(1, starts);
        assertEquals(1, ends);
        assertEquals("start", elements.get(0).getLocalName());
        assertEquals("end", elements.get(elements.size() - 1).getLocalName());
        assertEquals(workflow.getActions().size() + (workflow.getErrorHandler().isPresent() ? 1 : 0),
                emittedActions.size());
    }

    private static List<Action> actionsFor(int size, List<int[]> pairs, int mask) {
        List<List<String>> dependencies = new ArrayList<>();
        for (int j = 0; j < size; j++) {
            dependencies.add(new ArrayList<>());
        }
        for (int bit = 0; bit < pairs.size(); bit++) {
            if ((mask & (1 << bit)) != 0) {
                int[] pair = pairs.get(bit);
                dependencies.get(pair[1]).add("a" + pair[0]);
            }
        }

        List<Action> actions = new ArrayList<>();
        for (int j = 0; j < size; j++) {
            actions.add(new Action("a" + j, "shell", dependencies.get(j), payload("a" + j)));
        }
        return actions;
    }

    private static Action handler() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("email", Map.of("xmlns", "uri:oozie:email-action:0.2"));
        config.put("to", "ops@example.com");
        return new Action(HANDLER, "email", List.of(), config);
    }

    private static Map<String, Object> payload(String name) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("shell", Map.of("xmlns", "uri:oozie:shell-action:1.0"));
        config.put("exec", name + ".sh");
        return config;
    }

    private static Action node(String name) {
        return new Action(name, "shell");
    }

    private static boolean reachable(ActionGraph graph, Action from, Action to) {
        Set<Action> seen = new HashSet<>();
        Deque<Action> pending = new ArrayDeque<>();
        pending.push(from);
        while (!pending.isEmpty()) {
            Action current = pending.pop();
            if (current.equals(to)) {
                return true;
            }
            if (seen.add(current)) {
                for (Action next : graph.successors(current)) {
                    pending.push(next);
                }
            }
        }
        return false;
    }

    private static int count(Element parent, String localName) {
        int count = 0;
        for (Element child : children(parent)) {
            if (localName.equals(child.getLocalName())) {
                count++;
            }
        }
        return count;
    }

    private static List<Element> children(Element parent) {
        List<Element> elements = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }
}
