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
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentDecomposerTest {

    private final ComponentDecomposer decomposer = new ComponentDecomposer();

    @Test
    void testSingleComponent() {
        Action a = new Action("a", "shell");
        Action b = new Action("b", "shell");
        Action c = new Action("c", "shell");
        ActionGraph graph = new ActionGraph();
        // b and c only meet at a shared dependent, so connectivity must ignore direction
        graph.addEdge(b, a);
        graph.addEdge(c, a);

        List<ActionGraph> components = decomposer.decompose(graph);

        assertEquals(1, components.size());
        assertEquals(3, components.get(0).size());
        assertEquals(2, components.get(0).edgeCount());
    }

    @Test
    void testComponentsFollowNodeOrder() {
        Action a = new Action("a", "shell");
        Action b = new Action("b", "shell");
        Action c = new Action("c", "shell");
        Action d = new Action("d", "shell");
        ActionGraph graph = new ActionGraph();
        graph.addNode(a);
        graph.addNode(b);
        graph.addNode(c);
        graph.addNode(d);
        graph.addEdge(a, c);
        graph.addEdge(b, d);

        List<ActionGraph> components = decomposer.decompose(graph);

        assertEquals(2, components.size());
        assertEquals(List.of(a, c), components.get(0).getNodes());
        assertEquals(List.of(b, d), components.get(1).getNodes());
        assertTrue(components.get(0).hasEdge(a, c));
    }

    @Test
    void testEmptyGraph() {
        assertTrue(decomposer.decompose(new ActionGraph()).isEmpty());
    }

    @Test
    void testIsolatedNodesAreSeparateComponents() {
        ActionGraph graph = new ActionGraph();
        graph.addNode(new Action("a", "shell"));
        graph.addNode(new Action("b", "shell"));

        assertEquals(2, decomposer.decompose(graph).size());
    }
}
