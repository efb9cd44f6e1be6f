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

/**
 * Renders an {@link ActionGraph} as Graphviz DOT text. Nodes are labelled with
 * action names; control nodes get a shape per type.
 */
public class DotGraphExporter {

    public String toDot(String graphName, ActionGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(graphName)).append(" {\n");
        sb.append("  rankdir=TB;\n");

        for (Action node : graph.getNodes()) {
            sb.append("  ").append(quote(node.getName()))
              .append(" [shape=").append(shapeOf(node)).append("];\n");
        }
        for (Action node : graph.getNodes()) {
            for (Action successor : graph.successors(node)) {
                sb.append("  ").append(quote(node.getName()))
                  .append(" -> ").append(quote(successor.getName())).append(";\n");
            }
        }

        sb.append("}\n");
        return sb.toString();
    }

    private String shapeOf(Action node) {
        ControlNodeType type = node.getControlType();
        if (type == null) {
            return "box";
        }
        switch (type) {
            case START:
            case END:
                return "circle";
            case FORK:
            case JOIN:
                return "diamond";
            default:
                return "box";
        }
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
