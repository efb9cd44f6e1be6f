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

package dev.mars.woozie.emit;

import dev.mars.woozie.core.Action;
import dev.mars.woozie.core.ControlNodeType;
import dev.mars.woozie.core.exceptions.MalformedConfigException;
import dev.mars.woozie.core.exceptions.WorkflowGraphException;
import dev.mars.woozie.graph.ActionGraph;
import dev.mars.woozie.graph.StructuredWorkflowGraph;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Serializes a structured control-flow graph into a {@code workflow-app}
 * document, one element per node in topological order.
 *
 * <p>The error-routing node is the penultimate node of the order, the single
 * predecessor of {@code end}. The finalizer places the error handler there
 * when one exists. Every ordinary action fails over to it, except the error
 * handler itself. Without an error handler the routing node may be an ordinary
 * action; that action fails over to {@code end} rather than to itself.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class TopologicalEmitter {

    private static final Logger logger = Logger.getLogger(TopologicalEmitter.class.getName());

    public static final String DEFAULT_NAMESPACE = "uri:oozie:workflow:1.0";
    static final String ROOT_ELEMENT = "workflow-app";

    private final String namespace;
    private final ActionElementProjector projector;

    public TopologicalEmitter() {
        this(DEFAULT_NAMESPACE);
    }

    public TopologicalEmitter(String namespace) {
        this.namespace = Objects.requireNonNull(namespace, "Workflow namespace cannot be null");
        this.projector = new ActionElementProjector();
    }

    /**
     * Builds the workflow document.
     *
     * @param structured the finalized graph
     * @return a new DOM document
     * @throws WorkflowGraphException if the graph is cyclic or an action cannot be emitted
     */
    public Document emit(StructuredWorkflowGraph structured) throws WorkflowGraphException {
        ActionGraph graph = structured.getGraph();
        List<Action> order = graph.topologicalOrder();
        if (order.size() < 2) {
            throw new MalformedConfigException("Structured graph has no start/end pair",
                    order.stream().map(Action::getName).toList());
        }

        Action routingNode = order.get(order.size() - 2);
        Action errorHandler = structured.getErrorHandler().orElse(null);

        Document document = newDocument();
        Element root = document.createElementNS(namespace, ROOT_ELEMENT);
        root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns", namespace);
        root.setAttribute("name", structured.getWorkflowName());
        document.appendChild(root);

        for (Action node : order) {
            root.appendChild(elementFor(document, graph, node, routingNode, errorHandler));
        }

        logger.fine("Emitted " + order.size() + " elements for workflow '" + structured.getWorkflowName()
                + "', errors routed to '" + routingNode.getName() + "'");
        return document;
    }

    private Element elementFor(Document document, ActionGraph graph, Action node,
                               Action routingNode, Action errorHandler) throws MalformedConfigException {
        ControlNodeType type = node.getControlType();
        if (type == null) {
            return actionElement(document, graph, node, routingNode, errorHandler);
        }

        switch (type) {
            case START: {
                Element start = element(document, "start");
                start.setAttribute("to", soleSuccessor(graph, node).getName());
                return start;
            }
            case END: {
                Element end = element(document, "end");
                end.setAttribute("name", node.getName());
                return end;
            }
            case FORK: {
                Element fork = element(document, "fork");
                fork.setAttribute("name", node.getName());
                for (Action branch : graph.successors(node)) {
                    Element path = element(document, "path");
                    path.setAttribute("start", branch.getName());
                    fork.appendChild(path);
                }
                return fork;
            }
            case JOIN: {
                Element join = element(document, "join");
                join.setAttribute("name", node.getName());
                join.setAttribute("to", soleSuccessor(graph, node).getName());
                return join;
            }
            default:
                throw new IllegalStateException("Unhandled control node type: " + type);
        }
    }

    private Element actionElement(Document document, ActionGraph graph, Action action,
                                  Action routingNode, Action errorHandler) throws MalformedConfigException {
        Action next = soleSuccessor(graph, action);

        Element element = element(document, "action");
        element.setAttribute("name", action.getName());
        element.appendChild(projector.project(document, action, namespace));

        Element ok = element(document, "ok");
        ok.setAttribute("to", next.getName());
        element.appendChild(ok);

        if (!action.equals(errorHandler)) {
            Element error = element(document, "error");
            error.setAttribute("to", action.equals(routingNode) ? Action.end().getName() : routingNode.getName());
            element.appendChild(error);
        }
        return element;
    }

    private Action soleSuccessor(ActionGraph graph, Action node) throws MalformedConfigException {
        List<Action> successors = graph.successors(node);
        if (successors.size() != 1) {
            throw new MalformedConfigException("Node needs exactly one success transition, found "
                    + successors.size(), node.getName());
        }
        return successors.get(0);
    }

    private Element element(Document document, String name) {
        return document.createElementNS(namespace, name);
    }

    private static Document newDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            return factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML document builder is not available", e);
        }
    }
}
