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
import dev.mars.woozie.core.exceptions.CyclicDependencyException;

import java.util.*;

/**
 * Directed graph over {@link Action} nodes.
 *
 * <p>Nodes are kept in an arena keyed by action name, with ordered successor and
 * predecessor sets per node, so degree lookups are constant time. Insertion
 * order is preserved for nodes and edges, which keeps every traversal, and
 * therefore every generated document, deterministic.</p>
 *
 * <p>Instances are mutable and not thread-safe; each compilation owns its graphs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class ActionGraph {

    private final Map<String, Action> nodes;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    public ActionGraph() {
        this.nodes = new LinkedHashMap<>();
        this.successors = new LinkedHashMap<>();
        this.predecessors = new LinkedHashMap<>();
    }

    /**
     * Adds a node. Adding an action whose name is already present is a no-op.
     *
     * @param action the action to add
     */
    public void addNode(Action action) {
        Objects.requireNonNull(action, "Action cannot be null");

        String name = action.getName();
        if (!nodes.containsKey(name)) {
            nodes.put(name, action);
            successors.put(name, new LinkedHashSet<>());
            predecessors.put(name, new LinkedHashSet<>());
        }
    }

    /**
     * Adds a directed edge, adding either endpoint that is not yet a node.
     */
    public void addEdge(Action from, Action to) {
        addNode(from);
        addNode(to);
        successors.get(from.getName()).add(to.getName());
        predecessors.get(to.getName()).add(from.getName());
    }

    public boolean hasEdge(Action from, Action to) {
        Set<String> targets = successors.get(from.getName());
        return targets != null && targets.contains(to.getName());
    }

    /**
     * Removes a node together with all of its incoming and outgoing edges.
     */
    public void removeNode(Action action) {
        String name = action.getName();
        if (!nodes.containsKey(name)) {
            return;
        }
        for (String successor : successors.get(name)) {
            predecessors.get(successor).remove(name);
        }
        for (String predecessor : predecessors.get(name)) {
            successors.get(predecessor).remove(name);
        }
        nodes.remove(name);
        successors.remove(name);
        predecessors.remove(name);
    }

    public void removeNodes(Collection<Action> actions) {
        for (Action action : actions) {
            removeNode(action);
        }
    }

    public boolean containsNode(Action action) {
        return nodes.containsKey(action.getName());
    }

    public Optional<Action> getNode(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public List<Action> getNodes() {
        return List.copyOf(nodes.values());
    }

    public List<Action> successors(Action action) {
        return resolve(requireAdjacency(successors, action));
    }

    public List<Action> predecessors(Action action) {
        return resolve(requireAdjacency(predecessors, action));
    }

    public int inDegree(Action action) {
        return requireAdjacency(predecessors, action).size();
    }

    public int outDegree(Action action) {
        return requireAdjacency(successors, action).size();
    }

    /**
     * Nodes without incoming edges, in node order.
     */
    public List<Action> entryNodes() {
        List<Action> entries = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : predecessors.entrySet()) {
            if (entry.getValue().isEmpty()) {
                entries.add(nodes.get(entry.getKey()));
            }
        }
        return entries;
    }

    /**
     * Nodes without outgoing edges, in node order.
     */
    public List<Action> exitNodes() {
        List<Action> exits = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : successors.entrySet()) {
            if (entry.getValue().isEmpty()) {
                exits.add(nodes.get(entry.getKey()));
            }
        }
        return exits;
    }

    /**
     * Creates an independent copy of the subgraph induced by the given actions.
     * Node order follows this graph, not the order of the argument.
     */
    public ActionGraph subgraph(Collection<Action> actions) {
        Set<String> keep = new HashSet<>();
        for (Action action : actions) {
            keep.add(action.getName());
        }

        ActionGraph result = new ActionGraph();
        for (Action node : nodes.values()) {
            if (keep.contains(node.getName())) {
                result.addNode(node);
            }
        }
        for (Action node : result.nodes.values()) {
            for (String successor : successors.get(node.getName())) {
                if (keep.contains(successor)) {
                    result.addEdge(node, nodes.get(successor));
                }
            }
        }
        return result;
    }

    public ActionGraph copy() {
        return subgraph(nodes.values());
    }

    /**
     * Merges all nodes and edges of another graph into this one.
     */
    public void compose(ActionGraph other) {
        for (Action node : other.nodes.values()) {
            addNode(node);
        }
        for (Map.Entry<String, Set<String>> entry : other.successors.entrySet()) {
            Action from = other.nodes.get(entry.getKey());
            for (String to : entry.getValue()) {
                addEdge(from, other.nodes.get(to));
            }
        }
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int edgeCount() {
        int count = 0;
        for (Set<String> targets : successors.values()) {
            count += targets.size();
        }
        return count;
    }

    /**
     * Computes a topological order using Kahn's algorithm. Ties are broken by
     * node order, so the result is stable for a given graph.
     *
     * @return all nodes in topological order
     * @throws CyclicDependencyException if the graph contains a cycle
     */
    public List<Action> topologicalOrder() throws CyclicDependencyException {
        Map<String, Integer> inDegree = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        List<Action> result = new ArrayList<>();

        for (Map.Entry<String, Set<String>> entry : predecessors.entrySet()) {
            inDegree.put(entry.getKey(), entry.getValue().size());
            if (entry.getValue().isEmpty()) {
                queue.offer(entry.getKey());
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(nodes.get(current));

            for (String successor : successors.get(current)) {
                int remaining = inDegree.merge(successor, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(successor);
                }
            }
        }

        if (result.size() != nodes.size()) {
            List<String> remaining = new ArrayList<>();
            for (String name : nodes.keySet()) {
                if (inDegree.get(name) > 0) {
                    remaining.add(name);
                }
            }
            throw new CyclicDependencyException("Cyclic dependencies found among actions", remaining);
        }

        return result;
    }

    public boolean hasCycles() {
        try {
            topologicalOrder();
            return false;
        } catch (CyclicDependencyException e) {
            return true;
        }
    }

    private Set<String> requireAdjacency(Map<String, Set<String>> adjacency, Action action) {
        Set<String> names = adjacency.get(action.getName());
        if (names == null) {
            throw new IllegalArgumentException("Action '" + action.getName() + "' is not part of this graph");
        }
        return names;
    }

    private List<Action> resolve(Set<String> names) {
        List<Action> actions = new ArrayList<>(names.size());
        for (String name : names) {
            actions.add(nodes.get(name));
        }
        return actions;
    }

    @Override
    public String toString() {
        return "ActionGraph{" +
               "nodes=" + nodes.keySet() +
               ", edges=" + successors +
               '}';
    }
}
