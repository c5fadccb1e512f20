package org.p4hlir.util.graph;

import org.p4hlir.util.Utilities;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Strongly-connected components of a graph (Kosaraju). */
public class SCC<Node> {
    /** Count of strongly connected components */
    public int count = 0;
    /** Visited nodes */
    final Set<Node> marked = new HashSet<>();
    /** Maps each node to the component id */
    public final Map<Node, Integer> componentId = new LinkedHashMap<>();
    /** The nodes in each component */
    public final Map<Integer, List<Node>> component = new LinkedHashMap<>();

    /** Compute the strongly connected components of a graph.
     *
     * @param reverseGraph  Reverse graph: edges are predecessors.
     * @param graph         Graph of successors. */
    public SCC(final DiGraph<Node> reverseGraph, final DiGraph<Node> graph) {
        DFSOrder<Node> dfs = new DFSOrder<>(reverseGraph);
        for (Node v : dfs.reversePost()) {
            if (!this.marked.contains(v)) {
                this.dfs(graph, v);
                this.count++;
            }
        }
    }

    void dfs(final DiGraph<Node> graph, Node v) {
        this.marked.add(v);
        Utilities.putNew(this.componentId, v, this.count);
        this.component.computeIfAbsent(this.count, k -> new ArrayList<>()).add(v);
        for (Port<Node> w : graph.getSuccessors(v)) {
            if (!this.marked.contains(w.node()))
                this.dfs(graph, w.node());
        }
    }

    /** The components that contain a cycle: more than one node, or a node with an edge to itself. */
    public List<List<Node>> cyclicComponents(DiGraph<Node> graph) {
        List<List<Node>> result = new ArrayList<>();
        for (List<Node> nodes: this.component.values()) {
            if (nodes.size() > 1) {
                result.add(nodes);
                continue;
            }
            Node single = nodes.get(0);
            for (Port<Node> p: graph.getSuccessors(single)) {
                if (p.node().equals(single)) {
                    result.add(nodes);
                    break;
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (var e : this.component.entrySet()) {
            builder.append(e.getKey())
                    .append("=>")
                    .append(e.getValue().toString())
                    .append("\n");
        }
        return builder.toString();
    }
}
