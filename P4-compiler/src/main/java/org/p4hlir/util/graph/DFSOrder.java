package org.p4hlir.util.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Computes depth-first order of a graph */
public class DFSOrder<Node> {
    final Set<Node> marked;
    final List<Node> preorder;
    final List<Node> postorder;

    public DFSOrder(DiGraph<Node> graph) {
        this.postorder = new ArrayList<>();
        this.preorder = new ArrayList<>();
        this.marked = new HashSet<>();
        for (Node v: graph.getNodes())
            if (!this.marked.contains(v))
                this.dfs(graph, v);
    }

    // run DFS in graph from vertex v and compute preorder/postorder
    private void dfs(DiGraph<Node> graph, Node v) {
        this.marked.add(v);
        this.preorder.add(v);
        for (Port<Node> p : graph.getSuccessors(v)) {
            Node w = p.node();
            if (!this.marked.contains(w))
                this.dfs(graph, w);
        }
        this.postorder.add(v);
    }

    public List<Node> preorder() {
        return Collections.unmodifiableList(this.preorder);
    }

    /** Reverse postorder of the graph. */
    public List<Node> reversePost() {
        List<Node> result = new ArrayList<>(this.postorder);
        Collections.reverse(result);
        return result;
    }
}
