package org.p4hlir.util.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Kahn's algorithm.  Nodes without predecessors are released in the order
 * in which {@link DiGraph#getNodes()} lists them, so the result is deterministic.
 * If the graph has cycles the order is partial and {@link #isComplete()} is false. */
public class TopologicalOrder<Node> {
    final List<Node> order;
    final List<Node> remaining;

    public TopologicalOrder(DiGraph<Node> graph) {
        Map<Node, Integer> inDegree = new LinkedHashMap<>();
        for (Node node: graph.getNodes())
            inDegree.put(node, 0);
        for (Node node: graph.getNodes()) {
            for (Port<Node> p: graph.getSuccessors(node))
                inDegree.merge(p.node(), 1, Integer::sum);
        }

        Deque<Node> ready = new ArrayDeque<>();
        for (var e: inDegree.entrySet())
            if (e.getValue() == 0)
                ready.add(e.getKey());
        this.order = new ArrayList<>(inDegree.size());
        while (!ready.isEmpty()) {
            Node node = ready.removeFirst();
            this.order.add(node);
            for (Port<Node> p: graph.getSuccessors(node)) {
                int degree = inDegree.merge(p.node(), -1, Integer::sum);
                if (degree == 0)
                    ready.add(p.node());
            }
        }

        this.remaining = new ArrayList<>();
        for (var e: inDegree.entrySet())
            if (e.getValue() > 0)
                this.remaining.add(e.getKey());
    }

    public boolean isComplete() {
        return this.remaining.isEmpty();
    }

    /** The sorted nodes; when the graph has cycles only the acyclic prefix. */
    public List<Node> getOrder() {
        return Collections.unmodifiableList(this.order);
    }

    /** Nodes that could not be ordered because they are on or after a cycle. */
    public List<Node> getRemaining() {
        return Collections.unmodifiableList(this.remaining);
    }
}
