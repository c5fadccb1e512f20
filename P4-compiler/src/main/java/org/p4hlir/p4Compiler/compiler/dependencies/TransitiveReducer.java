package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Logger;
import org.p4hlir.util.Utilities;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes every edge (u, w) of an acyclic graph for which w is reachable from u
 * through some other path.  Reachability is preserved, and the result of reducing
 * a reduced graph is the same graph.
 *
 * <p>Only whole-table graphs are reduced; in split graphs the direct
 * action-to-match edges carry the scheduling information.
 */
public class TransitiveReducer implements IWritesLogs {
    public DependencyGraph reduce(DependencyGraph graph) {
        Utilities.enforce(!graph.split, "Transitive reduction of split graph " + graph.name);
        List<Event> order = graph.topologicalOrder();
        int size = graph.getEventCount();
        int[] position = new int[size];
        for (int i = 0; i < order.size(); i++)
            position[order.get(i).index] = i;

        // reach[v] has the indexes of events reachable from v in the reduced graph
        BitSet[] reach = new BitSet[size];
        Set<DependencyEdge> kept = new HashSet<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            Event event = order.get(i);
            List<DependencyEdge> outgoing = new ArrayList<>(graph.getOutgoing(event));
            outgoing.sort(Comparator.comparingInt(e -> position[e.target.index]));
            BitSet set = new BitSet(size);
            for (DependencyEdge edge: outgoing) {
                int target = edge.target.index;
                if (set.get(target))
                    continue;
                kept.add(edge);
                set.set(target);
                set.or(reach[target]);
            }
            reach[event.index] = set;
        }

        DependencyGraph result = graph.withoutEdges();
        // Keep the original edge order
        for (DependencyEdge edge: graph.getEdges()) {
            if (kept.contains(edge))
                result.addEdge(result.getEvent(edge.source.index), result.getEvent(edge.target.index),
                        edge.kind, edge.fields);
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Reduced ")
                .append(graph.name)
                .append(" from ")
                .append(graph.getEdgeCount())
                .append(" to ")
                .append(result.getEdgeCount())
                .append(" edges")
                .newline();
        return result;
    }
}
