package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.p4Compiler.ir.FieldRef;
import org.p4hlir.p4Compiler.ir.IControlNode;
import org.p4hlir.p4Compiler.ir.P4Pipeline;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.p4Compiler.ir.P4Table;
import org.p4hlir.p4Compiler.ir.PrimitiveTable;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Logger;
import org.p4hlir.util.Utilities;

import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds the dependency graph of a pipeline.
 *
 * <p>For every pair of nodes (A, B) where B can execute after A, there is an edge
 * from A to B.  It is a field edge if B decides what to do based on a field that
 * an action of A may write, and a control-flow edge otherwise.
 *
 * <p>In split graphs a table contributes a match event and an action event, joined
 * by an internal edge.  Dependencies leave from the action event and arrive at the
 * match event; when only the action bodies of B read what A writes, the edge goes
 * from the action of A to the action of B.
 */
public class DependencyGraphBuilder implements IWritesLogs {
    final P4Program program;
    final FieldAccessAnalysis accesses;

    public DependencyGraphBuilder(P4Program program, PrimitiveTable primitives) {
        this.program = program;
        this.accesses = new FieldAccessAnalysis(program, primitives);
    }

    /** Build the graph with one event per table. */
    public DependencyGraph buildCoarse(P4Pipeline pipeline) {
        return this.build(pipeline, false);
    }

    /** Build the graph with separate match and action events. */
    public DependencyGraph buildFine(P4Pipeline pipeline) {
        return this.build(pipeline, true);
    }

    Collection<FieldRef> decisionReads(IControlNode node) {
        Collection<FieldRef> reads = node.getDecisionReads();
        for (FieldRef ref: reads)
            this.program.checkReference(ref, node.toString());
        return reads;
    }

    public DependencyGraph build(P4Pipeline pipeline, boolean split) {
        ControlFlowGraph cfg = new ControlFlowGraph(this.program, pipeline);
        List<IControlNode> order = cfg.getProgramOrder();
        int size = order.size();

        DependencyGraph graph = new DependencyGraph(pipeline.name, split);
        // Events where incoming decisions arrive, and events where writes leave
        Event[] entry = new Event[size];
        Event[] exit = new Event[size];
        ActionEffects[] effects = new ActionEffects[size];
        @SuppressWarnings("unchecked")
        Collection<FieldRef>[] decisions = new Collection[size];

        for (int i = 0; i < size; i++) {
            IControlNode node = order.get(i);
            if (node instanceof P4Table table) {
                effects[i] = this.accesses.getEffects(table);
                if (split) {
                    entry[i] = graph.addEvent(node, EventRole.MATCH);
                    exit[i] = graph.addEvent(node, EventRole.ACTION);
                    graph.addEdge(entry[i], exit[i], DependencyKind.CONTROL_FLOW, new TreeSet<>());
                } else {
                    entry[i] = exit[i] = graph.addEvent(node, EventRole.TABLE);
                }
            } else {
                effects[i] = ActionEffects.NONE;
                entry[i] = exit[i] = graph.addEvent(node, EventRole.CONDITIONAL);
            }
            decisions[i] = this.decisionReads(node);
        }

        for (int i = 0; i < size; i++) {
            Set<FieldRef> writes = effects[i].writes;
            BitSet later = cfg.reachableFrom(i);
            for (int j = later.nextSetBit(0); j >= 0; j = later.nextSetBit(j + 1)) {
                SortedSet<FieldRef> fields = FieldOverlap.overlap(writes, decisions[j]);
                DependencyKind kind = fields.isEmpty() ? DependencyKind.CONTROL_FLOW : DependencyKind.FIELD;
                graph.addEdge(exit[i], entry[j], kind, fields);
                if (split && entry[j] != exit[j]) {
                    SortedSet<FieldRef> actionFields = FieldOverlap.overlap(writes, effects[j].reads);
                    if (!actionFields.isEmpty())
                        graph.addEdge(exit[i], exit[j], DependencyKind.FIELD, actionFields);
                }
            }
        }

        Utilities.enforce(graph.getEventCount() == (split ? size + this.tableCount(order) : size));
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Built ")
                .append(split ? "split" : "table")
                .append(" dependency graph for ")
                .append(pipeline.name)
                .append(": ")
                .append(graph.getEventCount())
                .append(" events, ")
                .append(graph.getEdgeCount())
                .append(" edges")
                .newline();
        Logger.INSTANCE.belowLevel(this, 3)
                .append(graph);
        return graph;
    }

    int tableCount(List<IControlNode> nodes) {
        int result = 0;
        for (IControlNode node: nodes)
            if (node instanceof P4Table)
                result++;
        return result;
    }
}
