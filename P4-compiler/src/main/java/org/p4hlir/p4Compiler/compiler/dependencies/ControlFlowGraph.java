package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.p4Compiler.compiler.errors.StructuralError;
import org.p4hlir.p4Compiler.ir.IControlNode;
import org.p4hlir.p4Compiler.ir.P4Pipeline;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Linq;
import org.p4hlir.util.Logger;
import org.p4hlir.util.Utilities;
import org.p4hlir.util.graph.DiGraph;
import org.p4hlir.util.graph.Port;
import org.p4hlir.util.graph.SCC;
import org.p4hlir.util.graph.TopologicalOrder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The control-flow graph of one pipeline, restricted to the tables and conditionals
 * reachable from its roots.  Construction fails with a {@link StructuralError} when
 * a branch names an undeclared node or when the graph has a cycle.
 */
public class ControlFlowGraph implements DiGraph<IControlNode>, IWritesLogs {
    public final P4Pipeline pipeline;
    /** Nodes in the order they are discovered from the roots. */
    final Map<String, IControlNode> nodes;
    final Map<IControlNode, List<Port<IControlNode>>> successors;
    final Map<IControlNode, List<Port<IControlNode>>> predecessors;
    /** Program order: a topological order of the nodes. */
    final List<IControlNode> order;
    /** Position of each node in {@link #order}. */
    final Map<IControlNode, Integer> position;
    /** reachable[i] has bit j set iff order[j] is reachable from order[i] by a non-empty path. */
    final BitSet[] reachable;

    public ControlFlowGraph(P4Program program, P4Pipeline pipeline) {
        this.pipeline = pipeline;
        this.nodes = new LinkedHashMap<>();
        this.successors = new HashMap<>();
        this.predecessors = new HashMap<>();

        Deque<IControlNode> work = new ArrayDeque<>();
        for (String root: pipeline.roots)
            work.add(this.lookup(program, root, "Control " + Utilities.singleQuote(pipeline.name)));
        while (!work.isEmpty()) {
            IControlNode node = work.removeFirst();
            if (this.successors.containsKey(node))
                continue;
            this.nodes.put(node.getName(), node);
            List<Port<IControlNode>> next = new ArrayList<>();
            for (IControlNode.Successor successor: node.getSuccessors()) {
                if (successor.next() == null)
                    continue;
                IControlNode target = this.lookup(program, successor.next(), node.toString());
                if (Linq.any(next, p -> p.node() == target))
                    continue;
                next.add(new Port<>(target, next.size()));
                this.predecessors.computeIfAbsent(target, k -> new ArrayList<>())
                        .add(new Port<>(node, 0));
                work.add(target);
            }
            this.successors.put(node, next);
        }

        this.checkAcyclic();
        TopologicalOrder<IControlNode> topo = new TopologicalOrder<>(this);
        Utilities.enforce(topo.isComplete());
        this.order = topo.getOrder();
        this.position = new HashMap<>();
        for (int i = 0; i < this.order.size(); i++)
            this.position.put(this.order.get(i), i);
        this.reachable = this.computeReachability();
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Control ")
                .append(pipeline.name)
                .append(" has ")
                .append(this.order.size())
                .append(" nodes")
                .newline();
    }

    IControlNode lookup(P4Program program, String name, String usedBy) {
        IControlNode result = program.getControlNode(name);
        if (result == null)
            throw new StructuralError(usedBy + " refers to undeclared table or conditional " +
                    Utilities.singleQuote(name), List.of(usedBy, name));
        return result;
    }

    void checkAcyclic() {
        SCC<IControlNode> scc = new SCC<>(this.reverse(), this);
        List<List<IControlNode>> cycles = scc.cyclicComponents(this);
        if (cycles.isEmpty())
            return;
        List<String> names = Linq.map(cycles.get(0), IControlNode::getName);
        throw new StructuralError("Control " + Utilities.singleQuote(this.pipeline.name) +
                " contains a control-flow cycle through " + String.join(", ", names), names);
    }

    BitSet[] computeReachability() {
        int size = this.order.size();
        BitSet[] result = new BitSet[size];
        for (int i = size - 1; i >= 0; i--) {
            BitSet set = new BitSet(size);
            for (Port<IControlNode> p: this.getSuccessors(this.order.get(i))) {
                int j = this.position.get(p.node());
                set.set(j);
                set.or(result[j]);
            }
            result[i] = set;
        }
        return result;
    }

    /** The graph with all edges reversed. */
    public DiGraph<IControlNode> reverse() {
        ControlFlowGraph self = this;
        return new DiGraph<>() {
            @Override
            public Iterable<IControlNode> getNodes() {
                return self.nodes.values();
            }

            @Override
            public List<Port<IControlNode>> getSuccessors(IControlNode node) {
                return self.predecessors.getOrDefault(node, Collections.emptyList());
            }
        };
    }

    @Override
    public Iterable<IControlNode> getNodes() {
        return this.nodes.values();
    }

    @Override
    public List<Port<IControlNode>> getSuccessors(IControlNode node) {
        return this.successors.getOrDefault(node, Collections.emptyList());
    }

    /** Nodes in program order. */
    public List<IControlNode> getProgramOrder() {
        return this.order;
    }

    public int size() {
        return this.order.size();
    }

    public int getPosition(IControlNode node) {
        return Utilities.getExists(this.position, node);
    }

    /** True if {@code to} can execute after {@code from} on some path. */
    public boolean reaches(IControlNode from, IControlNode to) {
        return this.reachable[this.getPosition(from)].get(this.getPosition(to));
    }

    /** Positions in program order of all nodes reachable from the node at {@code position}. */
    public BitSet reachableFrom(int position) {
        return (BitSet) this.reachable[position].clone();
    }
}
