package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.p4Compiler.ir.IControlNode;

/** A node of a {@link DependencyGraph}: one table, conditional, or table phase. */
public final class Event {
    /** Position in the owning graph; events are numbered in program order. */
    public final int index;
    public final IControlNode node;
    public final EventRole role;

    Event(int index, IControlNode node, EventRole role) {
        this.index = index;
        this.node = node;
        this.role = role;
    }

    /** The node name, qualified by the phase in split graphs, e.g. {@code ipv4_lpm.match}. */
    public String getName() {
        if (this.role.suffix.isEmpty())
            return this.node.getName();
        return this.node.getName() + "." + this.role.suffix;
    }

    /** True if both events come from the same control node. */
    public boolean sameNode(Event other) {
        return this.node == other.node;
    }

    @Override
    public String toString() {
        return this.getName();
    }
}
