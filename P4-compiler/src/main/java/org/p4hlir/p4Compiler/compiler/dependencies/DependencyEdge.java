package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.p4Compiler.ir.FieldRef;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/** A dependency from {@code source} to {@code target}.
 * Field edges carry the fields that give rise to them; control-flow edges carry none. */
public final class DependencyEdge {
    public final Event source;
    public final Event target;
    public final DependencyKind kind;
    public final SortedSet<FieldRef> fields;

    public DependencyEdge(Event source, Event target, DependencyKind kind, SortedSet<FieldRef> fields) {
        this.source = source;
        this.target = target;
        this.kind = kind;
        this.fields = Collections.unmodifiableSortedSet(new TreeSet<>(fields));
    }

    /** True for the edge between the phases of a single table. */
    public boolean isInternal() {
        return this.source.sameNode(this.target);
    }

    /** An edge with the same endpoints carrying the fields of both edges;
     * a field edge takes precedence over a control-flow edge. */
    DependencyEdge merge(DependencyEdge other) {
        SortedSet<FieldRef> fields = new TreeSet<>(this.fields);
        fields.addAll(other.fields);
        DependencyKind kind = this.kind == DependencyKind.FIELD || other.kind == DependencyKind.FIELD ?
                DependencyKind.FIELD : DependencyKind.CONTROL_FLOW;
        return new DependencyEdge(this.source, this.target, kind, fields);
    }

    @Override
    public String toString() {
        String result = this.source + " -> " + this.target + " [" + this.kind + "]";
        if (!this.fields.isEmpty())
            result += " " + this.fields;
        return result;
    }
}
