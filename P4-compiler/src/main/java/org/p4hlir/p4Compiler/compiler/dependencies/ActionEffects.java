package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.p4Compiler.ir.FieldRef;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** The fields an action (or all the candidate actions of a table) may read and write. */
public final class ActionEffects {
    public static final ActionEffects NONE = new ActionEffects(Set.of(), Set.of());

    public final Set<FieldRef> reads;
    public final Set<FieldRef> writes;

    public ActionEffects(Set<FieldRef> reads, Set<FieldRef> writes) {
        this.reads = Collections.unmodifiableSet(new LinkedHashSet<>(reads));
        this.writes = Collections.unmodifiableSet(new LinkedHashSet<>(writes));
    }

    public ActionEffects union(ActionEffects other) {
        Set<FieldRef> reads = new LinkedHashSet<>(this.reads);
        reads.addAll(other.reads);
        Set<FieldRef> writes = new LinkedHashSet<>(this.writes);
        writes.addAll(other.writes);
        return new ActionEffects(reads, writes);
    }

    @Override
    public String toString() {
        return "reads " + this.reads + " writes " + this.writes;
    }
}
