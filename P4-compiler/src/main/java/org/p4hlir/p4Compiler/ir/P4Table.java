package org.p4hlir.p4Compiler.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** A match-action table. */
public final class P4Table implements IControlNode {
    public final String name;
    public final List<MatchKey> keys;
    /** Names of the candidate actions, in declaration order. */
    public final List<String> actions;
    public final List<Successor> successors;
    public final int minSize;
    public final int maxSize;

    public P4Table(String name, List<MatchKey> keys, List<String> actions,
                   List<Successor> successors, int minSize, int maxSize) {
        this.name = name;
        this.keys = List.copyOf(keys);
        this.actions = List.copyOf(actions);
        this.successors = List.copyOf(successors);
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public List<Successor> getSuccessors() {
        return this.successors;
    }

    @Override
    public Collection<FieldRef> getDecisionReads() {
        List<FieldRef> result = new ArrayList<>(this.keys.size());
        for (MatchKey key: this.keys)
            result.add(key.readField());
        return result;
    }

    @Override
    public String toString() {
        return "table " + this.name;
    }
}
