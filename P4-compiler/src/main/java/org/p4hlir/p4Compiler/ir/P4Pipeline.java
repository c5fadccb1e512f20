package org.p4hlir.p4Compiler.ir;

import java.util.List;

/** A control function applied to every packet, such as ingress or egress.
 * Control starts at each root in turn; roots are not ordered with respect to each other. */
public final class P4Pipeline implements IHasName {
    public final String name;
    public final List<String> roots;

    public P4Pipeline(String name, List<String> roots) {
        this.name = name;
        this.roots = List.copyOf(roots);
    }

    @Override
    public String getName() {
        return this.name;
    }

    public boolean isEmpty() {
        return this.roots.isEmpty();
    }

    @Override
    public String toString() {
        return "control " + this.name + this.roots;
    }
}
