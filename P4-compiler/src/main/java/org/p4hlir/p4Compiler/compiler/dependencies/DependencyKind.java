package org.p4hlir.p4Compiler.compiler.dependencies;

/** Why one event must follow another. */
public enum DependencyKind {
    /** Ordering only: the target executes after the source on some path. */
    CONTROL_FLOW("control"),
    /** The target may read a field that the source writes. */
    FIELD("field");

    public final String label;

    DependencyKind(String label) {
        this.label = label;
    }

    @Override
    public String toString() {
        return this.label;
    }
}
