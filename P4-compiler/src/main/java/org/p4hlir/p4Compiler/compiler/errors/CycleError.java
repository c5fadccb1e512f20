package org.p4hlir.p4Compiler.compiler.errors;

import java.util.List;

/** A dependency graph could not be ordered topologically.
 * Graph construction never produces cycles, so this is an internal consistency failure. */
public final class CycleError extends BaseCompilerException {
    /** Events that are on, or depend on, a cycle. */
    public final List<String> events;

    public CycleError(List<String> events) {
        super("Dependency graph contains a cycle through " + String.join(", ", events));
        this.events = List.copyOf(events);
    }

    @Override
    public String getErrorKind() {
        return "Compiler error";
    }
}
