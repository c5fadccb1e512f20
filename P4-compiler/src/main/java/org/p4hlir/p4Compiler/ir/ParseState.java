package org.p4hlir.p4Compiler.ir;

import java.util.List;

/** A state of the packet parser. */
public final class ParseState implements IHasName {
    public record MetadataAssignment(FieldRef destination, String source) {}

    /** A select case; {@code next} names a parse state or a pipeline. */
    public record Transition(String value, String next) {}

    public final String name;
    public final List<FieldRef> extracts;
    public final List<MetadataAssignment> assignments;
    public final List<FieldRef> select;
    public final List<Transition> transitions;

    public ParseState(String name, List<FieldRef> extracts, List<MetadataAssignment> assignments,
                      List<FieldRef> select, List<Transition> transitions) {
        this.name = name;
        this.extracts = List.copyOf(extracts);
        this.assignments = List.copyOf(assignments);
        this.select = List.copyOf(select);
        this.transitions = List.copyOf(transitions);
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public String toString() {
        return "parser " + this.name;
    }
}
