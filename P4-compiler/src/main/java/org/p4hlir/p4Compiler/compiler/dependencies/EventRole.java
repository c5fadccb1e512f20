package org.p4hlir.p4Compiler.compiler.dependencies;

/** What part of a control node an {@link Event} stands for. */
public enum EventRole {
    /** A whole table application: match and action together. */
    TABLE(""),
    /** The lookup phase of a table. */
    MATCH("match"),
    /** The action execution phase of a table. */
    ACTION("action"),
    CONDITIONAL("");

    public final String suffix;

    EventRole(String suffix) {
        this.suffix = suffix;
    }
}
