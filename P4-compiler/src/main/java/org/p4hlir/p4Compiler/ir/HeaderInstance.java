package org.p4hlir.p4Compiler.ir;

/** A header or metadata instance, possibly a header stack. */
public final class HeaderInstance implements IHasName {
    public final String name;
    public final HeaderType type;
    public final boolean metadata;
    /** Number of elements for a header stack; 0 for a plain instance. */
    public final int stackSize;

    public HeaderInstance(String name, HeaderType type, boolean metadata, int stackSize) {
        this.name = name;
        this.type = type;
        this.metadata = metadata;
        this.stackSize = stackSize;
    }

    @Override
    public String getName() {
        return this.name;
    }

    public boolean isStack() {
        return this.stackSize > 0;
    }

    @Override
    public String toString() {
        return (this.metadata ? "metadata " : "header ") + this.type.name + " " + this.name +
                (this.isStack() ? "[" + this.stackSize + "]" : "");
    }
}
