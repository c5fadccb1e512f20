package org.p4hlir.p4Compiler.ir;

import java.util.List;

/** A primitive action, as described by a primitive-definition document. */
public final class Primitive implements IHasName {
    public record Parameter(String name, AccessMode access) {}

    public final String name;
    public final List<Parameter> parameters;

    public Primitive(String name, List<Parameter> parameters) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
    }

    @Override
    public String getName() {
        return this.name;
    }

    /** Access mode for the argument at the specified position.
     * Arguments past the declared parameters are treated as reads. */
    public AccessMode getAccess(int position) {
        if (position < this.parameters.size())
            return this.parameters.get(position).access();
        return AccessMode.READ;
    }

    @Override
    public String toString() {
        return "primitive " + this.name + this.parameters;
    }
}
