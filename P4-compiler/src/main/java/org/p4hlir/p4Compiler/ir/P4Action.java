package org.p4hlir.p4Compiler.ir;

import java.util.List;

/** A compound action: a sequence of calls to primitives or to other actions. */
public final class P4Action implements IHasName {
    /** A runtime parameter supplied by the control plane. */
    public record Param(String name, int width) {}

    /** One call in the action body.  Arguments are kept as source text:
     * field references, parameter names or constants. */
    public record Call(String callee, List<String> arguments) {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String toString() {
            return this.callee + "(" + String.join(", ", this.arguments) + ")";
        }
    }

    public final String name;
    public final List<Param> params;
    public final List<Call> calls;

    public P4Action(String name, List<Param> params, List<Call> calls) {
        this.name = name;
        this.params = List.copyOf(params);
        this.calls = List.copyOf(calls);
    }

    @Override
    public String getName() {
        return this.name;
    }

    public boolean isParameter(String argument) {
        for (Param p: this.params)
            if (p.name().equals(argument))
                return true;
        return false;
    }

    /** Width in bits of the action data supplied by a table entry. */
    public int dataWidth() {
        int result = 0;
        for (Param p: this.params)
            result += p.width();
        return result;
    }

    @Override
    public String toString() {
        return "action " + this.name + this.calls;
    }
}
