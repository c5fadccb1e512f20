package org.p4hlir.p4Compiler.ir;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;

/** An if statement in a control function. */
public final class P4Conditional implements IControlNode {
    public final String name;
    /** Source text of the condition, used only for display. */
    public final String expression;
    public final List<FieldRef> reads;
    @Nullable
    public final String trueNext;
    @Nullable
    public final String falseNext;

    public P4Conditional(String name, String expression, List<FieldRef> reads,
                         @Nullable String trueNext, @Nullable String falseNext) {
        this.name = name;
        this.expression = expression;
        this.reads = List.copyOf(reads);
        this.trueNext = trueNext;
        this.falseNext = falseNext;
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public List<Successor> getSuccessors() {
        return List.of(new Successor("true", this.trueNext), new Successor("false", this.falseNext));
    }

    @Override
    public Collection<FieldRef> getDecisionReads() {
        return this.reads;
    }

    @Override
    public String toString() {
        return "if (" + this.expression + ")";
    }
}
