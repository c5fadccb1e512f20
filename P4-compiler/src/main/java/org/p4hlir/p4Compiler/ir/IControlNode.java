package org.p4hlir.p4Compiler.ir;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;

/** A node of a control function: a table application or a conditional. */
public interface IControlNode extends IHasName {
    /** An outgoing control-flow branch.
     * @param label  What selects the branch: an action name, hit/miss, true/false.
     * @param next   The next control node; null when the branch leaves the control. */
    record Successor(String label, @Nullable String next) {}

    /** Branches in declaration order. */
    List<Successor> getSuccessors();

    /** Fields read to decide what to do: the search key or the condition. */
    Collection<FieldRef> getDecisionReads();
}
