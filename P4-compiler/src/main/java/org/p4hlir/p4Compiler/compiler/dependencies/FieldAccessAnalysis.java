package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.p4Compiler.compiler.errors.StructuralError;
import org.p4hlir.p4Compiler.ir.AccessMode;
import org.p4hlir.p4Compiler.ir.FieldRef;
import org.p4hlir.p4Compiler.ir.P4Action;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.p4Compiler.ir.P4Table;
import org.p4hlir.p4Compiler.ir.Primitive;
import org.p4hlir.p4Compiler.ir.PrimitiveTable;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Logger;
import org.p4hlir.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Computes the read and write sets of actions from the access modes of the primitives they call. */
public class FieldAccessAnalysis implements IWritesLogs {
    final P4Program program;
    final PrimitiveTable primitives;
    final Map<String, ActionEffects> effects;
    /** Actions whose effects are being computed; used to detect recursive calls. */
    final List<String> inProgress;

    public FieldAccessAnalysis(P4Program program, PrimitiveTable primitives) {
        this.program = program;
        this.primitives = primitives;
        this.effects = new HashMap<>();
        this.inProgress = new ArrayList<>();
    }

    /** Effects of the action with the specified name.
     * @throws StructuralError if the action is undeclared or its accesses cannot be determined. */
    public ActionEffects getEffects(String actionName) {
        ActionEffects result = this.effects.get(actionName);
        if (result != null)
            return result;
        if (this.inProgress.contains(actionName)) {
            List<String> cycle = new ArrayList<>(this.inProgress.subList(
                    this.inProgress.indexOf(actionName), this.inProgress.size()));
            cycle.add(actionName);
            throw new StructuralError("Recursive action calls: " + String.join(" -> ", cycle), cycle);
        }
        P4Action action = this.program.actions.getExists(actionName);
        this.inProgress.add(actionName);
        result = this.compute(action);
        Utilities.enforce(this.inProgress.remove(this.inProgress.size() - 1).equals(actionName));
        Utilities.putNew(this.effects, actionName, result);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Action ")
                .append(actionName)
                .append(" ")
                .append(result.toString())
                .newline();
        return result;
    }

    /** Union of the effects of all candidate actions of a table. */
    public ActionEffects getEffects(P4Table table) {
        ActionEffects result = ActionEffects.NONE;
        for (String action: table.actions) {
            if (!this.program.actions.contains(action))
                throw new StructuralError("Table " + Utilities.singleQuote(table.name) +
                        " refers to undeclared action " + Utilities.singleQuote(action),
                        List.of(table.name, action));
            result = result.union(this.getEffects(action));
        }
        return result;
    }

    /** The field an argument denotes, or null if it is a parameter, a constant,
     * or the name of some other stateful object. */
    @Nullable
    FieldRef resolveArgument(P4Action action, String argument, boolean written) {
        if (action.isParameter(argument))
            return null;
        FieldRef ref = FieldRef.parse(argument);
        if (ref == null) {
            if (FieldRef.hasReferenceSyntax(argument))
                throw new StructuralError("Action " + Utilities.singleQuote(action.name) +
                        " uses an unsupported stack index in " + Utilities.singleQuote(argument),
                        List.of(action.name, argument));
            return null;
        }
        if (!this.program.isDeclared(ref.instance)) {
            if (written)
                throw new StructuralError("Action " + Utilities.singleQuote(action.name) +
                        " writes " + Utilities.singleQuote(argument) +
                        ", which is neither a field nor a parameter", List.of(action.name, argument));
            // counters, registers, field lists and similar are not fields
            return null;
        }
        this.program.checkReference(ref, "Action " + Utilities.singleQuote(action.name));
        return ref;
    }

    ActionEffects compute(P4Action action) {
        Set<FieldRef> reads = new LinkedHashSet<>();
        Set<FieldRef> writes = new LinkedHashSet<>();
        for (P4Action.Call call: action.calls) {
            Primitive primitive = this.primitives.get(call.callee());
            if (primitive != null) {
                for (int i = 0; i < call.arguments().size(); i++) {
                    AccessMode access = primitive.getAccess(i);
                    FieldRef ref = this.resolveArgument(action, call.arguments().get(i), access.writes());
                    if (ref == null)
                        continue;
                    if (access.reads())
                        reads.add(ref);
                    if (access.writes())
                        writes.add(ref);
                }
                continue;
            }
            if (this.program.actions.contains(call.callee())) {
                ActionEffects callee = this.getEffects(call.callee());
                reads.addAll(callee.reads);
                writes.addAll(callee.writes);
                // The callee may use a field argument either way
                for (String argument: call.arguments()) {
                    FieldRef ref = this.resolveArgument(action, argument, false);
                    if (ref != null) {
                        reads.add(ref);
                        writes.add(ref);
                    }
                }
                continue;
            }
            throw new StructuralError("Action " + Utilities.singleQuote(action.name) +
                    " calls " + Utilities.singleQuote(call.callee()) +
                    ", which is neither a primitive nor an action", List.of(action.name, call.callee()));
        }
        return new ActionEffects(reads, writes);
    }
}
