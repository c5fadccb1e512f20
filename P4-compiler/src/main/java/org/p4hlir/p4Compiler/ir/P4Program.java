/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.p4hlir.p4Compiler.ir;

import org.p4hlir.p4Compiler.compiler.errors.StructuralError;
import org.p4hlir.util.Utilities;

import javax.annotation.Nullable;
import java.util.List;

/** The high-level intermediate representation of a P4 program.
 * Entities are kept in ordered containers; the order is the declaration order
 * and determines iteration order everywhere.  After {@link #freeze()} the
 * program is read-only. */
public final class P4Program {
    /** Name of the source the program was produced from; for messages. */
    public final String sourceName;
    public final NamedCollection<HeaderType> headerTypes = new NamedCollection<>("header type");
    public final NamedCollection<HeaderInstance> instances = new NamedCollection<>("header instance");
    public final NamedCollection<P4Action> actions = new NamedCollection<>("action");
    public final NamedCollection<P4Table> tables = new NamedCollection<>("table");
    public final NamedCollection<P4Conditional> conditionals = new NamedCollection<>("conditional");
    public final NamedCollection<ParseState> parseStates = new NamedCollection<>("parse state");
    public final NamedCollection<P4Pipeline> pipelines = new NamedCollection<>("control");
    boolean frozen = false;

    public P4Program(String sourceName) {
        this.sourceName = sourceName;
    }

    public P4Program add(HeaderType type) {
        this.headerTypes.add(type);
        return this;
    }

    public P4Program add(HeaderInstance instance) {
        this.instances.add(instance);
        return this;
    }

    public P4Program add(P4Action action) {
        this.actions.add(action);
        return this;
    }

    public P4Program add(P4Table table) {
        if (this.conditionals.contains(table.name))
            throw new StructuralError("Table " + Utilities.singleQuote(table.name) +
                    " has the same name as a conditional", List.of(table.name));
        this.tables.add(table);
        return this;
    }

    public P4Program add(P4Conditional conditional) {
        if (this.tables.contains(conditional.name))
            throw new StructuralError("Conditional " + Utilities.singleQuote(conditional.name) +
                    " has the same name as a table", List.of(conditional.name));
        this.conditionals.add(conditional);
        return this;
    }

    public P4Program add(ParseState state) {
        this.parseStates.add(state);
        return this;
    }

    public P4Program add(P4Pipeline pipeline) {
        this.pipelines.add(pipeline);
        return this;
    }

    /** Make the program read-only.  Returns this. */
    public P4Program freeze() {
        this.frozen = true;
        this.headerTypes.freeze();
        this.instances.freeze();
        this.actions.freeze();
        this.tables.freeze();
        this.conditionals.freeze();
        this.parseStates.freeze();
        this.pipelines.freeze();
        return this;
    }

    public boolean isFrozen() {
        return this.frozen;
    }

    /** The table or conditional with the specified name, or null. */
    @Nullable
    public IControlNode getControlNode(String name) {
        P4Table table = this.tables.get(name);
        if (table != null)
            return table;
        return this.conditionals.get(name);
    }

    public boolean isDeclared(String instance) {
        return this.instances.contains(instance);
    }

    /** Check that a reference names a declared instance and field.
     * @throws StructuralError if it does not. */
    public void checkReference(FieldRef ref, String usedBy) {
        HeaderInstance instance = this.instances.get(ref.instance);
        if (instance == null)
            throw new StructuralError(usedBy + " refers to undeclared header instance " +
                    Utilities.singleQuote(ref.instance), List.of(usedBy, ref.toString()));
        if (ref.index >= 0 && (!instance.isStack() || ref.index >= instance.stackSize))
            throw new StructuralError(usedBy + " uses index " + ref.index + " outside of " +
                    Utilities.singleQuote(instance.name), List.of(usedBy, ref.toString()));
        if (ref.field != null && !ref.isValidBit() && !instance.type.hasField(ref.field))
            throw new StructuralError(usedBy + " refers to undeclared field " +
                    Utilities.singleQuote(ref.toString()), List.of(usedBy, ref.toString()));
    }

    /** Width in bits of the storage a reference denotes; null for unknown instances. */
    @Nullable
    public Integer getWidth(FieldRef ref) {
        HeaderInstance instance = this.instances.get(ref.instance);
        if (instance == null)
            return null;
        if (ref.isValidBit())
            return 1;
        if (ref.field == null)
            return instance.type.totalWidth();
        return instance.type.getWidth(ref.field);
    }

    @Override
    public String toString() {
        return "P4Program(" + this.sourceName + ")";
    }
}
