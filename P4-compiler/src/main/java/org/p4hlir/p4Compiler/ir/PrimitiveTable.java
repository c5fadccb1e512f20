package org.p4hlir.p4Compiler.ir;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The primitive actions known to the analyzer, by name.
 * Unlike a {@link NamedCollection} definitions can be replaced: supplementary
 * documents are merged over the built-in definitions. */
public final class PrimitiveTable {
    private final Map<String, Primitive> primitives = new LinkedHashMap<>();

    /** Add or replace a definition.
     * @return the previous definition with the same name, if any. */
    @Nullable
    public Primitive define(Primitive primitive) {
        return this.primitives.put(primitive.name, primitive);
    }

    /** Merge all definitions of another table into this one; later definitions win. */
    public void merge(PrimitiveTable other) {
        for (Primitive p: other.primitives.values())
            this.define(p);
    }

    @Nullable
    public Primitive get(String name) {
        return this.primitives.get(name);
    }

    public boolean contains(String name) {
        return this.primitives.containsKey(name);
    }

    public int size() {
        return this.primitives.size();
    }

    public List<Primitive> values() {
        return Collections.unmodifiableList(new ArrayList<>(this.primitives.values()));
    }
}
