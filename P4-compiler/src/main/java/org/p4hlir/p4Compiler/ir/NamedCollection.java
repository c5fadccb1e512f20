package org.p4hlir.p4Compiler.ir;

import org.p4hlir.p4Compiler.compiler.errors.StructuralError;
import org.p4hlir.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** An ordered name-to-entity container.  Iteration follows insertion order.
 * Once the owning program is built the collection is frozen. */
public final class NamedCollection<T extends IHasName> implements Iterable<T> {
    /** Describes the kind of entity, used in error messages. */
    public final String kind;
    private final Map<String, T> entries;
    private boolean frozen;

    public NamedCollection(String kind) {
        this.kind = kind;
        this.entries = new LinkedHashMap<>();
        this.frozen = false;
    }

    /** Add a new entity; names must be unique. */
    public T add(T entity) {
        Utilities.enforce(!this.frozen, "Adding " + entity.getName() + " to frozen " + this.kind + " collection");
        if (this.entries.containsKey(entity.getName()))
            throw new StructuralError("Duplicate " + this.kind + " " +
                    Utilities.singleQuote(entity.getName()), List.of(entity.getName()));
        return Utilities.putNew(this.entries, entity.getName(), entity);
    }

    void freeze() {
        this.frozen = true;
    }

    @Nullable
    public T get(String name) {
        return this.entries.get(name);
    }

    /** Get an entity that must exist.
     * @throws StructuralError if there is no entity with this name. */
    public T getExists(String name) {
        T result = this.entries.get(name);
        if (result == null)
            throw new StructuralError("Reference to undeclared " + this.kind + " " +
                    Utilities.singleQuote(name), List.of(name));
        return result;
    }

    public boolean contains(String name) {
        return this.entries.containsKey(name);
    }

    public int size() {
        return this.entries.size();
    }

    public boolean isEmpty() {
        return this.entries.isEmpty();
    }

    public List<T> values() {
        return Collections.unmodifiableList(new ArrayList<>(this.entries.values()));
    }

    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableCollection(this.entries.values()).iterator();
    }

    @Override
    public String toString() {
        return this.kind + this.entries.keySet();
    }
}
