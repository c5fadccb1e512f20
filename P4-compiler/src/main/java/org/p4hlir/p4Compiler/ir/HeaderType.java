package org.p4hlir.p4Compiler.ir;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A header type: an ordered list of fields with bit widths. */
public final class HeaderType implements IHasName {
    public final String name;
    /** Field name to width in bits, in declaration order. */
    public final Map<String, Integer> fields;

    public HeaderType(String name, Map<String, Integer> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Nullable
    public Integer getWidth(String field) {
        return this.fields.get(field);
    }

    public boolean hasField(String field) {
        return this.fields.containsKey(field);
    }

    public int totalWidth() {
        int result = 0;
        for (int width: this.fields.values())
            result += width;
        return result;
    }

    @Override
    public String toString() {
        return "header_type " + this.name + this.fields;
    }
}
