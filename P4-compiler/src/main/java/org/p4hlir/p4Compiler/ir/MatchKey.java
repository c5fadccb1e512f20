package org.p4hlir.p4Compiler.ir;

import javax.annotation.Nullable;

/** One component of a table's search key.
 * @param field  Field (or header, for {@link MatchType#VALID}) that is matched.
 * @param type   Kind of match.
 * @param mask   Optional mask applied to the field before matching. */
public record MatchKey(FieldRef field, MatchType type, @Nullable Long mask) {
    /** The field the table actually reads: valid-matches read the validity bit. */
    public FieldRef readField() {
        if (this.type == MatchType.VALID && this.field.isWholeHeader())
            return new FieldRef(this.field.instance, this.field.index, FieldRef.VALID);
        return this.field;
    }

    @Override
    public String toString() {
        return this.field + " : " + this.type +
                (this.mask != null ? " mask 0x" + Long.toHexString(this.mask) : "");
    }
}
