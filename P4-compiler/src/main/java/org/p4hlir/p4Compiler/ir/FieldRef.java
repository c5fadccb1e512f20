package org.p4hlir.p4Compiler.ir;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Identifies a field, a whole header, or the validity bit of a header.
 * Two references may denote the same storage even when they are not equal;
 * see {@link #mayOverlap}. */
public final class FieldRef implements Comparable<FieldRef> {
    /** The reference does not index a header stack (or names the whole stack). */
    public static final int NO_INDEX = -1;
    /** Symbolic stack index ({@code next} or {@code last}) resolved at runtime. */
    public static final int ANY_INDEX = -2;
    /** Pseudo-field naming the validity bit of a header. */
    public static final String VALID = "$valid";

    static final Pattern SYNTAX = Pattern.compile(
            "([A-Za-z_][A-Za-z0-9_]*)(?:\\[(\\d+|next|last)])?(?:\\.([A-Za-z_][A-Za-z0-9_]*))?");
    static final Pattern VALID_SYNTAX = Pattern.compile("valid\\((.+)\\)");

    public final String instance;
    public final int index;
    /** Field name; null when the reference denotes the whole header. */
    @Nullable
    public final String field;

    public FieldRef(String instance, int index, @Nullable String field) {
        this.instance = instance;
        this.index = index;
        this.field = field;
    }

    public static FieldRef field(String instance, String field) {
        return new FieldRef(instance, NO_INDEX, field);
    }

    public static FieldRef header(String instance) {
        return new FieldRef(instance, NO_INDEX, null);
    }

    /** Parse the textual form: {@code ipv4.ttl}, {@code vlan[1].vid}, {@code vlan[next]},
     * {@code ipv4} or {@code valid(ipv4)}.
     * @return null if the text is not syntactically a reference. */
    @Nullable
    public static FieldRef parse(String text) {
        String trimmed = text.trim();
        Matcher valid = VALID_SYNTAX.matcher(trimmed);
        if (valid.matches()) {
            FieldRef header = parse(valid.group(1));
            if (header == null || header.field != null)
                return null;
            return new FieldRef(header.instance, header.index, VALID);
        }
        Matcher matcher = SYNTAX.matcher(trimmed);
        if (!matcher.matches())
            return null;
        int index = NO_INDEX;
        String indexText = matcher.group(2);
        if (indexText != null) {
            if (indexText.equals("next") || indexText.equals("last"))
                index = ANY_INDEX;
            else {
                try {
                    index = Integer.parseInt(indexText);
                } catch (NumberFormatException unused) {
                    // larger than any stack
                    return null;
                }
            }
        }
        return new FieldRef(matcher.group(1), index, matcher.group(3));
    }

    /** True if the text has the shape of a reference, even when {@link #parse} rejects its index. */
    public static boolean hasReferenceSyntax(String text) {
        String trimmed = text.trim();
        return SYNTAX.matcher(trimmed).matches() || VALID_SYNTAX.matcher(trimmed).matches();
    }

    public boolean isWholeHeader() {
        return this.field == null;
    }

    public boolean isValidBit() {
        return VALID.equals(this.field);
    }

    /** The same reference without a field: the header that contains this field. */
    public FieldRef getHeader() {
        return new FieldRef(this.instance, this.index, null);
    }

    static boolean indexesMayAlias(int left, int right) {
        return left == right || left < 0 || right < 0;
    }

    /** True if the two references may denote overlapping storage.
     * A whole-header reference overlaps all its fields, including the validity bit;
     * an unindexed or symbolic stack reference overlaps every element. */
    public boolean mayOverlap(FieldRef other) {
        if (!this.instance.equals(other.instance))
            return false;
        if (!indexesMayAlias(this.index, other.index))
            return false;
        return this.field == null || other.field == null || this.field.equals(other.field);
    }

    @Override
    public int compareTo(FieldRef other) {
        return this.toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldRef that = (FieldRef) o;
        return this.index == that.index &&
                this.instance.equals(that.instance) &&
                Objects.equals(this.field, that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.instance, this.index, this.field);
    }

    @Override
    public String toString() {
        String header = this.instance;
        if (this.index == ANY_INDEX)
            header += "[*]";
        else if (this.index >= 0)
            header += "[" + this.index + "]";
        if (this.field == null)
            return header;
        if (this.isValidBit())
            return "valid(" + header + ")";
        return header + "." + this.field;
    }
}
