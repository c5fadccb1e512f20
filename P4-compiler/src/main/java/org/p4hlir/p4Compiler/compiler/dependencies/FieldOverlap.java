package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.p4Compiler.ir.FieldRef;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;

/** May-overlap reasoning over explicit sets of field references.
 * All functions are pure; see {@link FieldRef#mayOverlap}. */
public final class FieldOverlap {
    private FieldOverlap() {}

    /** True if some written reference may overlap some read reference. */
    public static boolean mayOverlap(Collection<FieldRef> writes, Collection<FieldRef> reads) {
        for (FieldRef read: reads)
            for (FieldRef write: writes)
                if (write.mayOverlap(read))
                    return true;
        return false;
    }

    /** The read references that may observe a value written through {@code writes}.
     * The result is sorted, so it can be used directly for labels. */
    public static SortedSet<FieldRef> overlap(Collection<FieldRef> writes, Collection<FieldRef> reads) {
        SortedSet<FieldRef> result = new TreeSet<>();
        for (FieldRef read: reads) {
            for (FieldRef write: writes) {
                if (write.mayOverlap(read)) {
                    result.add(read);
                    break;
                }
            }
        }
        return result;
    }
}
