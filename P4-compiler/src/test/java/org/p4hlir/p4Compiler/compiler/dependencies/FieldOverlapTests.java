package org.p4hlir.p4Compiler.compiler.dependencies;

import org.junit.Assert;
import org.junit.Test;
import org.p4hlir.p4Compiler.ir.FieldRef;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;

public class FieldOverlapTests {
    static final FieldRef TTL = FieldRef.field("ipv4", "ttl");
    static final FieldRef SRC = FieldRef.field("ipv4", "srcAddr");
    static final FieldRef IPV4 = FieldRef.header("ipv4");
    static final FieldRef VRF = FieldRef.field("meta", "vrf");

    @Test
    public void empty() {
        Assert.assertFalse(FieldOverlap.mayOverlap(List.of(), List.of(TTL)));
        Assert.assertFalse(FieldOverlap.mayOverlap(List.of(TTL), List.of()));
        Assert.assertTrue(FieldOverlap.overlap(List.of(TTL), Set.of()).isEmpty());
    }

    @Test
    public void disjoint() {
        Assert.assertFalse(FieldOverlap.mayOverlap(List.of(TTL, VRF), List.of(SRC)));
    }

    @Test
    public void headerWriteCoversFields() {
        Assert.assertTrue(FieldOverlap.mayOverlap(List.of(IPV4), List.of(VRF, SRC)));
        SortedSet<FieldRef> overlap = FieldOverlap.overlap(List.of(IPV4), List.of(VRF, TTL, SRC));
        // sorted by text
        Assert.assertEquals(List.of(SRC, TTL), List.copyOf(overlap));
    }

    @Test
    public void readsAreReported() {
        SortedSet<FieldRef> overlap = FieldOverlap.overlap(List.of(TTL), List.of(IPV4));
        Assert.assertEquals(List.of(IPV4), List.copyOf(overlap));
    }
}
