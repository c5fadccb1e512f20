package org.p4hlir.p4Compiler.compiler.frontend;

import org.junit.Assert;
import org.junit.Test;
import org.p4hlir.p4Compiler.BaseP4Tests;
import org.p4hlir.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4hlir.p4Compiler.compiler.errors.ProgramLoadError;
import org.p4hlir.p4Compiler.compiler.errors.StructuralError;
import org.p4hlir.p4Compiler.ir.FieldRef;
import org.p4hlir.p4Compiler.ir.IControlNode;
import org.p4hlir.p4Compiler.ir.MatchKey;
import org.p4hlir.p4Compiler.ir.MatchType;
import org.p4hlir.p4Compiler.ir.P4Conditional;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.p4Compiler.ir.P4Table;

import java.nio.file.Path;
import java.util.List;

public class HlirJsonReaderTests extends BaseP4Tests {
    @Test
    public void loadScenario() {
        P4Program program = load("scenarioA.json");
        Assert.assertTrue(program.isFrozen());
        Assert.assertEquals(3, program.tables.size());
        Assert.assertEquals(3, program.actions.size());
        Assert.assertEquals(1, program.pipelines.size());
        Assert.assertEquals(List.of("T1"), program.pipelines.getExists("ingress").roots);
        Assert.assertTrue(program.instances.getExists("meta").metadata);
        Assert.assertEquals(Integer.valueOf(48), program.getWidth(FieldRef.field("ethernet", "srcAddr")));

        P4Table t3 = program.tables.getExists("T3");
        MatchKey key = t3.keys.get(0);
        Assert.assertEquals(MatchType.TERNARY, key.type());
        Assert.assertEquals(Long.valueOf(0xffff), key.mask());
        Assert.assertEquals(FieldRef.field("ethernet", "srcAddr"), key.field());

        P4Table t1 = program.tables.getExists("T1");
        Assert.assertEquals(List.of("set_f1", "nop"), t1.actions);
        Assert.assertEquals(2, t1.successors.size());
        IControlNode.Successor successor = t1.successors.get(0);
        Assert.assertEquals("set_f1", successor.label());
        Assert.assertEquals("T2", successor.next());
        Assert.assertNull(program.tables.getExists("T3").successors.get(0).next());
    }

    @Test
    public void loadConditional() {
        P4Program program = load("scenarioD.json");
        P4Conditional condition = program.conditionals.getExists("C");
        Assert.assertEquals(List.of(FieldRef.field("meta", "flag")), condition.reads);
        Assert.assertSame(condition, program.getControlNode("C"));
        Assert.assertNull(program.getControlNode("missing"));
    }

    @Test
    public void loadFromFile() {
        Path path = resourcePath("router.json");
        P4Program program = new HlirJsonReader().load(path, List.of("-DIPV6"));
        Assert.assertEquals(path.toString(), program.sourceName);
        Assert.assertEquals(2, program.pipelines.size());
        Assert.assertEquals(3, program.parseStates.size());
        Assert.assertEquals(2, program.instances.getExists("vlan").stackSize);
    }

    @Test
    public void missingFile() {
        Path path = Path.of("does", "not", "exist.json");
        Assert.assertThrows(ProgramLoadError.class,
                () -> new HlirJsonReader().load(path, List.of()));
    }

    @Test
    public void malformed() {
        ProgramLoadError error = Assert.assertThrows(ProgramLoadError.class, () -> parse("{ \"tables\": [ "));
        Assert.assertTrue(error.getMessage().contains("Malformed JSON"));
        Assert.assertThrows(ProgramLoadError.class, () -> parse("[]"));
        Assert.assertThrows(ProgramLoadError.class, () -> parse("{ \"tables\": 5 }"));
        Assert.assertThrows(ProgramLoadError.class, () -> parse("{ \"tables\": [ { \"keys\": [] } ] }"));
    }

    @Test
    public void badKeys() {
        String badMask = """
                { "tables": [ { "name": "t",
                  "keys": [ { "field": "m.f", "match_type": "ternary", "mask": "0xzz" } ] } ] }""";
        Assert.assertThrows(ProgramLoadError.class, () -> parse(badMask));
        String badType = """
                { "tables": [ { "name": "t",
                  "keys": [ { "field": "m.f", "match_type": "fuzzy" } ] } ] }""";
        Assert.assertThrows(ProgramLoadError.class, () -> parse(badType));
        String badField = """
                { "tables": [ { "name": "t",
                  "keys": [ { "field": "1.f", "match_type": "exact" } ] } ] }""";
        Assert.assertThrows(ProgramLoadError.class, () -> parse(badField));
    }

    @Test
    public void stackIndexTooLarge() {
        String key = """
                { "tables": [ { "name": "t",
                  "keys": [ { "field": "h[99999999999].f", "match_type": "exact" } ] } ] }""";
        ProgramLoadError error = Assert.assertThrows(ProgramLoadError.class, () -> parse(key));
        Assert.assertTrue(error.getMessage().contains("h[99999999999].f"));
        String condition = """
                { "conditionals": [ { "name": "c", "expression": "true",
                  "reads": [ "h[4294967296]" ] } ] }""";
        Assert.assertThrows(ProgramLoadError.class, () -> parse(condition));
    }

    @Test
    public void duplicateNames() {
        StructuralError error = Assert.assertThrows(StructuralError.class,
                () -> parse("{ \"tables\": [ { \"name\": \"t\" }, { \"name\": \"t\" } ] }"));
        Assert.assertEquals(List.of("t"), error.entities);
        Assert.assertThrows(StructuralError.class, () -> parse("""
                { "tables": [ { "name": "t" } ],
                  "conditionals": [ { "name": "t", "expression": "true" } ] }"""));
    }

    @Test
    public void undeclaredHeaderType() {
        StructuralError error = Assert.assertThrows(StructuralError.class,
                () -> parse("{ \"headers\": [ { \"name\": \"h\", \"type\": \"missing_t\" } ] }"));
        Assert.assertEquals(List.of("missing_t"), error.entities);
    }

    @Test
    public void emptyProgram() {
        P4Program program = parse("{}");
        Assert.assertTrue(program.tables.isEmpty());
        Assert.assertTrue(program.pipelines.isEmpty());
    }

    @Test
    public void programIsReadOnly() {
        P4Program program = load("scenarioB.json");
        P4Table table = new P4Table("extra", List.of(), List.of(), List.of(), 0, 0);
        Assert.assertThrows(InternalCompilerError.class, () -> program.add(table));
    }
}
