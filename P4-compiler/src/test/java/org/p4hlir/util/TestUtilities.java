package org.p4hlir.util;

import org.junit.Assert;
import org.junit.Test;
import org.p4hlir.p4Compiler.compiler.errors.ConfigurationError;
import org.p4hlir.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4hlir.p4Compiler.compiler.dependencies.StageScheduler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Test various utilities functions */
public class TestUtilities {
    @Test
    public void testEscape() {
        Assert.assertEquals("\"a\\\"b\\nc\\\\\"", Utilities.doubleQuote("a\"b\nc\\"));
        Assert.assertEquals("'x'", Utilities.singleQuote("x"));
        Assert.assertEquals("'null'", Utilities.singleQuote(null));
    }

    @Test
    public void testPutNew() {
        Map<String, Integer> map = new HashMap<>();
        Utilities.putNew(map, "a", 1);
        Assert.assertThrows(InternalCompilerError.class, () -> Utilities.putNew(map, "a", 2));
        Assert.assertEquals(Integer.valueOf(1), Utilities.getExists(map, "a"));
        Assert.assertThrows(InternalCompilerError.class, () -> Utilities.getExists(map, "b"));
    }

    @Test
    public void testEnforce() {
        Utilities.enforce(true, () -> "never computed");
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class,
                () -> Utilities.enforce(false, () -> "broken invariant"));
        Assert.assertTrue(error.getMessage().startsWith("broken invariant"));
    }

    @Test
    public void testLinq() {
        List<Integer> data = List.of(1, 2, 3, 4);
        Assert.assertEquals(List.of("1", "2", "3", "4"), Linq.map(data, String::valueOf));
        Assert.assertEquals(List.of(2, 4), Linq.where(data, x -> x % 2 == 0));
        Assert.assertTrue(Linq.any(data, x -> x > 3));
        Assert.assertFalse(Linq.all(data, x -> x > 3));
    }

    @Test
    public void testIndentStream() {
        StringBuilder builder = new StringBuilder();
        IIndentStream stream = new IndentStream(builder);
        stream.append("a {")
                .increase()
                .append("b")
                .newline()
                .append("c {")
                .increase()
                .append("d")
                .newline()
                .decrease()
                .append("}")
                .newline()
                .decrease()
                .append("}");
        Assert.assertEquals("a {\n    b\n    c {\n        d\n    }\n}", builder.toString());
    }

    @Test
    public void testLogger() {
        StringBuilder log = new StringBuilder();
        Appendable previous = Logger.INSTANCE.setDebugStream(log);
        try {
            Assert.assertEquals(0, Logger.INSTANCE.setLoggingLevel("StageScheduler", 2));
            Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(StageScheduler.class));
            Logger.INSTANCE.belowLevel(StageScheduler.class, 3).append("hidden").newline();
            Logger.INSTANCE.belowLevel(StageScheduler.class, 2).append("shown").newline();
            Assert.assertEquals("shown\n", log.toString());
            Assert.assertThrows(ConfigurationError.class,
                    () -> Logger.INSTANCE.setLoggingLevel("NoSuchClass", 1));
        } finally {
            Logger.INSTANCE.setLoggingLevel(StageScheduler.class, 0);
            Logger.INSTANCE.setDebugStream(previous);
        }
    }
}
