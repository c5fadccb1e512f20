package org.p4hlir.p4Compiler.compiler.frontend;

import org.junit.Assert;
import org.junit.Test;
import org.p4hlir.p4Compiler.BaseP4Tests;
import org.p4hlir.p4Compiler.compiler.errors.ConfigurationError;
import org.p4hlir.p4Compiler.ir.AccessMode;
import org.p4hlir.p4Compiler.ir.Primitive;
import org.p4hlir.p4Compiler.ir.PrimitiveTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class PrimitiveLoaderTests extends BaseP4Tests {
    @Test
    public void builtins() {
        PrimitiveTable table = new PrimitiveLoader().loadBuiltin();
        Primitive modify = table.get("modify_field");
        Assert.assertNotNull(modify);
        Assert.assertEquals(3, modify.parameters.size());
        Assert.assertEquals(AccessMode.WRITE, modify.getAccess(0));
        Assert.assertEquals(AccessMode.READ, modify.getAccess(1));
        Assert.assertEquals(AccessMode.READ_WRITE, table.get("add_to_field").getAccess(0));
        // extra arguments are read
        Assert.assertEquals(AccessMode.READ, modify.getAccess(7));
        Assert.assertTrue(table.contains("no_op"));
        Assert.assertFalse(table.contains("set_checksum"));
    }

    @Test
    public void supplementsOverrideBuiltins() {
        PrimitiveLoader loader = new PrimitiveLoader();
        int builtins = loader.loadBuiltin().size();
        PrimitiveTable table = loader.loadAll(List.of(resourcePath("extra_primitives.json")));
        Assert.assertEquals(builtins + 1, table.size());
        Primitive checksum = table.get("set_checksum");
        Assert.assertNotNull(checksum);
        Assert.assertEquals(AccessMode.WRITE, checksum.getAccess(0));
        Assert.assertEquals(AccessMode.READ, checksum.getAccess(1));
        Primitive noOp = table.get("no_op");
        Assert.assertNotNull(noOp);
        Assert.assertEquals(1, noOp.parameters.size());
        Assert.assertEquals(AccessMode.READ_WRITE, noOp.getAccess(0));
    }

    @Test
    public void missingFile() {
        Path missing = Path.of("no", "such", "primitives.json");
        ConfigurationError error = Assert.assertThrows(ConfigurationError.class,
                () -> new PrimitiveLoader().loadAll(List.of(missing)));
        Assert.assertTrue(error.getMessage().contains("primitives.json"));
    }

    @Test
    public void badDocuments() throws IOException {
        Path file = Files.createTempFile("primitives", ".json");
        file.toFile().deleteOnExit();
        PrimitiveLoader loader = new PrimitiveLoader();

        Files.writeString(file, "{ \"p\": { \"args\": [\"x\"], \"properties\": { \"x\": { \"access\": \"peek\" } } } }");
        ConfigurationError error = Assert.assertThrows(ConfigurationError.class, () -> loader.load(file));
        Assert.assertTrue(error.getMessage().contains("peek"));

        Files.writeString(file, "[ 1, 2 ]");
        Assert.assertThrows(ConfigurationError.class, () -> loader.load(file));

        Files.writeString(file, "{ \"p\": ");
        Assert.assertThrows(ConfigurationError.class, () -> loader.load(file));
    }

    @Test
    public void defaultAccessIsRead() throws IOException {
        Path file = Files.createTempFile("primitives", ".json");
        file.toFile().deleteOnExit();
        Files.writeString(file, "{ \"drop_it\": { \"args\": [\"a\", \"b\"] } }");
        Primitive primitive = new PrimitiveLoader().load(file).get("drop_it");
        Assert.assertNotNull(primitive);
        Assert.assertEquals(AccessMode.READ, primitive.getAccess(0));
        Assert.assertEquals(AccessMode.READ, primitive.getAccess(1));
    }
}
