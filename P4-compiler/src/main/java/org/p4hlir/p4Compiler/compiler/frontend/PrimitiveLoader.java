package org.p4hlir.p4Compiler.compiler.frontend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.p4hlir.p4Compiler.compiler.errors.ConfigurationError;
import org.p4hlir.p4Compiler.ir.AccessMode;
import org.p4hlir.p4Compiler.ir.Primitive;
import org.p4hlir.p4Compiler.ir.PrimitiveTable;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Logger;
import org.p4hlir.util.Utilities;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/** Loads primitive-definition documents.
 *
 * <p>A document is a JSON object mapping each primitive name to its description:
 * <pre>
 * "modify_field": {
 *     "args": ["dst", "src", "mask"],
 *     "properties": { "dst": { "access": "write" }, "src": { "access": "read" } }
 * }
 * </pre>
 * Parameters without an access property are read. */
public class PrimitiveLoader implements IWritesLogs {
    /** Resource holding the definitions of the standard primitives. */
    public static final String BUILTIN_RESOURCE = "/primitives.json";

    final ObjectMapper mapper;

    public PrimitiveLoader() {
        this.mapper = Utilities.deterministicObjectMapper();
    }

    /** The definitions of the standard P4 primitives. */
    public PrimitiveTable loadBuiltin() {
        try (InputStream stream = PrimitiveLoader.class.getResourceAsStream(BUILTIN_RESOURCE)) {
            if (stream == null)
                throw new ConfigurationError("Missing resource " + BUILTIN_RESOURCE);
            return this.parse(this.mapper.readTree(stream), BUILTIN_RESOURCE);
        } catch (IOException ex) {
            throw new ConfigurationError("Cannot read " + BUILTIN_RESOURCE + ": " + ex.getMessage(), ex);
        }
    }

    public PrimitiveTable load(Path file) {
        if (!Files.isReadable(file))
            throw new ConfigurationError("Cannot read primitive definitions " +
                    Utilities.singleQuote(file.toString()));
        try {
            return this.parse(this.mapper.readTree(file.toFile()), file.toString());
        } catch (IOException ex) {
            throw new ConfigurationError("Cannot parse primitive definitions " +
                    Utilities.singleQuote(file.toString()) + ": " + ex.getMessage(), ex);
        }
    }

    /** Built-in definitions with all the supplementary documents merged over them, in order. */
    public PrimitiveTable loadAll(List<Path> supplements) {
        PrimitiveTable result = this.loadBuiltin();
        for (Path file: supplements) {
            PrimitiveTable extra = this.load(file);
            for (Primitive p: extra.values()) {
                if (result.contains(p.name))
                    Logger.INSTANCE.belowLevel(this, 1)
                            .append(file.toString())
                            .append(" redefines primitive ")
                            .append(p.name)
                            .newline();
            }
            result.merge(extra);
        }
        return result;
    }

    PrimitiveTable parse(JsonNode root, String source) {
        if (root == null || !root.isObject())
            throw new ConfigurationError(Utilities.singleQuote(source) +
                    " must contain a JSON object of primitive definitions");
        PrimitiveTable result = new PrimitiveTable();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            result.define(this.primitive(e.getKey(), e.getValue(), source));
        }
        return result;
    }

    Primitive primitive(String name, JsonNode node, String source) {
        List<Primitive.Parameter> parameters = new ArrayList<>();
        JsonNode args = node.get("args");
        JsonNode properties = node.get("properties");
        if (args != null) {
            for (JsonNode arg: args) {
                String argName = arg.asText();
                AccessMode access = AccessMode.READ;
                JsonNode property = properties == null ? null : properties.get(argName);
                if (property != null && property.has("access")) {
                    String text = property.get("access").asText();
                    access = AccessMode.fromString(text);
                    if (access == null)
                        throw new ConfigurationError("Unknown access mode " + Utilities.singleQuote(text) +
                                " for " + name + "." + argName + " in " + source);
                }
                parameters.add(new Primitive.Parameter(argName, access));
            }
        }
        return new Primitive(name, parameters);
    }
}
