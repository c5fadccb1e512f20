package org.p4hlir.p4Compiler.compiler.frontend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.p4hlir.p4Compiler.compiler.errors.ProgramLoadError;
import org.p4hlir.p4Compiler.ir.FieldRef;
import org.p4hlir.p4Compiler.ir.HeaderInstance;
import org.p4hlir.p4Compiler.ir.HeaderType;
import org.p4hlir.p4Compiler.ir.IControlNode;
import org.p4hlir.p4Compiler.ir.MatchKey;
import org.p4hlir.p4Compiler.ir.MatchType;
import org.p4hlir.p4Compiler.ir.P4Action;
import org.p4hlir.p4Compiler.ir.P4Conditional;
import org.p4hlir.p4Compiler.ir.P4Pipeline;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.p4Compiler.ir.P4Table;
import org.p4hlir.p4Compiler.ir.ParseState;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Logger;
import org.p4hlir.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads the HLIR of a P4 program from the JSON document produced by a P4 front end.
 *
 * <p>The document has the arrays {@code header_types}, {@code headers}, {@code actions},
 * {@code tables}, {@code conditionals}, {@code parse_states} and {@code pipelines};
 * all are optional.  Field references use the textual syntax of {@link FieldRef#parse}. */
public class HlirJsonReader implements IHlirLoader, IWritesLogs {
    final ObjectMapper mapper;

    public HlirJsonReader() {
        this.mapper = Utilities.deterministicObjectMapper();
    }

    @Override
    public P4Program load(Path source, List<String> preprocessorArgs) {
        if (!preprocessorArgs.isEmpty())
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Preprocessor arguments for ")
                    .append(source.toString())
                    .append(" are not used by the JSON reader: ")
                    .join(" ", preprocessorArgs)
                    .newline();
        String contents;
        try {
            contents = Files.readString(source);
        } catch (IOException ex) {
            throw new ProgramLoadError("Cannot read " + Utilities.singleQuote(source.toString()) +
                    ": " + ex.getMessage(), ex);
        }
        return this.read(contents, source.toString());
    }

    public P4Program read(String json, String sourceName) {
        JsonNode root;
        try {
            root = this.mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ProgramLoadError("Malformed JSON in " + Utilities.singleQuote(sourceName) +
                    ": " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject())
            throw new ProgramLoadError(Utilities.singleQuote(sourceName) + " does not contain a JSON object");
        return this.read(root, sourceName);
    }

    public P4Program read(JsonNode root, String sourceName) {
        P4Program program = new P4Program(sourceName);
        for (JsonNode node: array(root, "header_types"))
            program.add(this.headerType(node));
        for (JsonNode node: array(root, "headers"))
            program.add(this.headerInstance(node, program));
        for (JsonNode node: array(root, "actions"))
            program.add(this.action(node));
        for (JsonNode node: array(root, "tables"))
            program.add(this.table(node));
        for (JsonNode node: array(root, "conditionals"))
            program.add(this.conditional(node));
        for (JsonNode node: array(root, "parse_states"))
            program.add(this.parseState(node));
        for (JsonNode node: array(root, "pipelines"))
            program.add(this.pipeline(node));
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Loaded ")
                .append(sourceName)
                .append(": ")
                .append(program.tables.size())
                .append(" tables, ")
                .append(program.conditionals.size())
                .append(" conditionals, ")
                .append(program.actions.size())
                .append(" actions")
                .newline();
        return program.freeze();
    }

    static Iterable<JsonNode> array(JsonNode node, String property) {
        JsonNode array = node.get(property);
        if (array == null || array.isNull())
            return List.of();
        if (!array.isArray())
            throw new ProgramLoadError("Property " + Utilities.singleQuote(property) + " must be an array");
        return array;
    }

    static JsonNode property(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        if (prop == null || prop.isNull())
            throw new ProgramLoadError("Missing property " + Utilities.singleQuote(property) +
                    " in " + node);
        return prop;
    }

    static String string(JsonNode node, String property) {
        JsonNode prop = property(node, property);
        if (!prop.isTextual())
            throw new ProgramLoadError("Property " + Utilities.singleQuote(property) +
                    " must be a string in " + node);
        return prop.asText();
    }

    @Nullable
    static String optionalString(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        if (prop == null || prop.isNull())
            return null;
        return prop.asText();
    }

    static int integer(JsonNode node, String property, int defaultValue) {
        JsonNode prop = node.get(property);
        if (prop == null || prop.isNull())
            return defaultValue;
        if (!prop.canConvertToInt())
            throw new ProgramLoadError("Property " + Utilities.singleQuote(property) +
                    " must be an integer in " + node);
        return prop.asInt();
    }

    static FieldRef fieldRef(String text) {
        FieldRef result = FieldRef.parse(text);
        if (result == null)
            throw new ProgramLoadError("Cannot parse field reference " + Utilities.singleQuote(text));
        return result;
    }

    static List<FieldRef> fieldRefs(JsonNode node, String property) {
        List<FieldRef> result = new ArrayList<>();
        for (JsonNode ref: array(node, property))
            result.add(fieldRef(ref.asText()));
        return result;
    }

    static List<String> strings(JsonNode node, String property) {
        List<String> result = new ArrayList<>();
        for (JsonNode element: array(node, property))
            result.add(element.asText());
        return result;
    }

    HeaderType headerType(JsonNode node) {
        Map<String, Integer> fields = new LinkedHashMap<>();
        for (JsonNode field: array(node, "fields")) {
            String name = string(field, "name");
            if (fields.put(name, integer(field, "width", 0)) != null)
                throw new ProgramLoadError("Duplicate field " + Utilities.singleQuote(name) +
                        " in header type " + Utilities.singleQuote(string(node, "name")));
        }
        return new HeaderType(string(node, "name"), fields);
    }

    HeaderInstance headerInstance(JsonNode node, P4Program program) {
        HeaderType type = program.headerTypes.getExists(string(node, "type"));
        JsonNode metadata = node.get("metadata");
        return new HeaderInstance(string(node, "name"), type,
                metadata != null && metadata.asBoolean(), integer(node, "stack", 0));
    }

    P4Action action(JsonNode node) {
        List<P4Action.Param> params = new ArrayList<>();
        for (JsonNode param: array(node, "params"))
            params.add(new P4Action.Param(string(param, "name"), integer(param, "width", 0)));
        List<P4Action.Call> calls = new ArrayList<>();
        for (JsonNode call: array(node, "calls"))
            calls.add(new P4Action.Call(string(call, "primitive"), strings(call, "args")));
        return new P4Action(string(node, "name"), params, calls);
    }

    static List<IControlNode.Successor> successors(JsonNode node) {
        List<IControlNode.Successor> result = new ArrayList<>();
        JsonNode next = node.get("next");
        if (next == null || next.isNull())
            return result;
        if (!next.isObject())
            throw new ProgramLoadError("Property 'next' must be an object in " + node);
        Iterator<Map.Entry<String, JsonNode>> it = next.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String target = e.getValue().isNull() ? null : e.getValue().asText();
            result.add(new IControlNode.Successor(e.getKey(), target));
        }
        return result;
    }

    P4Table table(JsonNode node) {
        List<MatchKey> keys = new ArrayList<>();
        for (JsonNode key: array(node, "keys")) {
            String typeText = string(key, "match_type");
            MatchType type = MatchType.fromString(typeText);
            if (type == null)
                throw new ProgramLoadError("Unknown match type " + Utilities.singleQuote(typeText));
            JsonNode mask = key.get("mask");
            Long maskValue = null;
            if (mask != null && !mask.isNull()) {
                try {
                    maskValue = mask.isTextual() ? Long.decode(mask.asText()) : mask.asLong();
                } catch (NumberFormatException ex) {
                    throw new ProgramLoadError("Cannot parse mask " + Utilities.singleQuote(mask.asText()), ex);
                }
            }
            keys.add(new MatchKey(fieldRef(string(key, "field")), type, maskValue));
        }
        return new P4Table(string(node, "name"), keys, strings(node, "actions"),
                successors(node), integer(node, "min_size", 0), integer(node, "max_size", 0));
    }

    P4Conditional conditional(JsonNode node) {
        return new P4Conditional(string(node, "name"), string(node, "expression"),
                fieldRefs(node, "reads"),
                optionalString(node, "true_next"), optionalString(node, "false_next"));
    }

    ParseState parseState(JsonNode node) {
        List<ParseState.MetadataAssignment> assignments = new ArrayList<>();
        for (JsonNode assign: array(node, "set_metadata"))
            assignments.add(new ParseState.MetadataAssignment(
                    fieldRef(string(assign, "dst")), string(assign, "src")));
        List<ParseState.Transition> transitions = new ArrayList<>();
        for (JsonNode transition: array(node, "transitions"))
            transitions.add(new ParseState.Transition(
                    string(transition, "value"), string(transition, "next")));
        return new ParseState(string(node, "name"), fieldRefs(node, "extracts"),
                assignments, fieldRefs(node, "select"), transitions);
    }

    P4Pipeline pipeline(JsonNode node) {
        return new P4Pipeline(string(node, "name"), strings(node, "roots"));
    }
}
