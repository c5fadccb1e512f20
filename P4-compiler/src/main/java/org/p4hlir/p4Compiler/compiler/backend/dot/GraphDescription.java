package org.p4hlir.p4Compiler.compiler.backend.dot;

import org.p4hlir.util.IIndentStream;
import org.p4hlir.util.IndentStream;
import org.p4hlir.util.ToIndentableString;
import org.p4hlir.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A renderer-independent description of a graph: ordered nodes and edges with display attributes.
 * It prints itself in the graphviz dot language. */
public final class GraphDescription implements ToIndentableString {
    public record Node(String id, String label, Map<String, String> attributes) {}

    public record Edge(String source, String target, @Nullable String label, Map<String, String> attributes) {}

    /** Name of the described object, e.g. the pipeline. */
    public final String name;
    /** Graph kind, used in file names: {@code parser}, {@code tables}, {@code table_dependencies}. */
    public final String kind;
    final List<Node> nodes;
    final List<Edge> edges;

    public GraphDescription(String name, String kind) {
        this.name = name;
        this.kind = kind;
        this.nodes = new ArrayList<>();
        this.edges = new ArrayList<>();
    }

    /** Attributes from alternating keys and values, in order. */
    public static Map<String, String> attributes(String... keysAndValues) {
        Utilities.enforce(keysAndValues.length % 2 == 0);
        Map<String, String> result = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2)
            result.put(keysAndValues[i], keysAndValues[i + 1]);
        return result;
    }

    public Node addNode(String id, String label, Map<String, String> attributes) {
        Node node = new Node(id, label, Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
        this.nodes.add(node);
        return node;
    }

    public Edge addEdge(String source, String target, @Nullable String label, Map<String, String> attributes) {
        Edge edge = new Edge(source, target, label, Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
        this.edges.add(edge);
        return edge;
    }

    public List<Node> getNodes() {
        return Collections.unmodifiableList(this.nodes);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(this.edges);
    }

    @Nullable
    public Node getNode(String id) {
        for (Node node: this.nodes)
            if (node.id().equals(id))
                return node;
        return null;
    }

    /** File name of the textual description, without directory. */
    public String getFileName() {
        return this.name + "." + this.kind + ".dot";
    }

    static String quote(String text) {
        return Utilities.doubleQuote(text);
    }

    void attributes(IIndentStream stream, @Nullable String label, Map<String, String> attributes) {
        List<String> parts = new ArrayList<>();
        if (label != null)
            parts.add("label=" + quote(label));
        for (var e: attributes.entrySet())
            parts.add(e.getKey() + "=" + quote(e.getValue()));
        if (parts.isEmpty())
            return;
        stream.append(" [")
                .join(", ", parts)
                .append("]");
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("digraph ")
                .append(quote(this.name + "_" + this.kind))
                .append(" {")
                .increase()
                .append("ordering=\"out\"")
                .newline();
        for (Node node: this.nodes) {
            builder.append(quote(node.id()));
            this.attributes(builder, node.label(), node.attributes());
            builder.newline();
        }
        for (Edge edge: this.edges) {
            builder.append(quote(edge.source()))
                    .append(" -> ")
                    .append(quote(edge.target()));
            this.attributes(builder, edge.label(), edge.attributes());
            builder.newline();
        }
        return builder.decrease().append("}").newline();
    }

    /** The graph in the dot language. */
    public String toDot() {
        StringBuilder builder = new StringBuilder();
        IndentStream stream = new IndentStream(builder);
        this.toString(stream);
        return builder.toString();
    }

    @Override
    public String toString() {
        return this.name + "." + this.kind + "(" + this.nodes.size() + " nodes, " + this.edges.size() + " edges)";
    }
}
