package org.p4hlir.p4Compiler.compiler.backend.dot;

import org.junit.Assert;
import org.junit.Test;
import org.p4hlir.p4Compiler.BaseP4Tests;
import org.p4hlir.p4Compiler.compiler.dependencies.AnalysisMode;
import org.p4hlir.p4Compiler.compiler.dependencies.DependencyAnalysis;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.p4Compiler.ir.P4Table;

import java.util.List;
import java.util.Objects;

public class DescriberTests extends BaseP4Tests {
    static GraphDescription.Edge edge(GraphDescription graph, String source, String target) {
        for (GraphDescription.Edge edge: graph.getEdges())
            if (edge.source().equals(source) && edge.target().equals(target))
                return edge;
        return null;
    }

    static GraphDescription.Node node(GraphDescription graph, String id) {
        return Objects.requireNonNull(graph.getNode(id), id);
    }

    static DependencyAnalysis.Result analyze(P4Program program, AnalysisMode mode) {
        DependencyAnalysis analysis = new DependencyAnalysis(program, primitives(), false);
        return analysis.analyze(program.pipelines.getExists("ingress"), mode, false);
    }

    @Test
    public void coarseGraph() {
        P4Program program = load("scenarioA.json");
        DependencyAnalysis.Result result = analyze(program, AnalysisMode.WHOLE_TABLE);
        DotOptions options = new DotOptions(false, true, true, false, true, false);
        GraphDescription graph = new DependencyGraphDescriber(program, options)
                .describe(result.graph(), result.schedule());
        Assert.assertEquals("ingress.table_dependencies.dot", graph.getFileName());
        Assert.assertEquals(3, graph.getNodes().size());
        Assert.assertEquals("T2\nstage 1", node(graph, "T2").label());
        Assert.assertEquals("box", node(graph, "T2").attributes().get("shape"));

        GraphDescription.Edge field = Objects.requireNonNull(edge(graph, "T1", "T2"));
        Assert.assertEquals("field\nmeta.f1", field.label());
        Assert.assertNull(field.attributes().get("style"));
        GraphDescription.Edge control = Objects.requireNonNull(edge(graph, "T2", "T3"));
        Assert.assertEquals("control", control.label());
        Assert.assertEquals("dashed", control.attributes().get("style"));
    }

    @Test
    public void hideControlFlow() {
        P4Program program = load("scenarioA.json");
        DependencyAnalysis.Result result = analyze(program, AnalysisMode.SPLIT_EVENT);
        DotOptions options = new DotOptions(false, false, false, false, false, false);
        GraphDescription graph = new DependencyGraphDescriber(program, options)
                .describe(result.graph(), result.schedule());
        Assert.assertNotNull(edge(graph, "T1.action", "T2.match"));
        Assert.assertNull(edge(graph, "T2.action", "T3.match"));
        Assert.assertNull(edge(graph, "T1.action", "T3.match"));
        // edges inside a table are always drawn
        Assert.assertNotNull(edge(graph, "T3.match", "T3.action"));
        Assert.assertEquals("ellipse", node(graph, "T1.match").attributes().get("shape"));
    }

    @Test
    public void criticalPath() {
        P4Program program = load("scenarioA.json");
        DependencyAnalysis.Result result = analyze(program, AnalysisMode.SPLIT_EVENT);
        DotOptions options = new DotOptions(false, false, true, true, true, false);
        GraphDescription graph = new DependencyGraphDescriber(program, options)
                .describe(result.graph(), result.schedule());
        Assert.assertEquals(6, graph.getNodes().size());
        Assert.assertNull(edge(graph, "T1.action", "T3.match"));
        GraphDescription.Edge critical = Objects.requireNonNull(edge(graph, "T2.action", "T3.match"));
        Assert.assertEquals("red", critical.attributes().get("color"));
        Assert.assertEquals("dashed", critical.attributes().get("style"));
        Assert.assertEquals(5, graph.getEdges().size());
        Assert.assertEquals("red", node(graph, "T3.action").attributes().get("color"));
        Assert.assertEquals("T3.action\nstage 2", node(graph, "T3.action").label());
    }

    @Test
    public void independentTablesShareStage() {
        P4Program program = load("scenarioB.json");
        DependencyAnalysis.Result result = analyze(program, AnalysisMode.SPLIT_EVENT);
        DotOptions options = new DotOptions(false, false, true, false, true, false);
        GraphDescription graph = new DependencyGraphDescriber(program, options)
                .describe(result.graph(), result.schedule());
        Assert.assertEquals("T1.match\nstage 0", node(graph, "T1.match").label());
        Assert.assertEquals("T2.action\nstage 0", node(graph, "T2.action").label());
        Assert.assertEquals(2, graph.getEdges().size());
        Assert.assertNotNull(edge(graph, "T1.match", "T1.action"));
        Assert.assertNotNull(edge(graph, "T2.match", "T2.action"));
    }

    @Test
    public void conditionsAndWidths() {
        P4Program program = load("scenarioD.json");
        DependencyAnalysis.Result result = analyze(program, AnalysisMode.WHOLE_TABLE);
        DotOptions options = new DotOptions(true, false, true, false, false, true);
        DependencyGraphDescriber describer = new DependencyGraphDescriber(program, options);
        GraphDescription graph = describer.describe(result.graph(), null);
        Assert.assertEquals("C\nmeta.flag == 1", node(graph, "C").label());
        Assert.assertEquals("diamond", node(graph, "C").attributes().get("shape"));
        Assert.assertEquals("T2\nkey 16b, data 16b", node(graph, "T2").label());
        P4Table t1 = program.tables.getExists("T1");
        Assert.assertEquals(16, describer.keyWidth(t1));
        Assert.assertEquals(0, describer.actionDataWidth(t1));
    }

    @Test
    public void tableGraph() {
        P4Program program = load("scenarioD.json");
        GraphDescription graph = new TableGraphDescriber(program, true)
                .describe(program.pipelines.getExists("ingress"));
        Assert.assertEquals("ingress.tables.dot", graph.getFileName());
        Assert.assertEquals(List.of("T1", "C", "T2", "T3", "exit"),
                graph.getNodes().stream().map(GraphDescription.Node::id).toList());
        Assert.assertEquals(5, graph.getEdges().size());
        Assert.assertEquals("true", Objects.requireNonNull(edge(graph, "C", "T2")).label());
        Assert.assertEquals("false", Objects.requireNonNull(edge(graph, "C", "T3")).label());
        Assert.assertEquals("set_out", Objects.requireNonNull(edge(graph, "T2", "exit")).label());
        Assert.assertEquals("C\nmeta.flag == 1", node(graph, "C").label());
    }

    @Test
    public void parseGraph() {
        P4Program program = load("router.json");
        GraphDescription graph = new ParseGraphDescriber(program).describe();
        Assert.assertEquals("router.parser.dot", graph.getFileName());
        Assert.assertEquals(List.of("start", "parse_vlan", "parse_ipv4", "ingress"),
                graph.getNodes().stream().map(GraphDescription.Node::id).toList());
        Assert.assertEquals("filled", node(graph, "ingress").attributes().get("style"));
        Assert.assertEquals("start\nethernet", node(graph, "start").label());
        Assert.assertEquals(7, graph.getEdges().size());
        GraphDescription.Edge loop = Objects.requireNonNull(edge(graph, "parse_vlan", "parse_vlan"));
        Assert.assertEquals("0x8100", loop.label());
        Assert.assertEquals("vlan[*].etherType", loop.attributes().get("tooltip"));
        Assert.assertNull(Objects.requireNonNull(edge(graph, "parse_ipv4", "ingress")).attributes().get("tooltip"));
    }

    @Test
    public void parseGraphName() {
        Assert.assertEquals("router", ParseGraphDescriber.baseName("/tmp/programs/router.json"));
        Assert.assertEquals("router", ParseGraphDescriber.baseName("router"));
        Assert.assertEquals(".hidden", ParseGraphDescriber.baseName(".hidden"));
    }
}
