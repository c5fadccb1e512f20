package org.p4hlir.p4Compiler.compiler.dependencies;

import org.junit.Assert;
import org.junit.Test;
import org.p4hlir.p4Compiler.BaseP4Tests;
import org.p4hlir.p4Compiler.ir.FieldRef;
import org.p4hlir.p4Compiler.ir.P4Program;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/** The reference programs with known dependency graphs. */
public class ScenarioTests extends BaseP4Tests {
    static DependencyEdge edge(DependencyGraph graph, String source, String target) {
        Event s = Objects.requireNonNull(graph.getEvent(source));
        Event t = Objects.requireNonNull(graph.getEvent(target));
        DependencyEdge result = graph.getEdge(s, t);
        Assert.assertNotNull("Missing edge " + source + " -> " + target, result);
        return result;
    }

    @Test
    public void sequentialTablesCoarse() {
        P4Program program = load("scenarioA.json");
        DependencyGraph graph = builder(program).buildCoarse(program.pipelines.getExists("ingress"));
        Assert.assertEquals(3, graph.getEventCount());

        DependencyEdge t1t2 = edge(graph, "T1", "T2");
        Assert.assertEquals(DependencyKind.FIELD, t1t2.kind);
        Assert.assertEquals(Set.of(FieldRef.field("meta", "f1")), t1t2.fields);
        DependencyEdge t2t3 = edge(graph, "T2", "T3");
        Assert.assertEquals(DependencyKind.CONTROL_FLOW, t2t3.kind);
        Assert.assertTrue(t2t3.fields.isEmpty());

        StageScheduler scheduler = new StageScheduler(false);
        Assert.assertEquals(3, scheduler.countMinStages(graph).getMinStages());

        DependencyGraph reduced = new TransitiveReducer().reduce(graph);
        Assert.assertEquals(2, reduced.getEdgeCount());
        Assert.assertFalse(reduced.hasEdge("T1", "T3"));
        Assert.assertEquals(DependencyKind.FIELD, edge(reduced, "T1", "T2").kind);
        Assert.assertEquals(DependencyKind.CONTROL_FLOW, edge(reduced, "T2", "T3").kind);
        StageAssignment stages = scheduler.countMinStages(reduced);
        Assert.assertEquals(3, stages.getMinStages());
        Assert.assertEquals(0, stages.getStage(reduced.getEvent(0)));
        Assert.assertEquals(2, stages.getStage(reduced.getEvent(2)));
    }

    @Test
    public void independentTables() {
        P4Program program = load("scenarioB.json");
        DependencyGraph graph = builder(program).buildCoarse(program.pipelines.getExists("ingress"));
        Assert.assertEquals(2, graph.getEventCount());
        Assert.assertEquals(0, graph.getEdgeCount());
        StageAssignment stages = new StageScheduler(false).countMinStages(graph);
        Assert.assertEquals(1, stages.getMinStages());
        for (Event event: graph.getEvents())
            Assert.assertEquals(0, stages.getStage(event));
    }

    @Test
    public void sequentialTablesSplit() {
        P4Program program = load("scenarioA.json");
        DependencyGraph graph = builder(program).buildFine(program.pipelines.getExists("ingress"));
        Assert.assertEquals(6, graph.getEventCount());
        Assert.assertEquals(DependencyKind.FIELD, edge(graph, "T1.action", "T2.match").kind);
        Assert.assertEquals(DependencyKind.CONTROL_FLOW, edge(graph, "T2.action", "T3.match").kind);
        Assert.assertTrue(edge(graph, "T1.match", "T1.action").isInternal());

        CriticalPath path = new StageScheduler(false).criticalPath(graph);
        Assert.assertEquals(3, path.getLength());
        List<DependencyEdge> critical = path.getDependencyEdges();
        Assert.assertEquals(2, critical.size());
        Assert.assertEquals("T1.action", critical.get(0).source.getName());
        Assert.assertEquals("T2.match", critical.get(0).target.getName());
        Assert.assertEquals(DependencyKind.FIELD, critical.get(0).kind);
        Assert.assertEquals("T2.action", critical.get(1).source.getName());
        Assert.assertEquals("T3.match", critical.get(1).target.getName());
        Assert.assertEquals(DependencyKind.CONTROL_FLOW, critical.get(1).kind);
        // T1 -> T3 is implied by the longer path through T2
        Assert.assertFalse(path.isCritical(edge(graph, "T1.action", "T3.match")));
    }

    @Test
    public void conditionalReadsWrittenField() {
        P4Program program = load("scenarioD.json");
        DependencyGraph graph = builder(program).buildCoarse(program.pipelines.getExists("ingress"));
        Assert.assertEquals(4, graph.getEventCount());
        DependencyEdge toCondition = edge(graph, "T1", "C");
        Assert.assertEquals(DependencyKind.FIELD, toCondition.kind);
        Assert.assertEquals(Set.of(FieldRef.field("meta", "flag")), toCondition.fields);
        Assert.assertEquals(DependencyKind.CONTROL_FLOW, edge(graph, "C", "T2").kind);
        Assert.assertEquals(DependencyKind.CONTROL_FLOW, edge(graph, "C", "T3").kind);
        Assert.assertFalse(graph.hasEdge("T2", "T3"));
        Assert.assertFalse(graph.hasEdge("T3", "T2"));

        DependencyGraph reduced = new TransitiveReducer().reduce(graph);
        Assert.assertEquals(3, reduced.getEdgeCount());
        Assert.assertEquals(2, new StageScheduler(false).countMinStages(reduced).getMinStages());
        Assert.assertEquals(3, new StageScheduler(true).countMinStages(reduced).getMinStages());
    }
}
