package org.p4hlir.p4Compiler.compiler.dependencies;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.p4hlir.util.Linq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The longest paths through a split dependency graph.
 * An event is critical when delaying it would delay the whole pipeline;
 * an edge is critical when it lies on some longest path.
 */
public final class CriticalPath extends ScheduleResult {
    /** Latest stage each event can start at without increasing the length. */
    final int[] latest;
    final List<DependencyEdge> edges;

    CriticalPath(DependencyGraph graph, int[] earliest, int[] cost, int[] latest, int length) {
        super(graph, earliest, cost, length);
        this.latest = latest;
        List<DependencyEdge> edges = new ArrayList<>();
        for (DependencyEdge edge: graph.getEdges())
            if (this.isCritical(edge))
                edges.add(edge);
        this.edges = Collections.unmodifiableList(edges);
    }

    public int getLatest(Event event) {
        return this.latest[event.index];
    }

    public int getSlack(Event event) {
        return this.latest[event.index] - this.earliest[event.index];
    }

    public boolean isCritical(Event event) {
        return this.getSlack(event) == 0;
    }

    public boolean isCritical(DependencyEdge edge) {
        return this.isCritical(edge.source) && this.isCritical(edge.target) &&
                this.getStage(edge.source) + this.getCost(edge.source) == this.getStage(edge.target);
    }

    /** All edges on some longest path, including the edges inside tables. */
    public List<DependencyEdge> getEdges() {
        return this.edges;
    }

    /** Critical edges between different tables or conditionals. */
    public List<DependencyEdge> getDependencyEdges() {
        return Linq.where(this.edges, e -> !e.isInternal());
    }

    public List<Event> getCriticalEvents() {
        return Linq.where(this.graph.getEvents(), this::isCritical);
    }

    @Override
    public ObjectNode asJson(ObjectMapper mapper) {
        ObjectNode result = super.asJson(mapper);
        ArrayNode critical = result.putArray("critical");
        for (DependencyEdge edge: this.getDependencyEdges())
            critical.add(edge.source.getName() + " -> " + edge.target.getName());
        return result;
    }

    @Override
    public String toString() {
        return "Critical path of " + this.graph.name + " has length " + this.length + ": " +
                Linq.map(this.getDependencyEdges(), e -> e.source + "->" + e.target);
    }
}
