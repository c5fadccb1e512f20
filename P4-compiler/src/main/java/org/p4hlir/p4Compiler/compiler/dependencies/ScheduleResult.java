package org.p4hlir.p4Compiler.compiler.dependencies;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** The earliest stage of every event of a dependency graph. */
public abstract class ScheduleResult {
    public final DependencyGraph graph;
    /** Indexed by event index. */
    final int[] earliest;
    final int[] cost;
    /** Number of stages needed to execute all events. */
    public final int length;

    protected ScheduleResult(DependencyGraph graph, int[] earliest, int[] cost, int length) {
        this.graph = graph;
        this.earliest = earliest;
        this.cost = cost;
        this.length = length;
    }

    /** First stage where the event can execute. */
    public int getStage(Event event) {
        return this.earliest[event.index];
    }

    /** Stages the event occupies. */
    public int getCost(Event event) {
        return this.cost[event.index];
    }

    public int getLength() {
        return this.length;
    }

    public ObjectNode asJson(ObjectMapper mapper) {
        ObjectNode result = mapper.createObjectNode();
        result.put("length", this.length);
        ObjectNode stages = result.putObject("stages");
        for (Event event: this.graph.getEvents())
            stages.put(event.getName(), this.getStage(event));
        return result;
    }
}
