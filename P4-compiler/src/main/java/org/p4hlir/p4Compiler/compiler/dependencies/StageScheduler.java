package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.util.IIndentStream;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Logger;
import org.p4hlir.util.Utilities;

import java.util.Arrays;
import java.util.List;

/**
 * Assigns stages to the events of a dependency graph.
 *
 * <p>A table, or the action phase of a split table, occupies one stage.
 * A match phase adds nothing: its stage is the one the action runs in.
 * A conditional occupies a stage only when conditionals are counted.
 * An event starts once all its predecessors are done, so both graph shapes
 * of one pipeline need the same number of stages.
 */
public class StageScheduler implements IWritesLogs {
    /** True if conditionals occupy a stage of their own. */
    final boolean conditionalsUseStages;

    public StageScheduler(boolean conditionalsUseStages) {
        this.conditionalsUseStages = conditionalsUseStages;
    }

    public int cost(Event event) {
        return switch (event.role) {
            case TABLE, ACTION -> 1;
            case MATCH -> 0;
            case CONDITIONAL -> this.conditionalsUseStages ? 1 : 0;
        };
    }

    int[] costs(DependencyGraph graph) {
        int[] result = new int[graph.getEventCount()];
        for (Event event: graph.getEvents())
            result[event.index] = this.cost(event);
        return result;
    }

    /** Forward pass; returns the earliest stages and stores the length at the end of the array. */
    int[] earliest(DependencyGraph graph, List<Event> order, int[] cost) {
        int[] result = new int[graph.getEventCount() + 1];
        int length = 0;
        for (Event event: order) {
            int done = result[event.index] + cost[event.index];
            length = Math.max(length, done);
            for (DependencyEdge edge: graph.getOutgoing(event))
                result[edge.target.index] = Math.max(result[edge.target.index], done);
        }
        result[graph.getEventCount()] = length;
        return result;
    }

    /** Minimum number of stages for a whole-table graph.
     * @throws org.p4hlir.p4Compiler.compiler.errors.CycleError if the graph has a cycle. */
    public StageAssignment countMinStages(DependencyGraph graph) {
        Utilities.enforce(!graph.split, "Stage count requested for split graph " + graph.name);
        List<Event> order = graph.topologicalOrder();
        int[] cost = this.costs(graph);
        int[] earliest = this.earliest(graph, order, cost);
        int length = earliest[graph.getEventCount()];
        StageAssignment result = new StageAssignment(
                graph, Arrays.copyOf(earliest, graph.getEventCount()), cost, length);
        this.log(result);
        return result;
    }

    /** Longest paths through a split graph.
     * @throws org.p4hlir.p4Compiler.compiler.errors.CycleError if the graph has a cycle. */
    public CriticalPath criticalPath(DependencyGraph graph) {
        Utilities.enforce(graph.split, "Critical path requested for whole-table graph " + graph.name);
        List<Event> order = graph.topologicalOrder();
        int[] cost = this.costs(graph);
        int[] earliest = this.earliest(graph, order, cost);
        int length = earliest[graph.getEventCount()];

        int[] latest = new int[graph.getEventCount()];
        for (int i = order.size() - 1; i >= 0; i--) {
            Event event = order.get(i);
            int finish = length;
            for (DependencyEdge edge: graph.getOutgoing(event))
                finish = Math.min(finish, latest[edge.target.index]);
            latest[event.index] = finish - cost[event.index];
        }
        CriticalPath result = new CriticalPath(
                graph, Arrays.copyOf(earliest, graph.getEventCount()), cost, latest, length);
        this.log(result);
        return result;
    }

    void log(ScheduleResult result) {
        IIndentStream stream = Logger.INSTANCE.belowLevel(this, 1);
        stream.append(result.toString()).newline();
        IIndentStream details = Logger.INSTANCE.belowLevel(this, 2);
        for (Event event: result.graph.getEvents()) {
            details.append(event.getName())
                    .append(" stage ")
                    .append(result.getStage(event))
                    .newline();
        }
    }
}
