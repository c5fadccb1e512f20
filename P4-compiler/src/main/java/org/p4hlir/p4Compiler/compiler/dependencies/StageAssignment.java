package org.p4hlir.p4Compiler.compiler.dependencies;

/** The minimum number of pipeline stages for a whole-table graph, with the stage of each table. */
public final class StageAssignment extends ScheduleResult {
    StageAssignment(DependencyGraph graph, int[] earliest, int[] cost, int length) {
        super(graph, earliest, cost, length);
    }

    public int getMinStages() {
        return this.length;
    }

    @Override
    public String toString() {
        return this.graph.name + " needs " + this.length + " stages";
    }
}
