package org.p4hlir.p4Compiler.compiler.dependencies;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.p4hlir.p4Compiler.ir.P4Pipeline;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.p4Compiler.ir.PrimitiveTable;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Logger;

/** Runs the builder, the reducer and the scheduler on the pipelines of a program. */
public class DependencyAnalysis implements IWritesLogs {
    /** The analysis of one pipeline.
     * @param graph     The graph that was scheduled: reduced if {@code reduced} is true.
     * @param schedule  Stage assignment or critical path, depending on the mode. */
    public record Result(P4Pipeline pipeline, AnalysisMode mode, DependencyGraph graph,
                         ScheduleResult schedule, boolean reduced) {
        public ObjectNode asJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            result.put("pipeline", this.pipeline.name);
            result.put("mode", this.mode.name);
            result.put("reduced", this.reduced);
            result.set("graph", this.graph.asJson(mapper));
            result.set("schedule", this.schedule.asJson(mapper));
            return result;
        }
    }

    final DependencyGraphBuilder builder;
    final TransitiveReducer reducer;
    final StageScheduler scheduler;

    public DependencyAnalysis(P4Program program, PrimitiveTable primitives, boolean conditionalsUseStages) {
        this.builder = new DependencyGraphBuilder(program, primitives);
        this.reducer = new TransitiveReducer();
        this.scheduler = new StageScheduler(conditionalsUseStages);
    }

    /** Build, optionally reduce, and schedule the dependency graph of a pipeline.
     * Reduction is skipped in modes that do not allow it. */
    public Result analyze(P4Pipeline pipeline, AnalysisMode mode, boolean reduce) {
        DependencyGraph graph = mode.build(this.builder, pipeline);
        graph.validate();
        boolean reduced = reduce && mode.allowsReduction();
        if (reduced)
            graph = this.reducer.reduce(graph);
        ScheduleResult schedule = mode.schedule(this.scheduler, graph);
        Logger.INSTANCE.belowLevel(this, 1)
                .append(pipeline.name)
                .append(" (")
                .append(mode.name)
                .append("): ")
                .append(schedule.getLength())
                .append(" stages")
                .newline();
        return new Result(pipeline, mode, graph, schedule, reduced);
    }

    /** Length of the schedule of a pipeline analyzed in the other mode. */
    public int lengthInOtherMode(Result result) {
        AnalysisMode other = AnalysisMode.select(!result.mode().isSplit());
        return this.analyze(result.pipeline(), other, false).schedule().getLength();
    }
}
