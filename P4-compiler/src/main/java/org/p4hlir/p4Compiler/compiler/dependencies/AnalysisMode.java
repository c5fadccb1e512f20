package org.p4hlir.p4Compiler.compiler.dependencies;

import org.p4hlir.p4Compiler.ir.P4Pipeline;

/** The granularity at which tables are analyzed. */
public abstract class AnalysisMode {
    public final String name;

    protected AnalysisMode(String name) {
        this.name = name;
    }

    public abstract boolean isSplit();

    public abstract DependencyGraph build(DependencyGraphBuilder builder, P4Pipeline pipeline);

    /** True if the transitive reduction preserves what the schedule needs. */
    public abstract boolean allowsReduction();

    public abstract ScheduleResult schedule(StageScheduler scheduler, DependencyGraph graph);

    /** One event per table; scheduling counts the minimum number of stages. */
    public static final AnalysisMode WHOLE_TABLE = new AnalysisMode("table") {
        @Override
        public boolean isSplit() {
            return false;
        }

        @Override
        public DependencyGraph build(DependencyGraphBuilder builder, P4Pipeline pipeline) {
            return builder.buildCoarse(pipeline);
        }

        @Override
        public boolean allowsReduction() {
            return true;
        }

        @Override
        public ScheduleResult schedule(StageScheduler scheduler, DependencyGraph graph) {
            return scheduler.countMinStages(graph);
        }
    };

    /** Match and action events; scheduling finds the critical path. */
    public static final AnalysisMode SPLIT_EVENT = new AnalysisMode("split") {
        @Override
        public boolean isSplit() {
            return true;
        }

        @Override
        public DependencyGraph build(DependencyGraphBuilder builder, P4Pipeline pipeline) {
            return builder.buildFine(pipeline);
        }

        @Override
        public boolean allowsReduction() {
            return false;
        }

        @Override
        public ScheduleResult schedule(StageScheduler scheduler, DependencyGraph graph) {
            return scheduler.criticalPath(graph);
        }
    };

    public static AnalysisMode select(boolean split) {
        return split ? SPLIT_EVENT : WHOLE_TABLE;
    }

    @Override
    public String toString() {
        return this.name;
    }
}
