package org.p4hlir.p4Compiler.compiler.backend.dot;

/** What to show when describing a dependency graph.
 * @param showConditions        Label conditionals with their condition text.
 * @param showFields            Label field edges with the fields involved.
 * @param showControlFlowEdges  Draw edges that only order execution.
 * @param criticalOnly          Only draw edges on a longest path; ignored for whole-table graphs.
 * @param debugStages           Show the stage of each event.
 * @param debugKeyWidths        Show the match key and action data widths of each table. */
public record DotOptions(boolean showConditions,
                         boolean showFields,
                         boolean showControlFlowEdges,
                         boolean criticalOnly,
                         boolean debugStages,
                         boolean debugKeyWidths) {
    public static final DotOptions DEFAULT = new DotOptions(false, false, true, false, false, false);
}
