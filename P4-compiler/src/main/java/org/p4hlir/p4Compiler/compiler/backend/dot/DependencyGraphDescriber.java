package org.p4hlir.p4Compiler.compiler.backend.dot;

import org.p4hlir.p4Compiler.compiler.dependencies.CriticalPath;
import org.p4hlir.p4Compiler.compiler.dependencies.DependencyEdge;
import org.p4hlir.p4Compiler.compiler.dependencies.DependencyGraph;
import org.p4hlir.p4Compiler.compiler.dependencies.DependencyKind;
import org.p4hlir.p4Compiler.compiler.dependencies.Event;
import org.p4hlir.p4Compiler.compiler.dependencies.EventRole;
import org.p4hlir.p4Compiler.compiler.dependencies.ScheduleResult;
import org.p4hlir.p4Compiler.ir.FieldRef;
import org.p4hlir.p4Compiler.ir.MatchKey;
import org.p4hlir.p4Compiler.ir.P4Action;
import org.p4hlir.p4Compiler.ir.P4Conditional;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.p4Compiler.ir.P4Table;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Linq;
import org.p4hlir.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Describes a dependency graph for display. */
public class DependencyGraphDescriber implements IWritesLogs {
    public static final String KIND = "table_dependencies";

    final P4Program program;
    final DotOptions options;

    public DependencyGraphDescriber(P4Program program, DotOptions options) {
        this.program = program;
        this.options = options;
    }

    static String nodeId(Event event) {
        return event.getName();
    }

    /** Width in bits of the search key of a table. */
    public int keyWidth(P4Table table) {
        int result = 0;
        for (MatchKey key: table.keys) {
            Integer width = this.program.getWidth(key.readField());
            if (width != null)
                result += width;
        }
        return result;
    }

    /** Width in bits of the widest action data of a table. */
    public int actionDataWidth(P4Table table) {
        int result = 0;
        for (String name: table.actions) {
            P4Action action = this.program.actions.get(name);
            if (action != null)
                result = Math.max(result, action.dataWidth());
        }
        return result;
    }

    String label(Event event, @Nullable ScheduleResult schedule) {
        StringBuilder label = new StringBuilder(event.getName());
        if (this.options.showConditions() && event.node instanceof P4Conditional conditional)
            label.append("\n").append(conditional.expression);
        if (this.options.debugKeyWidths() && event.node instanceof P4Table table && event.role != EventRole.ACTION) {
            label.append("\nkey ").append(this.keyWidth(table)).append("b")
                    .append(", data ").append(this.actionDataWidth(table)).append("b");
        }
        if (this.options.debugStages() && schedule != null) {
            label.append("\nstage ").append(schedule.getStage(event));
            if (schedule instanceof CriticalPath path && path.getLatest(event) != schedule.getStage(event))
                label.append("..").append(path.getLatest(event));
        }
        return label.toString();
    }

    Map<String, String> nodeAttributes(Event event, @Nullable CriticalPath path) {
        Map<String, String> result = new LinkedHashMap<>();
        switch (event.role) {
            case CONDITIONAL -> result.put("shape", "diamond");
            case MATCH -> result.put("shape", "ellipse");
            default -> result.put("shape", "box");
        }
        if (path != null && path.isCritical(event))
            result.put("color", "red");
        return result;
    }

    boolean drawn(DependencyEdge edge, @Nullable CriticalPath path) {
        if (path != null && this.options.criticalOnly() && !path.isCritical(edge))
            return false;
        return edge.kind == DependencyKind.FIELD || edge.isInternal() || this.options.showControlFlowEdges();
    }

    public GraphDescription describe(DependencyGraph graph, @Nullable ScheduleResult schedule) {
        CriticalPath path = schedule instanceof CriticalPath p ? p : null;
        GraphDescription result = new GraphDescription(graph.name, KIND);
        for (Event event: graph.getEvents())
            result.addNode(nodeId(event), this.label(event, schedule), this.nodeAttributes(event, path));
        for (DependencyEdge edge: graph.getEdges()) {
            if (!this.drawn(edge, path))
                continue;
            String label = null;
            if (this.options.showFields()) {
                // kind first, then one field per line
                List<String> lines = new ArrayList<>();
                lines.add(edge.kind.label);
                lines.addAll(Linq.map(edge.fields, FieldRef::toString));
                label = String.join("\n", lines);
            }
            Map<String, String> attributes = new LinkedHashMap<>();
            if (edge.kind == DependencyKind.CONTROL_FLOW)
                attributes.put("style", "dashed");
            if (path != null && path.isCritical(edge))
                attributes.put("color", "red");
            result.addEdge(nodeId(edge.source), nodeId(edge.target), label, attributes);
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Described ")
                .append(result.toString())
                .newline();
        return result;
    }
}
