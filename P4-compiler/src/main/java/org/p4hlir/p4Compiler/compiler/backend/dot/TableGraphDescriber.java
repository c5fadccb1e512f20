package org.p4hlir.p4Compiler.compiler.backend.dot;

import org.p4hlir.p4Compiler.compiler.dependencies.ControlFlowGraph;
import org.p4hlir.p4Compiler.ir.IControlNode;
import org.p4hlir.p4Compiler.ir.P4Conditional;
import org.p4hlir.p4Compiler.ir.P4Pipeline;
import org.p4hlir.p4Compiler.ir.P4Program;

/** Describes the control flow between the tables and conditionals of a pipeline. */
public class TableGraphDescriber {
    public static final String KIND = "tables";
    static final String EXIT = "exit";

    final P4Program program;
    final boolean showConditions;

    public TableGraphDescriber(P4Program program, boolean showConditions) {
        this.program = program;
        this.showConditions = showConditions;
    }

    public GraphDescription describe(P4Pipeline pipeline) {
        ControlFlowGraph cfg = new ControlFlowGraph(this.program, pipeline);
        GraphDescription result = new GraphDescription(pipeline.name, KIND);
        boolean exits = false;
        for (IControlNode node: cfg.getProgramOrder()) {
            String label = node.getName();
            if (this.showConditions && node instanceof P4Conditional conditional)
                label += "\n" + conditional.expression;
            result.addNode(node.getName(), label,
                    GraphDescription.attributes("shape", node instanceof P4Conditional ? "diamond" : "box"));
            for (IControlNode.Successor successor: node.getSuccessors())
                exits |= successor.next() == null;
        }
        if (exits)
            result.addNode(EXIT, EXIT, GraphDescription.attributes("shape", "point"));
        for (IControlNode node: cfg.getProgramOrder()) {
            for (IControlNode.Successor successor: node.getSuccessors()) {
                String target = successor.next() == null ? EXIT : successor.next();
                result.addEdge(node.getName(), target, successor.label(), GraphDescription.attributes());
            }
        }
        return result;
    }
}
