package org.p4hlir.p4Compiler.compiler.backend.dot;

import org.p4hlir.p4Compiler.ir.FieldRef;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.p4Compiler.ir.ParseState;
import org.p4hlir.util.Linq;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** Describes the parser state machine.  Transitions that leave the parser
 * point to the pipeline they start. */
public class ParseGraphDescriber {
    public static final String KIND = "parser";

    final P4Program program;

    public ParseGraphDescriber(P4Program program) {
        this.program = program;
    }

    /** The file name of the program source without directory and extension. */
    static String baseName(String sourceName) {
        Path file = Path.of(sourceName).getFileName();
        String name = file == null ? sourceName : file.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public GraphDescription describe() {
        GraphDescription result = new GraphDescription(baseName(this.program.sourceName), KIND);
        Set<String> targets = new LinkedHashSet<>();
        for (ParseState state: this.program.parseStates) {
            String label = state.name;
            if (!state.extracts.isEmpty())
                label += "\n" + String.join(", ", Linq.map(state.extracts, FieldRef::toString));
            result.addNode(state.name, label, GraphDescription.attributes("shape", "ellipse"));
            for (ParseState.Transition transition: state.transitions)
                if (!this.program.parseStates.contains(transition.next()))
                    targets.add(transition.next());
        }
        for (String target: targets)
            result.addNode(target, target, GraphDescription.attributes("shape", "box", "style", "filled"));
        for (ParseState state: this.program.parseStates) {
            String select = String.join(", ", Linq.map(state.select, FieldRef::toString));
            for (ParseState.Transition transition: state.transitions) {
                Map<String, String> attributes = GraphDescription.attributes();
                if (!select.isEmpty())
                    attributes.put("tooltip", select);
                result.addEdge(state.name, transition.next(), transition.value(), attributes);
            }
        }
        return result;
    }
}
