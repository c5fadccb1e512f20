package org.p4hlir.p4Compiler.compiler.errors;

import java.util.List;

/** None of the requested output formats could be rendered.
 * The textual graph description has been written regardless. */
public final class RenderingUnavailable extends BaseCompilerException {
    public final List<String> formatsTried;

    public RenderingUnavailable(String graph, List<String> formatsTried, Throwable lastFailure) {
        super("Could not render " + graph + " in any of the formats " +
                String.join(", ", formatsTried) + ": " + lastFailure.getMessage(), lastFailure);
        this.formatsTried = List.copyOf(formatsTried);
    }

    @Override
    public String getErrorKind() {
        return "Rendering unavailable";
    }
}
