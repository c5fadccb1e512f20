package org.p4hlir.p4Compiler.compiler.backend.dot;

import org.p4hlir.util.Utilities;

import java.io.IOException;
import java.nio.file.Path;

/** Converts a dot file into an image. */
public interface IRenderer {
    /** @throws IOException if the format is not supported or the tool fails. */
    void render(Path dotFile, String format, Path output) throws IOException, InterruptedException;

    /** Renders with the graphviz {@code dot} executable. */
    IRenderer GRAPHVIZ = (dotFile, format, output) ->
            Utilities.runProcess(".", "dot", "-T", format,
                    "-o", output.toAbsolutePath().toString(), dotFile.toAbsolutePath().toString());
}
