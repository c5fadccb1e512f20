package org.p4hlir.p4Compiler.compiler.backend.dot;

import org.p4hlir.p4Compiler.compiler.errors.ConfigurationError;
import org.p4hlir.p4Compiler.compiler.errors.RenderingUnavailable;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.Logger;
import org.p4hlir.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Writes graph descriptions in the graphviz dot format and renders them. */
public class ToDot implements IWritesLogs {
    /** Format that stops rendering without an image. */
    public static final String NONE = "none";

    final Path outputDirectory;
    /** Formats to try, in order. */
    final List<String> formats;
    final IRenderer renderer;

    public ToDot(Path outputDirectory, List<String> formats, IRenderer renderer) {
        if (formats.isEmpty())
            throw new ConfigurationError("No output format specified");
        this.outputDirectory = outputDirectory;
        this.formats = List.copyOf(formats);
        this.renderer = renderer;
    }

    public ToDot(Path outputDirectory, List<String> formats) {
        this(outputDirectory, formats, IRenderer.GRAPHVIZ);
    }

    /** Write the textual description.
     * @return The file written. */
    public Path write(GraphDescription graph) throws IOException {
        Path file = this.outputDirectory.resolve(graph.getFileName());
        Utilities.writeFile(file, graph.toDot());
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Wrote ")
                .append(file.toString())
                .newline();
        return file;
    }

    /** Render a dot file trying each format in turn.
     * @return The image produced, or null if the {@code none} format was reached first.
     * @throws RenderingUnavailable if every format failed. */
    @Nullable
    public Path render(GraphDescription graph, Path dotFile) throws InterruptedException {
        List<String> tried = new ArrayList<>();
        Exception lastFailure = null;
        for (String format: this.formats) {
            if (format.equals(NONE))
                return null;
            tried.add(format);
            Path image = this.outputDirectory.resolve(graph.name + "." + graph.kind + "." + format);
            try {
                this.renderer.render(dotFile, format, image);
                Logger.INSTANCE.belowLevel(this, 1)
                        .append("Rendered ")
                        .append(image.toString())
                        .newline();
                return image;
            } catch (IOException ex) {
                Logger.INSTANCE.belowLevel(this, 1)
                        .append("Format ")
                        .append(format)
                        .append(" failed: ")
                        .append(String.valueOf(ex.getMessage()))
                        .newline();
                lastFailure = ex;
            }
        }
        Utilities.enforce(lastFailure != null);
        throw new RenderingUnavailable(graph.name + "." + graph.kind, tried, lastFailure);
    }

    /** Write the description and render it.
     * @return The image produced, or null if none was requested. */
    @Nullable
    public Path dump(GraphDescription graph) throws IOException, InterruptedException {
        Path dotFile = this.write(graph);
        return this.render(graph, dotFile);
    }
}
