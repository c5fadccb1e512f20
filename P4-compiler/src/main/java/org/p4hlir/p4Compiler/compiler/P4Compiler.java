/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.p4hlir.p4Compiler.compiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.p4hlir.p4Compiler.compiler.backend.dot.DependencyGraphDescriber;
import org.p4hlir.p4Compiler.compiler.backend.dot.GraphDescription;
import org.p4hlir.p4Compiler.compiler.backend.dot.IRenderer;
import org.p4hlir.p4Compiler.compiler.backend.dot.ParseGraphDescriber;
import org.p4hlir.p4Compiler.compiler.backend.dot.TableGraphDescriber;
import org.p4hlir.p4Compiler.compiler.backend.dot.ToDot;
import org.p4hlir.p4Compiler.compiler.dependencies.AnalysisMode;
import org.p4hlir.p4Compiler.compiler.dependencies.CriticalPath;
import org.p4hlir.p4Compiler.compiler.dependencies.DependencyAnalysis;
import org.p4hlir.p4Compiler.compiler.dependencies.DependencyEdge;
import org.p4hlir.p4Compiler.compiler.dependencies.Event;
import org.p4hlir.p4Compiler.compiler.errors.BaseCompilerException;
import org.p4hlir.p4Compiler.compiler.errors.CompilerMessages;
import org.p4hlir.p4Compiler.compiler.errors.ConfigurationError;
import org.p4hlir.p4Compiler.compiler.errors.RenderingUnavailable;
import org.p4hlir.p4Compiler.compiler.frontend.HlirJsonReader;
import org.p4hlir.p4Compiler.compiler.frontend.IHlirLoader;
import org.p4hlir.p4Compiler.compiler.frontend.PrimitiveLoader;
import org.p4hlir.p4Compiler.ir.P4Pipeline;
import org.p4hlir.p4Compiler.ir.P4Program;
import org.p4hlir.p4Compiler.ir.PrimitiveTable;
import org.p4hlir.util.IIndentStream;
import org.p4hlir.util.IWritesLogs;
import org.p4hlir.util.IndentStream;
import org.p4hlir.util.Linq;
import org.p4hlir.util.Logger;
import org.p4hlir.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Analyzes one P4 program.  The phases run in order and each one stops
 * the run if it reports an error:
 * configuration, loading, dependency analysis, export.
 * Rendering failures are reported per graph and do not stop other graphs.
 */
public class P4Compiler implements IErrorReporter, IWritesLogs {
    public final CompilerOptions options;
    public final CompilerMessages messages;
    final IHlirLoader loader;
    IRenderer renderer;
    /** Where debug printouts go. */
    PrintStream output;
    @Nullable
    PrimitiveTable primitives;
    @Nullable
    P4Program program;
    @Nullable
    DependencyAnalysis analysis;
    final List<DependencyAnalysis.Result> results;

    public P4Compiler(CompilerOptions options, IHlirLoader loader) {
        this.options = options;
        this.loader = loader;
        this.messages = new CompilerMessages();
        this.messages.emitJson = options.ioOptions.emitJsonErrors;
        this.messages.quiet = options.ioOptions.quiet;
        this.renderer = IRenderer.GRAPHVIZ;
        this.output = System.out;
        this.results = new ArrayList<>();
    }

    public P4Compiler(CompilerOptions options) {
        this(options, new HlirJsonReader());
    }

    public void setRenderer(IRenderer renderer) {
        this.renderer = renderer;
    }

    public void setOutput(PrintStream output) {
        this.output = output;
    }

    @Override
    public void reportProblem(boolean warning, String errorType, String message) {
        this.messages.reportProblem(warning, errorType, message);
    }

    @Override
    public void reportError(BaseCompilerException exception) {
        this.messages.reportError(exception);
    }

    @Override
    public boolean hasErrors() {
        return this.messages.errorCount() > 0;
    }

    @Nullable
    public P4Program getProgram() {
        return this.program;
    }

    public List<DependencyAnalysis.Result> getResults() {
        return Collections.unmodifiableList(this.results);
    }

    /** Validate the options, set up logging and load the primitive definitions.
     * @return true on success. */
    public boolean configure() {
        if (!this.options.validate(this))
            return false;
        try {
            for (Map.Entry<String, String> entry: this.options.ioOptions.loggingLevel.entrySet()) {
                int level;
                try {
                    level = Integer.parseInt(entry.getValue());
                } catch (NumberFormatException ex) {
                    throw new ConfigurationError("-T option must be followed by 'class=number'; could not parse " +
                            entry, ex);
                }
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            }
            List<Path> supplements = Linq.map(this.options.ioOptions.primitives, Path::of);
            this.primitives = new PrimitiveLoader().loadAll(supplements);
        } catch (ConfigurationError ex) {
            this.reportError(ex);
            return false;
        }
        if (this.options.ioOptions.verbosity >= 1)
            this.output.println(this.options);
        return true;
    }

    /** Load the program to analyze.
     * @return true on success. */
    public boolean load(Path source) {
        try {
            this.program = this.loader.load(source, this.options.ioOptions.getPreprocessorArgs());
        } catch (BaseCompilerException ex) {
            this.reportError(ex);
            return false;
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Loaded ")
                .append(this.program.toString())
                .newline();
        return true;
    }

    /** Analyze every pipeline of the program.
     * @return true on success. */
    public boolean analyze() {
        P4Program program = this.program;
        PrimitiveTable primitives = this.primitives;
        Utilities.enforce(program != null && primitives != null, "Analysis before configuration and loading");
        CompilerOptions.Analysis options = this.options.analysisOptions;
        AnalysisMode mode = AnalysisMode.select(options.splitMatchAction);
        this.analysis = new DependencyAnalysis(program, primitives, options.conditionalsUseStages);
        try {
            for (P4Pipeline pipeline: program.pipelines) {
                DependencyAnalysis.Result result = this.analysis.analyze(pipeline, mode, options.reduce());
                this.results.add(result);
                int other = this.analysis.lengthInOtherMode(result);
                if (other != result.schedule().getLength())
                    this.reportWarning("Inconsistent stage count",
                            "Control " + Utilities.singleQuote(pipeline.name) + " needs " +
                                    result.schedule().getLength() + " stages in " + mode + " mode but " +
                                    other + " in the other mode");
                if (options.debugStages)
                    this.printStages(result);
            }
        } catch (BaseCompilerException ex) {
            this.reportError(ex);
            return false;
        }
        return true;
    }

    void printStages(DependencyAnalysis.Result result) {
        IIndentStream stream = new IndentStream(this.output);
        stream.append("Control ")
                .append(result.pipeline().name)
                .append(": ")
                .append(result.schedule().getLength())
                .append(" stages")
                .increase();
        for (Event event: result.graph().getEvents()) {
            stream.append(event.getName())
                    .append(": ")
                    .append(result.schedule().getStage(event));
            if (result.schedule() instanceof CriticalPath path)
                stream.append(path.isCritical(event) ? " critical" : " slack " + path.getSlack(event));
            stream.newline();
        }
        if (result.schedule() instanceof CriticalPath path) {
            for (DependencyEdge edge: path.getDependencyEdges())
                stream.append("critical ")
                        .append(edge.toString())
                        .newline();
        }
        stream.decrease();
    }

    /** The descriptions of all requested graphs, in output order. */
    public List<GraphDescription> describe() {
        P4Program program = this.program;
        Utilities.enforce(program != null);
        CompilerOptions.IO io = this.options.ioOptions;
        List<GraphDescription> result = new ArrayList<>();
        if (io.produces(CompilerOptions.PARSE_GRAPH) && !program.parseStates.isEmpty())
            result.add(new ParseGraphDescriber(program).describe());
        if (io.produces(CompilerOptions.TABLE_GRAPH)) {
            TableGraphDescriber describer = new TableGraphDescriber(program, this.options.analysisOptions.showConditions);
            for (P4Pipeline pipeline: program.pipelines)
                result.add(describer.describe(pipeline));
        }
        if (io.produces(CompilerOptions.DEPENDENCY_GRAPH)) {
            DependencyGraphDescriber describer = new DependencyGraphDescriber(
                    program, this.options.analysisOptions.getDotOptions());
            for (DependencyAnalysis.Result analysis: this.results)
                result.add(describer.describe(analysis.graph(), analysis.schedule()));
        }
        return result;
    }

    /** Write and render the requested graphs.  A graph that cannot be rendered
     * is reported and the remaining graphs are still produced. */
    public void export() {
        ToDot toDot = new ToDot(Path.of(this.options.ioOptions.genDir), this.options.ioOptions.formats, this.renderer);
        List<GraphDescription> graphs;
        try {
            graphs = this.describe();
        } catch (BaseCompilerException ex) {
            this.reportError(ex);
            return;
        }
        for (GraphDescription graph: graphs) {
            try {
                toDot.dump(graph);
            } catch (RenderingUnavailable ex) {
                this.reportError(ex);
            } catch (IOException ex) {
                this.reportError("Error writing file", ex.getMessage());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                this.reportError("Rendering interrupted", graph.getFileName());
                return;
            }
        }
    }

    public ObjectNode getSummary() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ObjectNode result = mapper.createObjectNode();
        P4Program program = this.program;
        result.put("program", program == null ? "" : program.sourceName);
        ArrayNode pipelines = result.putArray("pipelines");
        for (DependencyAnalysis.Result analysis: this.results)
            pipelines.add(analysis.asJson(mapper));
        return result;
    }

    void writeSummary(String file) {
        try {
            Utilities.writeFile(Path.of(file), this.getSummary().toPrettyString());
        } catch (IOException ex) {
            this.reportError("Error writing file", Utilities.singleQuote(file) + " " + ex.getMessage());
        }
    }

    /** Run all phases on the input file named in the options. */
    public CompilerMessages compile() {
        if (!this.configure())
            return this.messages;
        String input = this.options.ioOptions.inputFile;
        Utilities.enforce(input != null);
        if (!this.load(Path.of(input)))
            return this.messages;
        if (!this.analyze())
            return this.messages;
        this.export();
        if (this.options.ioOptions.summaryFile != null)
            this.writeSummary(this.options.ioOptions.summaryFile);
        return this.messages;
    }
}
