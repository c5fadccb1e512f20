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

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.p4hlir.p4Compiler.compiler.backend.dot.DotOptions;
import org.p4hlir.p4Compiler.compiler.backend.dot.ToDot;
import org.p4hlir.util.IDiff;
import org.p4hlir.util.IValidate;
import org.p4hlir.util.Utilities;

import javax.annotation.Nullable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Command-line options for the P4 analyzer */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions implements IDiff<CompilerOptions>, IValidate {
    public static final String PARSE_GRAPH = "parse";
    public static final String TABLE_GRAPH = "table";
    public static final String DEPENDENCY_GRAPH = "deps";

    /** Options controlling the dependency analysis and how its result is drawn. */
    @SuppressWarnings("CanBeFinal")
    public static class Analysis implements IDiff<Analysis>, IValidate {
        @Parameter(names = "--split-match-action-events",
                description = "Analyze the match and action of each table as separate events and report the critical path")
        public boolean splitMatchAction = false;
        @Parameter(names = "--no-reduction", description = "Do not remove transitively implied dependencies")
        public boolean noReduction = false;
        @Parameter(names = "--critical-only",
                description = "Only draw dependencies on the critical path; requires --split-match-action-events")
        public boolean criticalOnly = false;
        @Parameter(names = "--dep-stages-with-conds",
                description = "Conditionals occupy a pipeline stage of their own")
        public boolean conditionalsUseStages = false;
        @Parameter(names = "--no-control-flow-edges", description = "Do not draw control-flow dependencies")
        public boolean noControlFlowEdges = false;
        @Parameter(names = "--show-conditions", description = "Show the condition of conditionals in the graphs")
        public boolean showConditions = false;
        @Parameter(names = "--show-fields", description = "Show the fields causing each dependency")
        public boolean showFields = false;
        @Parameter(names = "--debug-stages", description = "Show and print the stage of each table")
        public boolean debugStages = false;
        @Parameter(names = "--debug-key-widths", description = "Show the key and action data widths of each table")
        public boolean debugKeyWidths = false;

        public boolean same(Analysis other) {
            // Only compare fields that change the analysis result.
            return this.splitMatchAction == other.splitMatchAction &&
                    this.noReduction == other.noReduction &&
                    this.conditionalsUseStages == other.conditionalsUseStages;
        }

        /** True if the graph is reduced before it is scheduled and drawn. */
        public boolean reduce() {
            return !this.noReduction && !this.splitMatchAction;
        }

        public DotOptions getDotOptions() {
            return new DotOptions(this.showConditions, this.showFields, !this.noControlFlowEdges,
                    this.criticalOnly && this.splitMatchAction, this.debugStages, this.debugKeyWidths);
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (this.criticalOnly && !this.splitMatchAction)
                reporter.reportWarning("Invalid options",
                        "Option --critical-only has no effect without --split-match-action-events");
            return true;
        }

        @Override
        public String toString() {
            return "Analysis{" +
                    "\n\tsplitMatchAction=" + this.splitMatchAction +
                    ",\n\tnoReduction=" + this.noReduction +
                    ",\n\tcriticalOnly=" + this.criticalOnly +
                    ",\n\tconditionalsUseStages=" + this.conditionalsUseStages +
                    ",\n\tnoControlFlowEdges=" + this.noControlFlowEdges +
                    ",\n\tshowConditions=" + this.showConditions +
                    ",\n\tshowFields=" + this.showFields +
                    ",\n\tdebugStages=" + this.debugStages +
                    ",\n\tdebugKeyWidths=" + this.debugKeyWidths +
                    '}';
        }

        @Override
        public String diff(Analysis other) {
            if (this.same(other))
                return "";
            StringBuilder result = new StringBuilder();
            result.append("Analysis{");
            if (this.splitMatchAction != other.splitMatchAction)
                result.append("splitMatchAction=")
                        .append(this.splitMatchAction)
                        .append("!=")
                        .append(other.splitMatchAction)
                        .append(System.lineSeparator());
            if (this.noReduction != other.noReduction)
                result.append(", noReduction=")
                        .append(this.noReduction)
                        .append("!=")
                        .append(other.noReduction)
                        .append(System.lineSeparator());
            if (this.conditionalsUseStages != other.conditionalsUseStages)
                result.append(", conditionalsUseStages=")
                        .append(this.conditionalsUseStages)
                        .append("!=")
                        .append(other.conditionalsUseStages)
                        .append(System.lineSeparator());
            result.append("}")
                    .append(System.lineSeparator());
            return result.toString();
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO implements IDiff<IO>, IValidate {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @DynamicParameter(names = "-D", description = "Preprocessor definition, passed to the program loader")
        public Map<String, String> defines = new LinkedHashMap<>();
        @Parameter(names = "-I", description = "Include directory, passed to the program loader")
        public List<String> includes = new ArrayList<>();
        @Parameter(names = "--primitives", description = "File with additional primitive definitions (can be repeated)")
        public List<String> primitives = new ArrayList<>();
        @Parameter(names = "--gen-dir", description = "Directory where the output files are written; must exist")
        public String genDir = ".";
        @Parameter(names = "--graphs", description = "Graphs to produce: parse, table, deps")
        public List<String> graphs = new ArrayList<>(List.of(DEPENDENCY_GRAPH));
        @Parameter(names = "--format",
                description = "Image formats to try, in order; 'none' stops without rendering")
        public List<String> formats = new ArrayList<>(List.of("png", "eps", ToDot.NONE));
        @Nullable @Parameter(names = "--summary", description = "Write a JSON summary of the analysis to the specified file")
        public String summaryFile = null;
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array to the error output")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;
        @Parameter(names = "-v", description = "Output verbosity")
        public int verbosity = 0;
        @Parameter(description = "HLIR program to analyze", required = true)
        @Nullable
        public String inputFile = null;

        /** Only compare fields that matter. */
        public boolean same(IO other) {
            return this.graphs.equals(other.graphs) &&
                    this.formats.equals(other.formats);
        }

        public boolean produces(String graph) {
            return this.graphs.contains(graph);
        }

        /** Arguments for the loader, in the usual preprocessor syntax. */
        public List<String> getPreprocessorArgs() {
            List<String> result = new ArrayList<>();
            for (var e: this.defines.entrySet())
                result.add("-D" + e.getKey() + (e.getValue().isEmpty() ? "" : "=" + e.getValue()));
            for (String include: this.includes)
                result.add("-I" + include);
            return result;
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            boolean result = true;
            for (String graph: this.graphs) {
                if (!graph.equals(PARSE_GRAPH) && !graph.equals(TABLE_GRAPH) && !graph.equals(DEPENDENCY_GRAPH)) {
                    reporter.reportError("Invalid options", "Unknown graph kind " + Utilities.singleQuote(graph) +
                            "; expected one of parse, table, deps");
                    result = false;
                }
            }
            if (this.formats.isEmpty()) {
                reporter.reportError("Invalid options", "Option --format needs at least one format");
                result = false;
            }
            if (!Files.isDirectory(Path.of(this.genDir))) {
                reporter.reportError("Invalid configuration", "Output directory " +
                        Utilities.singleQuote(this.genDir) + " does not exist or is not a directory");
                result = false;
            }
            return result;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                    ",\n\tdefines=" + this.defines +
                    ",\n\tincludes=" + this.includes +
                    ",\n\tprimitives=" + this.primitives +
                    ",\n\tgenDir=" + Utilities.singleQuote(this.genDir) +
                    ",\n\tgraphs=" + this.graphs +
                    ",\n\tformats=" + this.formats +
                    ",\n\tsummaryFile=" + Utilities.singleQuote(this.summaryFile) +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\tverbosity=" + this.verbosity +
                    ",\n\tquiet=" + this.quiet +
                    '}';
        }

        @Override
        public String diff(IO other) {
            if (this.same(other))
                return "";
            return "IO{" +
                    (!this.graphs.equals(other.graphs) ? ".graphs=" +
                            this.graphs + "!=" + other.graphs : "")
                    + (!this.formats.equals(other.formats) ? ".formats=" +
                            this.formats + "!=" + other.formats : "") +
                    "}";
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Analysis analysisOptions = new Analysis();

    @Override
    public String diff(CompilerOptions other) {
        return this.analysisOptions.diff(other.analysisOptions) +
                this.ioOptions.diff(other.ioOptions);
    }

    public boolean same(CompilerOptions other) {
        if (!this.ioOptions.same(other.ioOptions)) return false;
        return this.analysisOptions.same(other.analysisOptions);
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                ",\nanalysisOptions=" + this.analysisOptions +
                "\n}";
    }

    public CompilerOptions() {}

    @Override
    public boolean validate(IErrorReporter reporter) {
        return this.ioOptions.validate(reporter) &&
                this.analysisOptions.validate(reporter);
    }
}
