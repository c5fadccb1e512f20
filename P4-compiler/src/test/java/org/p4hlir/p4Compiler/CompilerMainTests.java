package org.p4hlir.p4Compiler;

import com.beust.jcommander.JCommander;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.p4hlir.p4Compiler.compiler.CompilerOptions;
import org.p4hlir.p4Compiler.compiler.P4Compiler;
import org.p4hlir.p4Compiler.compiler.dependencies.DependencyGraphBuilder;
import org.p4hlir.p4Compiler.compiler.errors.CompilerMessages;
import org.p4hlir.util.Logger;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Runs the analyzer the way the command line does. */
public class CompilerMainTests extends BaseP4Tests {
    Path genDir;

    @Before
    public void createDirectory() throws IOException {
        this.genDir = Files.createTempDirectory("p4graphs");
        this.genDir.toFile().deleteOnExit();
    }

    Path output(String name) {
        Path result = this.genDir.resolve(name);
        result.toFile().deleteOnExit();
        return result;
    }

    String input(String name) {
        return resourcePath(name).toString();
    }

    @Test
    public void textOnlyRun() {
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "--format", "none", input("scenarioA.json"));
        Assert.assertEquals(messages.toString(), 0, messages.exitCode);
        Assert.assertTrue(Files.exists(this.output("ingress.table_dependencies.dot")));
        Assert.assertFalse(Files.exists(this.output("ingress.tables.dot")));
    }

    @Test
    public void allGraphs() {
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "--format", "none",
                "--graphs", "parse,table,deps", input("router.json"));
        Assert.assertEquals(messages.toString(), 0, messages.exitCode);
        for (String file: List.of("router.parser.dot",
                "ingress.tables.dot", "egress.tables.dot",
                "ingress.table_dependencies.dot", "egress.table_dependencies.dot"))
            Assert.assertTrue(file, Files.exists(this.output(file)));
    }

    @Test
    public void help() {
        CompilerMessages messages = CompilerMain.execute("-h");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.isEmpty());
    }

    @Test
    public void missingInput() {
        CompilerMessages messages = CompilerMain.execute("--split-match-action-events");
        Assert.assertEquals(1, messages.exitCode);
    }

    @Test
    public void missingOutputDirectory() {
        String missing = this.genDir.resolve("missing").toString();
        CompilerMessages messages = CompilerMain.execute("--gen-dir", missing, input("scenarioA.json"));
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Invalid configuration", messages.getMessage(0).errorType);
    }

    @Test
    public void unknownGraph() {
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "--graphs", "deps,flow", input("scenarioA.json"));
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertTrue(messages.toString().contains("'flow'"));
    }

    @Test
    public void jsonMessages() throws IOException {
        String missing = this.genDir.resolve("missing").toString();
        CompilerMessages messages = CompilerMain.execute("--je", "--gen-dir", missing, input("scenarioA.json"));
        Assert.assertEquals(1, messages.exitCode);
        JsonNode json = new ObjectMapper().readTree(messages.toString());
        Assert.assertTrue(json.isArray());
        Assert.assertEquals(1, json.size());
        Assert.assertFalse(json.get(0).get("warning").asBoolean());
        Assert.assertEquals("Invalid configuration", json.get(0).get("error_type").asText());
    }

    @Test
    public void unreadablePrimitives() {
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "--format", "none",
                "--primitives", this.genDir.resolve("none.json").toString(), input("scenarioA.json"));
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Invalid configuration", messages.getMessage(0).errorType);
    }

    @Test
    public void extraPrimitives() {
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "--format", "none",
                "--primitives", input("extra_primitives.json"), input("scenarioA.json"));
        Assert.assertEquals(messages.toString(), 0, messages.exitCode);
    }

    @Test
    public void missingProgram() {
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), this.genDir.resolve("absent.json").toString());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Error reading program", messages.getMessage(0).errorType);
    }

    @Test
    public void cyclicProgram() {
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "--format", "none", input("cyclic.json"));
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals("Unsupported program structure", messages.getMessage(0).errorType);
        Assert.assertFalse(Files.exists(this.output("ingress.table_dependencies.dot")));
    }

    @Test
    public void loggingOptions() {
        CompilerMessages bad = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "-TNoSuchClass=2", input("scenarioA.json"));
        Assert.assertEquals(1, bad.exitCode);
        CompilerMessages notNumber = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "-TDependencyGraphBuilder=x", input("scenarioA.json"));
        Assert.assertEquals(1, notNumber.exitCode);

        StringBuilder log = new StringBuilder();
        Appendable previous = Logger.INSTANCE.setDebugStream(log);
        try {
            CompilerMessages messages = CompilerMain.execute(
                    "--gen-dir", this.genDir.toString(), "--format", "none",
                    "-TDependencyGraphBuilder=1", input("scenarioA.json"));
            Assert.assertEquals(0, messages.exitCode);
            Assert.assertTrue(log.toString().contains("ingress"));
        } finally {
            Logger.INSTANCE.setDebugStream(previous);
            Logger.INSTANCE.setLoggingLevel(DependencyGraphBuilder.class, 0);
        }
    }

    @Test
    public void criticalOnlyNeedsSplit() {
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "--format", "none", "--critical-only", input("scenarioA.json"));
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertEquals(1, messages.warningCount());
    }

    @Test
    public void summary() throws IOException {
        Path summary = this.output("summary.json");
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "--format", "none",
                "--summary", summary.toString(), input("scenarioA.json"));
        Assert.assertEquals(0, messages.exitCode);
        JsonNode json = new ObjectMapper().readTree(summary.toFile());
        JsonNode pipeline = json.get("pipelines").get(0);
        Assert.assertEquals("ingress", pipeline.get("pipeline").asText());
        Assert.assertEquals("table", pipeline.get("mode").asText());
        Assert.assertTrue(pipeline.get("reduced").asBoolean());
        Assert.assertEquals(3, pipeline.get("schedule").get("length").asInt());
        Assert.assertEquals(2, pipeline.get("graph").get("edges").size());
    }

    @Test
    public void splitSummary() throws IOException {
        Path summary = this.output("split.json");
        CompilerMessages messages = CompilerMain.execute(
                "--gen-dir", this.genDir.toString(), "--format", "none", "--split-match-action-events",
                "--summary", summary.toString(), input("scenarioA.json"));
        Assert.assertEquals(0, messages.exitCode);
        JsonNode pipeline = new ObjectMapper().readTree(summary.toFile()).get("pipelines").get(0);
        Assert.assertEquals("split", pipeline.get("mode").asText());
        Assert.assertFalse(pipeline.get("reduced").asBoolean());
        JsonNode critical = pipeline.get("schedule").get("critical");
        Assert.assertEquals(2, critical.size());
        Assert.assertEquals("T1.action -> T2.match", critical.get(0).asText());
        Assert.assertEquals("T2.action -> T3.match", critical.get(1).asText());
    }

    static CompilerOptions options(String input, Path genDir) {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.inputFile = input;
        options.ioOptions.genDir = genDir.toString();
        return options;
    }

    @Test
    public void renderingFailureIsPerGraph() {
        CompilerOptions options = options(input("scenarioD.json"), this.genDir);
        options.ioOptions.graphs = List.of(CompilerOptions.TABLE_GRAPH, CompilerOptions.DEPENDENCY_GRAPH);
        options.ioOptions.formats = List.of("png");
        P4Compiler compiler = new P4Compiler(options);
        compiler.setRenderer((dot, format, image) -> {
            throw new IOException("no renderer for " + format);
        });
        CompilerMessages messages = compiler.compile();
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(2, messages.errorCount());
        Assert.assertEquals("Rendering unavailable", messages.getMessage(0).errorType);
        Assert.assertTrue(Files.exists(this.output("ingress.tables.dot")));
        Assert.assertTrue(Files.exists(this.output("ingress.table_dependencies.dot")));
    }

    @Test
    public void rendering() {
        CompilerOptions options = options(input("scenarioB.json"), this.genDir);
        options.ioOptions.formats = List.of("svg");
        P4Compiler compiler = new P4Compiler(options);
        compiler.setRenderer((dot, format, image) -> {
            Files.writeString(image, format);
            image.toFile().deleteOnExit();
        });
        CompilerMessages messages = compiler.compile();
        Assert.assertEquals(0, messages.exitCode);
        Assert.assertTrue(Files.exists(this.output("ingress.table_dependencies.svg")));
    }

    @Test
    public void debugStages() {
        CompilerOptions options = options(input("scenarioA.json"), this.genDir);
        options.ioOptions.formats = List.of("none");
        options.analysisOptions.splitMatchAction = true;
        options.analysisOptions.debugStages = true;
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        P4Compiler compiler = new P4Compiler(options);
        compiler.setOutput(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        CompilerMessages messages = compiler.compile();
        Assert.assertEquals(0, messages.exitCode);
        String printed = bytes.toString(StandardCharsets.UTF_8);
        Assert.assertTrue(printed, printed.contains("Control ingress: 3 stages"));
        Assert.assertTrue(printed, printed.contains("T1.action: 0 critical"));
        Assert.assertEquals(1, compiler.getResults().size());
        Assert.assertNotNull(compiler.getProgram());
        Assert.assertTrue(this.output("ingress.table_dependencies.dot").toFile().isFile());
    }

    @Test
    public void preprocessorArguments() {
        CompilerOptions options = new CompilerOptions();
        JCommander.newBuilder()
                .addObject(options)
                .build()
                .parse("-DSIZE=16", "-I", "include" + File.separator + "p4", "prog.json");
        Assert.assertEquals(List.of("-DSIZE=16", "-Iinclude" + File.separator + "p4"),
                options.ioOptions.getPreprocessorArgs());
        Assert.assertEquals("prog.json", options.ioOptions.inputFile);
        Assert.assertTrue(options.analysisOptions.reduce());
    }
}
