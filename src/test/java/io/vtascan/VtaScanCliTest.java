package io.vtascan;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VtaScanCliTest {

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);
        return new CommandLine(new VtaScanCli(out, err)).execute(args);
    }

    private List<String> out() {
        return outBuffer.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private static String fixture(String name) throws URISyntaxException {
        return Path.of(VtaScanCliTest.class.getResource("/programs/" + name + ".yaml").toURI()).toString();
    }

    @Test
    void printsVtaEdgesByDefault() throws Exception {
        int exit = run(fixture("static"), "--no-color");

        assertThat(exit).isZero();
        assertThat(out()).containsExactly(
                "(*C).f -> (C).f",
                "f -> (C).f",
                "f -> f",
                "f -> f$1",
                "f -> g",
                "f -> h",
                "g -> (*C).f",
                "g -> (C).f");
    }

    @Test
    void algorithmOptionSelectsStaticGraph() throws Exception {
        int exit = run(fixture("static"), "--algorithm", "static");

        assertThat(exit).isZero();
        assertThat(out()).containsExactly("(*C).f -> (C).f", "f -> (C).f", "f -> f$1", "f -> g");
    }

    @Test
    void printsFlowGraphAndTypes() throws Exception {
        assertThat(run(fixture("interfaces"), "--format", "flow", "--no-color")).isZero();
        assertThat(out()).contains("Constant(P.C) -> Local(t0)");

        outBuffer.reset();
        assertThat(run(fixture("interfaces"), "-f", "types", "--no-color", "-j", "2")).isZero();
        assertThat(out()).contains("Local(t0): P.C");
    }

    @Test
    void printsTreeAndSummary() throws Exception {
        assertThat(run(fixture("static"), "--format", "tree", "--no-color", "-a", "static")).isZero();
        assertThat(out()).startsWith("=== CALL GRAPH ===");

        outBuffer.reset();
        assertThat(run(fixture("static"), "--format", "summary", "--no-color")).isZero();
        assertThat(out()).contains("=== CALLGRAPH SUMMARY ===", "=== CALL GRAPH ===");
    }

    @Test
    void flowFormatRequiresVta() throws Exception {
        int exit = run(fixture("static"), "--format", "flow", "--algorithm", "cha");

        assertThat(exit).isEqualTo(1);
        assertThat(err()).contains("Error: --format flow requires the vta algorithm");
    }

    @Test
    void rejectsUnknownAlgorithm() throws Exception {
        int exit = run(fixture("static"), "--algorithm", "bogus");

        assertThat(exit).isEqualTo(1);
        assertThat(err()).contains("Error: Invalid value for --algorithm: bogus", "Valid values: vta, cha, static");
    }

    @Test
    void rejectsNonPositiveParallelism() throws Exception {
        assertThat(run(fixture("static"), "-j", "0")).isEqualTo(1);
        assertThat(err()).contains("Error: --parallelism must be at least 1");
    }

    @Test
    void reportsMissingInputs() {
        assertThat(run()).isEqualTo(1);
        assertThat(err()).contains("Error: Specify a program description or a config file (-c)");

        assertThat(run(dir.resolve("missing.yaml").toString())).isEqualTo(1);
        assertThat(err()).contains("Error: Program description does not exist");

        assertThat(run("-c", dir.resolve("missing-config.yaml").toString())).isEqualTo(1);
        assertThat(err()).contains("Error: Config file does not exist");
    }

    @Test
    void reportsInvalidPrograms() throws IOException {
        Path bad = dir.resolve("bad.yaml");
        Files.writeString(bad, "package: P\nfunctions:\n  - name: g\n    body:\n      - {op: frobnicate}\n");

        assertThat(run(bad.toString())).isEqualTo(1);
        assertThat(err()).contains("Error loading program:", "unknown instruction 'frobnicate'");
    }

    @Test
    void reportsMalformedProgramsWithLocation() throws IOException {
        Path bad = dir.resolve("unbound.yaml");
        Files.writeString(bad, """
                package: P
                types:
                  I: "interface{f()}"
                functions:
                  - name: main
                    body:
                      - {op: make_closure, name: t0, fn: "main$1"}
                      - {op: return}
                    closures:
                      - freeVars: {x: I}
                        body:
                          - {op: return}
                """);

        assertThat(run(bad.toString())).isEqualTo(1);
        assertThat(err())
                .startsWith("Error: Malformed program: P.main: block 0, instruction 0: ")
                .contains("main$1 has 1 free variables, got 0 bindings")
                .doesNotContain("program at");
    }

    @Test
    void reportsInvalidConfig() throws IOException {
        Path config = dir.resolve("vta-scan.yaml");
        Files.writeString(config, "algorithm: vta\n");

        assertThat(run("-c", config.toString())).isEqualTo(1);
        assertThat(err()).contains("Error: Config file must specify 'program'");
    }

    @Test
    void configFileSuppliesProgramAndExclusions() throws Exception {
        Files.copy(Path.of(fixture("static")), dir.resolve("static.yaml"));
        Path config = dir.resolve("vta-scan.yaml");
        Files.writeString(config, """
                program: static.yaml
                algorithm: static
                excludeFunctions:
                  - g
                """);

        int exit = run("-c", config.toString());

        assertThat(exit).isZero();
        assertThat(out()).containsExactly("(*C).f -> (C).f", "f -> (C).f", "f -> f$1");
    }

    @Test
    void commandLineOverridesConfigFile() throws Exception {
        Path config = dir.resolve("vta-scan.yaml");
        Files.writeString(config, "program: nowhere.yaml\nalgorithm: cha\n");

        int exit = run("-c", config.toString(), fixture("static"), "--algorithm", "static");

        assertThat(exit).isZero();
        assertThat(out()).hasSize(4);
    }

    @Test
    void rejectsUnknownFormat() throws Exception {
        assertThat(run(fixture("static"), "--format", "dot")).isEqualTo(2);
    }
}
