package io.vtascan;

import io.vtascan.analysis.ChaCallGraphBuilder;
import io.vtascan.analysis.StaticCallGraphBuilder;
import io.vtascan.analysis.VtaAnalysis;
import io.vtascan.analysis.VtaResult;
import io.vtascan.ir.MalformedProgramException;
import io.vtascan.ir.Program;
import io.vtascan.loader.ProgramLoadException;
import io.vtascan.loader.ProgramLoader;
import io.vtascan.model.CallGraph;
import io.vtascan.output.CallGraphOutput;
import io.vtascan.output.FlowGraphOutput;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the vta-scan tool.
 */
@Command(
        name = "vta-scan",
        mixinStandardHelpOptions = true,
        version = "vta-scan 1.0.0",
        description = "Builds the call graph of a program description, resolving dynamic calls by type propagation.",
        footer = {
                "",
                "Examples:",
                "  vta-scan program.yaml",
                "  vta-scan program.yaml --format tree",
                "  vta-scan program.yaml --algorithm cha --format summary",
                "  vta-scan -c vta-scan.yaml --format flow --no-color"
        }
)
public class VtaScanCli implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(VtaScanCli.class);

    @Parameters(
            index = "0",
            arity = "0..1",
            description = "Path to the YAML program description (overrides 'program' of the config file)"
    )
    private Path programPath;

    @Option(
            names = {"-c", "--config"},
            description = "Path to YAML configuration file"
    )
    private Path configPath;

    @Option(
            names = {"-a", "--algorithm"},
            description = "Call graph algorithm: vta, cha, static (default: vta)"
    )
    private String algorithm;

    @Option(
            names = {"-f", "--format"},
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "edges"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-j", "--parallelism"},
            description = "Threads used to build the flow graph"
    )
    private Integer parallelism;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    private boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    public enum OutputFormat {
        edges,
        tree,
        summary,
        flow,
        types
    }

    private final PrintStream out;
    private final PrintStream err;

    public VtaScanCli() {
        this(System.out, System.err);
    }

    VtaScanCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (verbose) {
            Configurator.setLevel("io.vtascan", Level.DEBUG);
        }

        try {
            ScanConfig config = loadConfig();
            if (config == null) {
                return 1;
            }

            Path program = config.getProgramPath();
            if (!Files.exists(program)) {
                err.println("Error: Program description does not exist: " + program);
                return 1;
            }

            boolean needsFlow = outputFormat == OutputFormat.flow || outputFormat == OutputFormat.types;
            if (needsFlow && config.getAlgorithm() != ScanConfig.Algorithm.VTA) {
                err.println("Error: --format " + outputFormat + " requires the vta algorithm");
                return 1;
            }

            Program loaded = new ProgramLoader().load(program).program();
            logger.debug("Analyzing {} with {}", loaded, config.getAlgorithm());

            CallGraph baseline = null;
            CallGraph callGraph;
            VtaResult result = null;
            switch (config.getAlgorithm()) {
                case VTA -> {
                    result = new VtaAnalysis(loaded, config.getParallelism(), null).analyze();
                    baseline = result.baseline();
                    callGraph = result.callGraph();
                }
                case CHA -> callGraph = new ChaCallGraphBuilder(loaded).build();
                case STATIC -> callGraph = new StaticCallGraphBuilder(loaded).build();
                default -> throw new IllegalStateException("Unhandled algorithm " + config.getAlgorithm());
            }

            boolean useColor = !noColor;
            CallGraphOutput output = new CallGraphOutput(callGraph, baseline, out, useColor, config::isFunctionExcluded);
            switch (outputFormat) {
                case edges -> output.printEdges();
                case tree -> output.printCallTree();
                case summary -> output.printFull();
                case flow -> new FlowGraphOutput(out, useColor).printFlowGraph(result.flowGraph());
                case types -> new FlowGraphOutput(out, useColor).printTypeSets(result.types());
                default -> throw new IllegalStateException("Unhandled format " + outputFormat);
            }
            return 0;

        } catch (ProgramLoadException e) {
            err.println("Error loading program: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return 1;
        } catch (MalformedProgramException e) {
            err.println("Error: Malformed program: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return 1;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(err);
            }
            return 1;
        }
    }

    /**
     * Merges the config file, if any, with the command line. Returns null after reporting an error.
     */
    private ScanConfig loadConfig() throws IOException {
        ScanConfig.Algorithm parsedAlgorithm = null;
        if (algorithm != null) {
            try {
                parsedAlgorithm = ScanConfig.Algorithm.parse(algorithm);
            } catch (IllegalArgumentException e) {
                err.println("Error: Invalid value for --algorithm: " + algorithm);
                err.println("Valid values: vta, cha, static");
                return null;
            }
        }
        if (parallelism != null && parallelism < 1) {
            err.println("Error: --parallelism must be at least 1");
            return null;
        }

        ScanConfig config;
        if (configPath != null) {
            if (!Files.exists(configPath)) {
                err.println("Error: Config file does not exist: " + configPath);
                return null;
            }
            logger.debug("Loading configuration from: {}", configPath);
            config = ScanConfig.load(configPath);
        } else if (programPath != null) {
            config = ScanConfig.defaults(programPath);
        } else {
            err.println("Error: Specify a program description or a config file (-c)");
            return null;
        }
        return config.withOverrides(programPath, parsedAlgorithm, parallelism);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new VtaScanCli()).execute(args);
        System.exit(exitCode);
    }
}
