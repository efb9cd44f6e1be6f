/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.woozie.cli;

import dev.mars.woozie.config.WoozieConfiguration;
import dev.mars.woozie.core.exceptions.WorkflowGraphException;
import dev.mars.woozie.workflow.WorkflowParseException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line tool that compiles a workflow definition into an Oozie
 * workflow document.
 *
 * Usage:
 *   java WorkflowGeneratorCLI -o <output-dir> [-w workflow.yaml] [-c config.yaml] [--graph]
 *   java WorkflowGeneratorCLI --help
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowGeneratorCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILATION_ERROR = 1;
    static final int EXIT_INVALID_ARGUMENTS = 2;
    static final int EXIT_IO_ERROR = 3;

    private static final String VERSION = "1.0.0";
    private static final String USAGE = """
            Woozie Workflow Generator v%s

            USAGE:
              java WorkflowGeneratorCLI -o <output-dir> [-w <workflow.yaml>] [-c <config.yaml>] [--graph]
              java WorkflowGeneratorCLI --help
              java WorkflowGeneratorCLI --version

            OPTIONS:
              -o, --output DIR      Directory for the generated files (created if missing)
              -w, --workflow FILE   Workflow definition (default: workflow.yaml)
              -c, --config FILE     Action type configuration (default: config.yaml)
              --graph               Also write DOT graphs of the dependency and workflow graphs
              --verbose             Print stack traces for failures
              --help                Show this help message
              --version             Show version information

            EXIT CODES:
              0  Workflow generated
              1  Workflow could not be compiled
              2  Invalid command line arguments
              3  File not found, unreadable or malformed
            """.formatted(VERSION);

    private final PrintStream out;
    private final PrintStream err;
    private final WoozieConfiguration configuration;

    private Path outputDir;
    private Path workflowFile = Paths.get("workflow.yaml");
    private Path configFile = Paths.get("config.yaml");
    private boolean verbose = false;

    public WorkflowGeneratorCLI() {
        this(System.out, System.err, new WoozieConfiguration());
    }

    public WorkflowGeneratorCLI(PrintStream out, PrintStream err, WoozieConfiguration configuration) {
        this.out = out;
        this.err = err;
        this.configuration = configuration;
    }

    public static void main(String[] args) {
        WorkflowGeneratorCLI cli = new WorkflowGeneratorCLI();
        System.exit(cli.run(args));
    }

    public int run(String[] args) {
        if (args.length == 0) {
            err.println("Error: No output directory specified");
            err.println();
            err.println(USAGE);
            return EXIT_INVALID_ARGUMENTS;
        }

        for (String arg : args) {
            if (arg.equals("--help") || arg.equals("-h")) {
                out.println(USAGE);
                return EXIT_OK;
            }
            if (arg.equals("--version")) {
                out.println("Woozie Workflow Generator v" + VERSION);
                return EXIT_OK;
            }
        }

        String problem = parseArguments(args);
        if (problem != null) {
            err.println("Error: " + problem);
            err.println();
            err.println(USAGE);
            return EXIT_INVALID_ARGUMENTS;
        }

        return generate();
    }

    private String parseArguments(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o", "--output", "-w", "--workflow", "-c", "--config" -> {
                    if (i + 1 >= args.length) {
                        return arg + " requires a value";
                    }
                    Path value = Paths.get(args[++i]);
                    if (arg.equals("-o") || arg.equals("--output")) {
                        outputDir = value;
                    } else if (arg.equals("-w") || arg.equals("--workflow")) {
                        workflowFile = value;
                    } else {
                        configFile = value;
                    }
                }
                case "--graph" -> configuration.setProperty(WoozieConfiguration.GRAPH_EXPORT_ENABLED, "true");
                case "--verbose" -> verbose = true;
                default -> {
                    return "Unknown argument: " + arg;
                }
            }
        }

        if (outputDir == null) {
            return "-o <output-dir> is required";
        }
        return null;
    }

    private int generate() {
        if (!Files.isRegularFile(workflowFile)) {
            err.println("Error: Workflow file does not exist: " + workflowFile);
            return EXIT_IO_ERROR;
        }
        if (!Files.isRegularFile(configFile)) {
            err.println("Error: Configuration file does not exist: " + configFile);
            return EXIT_IO_ERROR;
        }

        WorkflowGenerationService service = new WorkflowGenerationService(configuration);
        try {
            WorkflowGenerationService.GenerationReport report = service.generate(workflowFile, configFile, outputDir);
            out.println("✓ Generated workflow '" + report.getWorkflowName() + "': " + report.getWorkflowXml());
            for (Path graphFile : report.getGraphFiles()) {
                out.println("  Graph: " + graphFile);
            }
            return EXIT_OK;
        } catch (WorkflowGraphException e) {
            err.println("✗ Compilation failed: " + e.getMessage());
            printStackTrace(e);
            return EXIT_COMPILATION_ERROR;
        } catch (WorkflowParseException e) {
            err.println("✗ Invalid input: " + e.getMessage());
            printStackTrace(e);
            return EXIT_IO_ERROR;
        } catch (IOException e) {
            err.println("✗ I/O error: " + e.getMessage());
            printStackTrace(e);
            return EXIT_IO_ERROR;
        }
    }

    private void printStackTrace(Exception e) {
        if (verbose) {
            e.printStackTrace(err);
        }
    }
}
