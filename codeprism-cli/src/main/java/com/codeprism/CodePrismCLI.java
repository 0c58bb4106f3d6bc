package com.codeprism;

import com.codeprism.cli.AnalyzeCommand;
import com.codeprism.cli.InitCommand;
import com.codeprism.cli.ListCommand;
import com.codeprism.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for CodePrism.
 *
 * <p>CodePrism analyzes Python source files and writes a structured report per
 * file: metrics, complexity, dependencies, detected patterns, data flow and
 * code quality, plus optional Mermaid diagrams and a Markdown summary.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze source files and write reports</li>
 *   <li>{@code validate} - Check that source files parse</li>
 *   <li>{@code list} - List available probes, generators, or renderers</li>
 *   <li>{@code init} - Write a default configuration file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Analyze a file into ./codeprism-output/transformer/
 * codeprism analyze transformer.py
 *
 * # Print the JSON report only
 * codeprism analyze --stdout transformer.py
 *
 * # List pattern probes
 * codeprism list probes
 * }</pre>
 */
@Command(
    name = "codeprism",
    mixinStandardHelpOptions = true,
    version = "CodePrism 1.0.0-SNAPSHOT",
    description = "Structural, complexity and quality analysis for Python source files",
    subcommands = {
        AnalyzeCommand.class,
        ValidateCommand.class,
        ListCommand.class,
        InitCommand.class
    }
)
public class CodePrismCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodePrismCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("CodePrism - Python source analysis");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codeprism --help' to see available commands");
        System.out.println("Use 'codeprism <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line, applying the global logging options before
     * whichever command was selected runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodePrismCLI cli = new CodePrismCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
