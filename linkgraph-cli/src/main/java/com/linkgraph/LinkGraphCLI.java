package com.linkgraph;

import ch.qos.logback.classic.Level;
import com.linkgraph.cli.CheckCommand;
import com.linkgraph.cli.CompatCommand;
import com.linkgraph.cli.DiffCommand;
import com.linkgraph.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for LinkGraph.
 *
 * <p>A developer tool around the connection engine: it replays diagram files through the engine
 * and answers the questions the engine asks while connecting nodes.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code check} - Replay a diagram file and report every edge and refusal</li>
 *   <li>{@code compat} - Ask whether one port type can feed another</li>
 *   <li>{@code diff} - Compare an expected and an actual column schema</li>
 *   <li>{@code list} - List node kinds or type conversions</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Check a diagram, failing on any warning
 * linkgraph check diagram.yaml --strict
 *
 * # Can a number output feed a string input?
 * linkgraph compat number string
 *
 * # Show engine decisions while replaying
 * linkgraph -v check diagram.yaml
 * }</pre>
 */
@Command(
    name = "linkgraph",
    mixinStandardHelpOptions = true,
    version = "LinkGraph 1.0.0-SNAPSHOT",
    description = "Connection graph engine for diagram editors",
    subcommands = {
        CheckCommand.class,
        CompatCommand.class,
        DiffCommand.class,
        ListCommand.class
    }
)
public class LinkGraphCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LinkGraphCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        spec.commandLine().getOut().println("LinkGraph - connection graph engine for diagram editors");
        spec.commandLine().getOut().println("Use 'linkgraph --help' to see available commands");
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

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured from the global options before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        LinkGraphCLI cli = new LinkGraphCLI();
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
