package com.docweaver;

import com.docweaver.cli.BuildCommand;
import com.docweaver.cli.ThemeCommand;
import com.docweaver.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for DocWeaver.
 *
 * <p>DocWeaver builds a documentation website from an extracted API model and Markdown
 * topics, styled by a theme.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Generate the documentation site</li>
 *   <li>{@code theme} - Show a resolved theme</li>
 *   <li>{@code validate} - Validate configuration and theme</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Exit codes:</b> 0 success, 1 some files failed, 2 usage error, 3 invalid
 * configuration or theme, 4 unexpected failure.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Build using ./docweaver.yaml
 * docweaver build
 *
 * # Build with another theme, verbose
 * docweaver -v build --theme modern
 *
 * # Show the parameters of a theme
 * docweaver theme classic
 * }</pre>
 */
@Command(
    name = "docweaver",
    mixinStandardHelpOptions = true,
    version = "DocWeaver 1.0.0-SNAPSHOT",
    description = "Documentation site generator for API references and Markdown topics",
    subcommands = {
        BuildCommand.class,
        ThemeCommand.class,
        ValidateCommand.class
    }
)
public class DocWeaverCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocWeaverCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("DocWeaver - Documentation Site Generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docweaver --help' to see available commands");
        System.out.println("Use 'docweaver <command> --help' for command-specific help");
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
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
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
     * Creates the command line, applying the global logging options before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        DocWeaverCLI cli = new DocWeaverCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
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
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
