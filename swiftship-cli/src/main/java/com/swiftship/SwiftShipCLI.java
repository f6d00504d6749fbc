package com.swiftship;

import ch.qos.logback.classic.Level;
import com.swiftship.cli.GenerateCommand;
import com.swiftship.cli.ListCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for SwiftShip.
 *
 * <p>SwiftShip turns validated component trees (JSON) into SwiftUI source files.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Generate a SwiftUI view from a component tree</li>
 *   <li>{@code list} - List supported component kinds</li>
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
 * swiftship generate -i login.json -n LoginScreen -o Sources/Views
 * swiftship -v generate -i login.json --stdout
 * swiftship list
 * }</pre>
 */
@Command(
    name = "swiftship",
    mixinStandardHelpOptions = true,
    version = "SwiftShip 1.0.0-SNAPSHOT",
    description = "SwiftUI source generator for component trees",
    subcommands = {
        GenerateCommand.class,
        ListCommand.class
    }
)
public class SwiftShipCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SwiftShipCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("SwiftShip - SwiftUI source generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'swiftship --help' to see available commands");
        System.out.println("Use 'swiftship <command> --help' for command-specific help");
    }

    /**
     * Configures the root logging level from the global options. Subcommands call this
     * before doing any work.
     */
    public void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SwiftShipCLI()).execute(args);
        System.exit(exitCode);
    }
}
