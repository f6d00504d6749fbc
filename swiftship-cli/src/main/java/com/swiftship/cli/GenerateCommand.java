package com.swiftship.cli;

import com.swiftship.SwiftShipCLI;
import com.swiftship.core.GeneratedSource;
import com.swiftship.core.SwiftCodeGenerator;
import com.swiftship.core.config.CodegenConfig;
import com.swiftship.core.config.ConfigLoader;
import com.swiftship.core.config.SwiftShipConfig;
import com.swiftship.core.model.ComponentNode;
import com.swiftship.core.model.ComponentTreeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to generate a SwiftUI view from a component tree file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Write Sources/Views/LoginScreen.swift
 * swiftship generate -i login.json -n LoginScreen -o Sources/Views
 *
 * # Print to standard output
 * swiftship generate -i login.json --stdout
 * }</pre>
 *
 * <p>Without {@code -n} the view is named after the input file. Without {@code -o} the
 * directory comes from {@code output.directory} in the configuration.
 */
@Command(
    name = "generate",
    description = "Generate a SwiftUI view from a component tree",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    private static final String JSON_EXTENSION = ".json";

    @ParentCommand
    private SwiftShipCLI parent;

    @Option(names = {"-i", "--input"}, description = "Component tree JSON file", required = true)
    private Path input;

    @Option(names = {"-n", "--name"}, description = "View (file) name; defaults to the input file name")
    private String name;

    @Option(names = {"-o", "--output"}, description = "Output directory")
    private Path outputDir;

    @Option(names = {"-c", "--config"}, description = "Configuration file")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = "--stdout", description = "Print the generated source instead of writing a file")
    private boolean stdout;

    @Option(names = "--no-preview", description = "Omit the #Preview block")
    private boolean noPreview;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        SwiftShipConfig config = ConfigLoader.load(configPath);
        CodegenConfig codegen = noPreview ? config.codegen().withPreview(false) : config.codegen();

        ComponentNode tree;
        try {
            tree = ComponentTreeReader.read(input);
        } catch (UncheckedIOException | IllegalArgumentException e) {
            log.error("Cannot read component tree {}: {}", input, e.getMessage());
            return 1;
        }

        GeneratedSource source = new SwiftCodeGenerator(codegen).generate(viewFileName(), tree);
        if (stdout) {
            System.out.print(source.content());
            return 0;
        }

        Path directory = outputDir != null ? outputDir : Paths.get(config.output().directory());
        try {
            Path written = new SourceFileWriter().write(directory, source);
            if (parent == null || !parent.isQuiet()) {
                System.out.println("Generated " + written);
            }
            return 0;
        } catch (IllegalStateException e) {
            log.error(e.getMessage(), e);
            return 1;
        }
    }

    private String viewFileName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        Path fileName = input.getFileName();
        String base = fileName == null ? "" : fileName.toString();
        return base.endsWith(JSON_EXTENSION) ? base.substring(0, base.length() - JSON_EXTENSION.length()) : base;
    }
}
