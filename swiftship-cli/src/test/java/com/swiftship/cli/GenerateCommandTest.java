package com.swiftship.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import com.swiftship.SwiftShipCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GenerateCommand}.
 */
class GenerateCommandTest {

    private static final String TREE = """
        {
          "id": "root",
          "type": "vstack",
          "children": [
            { "id": "title", "type": "text", "props": { "content": "Profile", "font": "title" } },
            { "id": "notify", "type": "toggle", "props": { "label": "Notifications" } }
          ]
        }
        """;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private Path input;
    private Path missingConfig;

    @BeforeEach
    void setUp() throws IOException {
        originalOut = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        input = tempDir.resolve("profile-screen.json");
        Files.writeString(input, TREE);
        missingConfig = tempDir.resolve("missing.yaml");
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void generate_writesViewNamedAfterInputFile() throws IOException {
        Path out = tempDir.resolve("out");

        int exitCode = execute("generate", "-i", input.toString(), "-o", out.toString(), "-c", missingConfig.toString());

        Path written = out.resolve("ProfileScreen.swift");
        assertThat(exitCode).isZero();
        assertThat(written).exists();
        assertThat(Files.readString(written))
            .startsWith("import SwiftUI\n")
            .contains("struct ProfileScreen: View {")
            .contains("@State private var isOn: Bool = false")
            .contains("#Preview {");
        assertThat(captured.toString(StandardCharsets.UTF_8)).contains("Generated ").contains("ProfileScreen.swift");
    }

    @Test
    void generate_quiet_writesFileWithoutConsoleOutput() {
        Path out = tempDir.resolve("out");

        int exitCode = execute("-q", "generate", "-i", input.toString(), "-o", out.toString(),
            "-c", missingConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(out.resolve("ProfileScreen.swift")).exists();
        assertThat(captured.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void generate_explicitNameAndNoPreview() throws IOException {
        Path out = tempDir.resolve("out");

        int exitCode = execute("generate", "-i", input.toString(), "-o", out.toString(), "-n", "Account",
            "--no-preview", "-c", missingConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(out.resolve("Account.swift")))
            .contains("struct Account: View {")
            .doesNotContain("#Preview");
    }

    @Test
    void generate_stdout_printsSourceWithoutWritingFiles() throws IOException {
        int exitCode = execute("generate", "-i", input.toString(), "--stdout", "-c", missingConfig.toString());

        assertThat(exitCode).isZero();
        assertThat(captured.toString(StandardCharsets.UTF_8))
            .contains("struct ProfileScreen: View {")
            .contains("Text(\"Profile\")\n            .font(.title)");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.filter(p -> p.toString().endsWith(".swift"))).isEmpty();
        }
    }

    @Test
    void generate_configFileControlsOutputDirectoryAndImports() throws IOException {
        Path views = tempDir.resolve("Sources/Views");
        Path config = tempDir.resolve("swiftship.yaml");
        Files.writeString(config, "codegen:\n  imports: [SwiftUI, Charts]\noutput:\n  directory: \""
            + views.toString().replace("\\", "/") + "\"\n");

        int exitCode = execute("generate", "-i", input.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(views.resolve("ProfileScreen.swift"))).startsWith("import SwiftUI\nimport Charts\n\n");
    }

    @Test
    void generate_malformedInput_returnsOne() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ \"type\": ");

        int exitCode = execute("generate", "-i", broken.toString(), "-o", tempDir.toString(), "-c", missingConfig.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void generate_missingInput_returnsOne() {
        int exitCode = execute("generate", "-i", tempDir.resolve("absent.json").toString(), "-c", missingConfig.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void generate_withoutInputOption_isUsageError() {
        CommandLine commandLine = new CommandLine(new SwiftShipCLI());
        commandLine.setErr(new PrintWriter(new ByteArrayOutputStream()));

        assertThat(commandLine.execute("generate")).isEqualTo(2);
    }

    private int execute(String... args) {
        return new CommandLine(new SwiftShipCLI()).execute(args);
    }
}
