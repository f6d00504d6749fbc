package com.swiftship.core.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            codegen:
              imports:
                - SwiftUI
                - MapKit
              includePreview: false
              semanticColors:
                - brand
            output:
              directory: Sources/Views
            """);

        SwiftShipConfig config = ConfigLoader.load(configFile);

        assertThat(config.codegen().imports()).containsExactly("SwiftUI", "MapKit");
        assertThat(config.codegen().includePreview()).isFalse();
        assertThat(config.codegen().semanticColors()).containsExactly("brand");
        assertThat(config.output().directory()).isEqualTo("Sources/Views");
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("partial.yaml");
        Files.writeString(configFile, """
            codegen:
              includePreview: false
            """);

        SwiftShipConfig config = ConfigLoader.load(configFile);

        assertThat(config.codegen().imports()).containsExactly("SwiftUI");
        assertThat(config.codegen().includePreview()).isFalse();
        assertThat(config.output().directory()).isEqualTo(".");
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("extra.yaml");
        Files.writeString(configFile, """
            project:
              name: demo
            codegen:
              indent: tabs
            """);

        SwiftShipConfig config = ConfigLoader.load(configFile);

        assertThat(config.codegen()).isEqualTo(CodegenConfig.defaults());
    }

    @Test
    void load_missingFile_returnsDefaults() {
        SwiftShipConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(SwiftShipConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(SwiftShipConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("invalid.yaml");
        Files.writeString(configFile, "codegen: [unclosed\n  imports: {");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SwiftShipConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("empty.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SwiftShipConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(SwiftShipConfig.defaults());
    }
}
