package com.swiftship.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration, loaded from {@code swiftship.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * codegen:
 *   imports: [SwiftUI]
 *   includePreview: true
 *   semanticColors: [mint, teal]
 *
 * output:
 *   directory: "./Sources/Views"
 * }</pre>
 *
 * @param codegen code generation settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SwiftShipConfig(
    @JsonProperty("codegen") CodegenConfig codegen,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor with validation.
     */
    public SwiftShipConfig {
        if (codegen == null) {
            codegen = CodegenConfig.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default configuration
     */
    public static SwiftShipConfig defaults() {
        return new SwiftShipConfig(CodegenConfig.defaults(), OutputConfig.defaults());
    }

    /**
     * Output configuration.
     *
     * @param directory directory generated files are written to
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(@JsonProperty("directory") String directory) {

        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = ".";
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(".");
        }
    }
}
