package com.swiftship.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Settings that shape the generated Swift file.
 *
 * @param imports modules imported at the top of the file, in order
 * @param includePreview whether a {@code #Preview} block follows the view (null = true)
 * @param semanticColors names added to the built-in semantic-colour allow-list
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodegenConfig(
    @JsonProperty("imports") List<String> imports,
    @JsonProperty("includePreview") Boolean includePreview,
    @JsonProperty("semanticColors") List<String> semanticColors
) {
    /**
     * Compact constructor with validation.
     */
    public CodegenConfig {
        imports = imports == null || imports.isEmpty() ? List.of("SwiftUI") : List.copyOf(imports);
        if (includePreview == null) {
            includePreview = Boolean.TRUE;
        }
        semanticColors = semanticColors == null ? List.of() : List.copyOf(semanticColors);
    }

    /**
     * Creates the default configuration: {@code import SwiftUI} and a preview block.
     *
     * @return default codegen config
     */
    public static CodegenConfig defaults() {
        return new CodegenConfig(null, null, null);
    }

    /**
     * Returns a copy with the preview block switched on or off.
     *
     * @param preview whether to append a preview
     * @return new config
     */
    public CodegenConfig withPreview(boolean preview) {
        return new CodegenConfig(imports, preview, semanticColors);
    }
}
