package com.swiftship.core;

import java.util.Objects;

/**
 * A generated Swift source file.
 *
 * @param viewName name of the generated view struct
 * @param fileName file name the content belongs in ({@code <viewName>.swift})
 * @param content Swift source text
 */
public record GeneratedSource(
    String viewName,
    String fileName,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedSource {
        Objects.requireNonNull(viewName, "viewName must not be null");
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
