package com.swiftship.core.generator;

import com.swiftship.core.config.CodegenConfig;

import java.util.Objects;

/**
 * Per-file generation state handed to every generator.
 *
 * <p>One context belongs to exactly one generation call. Contexts are not thread-safe and
 * are never shared between calls.
 */
public final class GenerationContext {

    private final ColorResolver colors;
    private final StateScope state;

    public GenerationContext(ColorResolver colors, StateScope state) {
        this.colors = Objects.requireNonNull(colors, "colors must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    /**
     * Creates a fresh context for one file.
     *
     * @param config codegen settings
     * @return new context
     */
    public static GenerationContext create(CodegenConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new GenerationContext(new ColorResolver(config.semanticColors()), new StateScope());
    }

    public ColorResolver colors() {
        return colors;
    }

    public StateScope state() {
        return state;
    }
}
