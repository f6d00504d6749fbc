package com.swiftship.core.ast;

import java.util.Objects;

/**
 * A call argument, optionally labeled.
 *
 * @param label argument label, or null for an unlabeled argument
 * @param value argument value
 */
public record Argument(String label, Expression value) {

    public Argument {
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Creates an unlabeled argument.
     *
     * @param value argument value
     * @return the argument
     */
    public static Argument of(Expression value) {
        return new Argument(null, value);
    }

    /**
     * Creates a labeled argument.
     *
     * @param label argument label
     * @param value argument value
     * @return the argument
     */
    public static Argument labeled(String label, Expression value) {
        return new Argument(Objects.requireNonNull(label, "label must not be null"), value);
    }
}
