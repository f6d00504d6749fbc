package com.swiftship.core.ast;

import java.util.Objects;

/**
 * A function parameter.
 *
 * @param label external argument label; null to reuse the name, {@code "_"} to suppress it
 * @param name internal parameter name
 * @param type parameter type
 * @param defaultValue default value, or null
 */
public record Parameter(String label, String name, String type, Expression defaultValue) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
