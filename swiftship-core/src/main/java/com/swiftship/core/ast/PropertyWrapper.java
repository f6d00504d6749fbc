package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A property wrapper attribute such as {@code @State} or {@code @Environment(\.dismiss)}.
 *
 * @param name wrapper name without the leading {@code @}
 * @param arguments wrapper arguments, possibly empty
 */
public record PropertyWrapper(String name, List<Argument> arguments) {

    public PropertyWrapper {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * The {@code @State} wrapper.
     *
     * @return state wrapper
     */
    public static PropertyWrapper state() {
        return new PropertyWrapper("State", List.of());
    }
}
