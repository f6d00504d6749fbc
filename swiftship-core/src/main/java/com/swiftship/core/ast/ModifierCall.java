package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A view modifier chained onto a {@link ViewBuilderExpr}, such as {@code .font(.title)}.
 *
 * <p>Modifier order is significant: modifiers apply top to bottom in the order they are
 * listed on the expression.
 *
 * @param name modifier name without the leading dot
 * @param arguments call arguments, possibly empty
 * @param trailingClosure trailing closure body, empty when the modifier takes none
 */
public record ModifierCall(String name, List<Argument> arguments, List<Expression> trailingClosure) {

    public ModifierCall {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        trailingClosure = trailingClosure == null ? List.of() : List.copyOf(trailingClosure);
    }

    /**
     * Creates a modifier with the given arguments and no trailing closure.
     *
     * @param name modifier name
     * @param arguments call arguments
     * @return the modifier
     */
    public static ModifierCall of(String name, Argument... arguments) {
        return new ModifierCall(name, List.of(arguments), List.of());
    }

    /**
     * Creates a modifier whose content is passed as a trailing closure.
     *
     * @param name modifier name
     * @param arguments call arguments
     * @param body trailing closure body
     * @return the modifier
     */
    public static ModifierCall withClosure(String name, List<Argument> arguments, List<Expression> body) {
        return new ModifierCall(name, arguments, body);
    }
}
