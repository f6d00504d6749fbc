package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A plain function or initializer call, e.g. {@code URL(string: "...")} or
 * {@code .system(size: 24)}.
 *
 * <p>When a trailing closure is present and there are no arguments the parentheses are
 * omitted ({@code #Preview { ... }}).
 *
 * @param name called name, printed verbatim
 * @param arguments call arguments
 * @param trailingClosure trailing closure body, possibly empty
 */
public record FunctionCallExpr(String name, List<Argument> arguments, List<Expression> trailingClosure)
    implements Expression {

    public FunctionCallExpr {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        trailingClosure = trailingClosure == null ? List.of() : List.copyOf(trailingClosure);
    }

    /**
     * Creates a call without a trailing closure.
     *
     * @param name called name
     * @param arguments call arguments
     * @return the expression
     */
    public static FunctionCallExpr of(String name, Argument... arguments) {
        return new FunctionCallExpr(name, List.of(arguments), List.of());
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
