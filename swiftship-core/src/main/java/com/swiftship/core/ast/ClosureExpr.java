package com.swiftship.core.ast;

import java.util.List;

/**
 * A closure literal, e.g. {@code { item in Text(item) }}.
 *
 * @param parameters closure parameter names, possibly empty
 * @param body body statements
 */
public record ClosureExpr(List<String> parameters, List<SwiftNode> body) implements Expression {

    public ClosureExpr {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        body = body == null ? List.of() : List.copyOf(body);
    }

    /**
     * Creates a parameterless closure.
     *
     * @param body body statements
     * @return the closure
     */
    public static ClosureExpr of(SwiftNode... body) {
        return new ClosureExpr(List.of(), List.of(body));
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitClosure(this);
    }
}
