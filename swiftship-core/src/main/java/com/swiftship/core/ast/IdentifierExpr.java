package com.swiftship.core.ast;

import java.util.Objects;

/**
 * A bare identifier reference, including binding projections such as {@code $text}.
 *
 * @param name identifier text
 */
public record IdentifierExpr(String name) implements Expression {

    public IdentifierExpr {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
