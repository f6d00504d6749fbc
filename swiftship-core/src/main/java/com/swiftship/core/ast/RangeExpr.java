package com.swiftship.core.ast;

import java.util.Objects;

/**
 * A closed range, {@code lower...upper}.
 *
 * @param lower lower bound
 * @param upper upper bound
 */
public record RangeExpr(Expression lower, Expression upper) implements Expression {

    public RangeExpr {
        Objects.requireNonNull(lower, "lower must not be null");
        Objects.requireNonNull(upper, "upper must not be null");
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitRange(this);
    }
}
