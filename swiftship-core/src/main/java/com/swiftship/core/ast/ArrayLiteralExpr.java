package com.swiftship.core.ast;

import java.util.List;

/**
 * An array literal, e.g. {@code [.medium, .large]}.
 *
 * @param elements elements, in order
 */
public record ArrayLiteralExpr(List<Expression> elements) implements Expression {

    public ArrayLiteralExpr {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitArrayLiteral(this);
    }
}
