package com.swiftship.core.ast;

/**
 * {@code true} or {@code false}.
 *
 * @param value literal value
 */
public record BoolLiteralExpr(boolean value) implements Expression {

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitBoolLiteral(this);
    }
}
