package com.swiftship.core.ast;

/**
 * A floating-point literal.
 *
 * @param value literal value; must be finite
 */
public record FloatLiteralExpr(double value) implements Expression {

    public FloatLiteralExpr {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Swift has no literal for " + value);
        }
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitFloatLiteral(this);
    }
}
