package com.swiftship.core.ast;

/**
 * An integer literal.
 *
 * @param value literal value
 */
public record IntLiteralExpr(long value) implements Expression {

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitIntLiteral(this);
    }
}
