package com.swiftship.core.ast;

import java.util.Objects;

/**
 * A string literal. Values containing a line break print as a multi-line literal.
 *
 * @param value the unescaped string value
 */
public record StringLiteralExpr(String value) implements Expression {

    public StringLiteralExpr {
        Objects.requireNonNull(value, "value must not be null");
    }

    /**
     * Whether this literal prints in the {@code """} form.
     *
     * @return true when the value contains a newline
     */
    public boolean isMultiline() {
        return value.indexOf('\n') >= 0;
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
