package com.swiftship.core.ast;

import java.util.Objects;

/**
 * A {@code //} line comment, optionally annotating the expression printed on the next line.
 *
 * <p>Used for visible placeholders: action stubs and markers for components the generator
 * cannot translate.
 *
 * @param text comment text without the leading {@code //}; must be a single line
 * @param subject annotated expression, or null for a standalone comment
 */
public record CommentExpr(String text, Expression subject) implements Expression {

    public CommentExpr {
        Objects.requireNonNull(text, "text must not be null");
        if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("comment text must be a single line");
        }
    }

    /**
     * Creates a standalone comment.
     *
     * @param text comment text
     * @return the comment
     */
    public static CommentExpr of(String text) {
        return new CommentExpr(text, null);
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
