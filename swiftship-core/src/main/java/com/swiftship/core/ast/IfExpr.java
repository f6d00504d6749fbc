package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code if condition { then } else { otherwise }}.
 *
 * @param condition the condition
 * @param then statements of the then-branch
 * @param otherwise statements of the else-branch; empty means no else-branch
 */
public record IfExpr(Expression condition, List<SwiftNode> then, List<SwiftNode> otherwise) implements Expression {

    public IfExpr {
        Objects.requireNonNull(condition, "condition must not be null");
        then = then == null ? List.of() : List.copyOf(then);
        otherwise = otherwise == null ? List.of() : List.copyOf(otherwise);
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
