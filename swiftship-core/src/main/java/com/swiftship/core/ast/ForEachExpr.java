package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code ForEach(collection) { item in body }}.
 *
 * @param collection the collection expression
 * @param itemName name bound to each element
 * @param body body statements
 */
public record ForEachExpr(Expression collection, String itemName, List<SwiftNode> body) implements Expression {

    public ForEachExpr {
        Objects.requireNonNull(collection, "collection must not be null");
        Objects.requireNonNull(itemName, "itemName must not be null");
        body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitForEach(this);
    }
}
