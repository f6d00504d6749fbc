package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A function declaration.
 *
 * @param name function name
 * @param parameters parameters, in order
 * @param returnType return type, or null for {@code Void}
 * @param isAsync whether the function is {@code async}
 * @param throwing whether the function {@code throws}
 * @param body body statements
 * @param accessLevel access level
 * @param attributes attributes printed above the declaration, without {@code @}
 */
public record FunctionDecl(
    String name,
    List<Parameter> parameters,
    String returnType,
    boolean isAsync,
    boolean throwing,
    List<SwiftNode> body,
    AccessLevel accessLevel,
    List<String> attributes
) implements Declaration {

    public FunctionDecl {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        body = body == null ? List.of() : List.copyOf(body);
        if (accessLevel == null) {
            accessLevel = AccessLevel.INTERNAL;
        }
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
