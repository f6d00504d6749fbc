package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A struct declaration. The generated view wrapper is a struct conforming to {@code View}.
 *
 * @param name struct name
 * @param conformances adopted protocols, in order
 * @param members member declarations, in order
 * @param accessLevel access level
 */
public record StructDecl(
    String name,
    List<String> conformances,
    List<Declaration> members,
    AccessLevel accessLevel
) implements Declaration {

    public StructDecl {
        Objects.requireNonNull(name, "name must not be null");
        conformances = conformances == null ? List.of() : List.copyOf(conformances);
        members = members == null ? List.of() : List.copyOf(members);
        if (accessLevel == null) {
            accessLevel = AccessLevel.INTERNAL;
        }
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitStruct(this);
    }
}
