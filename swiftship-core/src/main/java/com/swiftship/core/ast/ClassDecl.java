package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A class declaration.
 *
 * @param name class name
 * @param superclass superclass name, or null
 * @param conformances adopted protocols, in order
 * @param members member declarations, in order
 * @param accessLevel access level
 */
public record ClassDecl(
    String name,
    String superclass,
    List<String> conformances,
    List<Declaration> members,
    AccessLevel accessLevel
) implements Declaration {

    public ClassDecl {
        Objects.requireNonNull(name, "name must not be null");
        conformances = conformances == null ? List.of() : List.copyOf(conformances);
        members = members == null ? List.of() : List.copyOf(members);
        if (accessLevel == null) {
            accessLevel = AccessLevel.INTERNAL;
        }
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitClass(this);
    }
}
