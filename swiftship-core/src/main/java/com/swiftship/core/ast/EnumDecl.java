package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * An enum declaration with simple or raw-valued cases.
 *
 * @param name enum name
 * @param cases cases, in declaration order
 * @param conformances raw type and adopted protocols, in order
 * @param accessLevel access level
 */
public record EnumDecl(
    String name,
    List<Case> cases,
    List<String> conformances,
    AccessLevel accessLevel
) implements Declaration {

    public EnumDecl {
        Objects.requireNonNull(name, "name must not be null");
        cases = cases == null ? List.of() : List.copyOf(cases);
        conformances = conformances == null ? List.of() : List.copyOf(conformances);
        if (accessLevel == null) {
            accessLevel = AccessLevel.INTERNAL;
        }
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitEnum(this);
    }

    /**
     * One enum case.
     *
     * @param name case name
     * @param rawValue raw string value, or null
     */
    public record Case(String name, String rawValue) {

        public Case {
            Objects.requireNonNull(name, "name must not be null");
        }
    }
}
