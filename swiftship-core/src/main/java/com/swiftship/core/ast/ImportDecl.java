package com.swiftship.core.ast;

import java.util.Objects;

/**
 * {@code import <module>}.
 *
 * @param module imported module name
 */
public record ImportDecl(String module) implements Declaration {

    public ImportDecl {
        Objects.requireNonNull(module, "module must not be null");
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitImport(this);
    }
}
