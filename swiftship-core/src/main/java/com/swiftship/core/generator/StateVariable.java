package com.swiftship.core.generator;

import com.swiftship.core.ast.IdentifierExpr;

/**
 * A {@code @State} property declared for the generated view.
 *
 * @param name property name, unique within the file
 * @param type Swift type
 */
public record StateVariable(String name, String type) {

    /**
     * The {@code $name} projection passed to controls.
     *
     * @return binding expression
     */
    public IdentifierExpr binding() {
        return new IdentifierExpr("$" + name);
    }

    /**
     * A plain read of the property.
     *
     * @return identifier expression
     */
    public IdentifierExpr read() {
        return new IdentifierExpr(name);
    }
}
