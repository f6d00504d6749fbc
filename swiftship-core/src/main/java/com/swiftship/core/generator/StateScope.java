package com.swiftship.core.generator;

import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.PropertyDecl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Allocates the {@code @State} properties of one generated view.
 *
 * <p>Names are unique per file and allocated in walk order: the first {@code text} is
 * {@code text}, the next {@code text2}, and so on.
 */
public final class StateScope {

    private final Set<String> used = new HashSet<>();
    private final List<PropertyDecl> declarations = new ArrayList<>();

    /**
     * Declares a new state property.
     *
     * @param baseName preferred name
     * @param type Swift type
     * @param initialValue initial value
     * @return the declared variable
     */
    public StateVariable declare(String baseName, String type, Expression initialValue) {
        Objects.requireNonNull(baseName, "baseName must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(initialValue, "initialValue must not be null");

        String name = baseName;
        int suffix = 2;
        while (!used.add(name)) {
            name = baseName + suffix++;
        }
        declarations.add(PropertyDecl.state(name, type, initialValue));
        return new StateVariable(name, type);
    }

    /**
     * Returns the declarations made so far, in declaration order.
     *
     * @return state property declarations
     */
    public List<PropertyDecl> declarations() {
        return List.copyOf(declarations);
    }
}
