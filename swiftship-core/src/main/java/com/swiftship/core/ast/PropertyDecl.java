package com.swiftship.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A stored or computed {@code var} property.
 *
 * <p>A property is computed when {@code getter} is non-empty; computed properties never
 * carry a default value.
 *
 * @param name property name
 * @param type declared type (e.g. {@code some View})
 * @param wrapper property wrapper, or null
 * @param defaultValue initial value for stored properties, or null
 * @param getter getter body for computed properties, empty for stored ones
 * @param accessLevel access level
 */
public record PropertyDecl(
    String name,
    String type,
    PropertyWrapper wrapper,
    Expression defaultValue,
    List<SwiftNode> getter,
    AccessLevel accessLevel
) implements Declaration {

    public PropertyDecl {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        getter = getter == null ? List.of() : List.copyOf(getter);
        if (accessLevel == null) {
            accessLevel = AccessLevel.INTERNAL;
        }
        if (!getter.isEmpty() && defaultValue != null) {
            throw new IllegalArgumentException("computed property '" + name + "' cannot have a default value");
        }
    }

    /**
     * Creates a computed property.
     *
     * @param name property name
     * @param type declared type
     * @param getter getter body
     * @return the property
     */
    public static PropertyDecl computed(String name, String type, List<? extends SwiftNode> getter) {
        return new PropertyDecl(name, type, null, null, List.copyOf(getter), AccessLevel.INTERNAL);
    }

    /**
     * Creates a {@code @State private var} property.
     *
     * @param name property name
     * @param type declared type
     * @param initialValue initial value
     * @return the property
     */
    public static PropertyDecl state(String name, String type, Expression initialValue) {
        return new PropertyDecl(name, type, PropertyWrapper.state(), initialValue, List.of(), AccessLevel.PRIVATE);
    }

    /**
     * Whether this property has a getter body.
     *
     * @return true for computed properties
     */
    public boolean isComputed() {
        return !getter.isEmpty();
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitProperty(this);
    }
}
