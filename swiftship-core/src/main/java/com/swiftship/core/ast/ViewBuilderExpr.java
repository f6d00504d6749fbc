package com.swiftship.core.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A call to a SwiftUI view constructor with optional arguments, a trailing content closure
 * and a chain of modifiers.
 *
 * <p>Child views always live in {@code trailingClosure}; arguments carry only
 * configuration. A null {@code arguments} list marks a bare view reference such as
 * {@code Color.clear}, printed without parentheses.
 *
 * @param viewName view type or expression being called (e.g. {@code VStack})
 * @param arguments call arguments, or null for a bare reference
 * @param trailingClosure child content, possibly empty
 * @param modifiers modifiers, in application order
 */
public record ViewBuilderExpr(
    String viewName,
    List<Argument> arguments,
    List<Expression> trailingClosure,
    List<ModifierCall> modifiers
) implements Expression {

    public ViewBuilderExpr {
        Objects.requireNonNull(viewName, "viewName must not be null");
        arguments = arguments == null ? null : List.copyOf(arguments);
        trailingClosure = trailingClosure == null ? List.of() : List.copyOf(trailingClosure);
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        if (arguments == null && !trailingClosure.isEmpty()) {
            throw new IllegalArgumentException("bare view reference '" + viewName + "' cannot take content");
        }
    }

    /**
     * Creates a call with the given arguments and nothing else.
     *
     * @param viewName view name
     * @param arguments call arguments
     * @return the expression
     */
    public static ViewBuilderExpr of(String viewName, Argument... arguments) {
        return new ViewBuilderExpr(viewName, List.of(arguments), List.of(), List.of());
    }

    /**
     * Creates a bare view reference such as {@code Color.clear}.
     *
     * @param reference the view expression
     * @return the expression
     */
    public static ViewBuilderExpr reference(String reference) {
        return new ViewBuilderExpr(reference, null, List.of(), List.of());
    }

    /**
     * Whether this is a bare view reference.
     *
     * @return true when the view is printed without a call
     */
    public boolean isReference() {
        return arguments == null;
    }

    /**
     * Returns a copy with {@code extra} appended after the existing modifiers.
     *
     * @param extra modifiers to append
     * @return the new expression
     */
    public ViewBuilderExpr withModifiers(List<ModifierCall> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<ModifierCall> combined = new ArrayList<>(modifiers);
        combined.addAll(extra);
        return new ViewBuilderExpr(viewName, arguments, trailingClosure, combined);
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitViewBuilder(this);
    }
}
