package com.swiftship.core.generator;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.FunctionCallExpr;
import com.swiftship.core.ast.IdentifierExpr;
import com.swiftship.core.ast.MemberAccessExpr;
import com.swiftship.core.ast.StringLiteralExpr;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves colour-like prop values to Swift expressions.
 *
 * <ul>
 *   <li>{@code "#FF5733"} → {@code Color(hex: "#FF5733")}</li>
 *   <li>a semantic colour name such as {@code "accentColor"} → {@code .accentColor}</li>
 *   <li>anything else → a bare identifier, e.g. {@code brandPrimary}</li>
 * </ul>
 *
 * <p>The allow-list can be extended through {@code codegen.semanticColors}.
 */
public final class ColorResolver {

    /** Built-in semantic colour names. */
    public static final List<String> SEMANTIC_COLORS = List.of(
        "primary", "secondary", "accentColor",
        "red", "green", "blue", "orange", "yellow", "pink", "purple", "gray",
        "white", "black");

    private final Set<String> semanticColors;

    public ColorResolver() {
        this(List.of());
    }

    /**
     * Creates a resolver whose allow-list is the built-in list plus {@code extra}.
     *
     * @param extra additional semantic colour names
     */
    public ColorResolver(Collection<String> extra) {
        Set<String> names = new LinkedHashSet<>(SEMANTIC_COLORS);
        if (extra != null) {
            extra.stream().filter(Objects::nonNull).map(String::trim).filter(s -> !s.isEmpty()).forEach(names::add);
        }
        this.semanticColors = Set.copyOf(names);
    }

    /**
     * Resolves a colour value.
     *
     * @param value hex string, semantic name or identifier
     * @return colour expression
     */
    public Expression resolve(String value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value.startsWith("#")) {
            return FunctionCallExpr.of("Color", Argument.labeled("hex", new StringLiteralExpr(value)));
        }
        if (semanticColors.contains(value)) {
            return MemberAccessExpr.implicit(value);
        }
        return new IdentifierExpr(value);
    }

    /**
     * Whether a name is on the semantic allow-list.
     *
     * @param name colour name
     * @return true for semantic colours
     */
    public boolean isSemantic(String name) {
        return semanticColors.contains(name);
    }
}
