package com.swiftship.core.generator;

import com.swiftship.core.ast.BoolLiteralExpr;
import com.swiftship.core.ast.ClosureExpr;
import com.swiftship.core.ast.CommentExpr;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.FloatLiteralExpr;
import com.swiftship.core.ast.IntLiteralExpr;
import com.swiftship.core.ast.MemberAccessExpr;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.StringLiteralExpr;
import com.swiftship.core.ast.ViewBuilderExpr;

import java.util.List;
import java.util.Objects;

/**
 * Small constructors shared by the generators.
 */
public final class Expressions {

    /** Text of the comment marking an action the component tree cannot express. */
    public static final String ACTION_PLACEHOLDER = "TODO: Add action";

    private Expressions() {
    }

    public static StringLiteralExpr string(String value) {
        return new StringLiteralExpr(value == null ? "" : value);
    }

    /**
     * A numeric literal: integral values print as integers, others as decimals.
     *
     * @param value the number
     * @return int or float literal
     */
    public static Expression number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return new IntLiteralExpr((long) value);
        }
        return new FloatLiteralExpr(value);
    }

    public static MemberAccessExpr member(String name) {
        return MemberAccessExpr.implicit(name);
    }

    public static BoolLiteralExpr bool(boolean value) {
        return new BoolLiteralExpr(value);
    }

    /**
     * The trailing closure of a control whose action the tree does not model.
     *
     * @return closure body holding the placeholder comment
     */
    public static List<Expression> placeholderActionBody() {
        return List.of(CommentExpr.of(ACTION_PLACEHOLDER));
    }

    /**
     * The placeholder action as a closure argument ({@code action: { ... }}).
     *
     * @return closure expression
     */
    public static ClosureExpr placeholderAction() {
        return ClosureExpr.of(CommentExpr.of(ACTION_PLACEHOLDER));
    }

    /**
     * Container content: the children, or {@code EmptyView()} when there are none, so the
     * container still receives a content closure.
     *
     * @param children generated children
     * @return non-empty closure body
     */
    public static List<Expression> content(List<Expression> children) {
        return children.isEmpty() ? List.of(ViewBuilderExpr.of("EmptyView")) : children;
    }

    /**
     * Collapses children into one view: the child itself, a {@code Group} of several, or
     * {@code EmptyView()}.
     *
     * @param children generated children
     * @return single view expression
     */
    public static Expression single(List<Expression> children) {
        if (children.size() == 1) {
            return children.get(0);
        }
        return group(children);
    }

    /**
     * Wraps children in a {@code Group}.
     *
     * @param children generated children
     * @return group expression
     */
    public static ViewBuilderExpr group(List<Expression> children) {
        if (children.isEmpty()) {
            return ViewBuilderExpr.of("EmptyView");
        }
        return new ViewBuilderExpr("Group", List.of(), children, List.of());
    }

    /**
     * Appends modifiers to a view expression. A commented expression gets them on its
     * subject; any other expression is wrapped in a {@code Group} first.
     *
     * @param expression target view
     * @param modifiers modifiers to append
     * @return modified expression
     */
    public static Expression withModifiers(Expression expression, List<ModifierCall> modifiers) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (modifiers.isEmpty()) {
            return expression;
        }
        if (expression instanceof ViewBuilderExpr view) {
            return view.withModifiers(modifiers);
        }
        if (expression instanceof CommentExpr comment && comment.subject() != null) {
            return new CommentExpr(comment.text(), withModifiers(comment.subject(), modifiers));
        }
        return new ViewBuilderExpr("Group", List.of(), List.of(expression), modifiers);
    }
}
