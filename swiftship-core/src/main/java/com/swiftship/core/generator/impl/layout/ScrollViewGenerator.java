package com.swiftship.core.generator.impl.layout;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.ArrayLiteralExpr;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.LayoutProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;

import java.util.List;

import static com.swiftship.core.generator.Expressions.member;

/**
 * Generates a {@code ScrollView}. Non-vertical axes become the unlabeled axis argument;
 * hidden indicators become {@code .scrollIndicators(.hidden)}.
 */
public class ScrollViewGenerator extends AbstractViewGenerator<LayoutProps.ScrollView> {

    private static final String BOTH_AXES = "both";

    public ScrollViewGenerator() {
        super(ComponentKind.SCROLL_VIEW, LayoutProps.ScrollView::from);
    }

    @Override
    protected Expression build(LayoutProps.ScrollView props, List<Expression> children, GenerationContext context) {
        List<Argument> arguments = schema().isDefault("axes", props.axes())
            ? List.of()
            : List.of(Argument.of(axes(props.axes())));
        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("showsIndicators", props.showsIndicators(),
                () -> ModifierCall.of("scrollIndicators", Argument.of(member("hidden"))))
            .build();
        return new ViewBuilderExpr(getViewName(), arguments, Expressions.content(children), modifiers);
    }

    private static Expression axes(String axes) {
        if (BOTH_AXES.equals(axes)) {
            return new ArrayLiteralExpr(List.of(member("horizontal"), member("vertical")));
        }
        return member(axes);
    }
}
