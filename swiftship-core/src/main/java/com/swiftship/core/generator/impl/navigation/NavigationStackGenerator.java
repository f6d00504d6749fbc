package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.NavigationProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;

import java.util.List;

import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates a {@code NavigationStack}. Title modifiers belong to the stack's content, so
 * they are applied to the children (grouped when there are several).
 */
public class NavigationStackGenerator extends AbstractViewGenerator<NavigationProps.NavigationStack> {

    public NavigationStackGenerator() {
        super(ComponentKind.NAVIGATION_STACK, NavigationProps.NavigationStack::from);
    }

    @Override
    protected Expression build(NavigationProps.NavigationStack props, List<Expression> children,
                               GenerationContext context) {
        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("title", props.title(),
                () -> ModifierCall.of("navigationTitle", Argument.of(string(props.title()))))
            .unlessDefault("titleDisplayMode", props.titleDisplayMode(),
                () -> ModifierCall.of("navigationBarTitleDisplayMode", Argument.of(member(props.titleDisplayMode()))))
            .build();

        List<Expression> content = modifiers.isEmpty()
            ? Expressions.content(children)
            : List.of(Expressions.withModifiers(Expressions.single(children), modifiers));
        return new ViewBuilderExpr(getViewName(), List.of(), content, List.of());
    }
}
