package com.swiftship.core.generator.impl.layout;

import com.swiftship.core.ast.Argument;
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
 * Generates a {@code List}. Hidden row separators are a row modifier, so they are applied
 * to every child row.
 */
public class ListGenerator extends AbstractViewGenerator<LayoutProps.ListView> {

    public ListGenerator() {
        super(ComponentKind.LIST, LayoutProps.ListView::from);
    }

    @Override
    protected Expression build(LayoutProps.ListView props, List<Expression> children, GenerationContext context) {
        List<Expression> rows = children;
        if (!schema().isDefault("showsRowSeparators", props.showsRowSeparators())) {
            List<ModifierCall> hidden = List.of(ModifierCall.of("listRowSeparator", Argument.of(member("hidden"))));
            rows = children.stream().map(row -> Expressions.withModifiers(row, hidden)).toList();
        }
        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("style", props.style(),
                () -> ModifierCall.of("listStyle", Argument.of(member(props.style()))))
            .build();
        return new ViewBuilderExpr(getViewName(), List.of(), Expressions.content(rows), modifiers);
    }
}
