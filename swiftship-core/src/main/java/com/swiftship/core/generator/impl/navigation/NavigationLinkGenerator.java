package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.NavigationProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;

import java.util.List;

import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates {@code NavigationLink(destination:)} whose label is the children. The
 * destination screen is not part of the tree, so it is a {@code Text} naming it.
 */
public class NavigationLinkGenerator extends AbstractViewGenerator<NavigationProps.NavigationLink> {

    public NavigationLinkGenerator() {
        super(ComponentKind.NAVIGATION_LINK, NavigationProps.NavigationLink::from);
    }

    @Override
    protected Expression build(NavigationProps.NavigationLink props, List<Expression> children,
                               GenerationContext context) {
        Expression destination = ViewBuilderExpr.of("Text", Argument.of(string(props.destination())));
        return new ViewBuilderExpr(getViewName(), List.of(Argument.labeled("destination", destination)),
            Expressions.content(children), List.of());
    }
}
