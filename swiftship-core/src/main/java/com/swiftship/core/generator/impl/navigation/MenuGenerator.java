package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.NavigationProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates a {@code Menu} behind an ellipsis button. Item buttons come first, followed by
 * any child views.
 */
public class MenuGenerator extends AbstractViewGenerator<NavigationProps.Menu> {

    private static final String TITLE = "More";
    private static final String SYMBOL = "ellipsis.circle";

    public MenuGenerator() {
        super(ComponentKind.MENU, NavigationProps.Menu::from);
    }

    @Override
    protected Expression build(NavigationProps.Menu props, List<Expression> children, GenerationContext context) {
        List<Expression> content = new ArrayList<>(ActionButtons.of(props.items()));
        content.addAll(children);
        return new ViewBuilderExpr(getViewName(),
            List.of(Argument.of(string(TITLE)), Argument.labeled("systemImage", string(SYMBOL))),
            Expressions.content(content), List.of());
    }
}
