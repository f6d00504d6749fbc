package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.NavigationProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.member;

/**
 * Generates {@code .toolbar} on a {@code Color.clear} presenter with one
 * {@code ToolbarItem} per declared item or child, paired by position. Children beyond the
 * declared items use the {@code .automatic} placement; items without a child hold
 * {@code EmptyView()}.
 */
public class ToolbarGenerator extends AbstractViewGenerator<NavigationProps.Toolbar> {

    private static final String AUTOMATIC = "automatic";

    public ToolbarGenerator() {
        super(ComponentKind.TOOLBAR, NavigationProps.Toolbar::from);
    }

    @Override
    protected Expression build(NavigationProps.Toolbar props, List<Expression> children, GenerationContext context) {
        List<String> placements = props.placements();
        if (placements.size() > children.size()) {
            log.debug("Toolbar declares {} items but has {} children; filling with EmptyView",
                placements.size(), children.size());
        }

        // A toolbar needs at least one item to compile.
        int count = Math.max(1, Math.max(placements.size(), children.size()));
        List<Expression> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String placement = i < placements.size() ? placements.get(i) : AUTOMATIC;
            Expression content = i < children.size() ? children.get(i) : ViewBuilderExpr.of("EmptyView");
            items.add(new ViewBuilderExpr("ToolbarItem",
                List.of(Argument.labeled("placement", member(placement))), List.of(content), List.of()));
        }
        return ViewBuilderExpr.reference(getViewName())
            .withModifiers(List.of(ModifierCall.withClosure("toolbar", List.of(), items)));
    }
}
