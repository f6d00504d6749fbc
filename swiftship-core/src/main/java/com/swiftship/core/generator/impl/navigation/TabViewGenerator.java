package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.IntLiteralExpr;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.NavigationProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates a {@code TabView}. Tabs and children pair up by position: each child gets the
 * tab's {@code .tabItem}, {@code .badge} and {@code .tag}. A tab without a child shows its
 * title as a {@code Text}.
 */
public class TabViewGenerator extends AbstractViewGenerator<NavigationProps.TabView> {

    public TabViewGenerator() {
        super(ComponentKind.TAB_VIEW, NavigationProps.TabView::from);
    }

    @Override
    protected Expression build(NavigationProps.TabView props, List<Expression> children, GenerationContext context) {
        List<NavigationProps.Tab> tabs = props.tabs();
        int count = Math.max(tabs.size(), children.size());
        List<Expression> pages = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            if (i >= tabs.size()) {
                pages.add(children.get(i));
                continue;
            }
            NavigationProps.Tab tab = tabs.get(i);
            Expression page = i < children.size()
                ? children.get(i)
                : ViewBuilderExpr.of("Text", Argument.of(string(tab.title())));
            pages.add(Expressions.withModifiers(page, tabModifiers(tab)));
        }

        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("style", props.style(),
                () -> ModifierCall.of("tabViewStyle", Argument.of(member(props.style()))))
            .build();
        return new ViewBuilderExpr(getViewName(), List.of(), Expressions.content(pages), modifiers);
    }

    private static List<ModifierCall> tabModifiers(NavigationProps.Tab tab) {
        Expression label = tab.icon() == null || tab.icon().isEmpty()
            ? ViewBuilderExpr.of("Text", Argument.of(string(tab.title())))
            : ViewBuilderExpr.of("Label", Argument.of(string(tab.title())),
                Argument.labeled("systemImage", string(tab.icon())));

        List<ModifierCall> modifiers = new ArrayList<>();
        modifiers.add(ModifierCall.withClosure("tabItem", List.of(), List.of(label)));
        if (tab.badgeCount() != null && tab.badgeCount() > 0) {
            modifiers.add(ModifierCall.of("badge", Argument.of(new IntLiteralExpr(tab.badgeCount()))));
        }
        modifiers.add(ModifierCall.of("tag", Argument.of(string(tab.id()))));
        return modifiers;
    }
}
