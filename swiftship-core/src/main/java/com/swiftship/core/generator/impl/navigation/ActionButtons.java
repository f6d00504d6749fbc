package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.props.NavigationProps;
import com.swiftship.core.generator.Expressions;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Placeholder-action buttons for alerts, dialogs and menus.
 */
final class ActionButtons {

    private ActionButtons() {
    }

    static List<Expression> of(List<NavigationProps.Action> actions) {
        List<Expression> buttons = new ArrayList<>(actions.size());
        for (NavigationProps.Action action : actions) {
            buttons.add(button(action));
        }
        return buttons;
    }

    static Expression button(NavigationProps.Action action) {
        List<Argument> arguments = new ArrayList<>();
        arguments.add(Argument.of(string(action.label())));
        if (action.icon() != null && !action.icon().isEmpty()) {
            arguments.add(Argument.labeled("systemImage", string(action.icon())));
        }
        if (action.hasRole()) {
            arguments.add(Argument.labeled("role", member(action.role())));
        }
        return new ViewBuilderExpr("Button", arguments, Expressions.placeholderActionBody(), List.of());
    }
}
