package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.ClosureExpr;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.SwiftNode;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.NavigationProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.StateVariable;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.bool;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates {@code .alert(_:isPresented:actions:message:)} on a {@code Color.clear}
 * presenter. Each action is a placeholder button; an empty action list leaves SwiftUI's
 * default OK button.
 */
public class AlertGenerator extends AbstractViewGenerator<NavigationProps.Alert> {

    public AlertGenerator() {
        super(ComponentKind.ALERT, NavigationProps.Alert::from);
    }

    @Override
    protected Expression build(NavigationProps.Alert props, List<Expression> children, GenerationContext context) {
        StateVariable presented = context.state().declare("isAlertPresented", "Bool", bool(false));

        List<Argument> arguments = new ArrayList<>();
        arguments.add(Argument.of(string(props.title())));
        arguments.add(Argument.labeled("isPresented", presented.binding()));
        arguments.add(Argument.labeled("actions", closure(ActionButtons.of(props.actions()))));
        if (props.message() != null) {
            arguments.add(Argument.labeled("message",
                closure(List.of(ViewBuilderExpr.of("Text", Argument.of(string(props.message())))))));
        }
        return ViewBuilderExpr.reference(getViewName())
            .withModifiers(List.of(new ModifierCall("alert", arguments, List.of())));
    }

    static ClosureExpr closure(List<? extends SwiftNode> body) {
        return new ClosureExpr(List.of(), List.copyOf(body));
    }
}
