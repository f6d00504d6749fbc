package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.NavigationProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.StateVariable;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.bool;
import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

public class ConfirmationDialogGenerator extends AbstractViewGenerator<NavigationProps.ConfirmationDialog> {

    public ConfirmationDialogGenerator() {
        super(ComponentKind.CONFIRMATION_DIALOG, NavigationProps.ConfirmationDialog::from);
    }

    @Override
    protected Expression build(NavigationProps.ConfirmationDialog props, List<Expression> children,
                               GenerationContext context) {
        StateVariable presented = context.state().declare("isDialogPresented", "Bool", bool(false));

        List<Argument> arguments = new ArrayList<>();
        arguments.add(Argument.of(string(props.title())));
        arguments.add(Argument.labeled("isPresented", presented.binding()));
        if (!schema().isDefault("titleVisibility", props.titleVisibility())) {
            arguments.add(Argument.labeled("titleVisibility", member(props.titleVisibility())));
        }
        arguments.add(Argument.labeled("actions", AlertGenerator.closure(ActionButtons.of(props.actions()))));
        return ViewBuilderExpr.reference(getViewName())
            .withModifiers(List.of(new ModifierCall("confirmationDialog", arguments, List.of())));
    }
}
