package com.swiftship.core.generator.impl.primitives;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.PrimitiveProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.bool;
import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates a {@code Button}.
 *
 * <p>The component tree carries no executable actions, so the action is always a
 * {@code // TODO: Add action} placeholder. A text-only button uses the title initializer;
 * a button with an icon builds its label in the trailing closure and passes the action as
 * {@code action:}.
 */
public class ButtonGenerator extends AbstractViewGenerator<PrimitiveProps.Button> {

    private static final String TRAILING = "trailing";

    public ButtonGenerator() {
        super(ComponentKind.BUTTON, PrimitiveProps.Button::from);
    }

    @Override
    protected Expression build(PrimitiveProps.Button props, List<Expression> children, GenerationContext context) {
        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("style", props.style(),
                () -> ModifierCall.of("buttonStyle", Argument.of(member(props.style()))))
            .unlessDefault("isDisabled", props.isDisabled(),
                () -> ModifierCall.of("disabled", Argument.of(bool(true))))
            .unlessDefault("isLoading", props.isLoading(),
                () -> ModifierCall.withClosure("overlay", List.of(), List.of(ViewBuilderExpr.of("ProgressView"))))
            .build();

        boolean hasRole = !schema().isDefault("role", props.role());
        List<Argument> arguments = new ArrayList<>();

        if (props.icon() == null || props.icon().isEmpty()) {
            arguments.add(Argument.of(string(props.label())));
            if (hasRole) {
                arguments.add(Argument.labeled("role", member(props.role())));
            }
            return new ViewBuilderExpr(getViewName(), arguments, Expressions.placeholderActionBody(), modifiers);
        }

        if (hasRole) {
            arguments.add(Argument.labeled("role", member(props.role())));
        }
        arguments.add(Argument.labeled("action", Expressions.placeholderAction()));
        return new ViewBuilderExpr(getViewName(), arguments, List.of(label(props)), modifiers);
    }

    private static Expression label(PrimitiveProps.Button props) {
        if (TRAILING.equals(props.iconPosition())) {
            return new ViewBuilderExpr("HStack", List.of(), List.of(
                ViewBuilderExpr.of("Text", Argument.of(string(props.label()))),
                ViewBuilderExpr.of("Image", Argument.labeled("systemName", string(props.icon())))),
                List.of());
        }
        return ViewBuilderExpr.of("Label",
            Argument.of(string(props.label())),
            Argument.labeled("systemImage", string(props.icon())));
    }
}
