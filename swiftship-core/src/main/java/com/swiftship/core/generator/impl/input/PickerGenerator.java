package com.swiftship.core.generator.impl.input;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.InputProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.StateVariable;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates a {@code Picker} with one tagged {@code Text} per option. The selection starts
 * at the first option.
 */
public class PickerGenerator extends AbstractViewGenerator<InputProps.Picker> {

    public PickerGenerator() {
        super(ComponentKind.PICKER, InputProps.Picker::from);
    }

    @Override
    protected Expression build(InputProps.Picker props, List<Expression> children, GenerationContext context) {
        String initial = props.options().isEmpty() ? "" : props.options().get(0).value();
        StateVariable selection = context.state().declare("selection", "String", string(initial));

        List<Expression> options = new ArrayList<>();
        for (InputProps.Option option : props.options()) {
            options.add(ViewBuilderExpr.of("Text", Argument.of(string(option.label())))
                .withModifiers(List.of(ModifierCall.of("tag", Argument.of(string(option.value()))))));
        }

        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("style", props.style(),
                () -> ModifierCall.of("pickerStyle", Argument.of(member(props.style()))))
            .build();

        return new ViewBuilderExpr(getViewName(),
            List.of(Argument.of(string(props.label())), Argument.labeled("selection", selection.binding())),
            Expressions.content(options), modifiers);
    }
}
