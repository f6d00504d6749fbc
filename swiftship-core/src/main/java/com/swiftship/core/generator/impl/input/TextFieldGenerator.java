package com.swiftship.core.generator.impl.input;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.InputProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.StateVariable;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates a {@code TextField} bound to a new {@code String} state property.
 *
 * <p>The label, when present, is the title and the placeholder becomes the prompt.
 */
public class TextFieldGenerator extends AbstractViewGenerator<InputProps.TextField> {

    public TextFieldGenerator() {
        super(ComponentKind.TEXT_FIELD, InputProps.TextField::from);
    }

    @Override
    protected Expression build(InputProps.TextField props, List<Expression> children, GenerationContext context) {
        StateVariable text = context.state().declare("text", "String", string(""));

        List<Argument> arguments = new ArrayList<>();
        arguments.add(Argument.of(string(props.title())));
        arguments.add(Argument.labeled("text", text.binding()));
        boolean labeled = props.label() != null && !props.label().isEmpty();
        if (labeled && !props.placeholder().isEmpty()) {
            arguments.add(Argument.labeled("prompt", ViewBuilderExpr.of("Text", Argument.of(string(props.placeholder())))));
        }
        if (!schema().isDefault("axis", props.axis())) {
            arguments.add(Argument.labeled("axis", member(props.axis())));
        }

        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("keyboardType", props.keyboardType(),
                () -> ModifierCall.of("keyboardType", Argument.of(member(props.keyboardType()))))
            .unlessDefault("textContentType", props.textContentType(),
                () -> ModifierCall.of("textContentType", Argument.of(member(props.textContentType()))))
            .unlessDefault("autocapitalization", props.autocapitalization(),
                () -> ModifierCall.of("textInputAutocapitalization", Argument.of(member(props.autocapitalization()))))
            .unlessDefault("autocorrection", props.autocorrection(),
                () -> ModifierCall.of("autocorrectionDisabled"))
            .build();

        return new ViewBuilderExpr(getViewName(), arguments, List.of(), modifiers);
    }
}
