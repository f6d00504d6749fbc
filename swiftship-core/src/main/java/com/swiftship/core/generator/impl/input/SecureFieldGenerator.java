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

import java.util.List;

import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

public class SecureFieldGenerator extends AbstractViewGenerator<InputProps.SecureField> {

    public SecureFieldGenerator() {
        super(ComponentKind.SECURE_FIELD, InputProps.SecureField::from);
    }

    @Override
    protected Expression build(InputProps.SecureField props, List<Expression> children, GenerationContext context) {
        StateVariable password = context.state().declare("password", "String", string(""));

        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("textContentType", props.textContentType(),
                () -> ModifierCall.of("textContentType", Argument.of(member(props.textContentType()))))
            .build();

        return new ViewBuilderExpr(getViewName(),
            List.of(Argument.of(string(props.title())), Argument.labeled("text", password.binding())),
            List.of(), modifiers);
    }
}
