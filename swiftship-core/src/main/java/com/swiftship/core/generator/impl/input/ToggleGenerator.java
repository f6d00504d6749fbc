package com.swiftship.core.generator.impl.input;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.InputProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.StateVariable;

import java.util.List;

import static com.swiftship.core.generator.Expressions.bool;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates a {@code Toggle}. {@code isOn} sets the initial value of its state property.
 */
public class ToggleGenerator extends AbstractViewGenerator<InputProps.Toggle> {

    public ToggleGenerator() {
        super(ComponentKind.TOGGLE, InputProps.Toggle::from);
    }

    @Override
    protected Expression build(InputProps.Toggle props, List<Expression> children, GenerationContext context) {
        StateVariable isOn = context.state().declare("isOn", "Bool", bool(props.isOn()));
        return ViewBuilderExpr.of(getViewName(),
            Argument.of(string(props.label())),
            Argument.labeled("isOn", isOn.binding()));
    }
}
