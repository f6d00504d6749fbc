package com.swiftship.core.generator.impl.input;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.IdentifierExpr;
import com.swiftship.core.ast.IntLiteralExpr;
import com.swiftship.core.ast.RangeExpr;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.InputProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.StateVariable;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates {@code Stepper(_:value:in:step:)} over an {@code Int} state property. A range
 * with only one bound is closed with {@code Int.min} or {@code Int.max}.
 */
public class StepperGenerator extends AbstractViewGenerator<InputProps.Stepper> {

    public StepperGenerator() {
        super(ComponentKind.STEPPER, InputProps.Stepper::from);
    }

    @Override
    protected Expression build(InputProps.Stepper props, List<Expression> children, GenerationContext context) {
        long initial = props.minValue() == null ? 0 : Math.round(props.minValue());
        StateVariable count = context.state().declare("count", "Int", new IntLiteralExpr(initial));

        List<Argument> arguments = new ArrayList<>();
        arguments.add(Argument.of(string(props.label())));
        arguments.add(Argument.labeled("value", count.binding()));
        if (props.minValue() != null || props.maxValue() != null) {
            arguments.add(Argument.labeled("in", new RangeExpr(
                bound(props.minValue(), "Int.min"),
                bound(props.maxValue(), "Int.max"))));
        }
        if (!schema().isDefault("step", props.step())) {
            arguments.add(Argument.labeled("step", new IntLiteralExpr(Math.round(props.step()))));
        }
        return new ViewBuilderExpr(getViewName(), arguments, List.of(), List.of());
    }

    private static Expression bound(Double value, String open) {
        return value == null ? new IdentifierExpr(open) : new IntLiteralExpr(Math.round(value));
    }
}
