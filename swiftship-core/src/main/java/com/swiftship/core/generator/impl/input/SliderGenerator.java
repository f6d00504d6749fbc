package com.swiftship.core.generator.impl.input;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.RangeExpr;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.InputProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.StateVariable;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.number;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates {@code Slider(value:in:step:)}. The value starts at the lower bound; the label,
 * when present, is the trailing closure.
 */
public class SliderGenerator extends AbstractViewGenerator<InputProps.Slider> {

    public SliderGenerator() {
        super(ComponentKind.SLIDER, InputProps.Slider::from);
    }

    @Override
    protected Expression build(InputProps.Slider props, List<Expression> children, GenerationContext context) {
        StateVariable value = context.state().declare("value", "Double", number(props.minValue()));

        List<Argument> arguments = new ArrayList<>();
        arguments.add(Argument.labeled("value", value.binding()));
        arguments.add(Argument.labeled("in", new RangeExpr(number(props.minValue()), number(props.maxValue()))));
        if (props.step() != null) {
            arguments.add(Argument.labeled("step", number(props.step())));
        }

        List<Expression> label = props.label() == null
            ? List.of()
            : List.of(ViewBuilderExpr.of("Text", Argument.of(string(props.label()))));
        return new ViewBuilderExpr(getViewName(), arguments, label, List.of());
    }
}
