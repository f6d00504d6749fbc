package com.swiftship.core.generator.impl.input;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.ArrayLiteralExpr;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.FunctionCallExpr;
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

/**
 * Generates a {@code DatePicker}. {@code components} selects what is edited;
 * {@code displayedComponents} selects the picker style.
 */
public class DatePickerGenerator extends AbstractViewGenerator<InputProps.DatePicker> {

    private static final String DATE_AND_TIME = "dateAndTime";

    public DatePickerGenerator() {
        super(ComponentKind.DATE_PICKER, InputProps.DatePicker::from);
    }

    @Override
    protected Expression build(InputProps.DatePicker props, List<Expression> children, GenerationContext context) {
        StateVariable date = context.state().declare("date", "Date", FunctionCallExpr.of("Date"));

        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("displayedComponents", props.displayedComponents(),
                () -> ModifierCall.of("datePickerStyle", Argument.of(member(props.displayedComponents()))))
            .build();

        return new ViewBuilderExpr(getViewName(), List.of(
            Argument.of(string(props.label())),
            Argument.labeled("selection", date.binding()),
            Argument.labeled("displayedComponents", components(props.components()))),
            List.of(), modifiers);
    }

    private static Expression components(String components) {
        if (DATE_AND_TIME.equals(components)) {
            return new ArrayLiteralExpr(List.of(member("date"), member("hourAndMinute")));
        }
        return member(components);
    }
}
