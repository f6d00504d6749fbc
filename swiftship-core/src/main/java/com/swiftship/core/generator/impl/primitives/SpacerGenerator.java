package com.swiftship.core.generator.impl.primitives;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.PrimitiveProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;

import java.util.List;

import static com.swiftship.core.generator.Expressions.number;

/**
 * Generates {@code Spacer()} or {@code Spacer(minLength: n)}.
 */
public class SpacerGenerator extends AbstractViewGenerator<PrimitiveProps.Spacer> {

    public SpacerGenerator() {
        super(ComponentKind.SPACER, PrimitiveProps.Spacer::from);
    }

    @Override
    protected Expression build(PrimitiveProps.Spacer props, List<Expression> children, GenerationContext context) {
        if (props.minLength() == null) {
            return ViewBuilderExpr.of(getViewName());
        }
        return ViewBuilderExpr.of(getViewName(), Argument.labeled("minLength", number(props.minLength())));
    }
}
