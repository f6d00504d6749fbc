package com.swiftship.core.generator.impl.primitives;

import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.PrimitiveProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;

import java.util.List;

public class DividerGenerator extends AbstractViewGenerator<PrimitiveProps.Divider> {

    public DividerGenerator() {
        super(ComponentKind.DIVIDER, PrimitiveProps.Divider::from);
    }

    @Override
    protected Expression build(PrimitiveProps.Divider props, List<Expression> children, GenerationContext context) {
        return ViewBuilderExpr.of(getViewName());
    }
}
