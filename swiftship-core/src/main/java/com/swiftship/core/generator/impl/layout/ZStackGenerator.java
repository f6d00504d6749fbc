package com.swiftship.core.generator.impl.layout;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.LayoutProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;

import java.util.List;

import static com.swiftship.core.generator.Expressions.member;

public class ZStackGenerator extends AbstractViewGenerator<LayoutProps.ZStack> {

    public ZStackGenerator() {
        super(ComponentKind.ZSTACK, LayoutProps.ZStack::from);
    }

    @Override
    protected Expression build(LayoutProps.ZStack props, List<Expression> children, GenerationContext context) {
        List<Argument> arguments = schema().isDefault("alignment", props.alignment())
            ? List.of()
            : List.of(Argument.labeled("alignment", member(props.alignment())));
        return new ViewBuilderExpr(getViewName(), arguments, Expressions.content(children), List.of());
    }
}
