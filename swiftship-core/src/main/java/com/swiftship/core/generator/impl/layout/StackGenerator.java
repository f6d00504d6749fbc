package com.swiftship.core.generator.impl.layout;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.LayoutProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;

import java.util.ArrayList;
import java.util.List;

import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.number;

/**
 * Shared lowering for the linear stacks: alignment and spacing become arguments when they
 * differ from their defaults, children go into the trailing closure.
 */
public abstract class StackGenerator extends AbstractViewGenerator<LayoutProps.Stack> {

    protected StackGenerator(ComponentKind kind) {
        super(kind, LayoutProps.Stack::from);
    }

    @Override
    protected Expression build(LayoutProps.Stack props, List<Expression> children, GenerationContext context) {
        List<Argument> arguments = new ArrayList<>();
        if (!schema().isDefault("alignment", props.alignment())) {
            arguments.add(Argument.labeled("alignment", member(props.alignment())));
        }
        if (!schema().isDefault("spacing", props.spacing())) {
            arguments.add(Argument.labeled("spacing", number(props.spacing())));
        }
        return new ViewBuilderExpr(getViewName(), arguments, Expressions.content(children), List.of());
    }
}
