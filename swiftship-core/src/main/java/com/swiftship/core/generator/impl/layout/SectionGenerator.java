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

import static com.swiftship.core.generator.Expressions.string;

public class SectionGenerator extends AbstractViewGenerator<LayoutProps.Section> {

    public SectionGenerator() {
        super(ComponentKind.SECTION, LayoutProps.Section::from);
    }

    @Override
    protected Expression build(LayoutProps.Section props, List<Expression> children, GenerationContext context) {
        List<Argument> arguments = new ArrayList<>();
        if (props.header() != null) {
            arguments.add(Argument.labeled("header", ViewBuilderExpr.of("Text", Argument.of(string(props.header())))));
        }
        if (props.footer() != null) {
            arguments.add(Argument.labeled("footer", ViewBuilderExpr.of("Text", Argument.of(string(props.footer())))));
        }
        return new ViewBuilderExpr(getViewName(), arguments, Expressions.content(children), List.of());
    }
}
