package com.swiftship.core.generator.impl.primitives;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.IntLiteralExpr;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.PrimitiveProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;

import java.util.List;

import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates {@code Text("...")} with font, weight, colour, alignment and line-limit
 * modifiers.
 */
public class TextGenerator extends AbstractViewGenerator<PrimitiveProps.Text> {

    public TextGenerator() {
        super(ComponentKind.TEXT, PrimitiveProps.Text::from);
    }

    @Override
    protected Expression build(PrimitiveProps.Text props, List<Expression> children, GenerationContext context) {
        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("font", props.font(),
                () -> ModifierCall.of("font", Argument.of(member(props.font()))))
            .unlessDefault("weight", props.weight(),
                () -> ModifierCall.of("fontWeight", Argument.of(member(props.weight()))))
            .unlessDefault("color", props.color(),
                () -> ModifierCall.of("foregroundStyle", Argument.of(context.colors().resolve(props.color()))))
            .unlessDefault("alignment", props.alignment(),
                () -> ModifierCall.of("multilineTextAlignment", Argument.of(member(props.alignment()))))
            .unlessDefault("lineLimit", props.lineLimit(),
                () -> ModifierCall.of("lineLimit", Argument.of(new IntLiteralExpr(props.lineLimit()))))
            .build();

        return new ViewBuilderExpr(getViewName(), List.of(Argument.of(string(props.content()))), List.of(), modifiers);
    }
}
