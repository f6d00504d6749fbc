package com.swiftship.core.generator.impl.primitives;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.FunctionCallExpr;
import com.swiftship.core.ast.IntLiteralExpr;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.PrimitiveProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;

import java.util.List;
import java.util.Map;

import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates an SF Symbol as {@code Image(systemName:)}.
 */
public class IconGenerator extends AbstractViewGenerator<PrimitiveProps.Icon> {

    // Point sizes per named icon size
    private static final Map<String, Integer> SIZES = Map.of(
        "small", 16,
        "medium", 24,
        "large", 32,
        "extraLarge", 48);
    private static final int FALLBACK_SIZE = 24;

    public IconGenerator() {
        super(ComponentKind.ICON, PrimitiveProps.Icon::from);
    }

    @Override
    protected Expression build(PrimitiveProps.Icon props, List<Expression> children, GenerationContext context) {
        List<ModifierCall> modifiers = modifiers()
            .unlessDefault("size", props.size(), () -> ModifierCall.of("font", Argument.of(
                FunctionCallExpr.of(".system", Argument.labeled("size",
                    new IntLiteralExpr(SIZES.getOrDefault(props.size(), FALLBACK_SIZE)))))))
            .unlessDefault("weight", props.weight(),
                () -> ModifierCall.of("fontWeight", Argument.of(member(props.weight()))))
            .unlessDefault("color", props.color(),
                () -> ModifierCall.of("foregroundStyle", Argument.of(context.colors().resolve(props.color()))))
            .unlessDefault("renderingMode", props.renderingMode(),
                () -> ModifierCall.of("symbolRenderingMode", Argument.of(member(props.renderingMode()))))
            .build();

        return new ViewBuilderExpr(getViewName(), List.of(Argument.labeled("systemName", string(props.name()))),
            List.of(), modifiers);
    }
}
