package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.NavigationProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.StateVariable;

import java.util.List;

import static com.swiftship.core.generator.Expressions.bool;

public class FullScreenCoverGenerator extends AbstractViewGenerator<NavigationProps.FullScreenCover> {

    public FullScreenCoverGenerator() {
        super(ComponentKind.FULL_SCREEN_COVER, NavigationProps.FullScreenCover::from);
    }

    @Override
    protected Expression build(NavigationProps.FullScreenCover props, List<Expression> children,
                               GenerationContext context) {
        StateVariable presented = context.state().declare("isCoverPresented", "Bool", bool(false));

        List<ModifierCall> presentation = modifiers()
            .unlessDefault("isInteractiveDismissDisabled", props.isInteractiveDismissDisabled(),
                () -> ModifierCall.of("interactiveDismissDisabled"))
            .build();

        Expression content = Expressions.withModifiers(Expressions.single(children), presentation);
        return ViewBuilderExpr.reference(getViewName()).withModifiers(List.of(ModifierCall.withClosure(
            "fullScreenCover", List.of(Argument.labeled("isPresented", presented.binding())), List.of(content))));
    }
}
