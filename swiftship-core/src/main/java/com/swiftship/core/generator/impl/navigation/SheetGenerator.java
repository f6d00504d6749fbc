package com.swiftship.core.generator.impl.navigation;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.ArrayLiteralExpr;
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
import static com.swiftship.core.generator.Expressions.member;

/**
 * Generates a sheet presented from a {@code Color.clear} presenter.
 *
 * <p>The presentation modifiers apply to the sheet content; the presenter carries only
 * {@code .sheet(isPresented:)} bound to a new state property.
 */
public class SheetGenerator extends AbstractViewGenerator<NavigationProps.Sheet> {

    public SheetGenerator() {
        super(ComponentKind.SHEET, NavigationProps.Sheet::from);
    }

    @Override
    protected Expression build(NavigationProps.Sheet props, List<Expression> children, GenerationContext context) {
        StateVariable presented = context.state().declare("isSheetPresented", "Bool", bool(false));

        List<ModifierCall> presentation = modifiers()
            .unlessDefault("detents", props.detents(), () -> ModifierCall.of("presentationDetents",
                Argument.of(new ArrayLiteralExpr(props.detents().stream().map(d -> (Expression) member(d)).toList()))))
            .unlessDefault("showsDragIndicator", props.showsDragIndicator(),
                () -> ModifierCall.of("presentationDragIndicator", Argument.of(member("hidden"))))
            .unlessDefault("isInteractiveDismissDisabled", props.isInteractiveDismissDisabled(),
                () -> ModifierCall.of("interactiveDismissDisabled"))
            .build();

        Expression content = Expressions.withModifiers(Expressions.single(children), presentation);
        return ViewBuilderExpr.reference(getViewName()).withModifiers(List.of(ModifierCall.withClosure("sheet",
            List.of(Argument.labeled("isPresented", presented.binding())), List.of(content))));
    }
}
