package com.swiftship.core.generator.impl.layout;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.FunctionCallExpr;
import com.swiftship.core.ast.IntLiteralExpr;
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
 * Generates a {@code LazyVGrid} of equal flexible columns.
 *
 * <p>{@code columnSpacing} and {@code rowSpacing} override the shared {@code spacing} for
 * their axis.
 */
public class GridGenerator extends AbstractViewGenerator<LayoutProps.Grid> {

    private static final int FALLBACK_COLUMNS = 2;

    public GridGenerator() {
        super(ComponentKind.GRID, LayoutProps.Grid::from);
    }

    @Override
    protected Expression build(LayoutProps.Grid props, List<Expression> children, GenerationContext context) {
        Double shared = schema().isDefault("spacing", props.spacing()) ? null : props.spacing();
        Double columnSpacing = props.columnSpacing() != null ? props.columnSpacing() : shared;
        Double rowSpacing = props.rowSpacing() != null ? props.rowSpacing() : shared;

        List<Argument> item = new ArrayList<>();
        item.add(Argument.of(FunctionCallExpr.of(".flexible")));
        if (columnSpacing != null) {
            item.add(Argument.labeled("spacing", number(columnSpacing)));
        }
        int count = props.columns() == null || props.columns() < 1 ? FALLBACK_COLUMNS : props.columns();
        Expression columns = FunctionCallExpr.of("Array",
            Argument.labeled("repeating", new FunctionCallExpr("GridItem", item, List.of())),
            Argument.labeled("count", new IntLiteralExpr(count)));

        List<Argument> arguments = new ArrayList<>();
        arguments.add(Argument.labeled("columns", columns));
        if (rowSpacing != null) {
            arguments.add(Argument.labeled("spacing", number(rowSpacing)));
        }
        return new ViewBuilderExpr(getViewName(), arguments, Expressions.content(children), List.of());
    }
}
