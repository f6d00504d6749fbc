package com.swiftship.core.generator.impl.input;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.IdentifierExpr;
import com.swiftship.core.ast.IfExpr;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.props.InputProps;
import com.swiftship.core.generator.AbstractViewGenerator;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.ModifierChain;
import com.swiftship.core.generator.StateVariable;

import java.util.List;

import static com.swiftship.core.generator.Expressions.bool;
import static com.swiftship.core.generator.Expressions.member;
import static com.swiftship.core.generator.Expressions.number;
import static com.swiftship.core.generator.Expressions.string;

/**
 * Generates a {@code TextEditor}. SwiftUI editors have no placeholder, so one is overlaid
 * while the text is empty.
 */
public class TextEditorGenerator extends AbstractViewGenerator<InputProps.TextEditor> {

    public TextEditorGenerator() {
        super(ComponentKind.TEXT_EDITOR, InputProps.TextEditor::from);
    }

    @Override
    protected Expression build(InputProps.TextEditor props, List<Expression> children, GenerationContext context) {
        StateVariable text = context.state().declare("text", "String", string(""));

        ModifierChain chain = modifiers();
        if (props.placeholder() != null && !props.placeholder().isEmpty()) {
            Expression hint = ViewBuilderExpr.of("Text", Argument.of(string(props.placeholder())))
                .withModifiers(List.of(
                    ModifierCall.of("foregroundStyle", Argument.of(member("secondary"))),
                    ModifierCall.of("allowsHitTesting", Argument.of(bool(false)))));
            IfExpr whenEmpty = new IfExpr(new IdentifierExpr(text.name() + ".isEmpty"), List.of(hint), List.of());
            chain.add("placeholder", ModifierCall.withClosure("overlay",
                List.of(Argument.labeled("alignment", member("topLeading"))), List.of(whenEmpty)));
        }
        chain.unlessDefault("minHeight", props.minHeight(),
            () -> ModifierCall.of("frame", Argument.labeled("minHeight", number(props.minHeight()))));

        return new ViewBuilderExpr(getViewName(), List.of(Argument.labeled("text", text.binding())),
            List.of(), chain.build());
    }
}
