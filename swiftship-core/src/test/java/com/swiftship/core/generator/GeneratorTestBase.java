package com.swiftship.core.generator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.StringLiteralExpr;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.config.CodegenConfig;
import com.swiftship.core.model.ComponentNode;
import com.swiftship.core.printer.SwiftPrinter;
import org.junit.jupiter.api.BeforeEach;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Shared fixtures for view generator tests: a fresh context per test and helpers to run a
 * generator against inline props and print the result.
 */
public abstract class GeneratorTestBase {

    protected final SwiftPrinter printer = new SwiftPrinter();
    protected GenerationContext context;

    @BeforeEach
    protected void createContext() {
        context = GenerationContext.create(CodegenConfig.defaults());
    }

    protected Expression generate(ViewGenerator generator, Map<String, Object> props, Expression... children) {
        ComponentNode node = new ComponentNode("node-1", generator.getKind().type(), props, List.of());
        return generator.generate(node, List.of(children), context);
    }

    protected String render(ViewGenerator generator, Map<String, Object> props, Expression... children) {
        return printer.printNode(generate(generator, props, children));
    }

    /** Prints every state property declared so far, one per line. */
    protected List<String> stateDeclarations() {
        return context.state().declarations().stream().map(printer::printNode).toList();
    }

    protected static Map<String, Object> props(Object... keysAndValues) {
        Map<String, Object> props = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            props.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return props;
    }

    protected static Expression text(String content) {
        return ViewBuilderExpr.of("Text", Argument.of(new StringLiteralExpr(content)));
    }

    protected static List<String> modifierNames(Expression expression) {
        assertThat(expression).isInstanceOf(ViewBuilderExpr.class);
        return ((ViewBuilderExpr) expression).modifiers().stream().map(ModifierCall::name).toList();
    }
}
