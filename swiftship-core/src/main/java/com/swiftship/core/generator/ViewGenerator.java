package com.swiftship.core.generator;

import com.swiftship.core.ast.Expression;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.model.ComponentNode;

import java.util.List;

/**
 * Lowers one component kind into a Swift view expression.
 *
 * <p>Generators are pure with respect to their inputs: the node's props (already validated
 * against the kind's schema) and the child expressions the tree walker has generated. They
 * never recurse into {@code node.children()} themselves. The only side effect allowed is
 * declaring state through {@link GenerationContext#state()}.
 *
 * <p>Each generator:
 * <ul>
 *   <li>emits a base call named after {@link #getViewName()}</li>
 *   <li>emits one modifier per non-default prop, in the kind's declared prop order</li>
 *   <li>places child expressions in the trailing closure, layout parameters in arguments</li>
 * </ul>
 *
 * @see GeneratorRegistry
 * @see AbstractViewGenerator
 */
public interface ViewGenerator {

    /**
     * Returns the component kind this generator handles.
     *
     * @return component kind
     */
    ComponentKind getKind();

    /**
     * Returns the SwiftUI view (or presenter) the generated expression is built on.
     *
     * @return target view name
     */
    default String getViewName() {
        return getKind().viewName();
    }

    /**
     * Generates the view expression for a node.
     *
     * @param node validated component node of this generator's kind
     * @param children already generated child expressions, in order
     * @param context per-file generation state
     * @return view expression
     */
    Expression generate(ComponentNode node, List<Expression> children, GenerationContext context);
}
