package com.swiftship.core.assembler;

import com.swiftship.core.ast.CommentExpr;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.generator.Expressions;
import com.swiftship.core.generator.GenerationContext;
import com.swiftship.core.generator.GeneratorRegistry;
import com.swiftship.core.generator.ViewGenerator;
import com.swiftship.core.model.ComponentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lowers a component tree to one view expression.
 *
 * <p>Children are generated first and handed to the parent's generator, so every node is
 * visited exactly once. A node whose type is not in the catalog does not abort the walk:
 * it becomes a {@code // Unsupported component: ...} marker on the line above an
 * {@code EmptyView()} (or a {@code Group} of its generated children), and its siblings are
 * generated normally. Children given to a leaf component are not generated; the leaf is
 * printed below a {@code // Ignored N child component(s) ...} marker naming their ids.
 */
public final class TreeWalker {

    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    /** Prefix of the marker left for a node whose type is not in the catalog. */
    public static final String UNSUPPORTED_PREFIX = "Unsupported component: ";

    /** Prefix of the marker left above a leaf component that was given children. */
    public static final String IGNORED_CHILDREN_PREFIX = "Ignored ";

    private final GeneratorRegistry registry;

    public TreeWalker(GeneratorRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Generates the expression for a node and its subtree.
     *
     * @param node subtree root
     * @param context per-file generation state
     * @return view expression
     */
    public Expression walk(ComponentNode node, GenerationContext context) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Optional<ViewGenerator> generator = registry.find(node.type());
        if (generator.isEmpty()) {
            return unsupported(node, context);
        }

        ViewGenerator viewGenerator = generator.get();
        if (node.hasChildren() && !viewGenerator.getKind().acceptsChildren()) {
            log.warn("Component '{}' of type '{}' cannot contain children; ignoring {} child node(s)",
                node.id(), node.type(), node.children().size());
            Expression leaf = viewGenerator.generate(node, List.of(), context);
            return new CommentExpr(ignoredChildrenMarker(node), leaf);
        }

        log.debug("Dispatching node '{}' to {}", node.id(), viewGenerator.getClass().getSimpleName());
        return viewGenerator.generate(node, walkChildren(node, context), context);
    }

    private List<Expression> walkChildren(ComponentNode node, GenerationContext context) {
        List<Expression> children = new ArrayList<>(node.children().size());
        for (ComponentNode child : node.children()) {
            children.add(walk(child, context));
        }
        return children;
    }

    private Expression unsupported(ComponentNode node, GenerationContext context) {
        log.warn("Unsupported component type '{}' (id: {}); emitting placeholder", node.type(), node.id());
        List<Expression> children = walkChildren(node, context);
        String marker = UNSUPPORTED_PREFIX + singleLine(node.type()) + " (id: " + singleLine(node.id()) + ")";
        return new CommentExpr(marker, Expressions.group(children));
    }

    private static String ignoredChildrenMarker(ComponentNode node) {
        StringBuilder ids = new StringBuilder();
        for (ComponentNode child : node.children()) {
            if (ids.length() > 0) {
                ids.append(", ");
            }
            ids.append(singleLine(child.id()));
        }
        return IGNORED_CHILDREN_PREFIX + node.children().size() + " child component(s) of "
            + singleLine(node.type()) + " (id: " + singleLine(node.id()) + "): " + ids;
    }

    private static String singleLine(String value) {
        return value.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
    }
}
