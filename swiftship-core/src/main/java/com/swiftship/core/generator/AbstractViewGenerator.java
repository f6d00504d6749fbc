package com.swiftship.core.generator;

import com.swiftship.core.ast.Expression;
import com.swiftship.core.catalog.ComponentCatalog;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.PropBag;
import com.swiftship.core.catalog.PropSchema;
import com.swiftship.core.model.ComponentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Base class for generators that work on a typed prop record.
 *
 * <p>Binds the node's raw props to {@code P} with the kind's documented defaults applied,
 * then hands the record to {@link #build}. Subclasses collect modifiers through
 * {@link #modifiers()}, which orders them by declared prop.
 *
 * @param <P> prop record type
 */
public abstract class AbstractViewGenerator<P> implements ViewGenerator {

    /**
     * Logger instance for this generator, named after the concrete class.
     */
    protected final Logger log;

    private final ComponentKind kind;
    private final PropSchema schema;
    private final Function<PropBag, P> binder;

    protected AbstractViewGenerator(ComponentKind kind, Function<PropBag, P> binder) {
        this.log = LoggerFactory.getLogger(getClass());
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.schema = ComponentCatalog.schemaFor(kind);
        this.binder = Objects.requireNonNull(binder, "binder must not be null");
    }

    @Override
    public final ComponentKind getKind() {
        return kind;
    }

    @Override
    public final Expression generate(ComponentNode node, List<Expression> children, GenerationContext context) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(children, "children must not be null");
        Objects.requireNonNull(context, "context must not be null");

        P props = binder.apply(new PropBag(node.props(), schema));
        log.debug("Generating {} for node '{}' with {} children", getViewName(), node.id(), children.size());
        return build(props, children, context);
    }

    /**
     * Builds the view expression from typed props.
     *
     * @param props bound props
     * @param children generated child expressions
     * @param context generation state
     * @return view expression
     */
    protected abstract Expression build(P props, List<Expression> children, GenerationContext context);

    /**
     * Starts a modifier chain ordered by this kind's schema.
     *
     * @return empty chain
     */
    protected ModifierChain modifiers() {
        return new ModifierChain(schema);
    }

    protected PropSchema schema() {
        return schema;
    }
}
