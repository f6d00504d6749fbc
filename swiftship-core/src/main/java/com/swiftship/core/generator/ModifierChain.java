package com.swiftship.core.generator;

import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.catalog.PropSchema;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Collects the modifiers of one view and emits them in declared prop order.
 *
 * <p>Every modifier is anchored to a prop. {@link #build()} orders modifiers by the anchor's
 * index in the kind's {@link PropSchema}, keeping insertion order among modifiers sharing
 * an anchor, so the result never depends on the order a generator adds them in or on the
 * incoming prop map.
 */
public final class ModifierChain {

    private final PropSchema schema;
    private final List<Entry> entries = new ArrayList<>();

    public ModifierChain(PropSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    /**
     * Adds a modifier unless {@code value} equals the prop's documented default.
     *
     * @param prop anchoring prop
     * @param value the prop's resolved value
     * @param modifier builds the modifier; only called for non-default values
     * @return this chain
     */
    public ModifierChain unlessDefault(String prop, Object value, Supplier<ModifierCall> modifier) {
        if (!schema.isDefault(prop, value)) {
            add(prop, modifier.get());
        }
        return this;
    }

    /**
     * Adds a modifier anchored at {@code prop} unconditionally.
     *
     * @param prop anchoring prop
     * @param modifier the modifier
     * @return this chain
     */
    public ModifierChain add(String prop, ModifierCall modifier) {
        Objects.requireNonNull(modifier, "modifier must not be null");
        entries.add(new Entry(schema.indexOf(prop), entries.size(), modifier));
        return this;
    }

    /**
     * Returns the modifiers in declared prop order.
     *
     * @return ordered modifiers
     */
    public List<ModifierCall> build() {
        return entries.stream()
            .sorted(Comparator.comparingInt(Entry::index).thenComparingInt(Entry::sequence))
            .map(Entry::modifier)
            .toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private record Entry(int index, int sequence, ModifierCall modifier) {
    }
}
