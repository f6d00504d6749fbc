package com.swiftship.core.catalog;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The ordered prop declarations of one component kind, with their documented defaults.
 *
 * <p>Declaration order is the order in which a generator's modifiers are emitted. A prop
 * whose default is null is optional: absent means "not set".
 *
 * @param kind the component kind
 * @param props prop declarations, in declared order
 */
public record PropSchema(ComponentKind kind, List<PropDef> props) {

    public PropSchema {
        Objects.requireNonNull(kind, "kind must not be null");
        props = props == null ? List.of() : List.copyOf(props);
    }

    /**
     * One declared prop.
     *
     * @param name prop name
     * @param defaultValue documented default, or null when the prop has none
     */
    public record PropDef(String name, Object defaultValue) {

        public PropDef {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * Returns the declaration index of a prop.
     *
     * @param name prop name
     * @return zero-based index in declared order
     * @throws IllegalArgumentException if the prop is not declared for this kind
     */
    public int indexOf(String name) {
        for (int i = 0; i < props.size(); i++) {
            if (props.get(i).name().equals(name)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Prop '" + name + "' is not declared for " + kind.type());
    }

    /**
     * Returns the documented default of a prop.
     *
     * @param name prop name
     * @return default value, or null when the prop has none
     */
    public Object defaultValue(String name) {
        return props.get(indexOf(name)).defaultValue();
    }

    /**
     * Returns the declared prop names in order.
     *
     * @return prop names
     */
    public List<String> names() {
        List<String> names = new ArrayList<>(props.size());
        props.forEach(p -> names.add(p.name()));
        return names;
    }

    /**
     * Whether {@code value} equals the prop's documented default. An absent (null) value
     * always counts as default; a present value for a prop without a default never does.
     *
     * @param name prop name
     * @param value incoming value
     * @return true when a modifier for this prop should be elided
     */
    public boolean isDefault(String name, Object value) {
        if (value == null) {
            return true;
        }
        Object defaultValue = defaultValue(name);
        return defaultValue != null && structurallyEqual(value, defaultValue);
    }

    /**
     * Structural equality for prop values: numbers compare by numeric value, lists and maps
     * element by element, everything else by {@code equals}.
     *
     * @param a first value
     * @param b second value
     * @return true when both values are structurally equal
     */
    public static boolean structurallyEqual(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return toDecimal(na).compareTo(toDecimal(nb)) == 0;
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size()) {
                return false;
            }
            Iterator<?> ia = la.iterator();
            Iterator<?> ib = lb.iterator();
            while (ia.hasNext()) {
                if (!structurallyEqual(ia.next(), ib.next())) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
            if (ma.size() != mb.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : ma.entrySet()) {
                if (!mb.containsKey(entry.getKey()) || !structurallyEqual(entry.getValue(), mb.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return a.equals(b);
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return new BigDecimal(n.toString());
    }
}
