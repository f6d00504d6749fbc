package com.swiftship.core.catalog;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read access to a node's props with the kind's documented defaults filled in.
 *
 * <p>Props are assumed to match the schema (validated upstream); accessors convert
 * leniently rather than re-validating.
 */
public final class PropBag {

    private final Map<String, Object> values;
    private final PropSchema schema;

    /**
     * Creates a bag over raw props.
     *
     * @param values raw props from the component node
     * @param schema the kind's schema
     */
    public PropBag(Map<String, Object> values, PropSchema schema) {
        this.values = values == null ? Map.of() : values;
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    public PropSchema schema() {
        return schema;
    }

    /**
     * Returns the prop value, or its documented default when absent.
     *
     * @param name prop name
     * @return value, default, or null
     */
    public Object get(String name) {
        Object value = values.get(name);
        return value != null ? value : schema.defaultValue(name);
    }

    public String string(String name) {
        Object value = get(name);
        return value == null ? null : value.toString();
    }

    public Double number(String name) {
        Object value = get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.valueOf(value.toString());
    }

    public Integer integer(String name) {
        Double value = number(name);
        return value == null ? null : (int) Math.round(value);
    }

    public Boolean bool(String name) {
        Object value = get(name);
        if (value == null) {
            return null;
        }
        return value instanceof Boolean b ? b : Boolean.valueOf(value.toString());
    }

    @SuppressWarnings("unchecked")
    public List<Object> list(String name) {
        Object value = get(name);
        return value instanceof List<?> list ? (List<Object>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> map(String name) {
        Object value = get(name);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    /**
     * Wraps a nested object (e.g. one element of {@code options}) for typed access without
     * schema defaults.
     *
     * @param raw nested value
     * @return accessor over the nested map
     */
    public static Nested nested(Object raw) {
        return new Nested(raw instanceof Map<?, ?> m ? m : Map.of());
    }

    /**
     * Typed access to a nested prop object.
     */
    public static final class Nested {

        private final Map<?, ?> values;

        private Nested(Map<?, ?> values) {
            this.values = values;
        }

        public String string(String name) {
            Object value = values.get(name);
            return value == null ? null : value.toString();
        }

        public String string(String name, String defaultValue) {
            String value = string(name);
            return value != null ? value : defaultValue;
        }

        public Double number(String name) {
            Object value = values.get(name);
            if (value == null) {
                return null;
            }
            return value instanceof Number n ? n.doubleValue() : Double.valueOf(value.toString());
        }
    }
}
