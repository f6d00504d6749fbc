package com.swiftship.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a validated component tree.
 *
 * <p>Props keep their incoming key order, but nothing downstream depends on it: modifiers
 * are always emitted in the kind's declared prop order.
 *
 * @param id opaque stable identifier
 * @param type kind tag from the component catalog
 * @param props prop bag, shaped by {@code type}
 * @param children child nodes, in order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComponentNode(
    @JsonProperty("id") String id,
    @JsonProperty("type") String type,
    @JsonProperty("props") Map<String, Object> props,
    @JsonProperty("children") List<ComponentNode> children
) {
    /**
     * Compact constructor with validation.
     */
    public ComponentNode {
        Objects.requireNonNull(type, "type must not be null");
        if (id == null) {
            id = "";
        }
        props = props == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(props));
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a node.
     *
     * @param id node id
     * @param type kind tag
     * @param props prop bag
     * @param children child nodes
     * @return the node
     */
    public static ComponentNode of(String id, String type, Map<String, Object> props, ComponentNode... children) {
        return new ComponentNode(id, type, props, List.of(children));
    }

    /**
     * Whether this node has child nodes.
     *
     * @return true when {@code children} is non-empty
     */
    public boolean hasChildren() {
        return !children.isEmpty();
    }
}
