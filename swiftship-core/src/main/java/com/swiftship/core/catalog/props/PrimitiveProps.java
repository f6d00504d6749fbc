package com.swiftship.core.catalog.props;

import com.swiftship.core.catalog.PropBag;

/**
 * Typed prop sets for the primitive kinds. Values carry the documented defaults already
 * applied; optional props without a default are null when absent.
 */
public final class PrimitiveProps {

    private PrimitiveProps() {
    }

    public record Text(
        String content,
        String font,
        String weight,
        String color,
        String alignment,
        Integer lineLimit
    ) {
        public static Text from(PropBag bag) {
            return new Text(
                orEmpty(bag.string("content")),
                bag.string("font"),
                bag.string("weight"),
                bag.string("color"),
                bag.string("alignment"),
                bag.integer("lineLimit"));
        }
    }

    public record Button(
        String label,
        String style,
        String role,
        String icon,
        String iconPosition,
        boolean isDisabled,
        boolean isLoading
    ) {
        public static Button from(PropBag bag) {
            return new Button(
                orEmpty(bag.string("label")),
                bag.string("style"),
                bag.string("role"),
                bag.string("icon"),
                bag.string("iconPosition"),
                Boolean.TRUE.equals(bag.bool("isDisabled")),
                Boolean.TRUE.equals(bag.bool("isLoading")));
        }
    }

    /**
     * Where an image comes from.
     *
     * @param type {@code system}, {@code asset} or {@code url}
     * @param name symbol or asset name
     * @param url remote image URL
     */
    public record ImageSource(String type, String name, String url) {

        static ImageSource from(PropBag.Nested nested) {
            return new ImageSource(nested.string("type", "system"), nested.string("name", ""), nested.string("url", ""));
        }
    }

    public record Image(
        ImageSource source,
        String contentMode,
        Double cornerRadius,
        Double width,
        Double height
    ) {
        public static Image from(PropBag bag) {
            return new Image(
                ImageSource.from(PropBag.nested(bag.get("source"))),
                bag.string("contentMode"),
                bag.number("cornerRadius"),
                bag.number("width"),
                bag.number("height"));
        }
    }

    public record Icon(String name, String size, String weight, String color, String renderingMode) {

        public static Icon from(PropBag bag) {
            return new Icon(
                orEmpty(bag.string("name")),
                bag.string("size"),
                bag.string("weight"),
                bag.string("color"),
                bag.string("renderingMode"));
        }
    }

    public record Spacer(Double minLength) {

        public static Spacer from(PropBag bag) {
            return new Spacer(bag.number("minLength"));
        }
    }

    public record Divider() {

        public static Divider from(PropBag bag) {
            return new Divider();
        }
    }

    static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
