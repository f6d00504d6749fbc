package com.swiftship.core.catalog.props;

import com.swiftship.core.catalog.PropBag;

/**
 * Typed prop sets for the layout containers.
 */
public final class LayoutProps {

    private LayoutProps() {
    }

    /** Shared by {@code vstack} and {@code hstack}. */
    public record Stack(String alignment, Double spacing) {

        public static Stack from(PropBag bag) {
            return new Stack(bag.string("alignment"), bag.number("spacing"));
        }
    }

    public record ZStack(String alignment) {

        public static ZStack from(PropBag bag) {
            return new ZStack(bag.string("alignment"));
        }
    }

    public record ScrollView(String axes, boolean showsIndicators) {

        public static ScrollView from(PropBag bag) {
            return new ScrollView(bag.string("axes"), !Boolean.FALSE.equals(bag.bool("showsIndicators")));
        }
    }

    public record ListView(String style, boolean showsRowSeparators) {

        public static ListView from(PropBag bag) {
            return new ListView(bag.string("style"), !Boolean.FALSE.equals(bag.bool("showsRowSeparators")));
        }
    }

    public record Grid(Integer columns, Double spacing, Double columnSpacing, Double rowSpacing) {

        public static Grid from(PropBag bag) {
            return new Grid(
                bag.integer("columns"),
                bag.number("spacing"),
                bag.number("columnSpacing"),
                bag.number("rowSpacing"));
        }
    }

    public record Section(String header, String footer) {

        public static Section from(PropBag bag) {
            return new Section(bag.string("header"), bag.string("footer"));
        }
    }
}
