package com.swiftship.core.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Prop schemas and documented defaults for every {@link ComponentKind}.
 *
 * <p>This is the single default-value table the generators consult when deciding whether a
 * prop produces a modifier. Props are listed in their declared order; modifiers follow the
 * same order.
 *
 * <p>The table is built through an exhaustive switch over {@link ComponentKind}, so a kind
 * added to the enum without a schema does not compile.
 */
public final class ComponentCatalog {

    private static final Map<ComponentKind, PropSchema> SCHEMAS;

    static {
        Map<ComponentKind, PropSchema> schemas = new EnumMap<>(ComponentKind.class);
        for (ComponentKind kind : ComponentKind.values()) {
            schemas.put(kind, define(kind));
        }
        SCHEMAS = Collections.unmodifiableMap(schemas);
    }

    private ComponentCatalog() {
    }

    /**
     * Returns the schema for a kind.
     *
     * @param kind component kind
     * @return its prop schema
     */
    public static PropSchema schemaFor(ComponentKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return SCHEMAS.get(kind);
    }

    /**
     * Returns every kind with its schema, in enum order.
     *
     * @return unmodifiable kind-to-schema map
     */
    public static Map<ComponentKind, PropSchema> all() {
        return SCHEMAS;
    }

    private static PropSchema define(ComponentKind kind) {
        Builder b = new Builder(kind);
        return switch (kind) {
            case TEXT -> b.prop("content").prop("font", "body").prop("weight").prop("color")
                .prop("alignment").prop("lineLimit").build();
            case BUTTON -> b.prop("label").prop("style", "borderedProminent").prop("role", "none").prop("icon")
                .prop("iconPosition", "leading").prop("isDisabled", false).prop("isLoading", false).build();
            case IMAGE -> b.prop("source").prop("contentMode", "fit").prop("cornerRadius", 0)
                .prop("width").prop("height").build();
            case ICON -> b.prop("name").prop("size", "medium").prop("weight", "regular").prop("color")
                .prop("renderingMode", "monochrome").build();
            case SPACER -> b.prop("minLength").build();
            case DIVIDER -> b.build();

            case VSTACK, HSTACK -> b.prop("alignment", "center").prop("spacing", 8).build();
            case ZSTACK -> b.prop("alignment", "center").build();
            case SCROLL_VIEW -> b.prop("axes", "vertical").prop("showsIndicators", true).build();
            case LIST -> b.prop("style", "automatic").prop("showsRowSeparators", true).build();
            case GRID -> b.prop("columns", 2).prop("spacing", 8).prop("columnSpacing").prop("rowSpacing").build();
            case SECTION -> b.prop("header").prop("footer").build();

            case TEXT_FIELD -> b.prop("placeholder", "").prop("label").prop("axis", "horizontal")
                .prop("keyboardType", "default").prop("textContentType", "none")
                .prop("autocapitalization", "sentences").prop("autocorrection", true).build();
            case SECURE_FIELD -> b.prop("placeholder", "").prop("label").prop("textContentType", "password").build();
            case TEXT_EDITOR -> b.prop("placeholder").prop("minHeight", 100).build();
            case TOGGLE -> b.prop("label").prop("isOn", false).build();
            case PICKER -> b.prop("label").prop("options", List.of()).prop("style", "automatic").build();
            case DATE_PICKER -> b.prop("label").prop("components", "date")
                .prop("displayedComponents", "compact").build();
            case SLIDER -> b.prop("label").prop("minValue", 0).prop("maxValue", 100).prop("step").build();
            case STEPPER -> b.prop("label").prop("minValue").prop("maxValue").prop("step", 1).build();

            case NAVIGATION_STACK -> b.prop("title").prop("titleDisplayMode", "automatic").build();
            case NAVIGATION_LINK -> b.prop("destination").build();
            case TAB_VIEW -> b.prop("tabs", List.of()).prop("style", "automatic").build();
            case SHEET -> b.prop("detents", List.of("large")).prop("showsDragIndicator", true)
                .prop("isInteractiveDismissDisabled", false).build();
            case FULL_SCREEN_COVER -> b.prop("isInteractiveDismissDisabled", false).build();
            case ALERT -> b.prop("title").prop("message").prop("actions", List.of()).build();
            case CONFIRMATION_DIALOG -> b.prop("title").prop("titleVisibility", "automatic")
                .prop("actions", List.of()).build();
            case MENU, TOOLBAR -> b.prop("items", List.of()).build();
        };
    }

    private static final class Builder {

        private final ComponentKind kind;
        private final List<PropSchema.PropDef> props = new ArrayList<>();

        Builder(ComponentKind kind) {
            this.kind = kind;
        }

        Builder prop(String name) {
            return prop(name, null);
        }

        Builder prop(String name, Object defaultValue) {
            props.add(new PropSchema.PropDef(name, defaultValue));
            return this;
        }

        PropSchema build() {
            return new PropSchema(kind, props);
        }
    }
}
