package com.swiftship.core.catalog;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of component kinds the generator understands.
 *
 * <p>Each kind carries the {@code type} tag used in component trees, the SwiftUI view its
 * generator emits as the base of the expression, its catalog category, and whether it
 * accepts child components. Presentation kinds (sheets, alerts, toolbars) attach to a
 * {@code Color.clear} presenter, which is therefore their documented target view.
 */
public enum ComponentKind {

    // Primitives
    TEXT("text", "Text", ComponentCategory.PRIMITIVES, false),
    BUTTON("button", "Button", ComponentCategory.PRIMITIVES, false),
    IMAGE("image", "Image", ComponentCategory.PRIMITIVES, false),
    ICON("icon", "Image", ComponentCategory.PRIMITIVES, false),
    SPACER("spacer", "Spacer", ComponentCategory.PRIMITIVES, false),
    DIVIDER("divider", "Divider", ComponentCategory.PRIMITIVES, false),

    // Layout
    VSTACK("vstack", "VStack", ComponentCategory.LAYOUT, true),
    HSTACK("hstack", "HStack", ComponentCategory.LAYOUT, true),
    ZSTACK("zstack", "ZStack", ComponentCategory.LAYOUT, true),
    SCROLL_VIEW("scrollview", "ScrollView", ComponentCategory.LAYOUT, true),
    LIST("list", "List", ComponentCategory.LAYOUT, true),
    GRID("grid", "LazyVGrid", ComponentCategory.LAYOUT, true),
    SECTION("section", "Section", ComponentCategory.LAYOUT, true),

    // Input
    TEXT_FIELD("textfield", "TextField", ComponentCategory.INPUT, false),
    SECURE_FIELD("securefield", "SecureField", ComponentCategory.INPUT, false),
    TEXT_EDITOR("texteditor", "TextEditor", ComponentCategory.INPUT, false),
    TOGGLE("toggle", "Toggle", ComponentCategory.INPUT, false),
    PICKER("picker", "Picker", ComponentCategory.INPUT, false),
    DATE_PICKER("datepicker", "DatePicker", ComponentCategory.INPUT, false),
    SLIDER("slider", "Slider", ComponentCategory.INPUT, false),
    STEPPER("stepper", "Stepper", ComponentCategory.INPUT, false),

    // Navigation
    NAVIGATION_STACK("navigationstack", "NavigationStack", ComponentCategory.NAVIGATION, true),
    NAVIGATION_LINK("navigationlink", "NavigationLink", ComponentCategory.NAVIGATION, true),
    TAB_VIEW("tabview", "TabView", ComponentCategory.NAVIGATION, true),
    SHEET("sheet", "Color.clear", ComponentCategory.NAVIGATION, true),
    FULL_SCREEN_COVER("fullscreencover", "Color.clear", ComponentCategory.NAVIGATION, true),
    ALERT("alert", "Color.clear", ComponentCategory.NAVIGATION, false),
    CONFIRMATION_DIALOG("confirmationdialog", "Color.clear", ComponentCategory.NAVIGATION, false),
    MENU("menu", "Menu", ComponentCategory.NAVIGATION, true),
    TOOLBAR("toolbar", "Color.clear", ComponentCategory.NAVIGATION, true);

    /** Invisible view that hosts presentation modifiers. */
    public static final String PRESENTER = "Color.clear";

    private static final Map<String, ComponentKind> BY_TYPE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(ComponentKind::type, Function.identity()));

    private final String type;
    private final String viewName;
    private final ComponentCategory category;
    private final boolean container;

    ComponentKind(String type, String viewName, ComponentCategory category, boolean container) {
        this.type = type;
        this.viewName = viewName;
        this.category = category;
        this.container = container;
    }

    /**
     * Looks up a kind by its component-tree type tag.
     *
     * @param type type tag, e.g. {@code "vstack"}
     * @return the kind, or empty when the tag is not in the catalog
     */
    public static Optional<ComponentKind> fromType(String type) {
        return Optional.ofNullable(type).map(BY_TYPE::get);
    }

    public String type() {
        return type;
    }

    public String viewName() {
        return viewName;
    }

    public ComponentCategory category() {
        return category;
    }

    /**
     * Whether nodes of this kind embed child components.
     *
     * @return true for containers
     */
    public boolean acceptsChildren() {
        return container;
    }
}
