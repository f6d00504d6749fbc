package com.swiftship.core.generator;

import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.generator.impl.input.DatePickerGenerator;
import com.swiftship.core.generator.impl.input.PickerGenerator;
import com.swiftship.core.generator.impl.input.SecureFieldGenerator;
import com.swiftship.core.generator.impl.input.SliderGenerator;
import com.swiftship.core.generator.impl.input.StepperGenerator;
import com.swiftship.core.generator.impl.input.TextEditorGenerator;
import com.swiftship.core.generator.impl.input.TextFieldGenerator;
import com.swiftship.core.generator.impl.input.ToggleGenerator;
import com.swiftship.core.generator.impl.layout.GridGenerator;
import com.swiftship.core.generator.impl.layout.HStackGenerator;
import com.swiftship.core.generator.impl.layout.ListGenerator;
import com.swiftship.core.generator.impl.layout.ScrollViewGenerator;
import com.swiftship.core.generator.impl.layout.SectionGenerator;
import com.swiftship.core.generator.impl.layout.VStackGenerator;
import com.swiftship.core.generator.impl.layout.ZStackGenerator;
import com.swiftship.core.generator.impl.navigation.AlertGenerator;
import com.swiftship.core.generator.impl.navigation.ConfirmationDialogGenerator;
import com.swiftship.core.generator.impl.navigation.FullScreenCoverGenerator;
import com.swiftship.core.generator.impl.navigation.MenuGenerator;
import com.swiftship.core.generator.impl.navigation.NavigationLinkGenerator;
import com.swiftship.core.generator.impl.navigation.NavigationStackGenerator;
import com.swiftship.core.generator.impl.navigation.SheetGenerator;
import com.swiftship.core.generator.impl.navigation.TabViewGenerator;
import com.swiftship.core.generator.impl.navigation.ToolbarGenerator;
import com.swiftship.core.generator.impl.primitives.ButtonGenerator;
import com.swiftship.core.generator.impl.primitives.DividerGenerator;
import com.swiftship.core.generator.impl.primitives.IconGenerator;
import com.swiftship.core.generator.impl.primitives.ImageGenerator;
import com.swiftship.core.generator.impl.primitives.SpacerGenerator;
import com.swiftship.core.generator.impl.primitives.TextGenerator;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The closed dispatch table from component kind to generator.
 *
 * <p>The table is filled through an exhaustive switch over {@link ComponentKind}: adding a
 * kind without a generator is a compile error, not a runtime gap. Lookup by raw type tag
 * returns empty for tags outside the catalog, which the tree walker turns into a visible
 * placeholder.
 *
 * <p>Generators are stateless, so one registry can serve concurrent generations.
 */
public final class GeneratorRegistry {

    private final Map<ComponentKind, ViewGenerator> generators;

    public GeneratorRegistry() {
        Map<ComponentKind, ViewGenerator> table = new EnumMap<>(ComponentKind.class);
        for (ComponentKind kind : ComponentKind.values()) {
            table.put(kind, create(kind));
        }
        this.generators = Collections.unmodifiableMap(table);
    }

    /**
     * Returns the generator for a kind.
     *
     * @param kind component kind
     * @return its generator
     */
    public ViewGenerator get(ComponentKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return generators.get(kind);
    }

    /**
     * Looks up a generator by raw type tag.
     *
     * @param type node type tag
     * @return the generator, or empty when the tag is not in the catalog
     */
    public Optional<ViewGenerator> find(String type) {
        return ComponentKind.fromType(type).map(generators::get);
    }

    /**
     * Returns every registered generator, in kind order.
     *
     * @return generators
     */
    public Collection<ViewGenerator> all() {
        return generators.values();
    }

    private static ViewGenerator create(ComponentKind kind) {
        return switch (kind) {
            case TEXT -> new TextGenerator();
            case BUTTON -> new ButtonGenerator();
            case IMAGE -> new ImageGenerator();
            case ICON -> new IconGenerator();
            case SPACER -> new SpacerGenerator();
            case DIVIDER -> new DividerGenerator();
            case VSTACK -> new VStackGenerator();
            case HSTACK -> new HStackGenerator();
            case ZSTACK -> new ZStackGenerator();
            case SCROLL_VIEW -> new ScrollViewGenerator();
            case LIST -> new ListGenerator();
            case GRID -> new GridGenerator();
            case SECTION -> new SectionGenerator();
            case TEXT_FIELD -> new TextFieldGenerator();
            case SECURE_FIELD -> new SecureFieldGenerator();
            case TEXT_EDITOR -> new TextEditorGenerator();
            case TOGGLE -> new ToggleGenerator();
            case PICKER -> new PickerGenerator();
            case DATE_PICKER -> new DatePickerGenerator();
            case SLIDER -> new SliderGenerator();
            case STEPPER -> new StepperGenerator();
            case NAVIGATION_STACK -> new NavigationStackGenerator();
            case NAVIGATION_LINK -> new NavigationLinkGenerator();
            case TAB_VIEW -> new TabViewGenerator();
            case SHEET -> new SheetGenerator();
            case FULL_SCREEN_COVER -> new FullScreenCoverGenerator();
            case ALERT -> new AlertGenerator();
            case CONFIRMATION_DIALOG -> new ConfirmationDialogGenerator();
            case MENU -> new MenuGenerator();
            case TOOLBAR -> new ToolbarGenerator();
        };
    }
}
