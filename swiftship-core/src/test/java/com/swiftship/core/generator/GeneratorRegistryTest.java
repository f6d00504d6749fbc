package com.swiftship.core.generator;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.catalog.ComponentCatalog;
import com.swiftship.core.catalog.ComponentKind;
import com.swiftship.core.catalog.PropSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GeneratorRegistry}, plus checks that hold for every registered generator.
 */
class GeneratorRegistryTest extends GeneratorTestBase {

    private static final Set<ComponentKind> PRESENTERS = EnumSet.of(
        ComponentKind.SHEET, ComponentKind.FULL_SCREEN_COVER, ComponentKind.ALERT,
        ComponentKind.CONFIRMATION_DIALOG, ComponentKind.TOOLBAR);

    private final GeneratorRegistry registry = new GeneratorRegistry();

    @Test
    void all_registersOneGeneratorPerKind() {
        assertThat(registry.all()).hasSize(ComponentKind.values().length);
        assertThat(registry.all()).extracting(ViewGenerator::getKind)
            .containsExactlyInAnyOrder(ComponentKind.values());
    }

    @Test
    void find_byTypeTag() {
        assertThat(registry.find("vstack")).get().extracting(ViewGenerator::getKind).isEqualTo(ComponentKind.VSTACK);
        assertThat(registry.find("carousel")).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(ComponentKind.class)
    void generate_rootViewMatchesKind(ComponentKind kind) {
        ViewGenerator generator = registry.get(kind);

        Expression result = generate(generator, Map.of());

        assertThat(generator.getViewName()).isEqualTo(kind.viewName());
        assertThat(result).isInstanceOf(ViewBuilderExpr.class);
        assertThat(((ViewBuilderExpr) result).viewName()).isEqualTo(kind.viewName());
    }

    @ParameterizedTest
    @EnumSource(ComponentKind.class)
    void generate_documentedDefaults_addNoStyleModifiers(ComponentKind kind) {
        Expression result = generate(registry.get(kind), defaultsOf(ComponentCatalog.schemaFor(kind)));

        if (PRESENTERS.contains(kind)) {
            assertThat(modifierNames(result)).hasSize(1);
        } else {
            assertThat(modifierNames(result)).isEmpty();
        }
    }

    @ParameterizedTest
    @EnumSource(ComponentKind.class)
    void generate_sameInputTwice_printsIdentically(ComponentKind kind) {
        String first = render(registry.get(kind), Map.of(), text("child"));
        createContext();
        String second = render(registry.get(kind), Map.of(), text("child"));

        assertThat(second).isEqualTo(first);
    }

    private static Map<String, Object> defaultsOf(PropSchema schema) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (PropSchema.PropDef prop : schema.props()) {
            if (prop.defaultValue() != null) {
                defaults.put(prop.name(), prop.defaultValue());
            }
        }
        return defaults;
    }
}
