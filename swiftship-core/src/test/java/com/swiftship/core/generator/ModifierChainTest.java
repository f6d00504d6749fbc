package com.swiftship.core.generator;

import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.catalog.ComponentCatalog;
import com.swiftship.core.catalog.ComponentKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ModifierChain}.
 */
class ModifierChainTest {

    @Test
    void build_ordersBySchemaPosition_notInsertionOrder() {
        ModifierChain chain = new ModifierChain(ComponentCatalog.schemaFor(ComponentKind.TEXT))
            .add("lineLimit", ModifierCall.of("lineLimit"))
            .add("color", ModifierCall.of("foregroundStyle"))
            .add("font", ModifierCall.of("font"));

        assertThat(chain.build()).extracting(ModifierCall::name)
            .containsExactly("font", "foregroundStyle", "lineLimit");
    }

    @Test
    void build_samePropKeepsInsertionOrder() {
        ModifierChain chain = new ModifierChain(ComponentCatalog.schemaFor(ComponentKind.IMAGE))
            .add("width", ModifierCall.of("resizable"))
            .add("width", ModifierCall.of("frame"));

        assertThat(chain.build()).extracting(ModifierCall::name).containsExactly("resizable", "frame");
    }

    @Test
    void unlessDefault_defaultValue_addsNothing() {
        ModifierChain chain = new ModifierChain(ComponentCatalog.schemaFor(ComponentKind.TEXT))
            .unlessDefault("font", "body", () -> ModifierCall.of("font"))
            .unlessDefault("color", null, () -> ModifierCall.of("foregroundStyle"));

        assertThat(chain.isEmpty()).isTrue();
        assertThat(chain.build()).isEmpty();
    }

    @Test
    void add_undeclaredProp_isRejected() {
        ModifierChain chain = new ModifierChain(ComponentCatalog.schemaFor(ComponentKind.TEXT));

        assertThatThrownBy(() -> chain.add("padding", ModifierCall.of("padding")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
