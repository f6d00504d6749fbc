package com.swiftship.core.generator.impl.primitives;

import java.util.Map;

import com.swiftship.core.ast.Expression;
import com.swiftship.core.generator.GeneratorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TextGenerator}.
 */
class TextGeneratorTest extends GeneratorTestBase {

    private final TextGenerator generator = new TextGenerator();

    @Test
    void generate_contentOnly_producesBareText() {
        assertThat(render(generator, props("content", "Hello"))).isEqualTo("Text(\"Hello\")");
    }

    @Test
    void generate_defaultFont_isElided() {
        Expression text = generate(generator, props("content", "Hello", "font", "body"));

        assertThat(modifierNames(text)).isEmpty();
    }

    @Test
    void generate_styledText_appliesModifiersInCatalogOrder() {
        String printed = render(generator, props("content", "Hi", "font", "title", "weight", "bold"));

        assertThat(printed).isEqualTo("Text(\"Hi\")\n.font(.title)\n.fontWeight(.bold)");
    }

    @Test
    void generate_reversedPropOrder_producesSameModifierOrder() {
        Map<String, Object> forward = props("content", "Hi", "font", "title", "weight", "bold",
            "color", "blue", "alignment", "center", "lineLimit", 2);
        Map<String, Object> reversed = props("lineLimit", 2, "alignment", "center", "color", "blue",
            "weight", "bold", "font", "title", "content", "Hi");

        assertThat(render(generator, reversed)).isEqualTo(render(generator, forward));
        assertThat(modifierNames(generate(generator, reversed)))
            .containsExactly("font", "fontWeight", "foregroundStyle", "multilineTextAlignment", "lineLimit");
    }

    @Test
    void generate_hexColor_usesColorHexInitializer() {
        String printed = render(generator, props("content", "Alert", "color", "#FF0000"));

        assertThat(printed).isEqualTo("Text(\"Alert\")\n.foregroundStyle(Color(hex: \"#FF0000\"))");
    }

    @Test
    void generate_contentWithQuotesAndNewlines_isEscapedOrMultiline() {
        assertThat(render(generator, props("content", "Say \"hi\""))).isEqualTo("Text(\"Say \\\"hi\\\"\")");
        assertThat(render(generator, props("content", "One\nTwo"))).isEqualTo("Text(\"\"\"\nOne\nTwo\n\"\"\")");
    }

    @Test
    void generate_missingContent_printsEmptyString() {
        assertThat(render(generator, props())).isEqualTo("Text(\"\")");
    }
}
