package com.swiftship.core.model;

import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ComponentTreeReader} and {@link ComponentNode}.
 */
class ComponentTreeReaderTest {

    @Test
    void parse_nestedTree_preservesOrderAndProps() {
        ComponentNode root = ComponentTreeReader.parse("""
            {
              "id": "root",
              "type": "vstack",
              "props": { "spacing": 12, "alignment": "leading" },
              "children": [
                { "id": "a", "type": "text", "props": { "content": "A" } },
                { "id": "b", "type": "slider", "props": { "step": 0.5 } }
              ]
            }
            """);

        assertThat(root.type()).isEqualTo("vstack");
        assertThat(root.props()).containsKeys("spacing", "alignment");
        assertThat(root.props().keySet()).containsExactly("spacing", "alignment");
        assertThat(root.children()).extracting(ComponentNode::id).containsExactly("a", "b");
        assertThat(((Number) root.children().get(1).props().get("step")).doubleValue()).isEqualTo(0.5);
    }

    @Test
    void parse_optionalFieldsMissing_defaultsToEmpty() {
        ComponentNode node = ComponentTreeReader.parse("{\"type\": \"divider\", \"meta\": {\"author\": \"x\"}}");

        assertThat(node.id()).isEmpty();
        assertThat(node.props()).isEmpty();
        assertThat(node.children()).isEmpty();
        assertThat(node.hasChildren()).isFalse();
    }

    @Test
    void parse_missingType_isRejected() {
        assertThatThrownBy(() -> ComponentTreeReader.parse("{\"id\": \"x\"}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid component tree JSON");
    }

    @Test
    void parse_malformedJson_isRejected() {
        assertThatThrownBy(() -> ComponentTreeReader.parse("{\"type\": "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ComponentTreeReader.parse("null"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void read_fixtureFile() throws URISyntaxException {
        Path fixture = Path.of(getClass().getResource("/fixtures/login-screen.json").toURI());

        ComponentNode root = ComponentTreeReader.read(fixture);

        assertThat(root.type()).isEqualTo("navigationstack");
        assertThat(root.children().get(0).children()).hasSize(6);
    }

    @Test
    void read_missingFile_throwsUnchecked() {
        assertThatThrownBy(() -> ComponentTreeReader.read(Path.of("does-not-exist.json")))
            .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void componentNode_isImmutable() {
        ComponentNode node = ComponentNode.of("a", "text", Map.of("content", "A"));

        assertThatThrownBy(() -> node.props().put("font", "title")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> node.children().add(node)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(new ComponentNode(null, "text", null, List.of()).id()).isEmpty();
    }
}
