package com.swiftship.core.generator.impl.primitives;

import java.util.Map;

import com.swiftship.core.generator.GeneratorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ImageGenerator}.
 */
class ImageGeneratorTest extends GeneratorTestBase {

    private final ImageGenerator generator = new ImageGenerator();

    @Test
    void generate_systemSource_usesSystemName() {
        assertThat(render(generator, props("source", Map.of("type", "system", "name", "star"))))
            .isEqualTo("Image(systemName: \"star\")");
    }

    @Test
    void generate_defaults_produceNoModifiers() {
        assertThat(modifierNames(generate(generator, props(
            "source", Map.of("type", "asset", "name", "hero"), "contentMode", "fit", "cornerRadius", 0)))).isEmpty();
    }

    @Test
    void generate_assetFilledAndRounded() {
        String printed = render(generator, props("source", Map.of("type", "asset", "name", "hero"),
            "contentMode", "fill", "cornerRadius", 12, "width", 200));

        assertThat(printed).isEqualTo(
            "Image(\"hero\")\n"
                + ".resizable()\n"
                + ".scaledToFill()\n"
                + ".clipShape(RoundedRectangle(cornerRadius: 12))\n"
                + ".frame(width: 200)");
    }

    @Test
    void generate_roundedFramedFitImage_resizesBeforeClipping() {
        String printed = render(generator, props("source", Map.of("type", "asset", "name", "hero"),
            "cornerRadius", 12, "width", 100));

        assertThat(printed).isEqualTo(
            "Image(\"hero\")\n"
                + ".resizable()\n"
                + ".clipShape(RoundedRectangle(cornerRadius: 12))\n"
                + ".frame(width: 100)");
    }

    @Test
    void generate_heightOnly_makesImageResizable() {
        String printed = render(generator, props("source", Map.of("name", "star"), "height", 40));

        assertThat(printed).isEqualTo("Image(systemName: \"star\")\n.resizable()\n.frame(height: 40)");
    }

    @Test
    void generate_urlSource_usesAsyncImage() {
        String printed = render(generator, props("source", Map.of("type", "url", "url", "https://example.com/a.png"),
            "width", 64, "height", 64));

        assertThat(printed).isEqualTo(
            "AsyncImage(url: URL(string: \"https://example.com/a.png\"))\n"
                + ".frame(width: 64, height: 64)");
    }
}
