package com.swiftship.core;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.swiftship.core.config.CodegenConfig;
import com.swiftship.core.model.ComponentNode;
import com.swiftship.core.model.ComponentTreeReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link SwiftCodeGenerator}.
 */
class SwiftCodeGeneratorTest {

    private SwiftCodeGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SwiftCodeGenerator();
    }

    @Test
    void generateSourceFile_singleText_producesCompleteFile() {
        ComponentNode tree = ComponentNode.of("t1", "text", Map.of("content", "Hello"));

        String source = generator.generateSourceFile("Greeting", tree);

        assertThat(source).isEqualTo(
            "import SwiftUI\n"
                + "\n"
                + "struct Greeting: View {\n"
                + "    var body: some View {\n"
                + "        Text(\"Hello\")\n"
                + "    }\n"
                + "}\n"
                + "\n"
                + "#Preview {\n"
                + "    Greeting()\n"
                + "}\n");
    }

    @Test
    void generateSourceFile_inputs_declareStateBeforeBody() {
        ComponentNode tree = ComponentNode.of("root", "vstack", Map.of(),
            ComponentNode.of("email", "textfield", Map.of("placeholder", "Email")),
            ComponentNode.of("remember", "toggle", Map.of("label", "Remember me")));

        String source = generator.generateSourceFile("login-screen.swift", tree);

        assertThat(source).isEqualTo(
            "import SwiftUI\n"
                + "\n"
                + "struct LoginScreen: View {\n"
                + "    @State private var text: String = \"\"\n"
                + "    @State private var isOn: Bool = false\n"
                + "\n"
                + "    var body: some View {\n"
                + "        VStack {\n"
                + "            TextField(\"Email\", text: $text)\n"
                + "            Toggle(\"Remember me\", isOn: $isOn)\n"
                + "        }\n"
                + "    }\n"
                + "}\n"
                + "\n"
                + "#Preview {\n"
                + "    LoginScreen()\n"
                + "}\n");
    }

    @Test
    void generateSourceFile_multilineText_isIndentedWithBody() {
        ComponentNode tree = ComponentNode.of("t1", "text", Map.of("content", "Line 1\nLine 2"));

        String source = generator.generateSourceFile("Poem", tree);

        assertThat(source).contains(
            "        Text(\"\"\"\n"
                + "        Line 1\n"
                + "        Line 2\n"
                + "        \"\"\")\n");
    }

    @Test
    void generate_fixture_containsEveryComponentAndMarker() throws URISyntaxException {
        ComponentNode tree = ComponentTreeReader.read(fixture());

        GeneratedSource result = generator.generate("login-screen", tree);

        assertThat(result.viewName()).isEqualTo("LoginScreen");
        assertThat(result.fileName()).isEqualTo("LoginScreen.swift");
        assertThat(result.content())
            .contains("@State private var text: String = \"\"\n"
                + "    @State private var password: String = \"\"\n"
                + "    @State private var isOn: Bool = true\n")
            .contains("NavigationStack {")
            .contains("VStack(alignment: .leading, spacing: 16) {")
            .contains(".navigationTitle(\"Sign In\")")
            .contains(".navigationBarTitleDisplayMode(.large)")
            .contains("Text(\"Welcome back\")")
            .contains("TextField(\"Email\", text: $text)")
            .contains("SecureField(\"Password\", text: $password)")
            .contains("Label(\"Sign In\", systemImage: \"arrow.right.circle\")")
            .contains("// Unsupported component: carousel (id: promo)");
    }

    @Test
    void generate_sameTreeTwice_isByteIdentical() throws URISyntaxException {
        ComponentNode tree = ComponentTreeReader.read(fixture());

        assertThat(new SwiftCodeGenerator().generateSourceFile("A", tree))
            .isEqualTo(generator.generateSourceFile("A", tree));
    }

    @Test
    void generate_concurrentCalls_shareNothing() throws Exception {
        ComponentNode tree = ComponentTreeReader.read(fixture());
        String expected = generator.generateSourceFile("Login", tree);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> generator.generateSourceFile("Login", tree)));
            }
            for (Future<String> future : futures) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void generate_previewDisabled_omitsPreviewMacro() {
        SwiftCodeGenerator noPreview = new SwiftCodeGenerator(CodegenConfig.defaults().withPreview(false));

        String source = noPreview.generateSourceFile("Plain", ComponentNode.of("d", "divider", Map.of()));

        assertThat(source).doesNotContain("#Preview").endsWith("}\n");
    }

    @Test
    void generate_nullTree_isRejected() {
        assertThatThrownBy(() -> generator.generateSourceFile("X", null)).isInstanceOf(NullPointerException.class);
    }

    private Path fixture() throws URISyntaxException {
        return Path.of(getClass().getResource("/fixtures/login-screen.json").toURI());
    }
}
