package com.swiftship.core.assembler;

import java.util.List;

import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.BoolLiteralExpr;
import com.swiftship.core.ast.FunctionCallExpr;
import com.swiftship.core.ast.ImportDecl;
import com.swiftship.core.ast.PropertyDecl;
import com.swiftship.core.ast.StringLiteralExpr;
import com.swiftship.core.ast.StructDecl;
import com.swiftship.core.ast.SwiftNode;
import com.swiftship.core.ast.ViewBuilderExpr;
import com.swiftship.core.config.CodegenConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SwiftFileAssembler}.
 */
class SwiftFileAssemblerTest {

    private static final ViewBuilderExpr BODY = ViewBuilderExpr.of("Text", Argument.of(new StringLiteralExpr("Hi")));

    @Test
    void assemble_defaultConfig_importsViewAndPreview() {
        List<SwiftNode> nodes = new SwiftFileAssembler(CodegenConfig.defaults()).assemble("Greeting", BODY, List.of());

        assertThat(nodes).hasSize(3);
        assertThat(nodes.get(0)).isEqualTo(new ImportDecl("SwiftUI"));
        StructDecl view = (StructDecl) nodes.get(1);
        assertThat(view.name()).isEqualTo("Greeting");
        assertThat(view.conformances()).containsExactly("View");
        assertThat(view.members()).hasSize(1);
        assertThat(((FunctionCallExpr) nodes.get(2)).name()).isEqualTo("#Preview");
    }

    @Test
    void assemble_stateComesBeforeBody() {
        PropertyDecl isOn = PropertyDecl.state("isOn", "Bool", new BoolLiteralExpr(false));

        StructDecl view = (StructDecl) new SwiftFileAssembler(CodegenConfig.defaults())
            .assemble("Settings", BODY, List.of(isOn)).get(1);

        assertThat(view.members()).hasSize(2);
        assertThat(view.members().get(0)).isEqualTo(isOn);
        assertThat(((PropertyDecl) view.members().get(1)).name()).isEqualTo("body");
    }

    @Test
    void assemble_customImportsWithoutPreview() {
        CodegenConfig config = new CodegenConfig(List.of("SwiftUI", "MapKit"), false, null);

        List<SwiftNode> nodes = new SwiftFileAssembler(config).assemble("Map", BODY, List.of());

        assertThat(nodes).hasSize(3);
        assertThat(nodes.get(1)).isEqualTo(new ImportDecl("MapKit"));
        assertThat(nodes.get(2)).isInstanceOf(StructDecl.class);
    }
}
