package com.swiftship.core.assembler;

import com.swiftship.core.ast.AccessLevel;
import com.swiftship.core.ast.Declaration;
import com.swiftship.core.ast.Expression;
import com.swiftship.core.ast.FunctionCallExpr;
import com.swiftship.core.ast.ImportDecl;
import com.swiftship.core.ast.PropertyDecl;
import com.swiftship.core.ast.StructDecl;
import com.swiftship.core.ast.SwiftNode;
import com.swiftship.core.config.CodegenConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles the top-level nodes of a generated file: imports, the view struct and, when
 * enabled, a {@code #Preview} block.
 *
 * <p>The struct holds the state properties declared during generation, followed by the
 * computed {@code body} returning the root expression.
 */
public final class SwiftFileAssembler {

    private static final String PREVIEW_MACRO = "#Preview";

    private final CodegenConfig config;

    public SwiftFileAssembler(CodegenConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Builds the ordered top-level node list.
     *
     * @param viewName struct name
     * @param body root view expression
     * @param state state properties, in declaration order
     * @return top-level nodes
     */
    public List<SwiftNode> assemble(String viewName, Expression body, List<PropertyDecl> state) {
        Objects.requireNonNull(viewName, "viewName must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(state, "state must not be null");

        List<SwiftNode> nodes = new ArrayList<>();
        for (String module : config.imports()) {
            nodes.add(new ImportDecl(module));
        }

        List<Declaration> members = new ArrayList<>(state);
        members.add(PropertyDecl.computed("body", "some View", List.of(body)));
        nodes.add(new StructDecl(viewName, List.of("View"), members, AccessLevel.INTERNAL));

        if (config.includePreview()) {
            nodes.add(new FunctionCallExpr(PREVIEW_MACRO, List.of(), List.of(FunctionCallExpr.of(viewName))));
        }
        return nodes;
    }
}
