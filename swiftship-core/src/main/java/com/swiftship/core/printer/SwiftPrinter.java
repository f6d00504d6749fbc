package com.swiftship.core.printer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.swiftship.core.ast.AccessLevel;
import com.swiftship.core.ast.Argument;
import com.swiftship.core.ast.ArrayLiteralExpr;
import com.swiftship.core.ast.BoolLiteralExpr;
import com.swiftship.core.ast.ClassDecl;
import com.swiftship.core.ast.ClosureExpr;
import com.swiftship.core.ast.CommentExpr;
import com.swiftship.core.ast.Declaration;
import com.swiftship.core.ast.EnumDecl;
import com.swiftship.core.ast.FloatLiteralExpr;
import com.swiftship.core.ast.ForEachExpr;
import com.swiftship.core.ast.FunctionCallExpr;
import com.swiftship.core.ast.FunctionDecl;
import com.swiftship.core.ast.IdentifierExpr;
import com.swiftship.core.ast.IfExpr;
import com.swiftship.core.ast.ImportDecl;
import com.swiftship.core.ast.IntLiteralExpr;
import com.swiftship.core.ast.MemberAccessExpr;
import com.swiftship.core.ast.ModifierCall;
import com.swiftship.core.ast.Parameter;
import com.swiftship.core.ast.PropertyDecl;
import com.swiftship.core.ast.PropertyWrapper;
import com.swiftship.core.ast.RangeExpr;
import com.swiftship.core.ast.StringLiteralExpr;
import com.swiftship.core.ast.StructDecl;
import com.swiftship.core.ast.SwiftNode;
import com.swiftship.core.ast.SwiftNodeVisitor;
import com.swiftship.core.ast.ViewBuilderExpr;

/**
 * Renders Swift AST nodes to formatted source text.
 *
 * <p>Formatting is fixed: four spaces per indentation level, one modifier per line at the
 * same indentation as the expression it modifies, labeled arguments as {@code label: value},
 * and a new indented block for every trailing closure, declaration body and control-flow
 * body. The printer never reorders or drops nodes.
 *
 * <p>The printer itself holds no state. Every call to {@link #print(List)} or
 * {@link #printNode(SwiftNode)} creates a fresh session that owns the indentation depth, so a
 * single instance can be shared across threads.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SwiftPrinter printer = new SwiftPrinter();
 * String source = printer.print(List.of(
 *     new ImportDecl("SwiftUI"),
 *     structDecl));
 * }</pre>
 */
public class SwiftPrinter {

    private static final String INDENT = "    ";
    private static final String NEWLINE = "\n";
    private static final String TRIPLE_QUOTE = "\"\"\"";

    /**
     * Prints top-level declarations as a complete source file.
     *
     * <p>Consecutive imports are separated by a single newline, everything else by a blank
     * line. The result ends with a newline.
     *
     * @param nodes top-level nodes, in order
     * @return formatted source text
     */
    public String print(List<? extends SwiftNode> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");

        Session session = new Session();
        StringBuilder sb = new StringBuilder();
        SwiftNode previous = null;
        for (SwiftNode node : nodes) {
            if (previous != null) {
                boolean importRun = previous instanceof ImportDecl && node instanceof ImportDecl;
                sb.append(importRun ? NEWLINE : NEWLINE + NEWLINE);
            }
            sb.append(session.print(node));
            previous = node;
        }
        if (!nodes.isEmpty()) {
            sb.append(NEWLINE);
        }
        return sb.toString();
    }

    /**
     * Prints a single node at indentation level zero, without a trailing newline.
     *
     * @param node the node
     * @return formatted text
     */
    public String printNode(SwiftNode node) {
        Objects.requireNonNull(node, "node must not be null");
        return new Session().print(node);
    }

    /**
     * One printing pass. The first line of every returned fragment carries no indentation
     * (the caller positions it); continuation lines carry absolute indentation.
     */
    private static final class Session implements SwiftNodeVisitor<String> {

        private int depth;

        String print(SwiftNode node) {
            return node.accept(this);
        }

        // ==================== Declarations ====================

        @Override
        public String visitImport(ImportDecl node) {
            return "import " + node.module();
        }

        @Override
        public String visitStruct(StructDecl node) {
            StringBuilder sb = new StringBuilder();
            appendAccess(sb, node.accessLevel());
            sb.append("struct ").append(node.name());
            appendConformances(sb, node.conformances());
            sb.append(' ');
            appendMembers(sb, node.members());
            return sb.toString();
        }

        @Override
        public String visitClass(ClassDecl node) {
            StringBuilder sb = new StringBuilder();
            appendAccess(sb, node.accessLevel());
            sb.append("class ").append(node.name());
            List<String> inherited = new ArrayList<>();
            if (node.superclass() != null) {
                inherited.add(node.superclass());
            }
            inherited.addAll(node.conformances());
            appendConformances(sb, inherited);
            sb.append(' ');
            appendMembers(sb, node.members());
            return sb.toString();
        }

        @Override
        public String visitEnum(EnumDecl node) {
            StringBuilder sb = new StringBuilder();
            appendAccess(sb, node.accessLevel());
            sb.append("enum ").append(node.name());
            appendConformances(sb, node.conformances());
            sb.append(" {").append(NEWLINE);
            depth++;
            for (EnumDecl.Case c : node.cases()) {
                sb.append(indent()).append("case ").append(c.name());
                if (c.rawValue() != null) {
                    sb.append(" = ").append(print(new StringLiteralExpr(c.rawValue())));
                }
                sb.append(NEWLINE);
            }
            depth--;
            sb.append(indent()).append('}');
            return sb.toString();
        }

        @Override
        public String visitFunction(FunctionDecl node) {
            StringBuilder sb = new StringBuilder();
            for (String attribute : node.attributes()) {
                sb.append('@').append(attribute).append(NEWLINE).append(indent());
            }
            appendAccess(sb, node.accessLevel());
            sb.append("func ").append(node.name()).append('(');
            sb.append(node.parameters().stream().map(this::printParameter).collect(Collectors.joining(", ")));
            sb.append(')');
            if (node.isAsync()) {
                sb.append(" async");
            }
            if (node.throwing()) {
                sb.append(" throws");
            }
            if (node.returnType() != null) {
                sb.append(" -> ").append(node.returnType());
            }
            sb.append(' ');
            appendBlock(sb, node.body());
            return sb.toString();
        }

        @Override
        public String visitProperty(PropertyDecl node) {
            StringBuilder sb = new StringBuilder();
            if (node.wrapper() != null) {
                appendWrapper(sb, node.wrapper());
                sb.append(' ');
            }
            appendAccess(sb, node.accessLevel());
            sb.append("var ").append(node.name()).append(": ").append(node.type());
            if (node.isComputed()) {
                sb.append(' ');
                appendBlock(sb, node.getter());
            } else if (node.defaultValue() != null) {
                sb.append(" = ").append(print(node.defaultValue()));
            }
            return sb.toString();
        }

        // ==================== Expressions ====================

        @Override
        public String visitViewBuilder(ViewBuilderExpr node) {
            StringBuilder sb = new StringBuilder(node.viewName());
            if (!node.isReference()) {
                appendCall(sb, node.arguments(), node.trailingClosure());
            }
            for (ModifierCall modifier : node.modifiers()) {
                sb.append(NEWLINE).append(indent()).append('.').append(modifier.name());
                appendCall(sb, modifier.arguments(), modifier.trailingClosure());
            }
            return sb.toString();
        }

        @Override
        public String visitFunctionCall(FunctionCallExpr node) {
            StringBuilder sb = new StringBuilder(node.name());
            appendCall(sb, node.arguments(), node.trailingClosure());
            return sb.toString();
        }

        @Override
        public String visitIdentifier(IdentifierExpr node) {
            return node.name();
        }

        @Override
        public String visitStringLiteral(StringLiteralExpr node) {
            if (!node.isMultiline()) {
                return '"' + StringLiterals.escape(node.value()) + '"';
            }
            // Swift strips the closing delimiter's indentation from every content line.
            StringBuilder sb = new StringBuilder(TRIPLE_QUOTE).append(NEWLINE);
            for (String line : node.value().split("\n", -1)) {
                if (!line.isEmpty()) {
                    sb.append(indent()).append(StringLiterals.escapeMultilineLine(line));
                }
                sb.append(NEWLINE);
            }
            sb.append(indent()).append(TRIPLE_QUOTE);
            return sb.toString();
        }

        @Override
        public String visitIntLiteral(IntLiteralExpr node) {
            return Long.toString(node.value());
        }

        @Override
        public String visitFloatLiteral(FloatLiteralExpr node) {
            String text = BigDecimal.valueOf(node.value()).stripTrailingZeros().toPlainString();
            return text.indexOf('.') >= 0 ? text : text + ".0";
        }

        @Override
        public String visitBoolLiteral(BoolLiteralExpr node) {
            return node.value() ? "true" : "false";
        }

        @Override
        public String visitArrayLiteral(ArrayLiteralExpr node) {
            return node.elements().stream()
                .map(this::print)
                .collect(Collectors.joining(", ", "[", "]"));
        }

        @Override
        public String visitClosure(ClosureExpr node) {
            if (node.parameters().isEmpty() && node.body().isEmpty()) {
                return "{}";
            }
            StringBuilder sb = new StringBuilder("{");
            if (!node.parameters().isEmpty()) {
                sb.append(' ').append(String.join(", ", node.parameters())).append(" in");
            }
            if (node.body().size() == 1 && !(node.body().get(0) instanceof CommentExpr)) {
                String single = print(node.body().get(0));
                if (single.indexOf('\n') < 0) {
                    return sb.append(' ').append(single).append(" }").toString();
                }
            }
            appendBlockBody(sb, node.body());
            return sb.toString();
        }

        @Override
        public String visitMemberAccess(MemberAccessExpr node) {
            if (node.base() == null) {
                return "." + node.member();
            }
            return print(node.base()) + "." + node.member();
        }

        @Override
        public String visitRange(RangeExpr node) {
            return print(node.lower()) + "..." + print(node.upper());
        }

        @Override
        public String visitIf(IfExpr node) {
            StringBuilder sb = new StringBuilder("if ").append(print(node.condition())).append(' ');
            appendBlock(sb, node.then());
            if (!node.otherwise().isEmpty()) {
                sb.append(" else ");
                appendBlock(sb, node.otherwise());
            }
            return sb.toString();
        }

        @Override
        public String visitForEach(ForEachExpr node) {
            StringBuilder sb = new StringBuilder("ForEach(")
                .append(print(node.collection()))
                .append(") { ")
                .append(node.itemName())
                .append(" in");
            appendBlockBody(sb, node.body());
            return sb.toString();
        }

        @Override
        public String visitComment(CommentExpr node) {
            String comment = node.text().isEmpty() ? "//" : "// " + node.text();
            if (node.subject() == null) {
                return comment;
            }
            return comment + NEWLINE + indent() + print(node.subject());
        }

        // ==================== Helpers ====================

        /**
         * Appends {@code (args)} and/or a trailing block. Parentheses are omitted only when
         * there are no arguments and a trailing closure follows.
         */
        private void appendCall(StringBuilder sb, List<Argument> arguments, List<? extends SwiftNode> trailing) {
            if (!arguments.isEmpty() || trailing.isEmpty()) {
                sb.append('(').append(printArguments(arguments)).append(')');
            }
            if (!trailing.isEmpty()) {
                sb.append(' ');
                appendBlock(sb, trailing);
            }
        }

        private String printArguments(List<Argument> arguments) {
            return arguments.stream()
                .map(arg -> arg.label() == null
                    ? print(arg.value())
                    : arg.label() + ": " + print(arg.value()))
                .collect(Collectors.joining(", "));
        }

        private String printParameter(Parameter parameter) {
            StringBuilder sb = new StringBuilder();
            if (parameter.label() != null) {
                sb.append(parameter.label()).append(' ');
            }
            sb.append(parameter.name()).append(": ").append(parameter.type());
            if (parameter.defaultValue() != null) {
                sb.append(" = ").append(print(parameter.defaultValue()));
            }
            return sb.toString();
        }

        /** Appends {@code { <body> }} with the body one level deeper. */
        private void appendBlock(StringBuilder sb, List<? extends SwiftNode> body) {
            sb.append('{');
            appendBlockBody(sb, body);
        }

        /** Appends the body lines and closing brace of a block whose opening line is already written. */
        private void appendBlockBody(StringBuilder sb, List<? extends SwiftNode> body) {
            sb.append(NEWLINE);
            depth++;
            for (SwiftNode statement : body) {
                sb.append(indent()).append(print(statement)).append(NEWLINE);
            }
            depth--;
            sb.append(indent()).append('}');
        }

        /**
         * Appends a declaration body. Members are separated by a blank line, except runs of
         * stored properties, which stay together.
         */
        private void appendMembers(StringBuilder sb, List<Declaration> members) {
            if (members.isEmpty()) {
                sb.append("{}");
                return;
            }
            sb.append('{').append(NEWLINE);
            depth++;
            for (int i = 0; i < members.size(); i++) {
                if (i > 0 && !(isStored(members.get(i - 1)) && isStored(members.get(i)))) {
                    sb.append(NEWLINE);
                }
                sb.append(indent()).append(print(members.get(i))).append(NEWLINE);
            }
            depth--;
            sb.append(indent()).append('}');
        }

        private static boolean isStored(Declaration declaration) {
            return declaration instanceof PropertyDecl property && !property.isComputed();
        }

        private void appendWrapper(StringBuilder sb, PropertyWrapper wrapper) {
            sb.append('@').append(wrapper.name());
            if (!wrapper.arguments().isEmpty()) {
                sb.append('(').append(printArguments(wrapper.arguments())).append(')');
            }
        }

        private static void appendAccess(StringBuilder sb, AccessLevel level) {
            if (level.isExplicit()) {
                sb.append(level.keyword()).append(' ');
            }
        }

        private static void appendConformances(StringBuilder sb, List<String> conformances) {
            if (!conformances.isEmpty()) {
                sb.append(": ").append(String.join(", ", conformances));
            }
        }

        private String indent() {
            return INDENT.repeat(depth);
        }
    }
}
