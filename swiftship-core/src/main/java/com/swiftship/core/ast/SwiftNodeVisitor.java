package com.swiftship.core.ast;

/**
 * Visitor over the closed {@link SwiftNode} variant set.
 *
 * @param <R> result type of every visit method
 */
public interface SwiftNodeVisitor<R> {

    // --- Declarations ---
    R visitImport(ImportDecl node);

    R visitStruct(StructDecl node);

    R visitClass(ClassDecl node);

    R visitEnum(EnumDecl node);

    R visitFunction(FunctionDecl node);

    R visitProperty(PropertyDecl node);

    // --- Expressions ---
    R visitViewBuilder(ViewBuilderExpr node);

    R visitFunctionCall(FunctionCallExpr node);

    R visitIdentifier(IdentifierExpr node);

    R visitStringLiteral(StringLiteralExpr node);

    R visitIntLiteral(IntLiteralExpr node);

    R visitFloatLiteral(FloatLiteralExpr node);

    R visitBoolLiteral(BoolLiteralExpr node);

    R visitArrayLiteral(ArrayLiteralExpr node);

    R visitClosure(ClosureExpr node);

    R visitMemberAccess(MemberAccessExpr node);

    R visitRange(RangeExpr node);

    R visitIf(IfExpr node);

    R visitForEach(ForEachExpr node);

    R visitComment(CommentExpr node);
}
