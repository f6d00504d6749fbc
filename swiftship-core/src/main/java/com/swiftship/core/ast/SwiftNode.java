package com.swiftship.core.ast;

/**
 * Root of the Swift abstract syntax tree produced by the generators.
 *
 * <p>The variant set is closed: every node is either a {@link Declaration} or an
 * {@link Expression}, every concrete variant is an immutable record in this package, and
 * each one dispatches to its own {@link SwiftNodeVisitor} method. Nodes own their
 * children exclusively and compare structurally, so two independently built trees with the
 * same content are {@code equals}.
 *
 * <p>Each variant can be printed from its own fields plus the printer's indentation depth.
 * Traversal goes through {@link SwiftNodeVisitor}, which forces every consumer to handle
 * every variant at compile time.
 *
 * @see com.swiftship.core.printer.SwiftPrinter
 */
public interface SwiftNode {

    /**
     * Dispatches to the visitor method for this variant.
     *
     * @param visitor the visitor
     * @param <R> visitor result type
     * @return the visitor's result
     */
    <R> R accept(SwiftNodeVisitor<R> visitor);
}
