package com.swiftship.core.ast;

/**
 * Expression variants: view-builder calls, plain calls, identifiers, literals, closures,
 * member access, control flow and line comments.
 */
public interface Expression extends SwiftNode {
}
