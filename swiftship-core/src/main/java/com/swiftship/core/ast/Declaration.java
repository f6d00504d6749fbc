package com.swiftship.core.ast;

/**
 * Declaration variants: imports, type declarations, functions and properties.
 */
public interface Declaration extends SwiftNode {
}
