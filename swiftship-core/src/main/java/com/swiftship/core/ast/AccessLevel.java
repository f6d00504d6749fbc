package com.swiftship.core.ast;

/**
 * Swift access-control levels.
 *
 * <p>{@link #INTERNAL} is Swift's implicit level and is never printed.
 */
public enum AccessLevel {
    PRIVATE("private"),
    FILEPRIVATE("fileprivate"),
    INTERNAL("internal"),
    PUBLIC("public"),
    OPEN("open");

    private final String keyword;

    AccessLevel(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the Swift keyword for this level.
     *
     * @return keyword text
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Whether this level appears in printed source.
     *
     * @return false for the implicit {@code internal} level
     */
    public boolean isExplicit() {
        return this != INTERNAL;
    }
}
