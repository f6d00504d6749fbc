package com.swiftship.core.catalog;

/**
 * Catalog grouping of component kinds.
 */
public enum ComponentCategory {
    /** Leaf content: text, images, buttons, spacing */
    PRIMITIVES,

    /** Containers that arrange their children */
    LAYOUT,

    /** Controls that edit a value */
    INPUT,

    /** Navigation containers and modal presentations */
    NAVIGATION
}
