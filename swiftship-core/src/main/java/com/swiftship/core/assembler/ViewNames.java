package com.swiftship.core.assembler;

import java.util.Locale;

/**
 * Derives Swift type names from file names.
 */
public final class ViewNames {

    /** Name used when nothing usable remains of the file name. */
    public static final String DEFAULT_VIEW_NAME = "ContentView";

    private static final String SWIFT_EXTENSION = ".swift";

    private ViewNames() {
    }

    /**
     * Converts a file name to an upper-camel-case struct name.
     *
     * <p>{@code "login-screen.swift"} becomes {@code LoginScreen}, {@code "3d view"}
     * becomes {@code View3dView}, and a blank name becomes {@value #DEFAULT_VIEW_NAME}.
     *
     * @param fileName file name, with or without {@code .swift}
     * @return struct name
     */
    public static String fromFileName(String fileName) {
        if (fileName == null) {
            return DEFAULT_VIEW_NAME;
        }
        String base = fileName.strip();
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        if (base.toLowerCase(Locale.ROOT).endsWith(SWIFT_EXTENSION)) {
            base = base.substring(0, base.length() - SWIFT_EXTENSION.length());
        }

        StringBuilder sb = new StringBuilder();
        for (String part : base.split("[^A-Za-z0-9]+")) {
            if (!part.isEmpty()) {
                sb.append(Character.toUpperCase(part.charAt(0))).append(part, 1, part.length());
            }
        }
        if (sb.length() == 0) {
            return DEFAULT_VIEW_NAME;
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, "View");
        }
        return sb.toString();
    }
}
