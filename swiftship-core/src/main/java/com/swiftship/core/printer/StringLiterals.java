package com.swiftship.core.printer;

/**
 * Escaping rules for Swift string literals.
 *
 * <p>Single-line literals escape backslash, double quote, newline, carriage return and tab.
 * Multi-line literals keep quotes and newlines as-is and escape only what would otherwise
 * change meaning: backslashes, tabs, carriage returns and any {@code """} run. Remaining
 * control characters use the unicode-scalar escape in both.
 */
public final class StringLiterals {

    private static final String TRIPLE_QUOTE = "\"\"\"";

    private StringLiterals() {
    }

    /**
     * Escapes a value for use between the quotes of a single-line literal.
     *
     * @param value raw value
     * @return escaped text, without surrounding quotes
     */
    public static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> appendPlain(sb, c);
            }
        }
        return sb.toString();
    }

    /**
     * Escapes one line of a multi-line literal. The line must not contain {@code \n}.
     *
     * @param line raw line content
     * @return escaped line
     */
    public static String escapeMultilineLine(String line) {
        StringBuilder sb = new StringBuilder(line.length() + 8);
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"' && line.startsWith(TRIPLE_QUOTE, i)) {
                sb.append("\\\"");
                continue;
            }
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> appendPlain(sb, c);
            }
        }
        return sb.toString();
    }

    private static void appendPlain(StringBuilder sb, char c) {
        if (c < 0x20 || c == 0x7F) {
            sb.append("\\u{").append(Integer.toHexString(c).toUpperCase()).append('}');
        } else {
            sb.append(c);
        }
    }
}
