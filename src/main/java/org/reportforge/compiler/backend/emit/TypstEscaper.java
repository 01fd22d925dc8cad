package org.reportforge.compiler.backend.emit;

/**
 * Escapes text for Typst markup mode.
 * <p>
 * The backslash is escaped first, so backslashes introduced for later characters
 * are never escaped a second time.
 */
public final class TypstEscaper {

    private static final String SPECIAL = "#$@*_[]{}<>";

    private TypstEscaper() {}

    /**
     * @param text The raw text. Can be null.
     * @return The escaped text, empty for null.
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String escaped = text.replace("\\", "\\\\");
        StringBuilder sb = new StringBuilder(escaped.length() + 8);
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (SPECIAL.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
