package org.reportforge.compiler.ir;

import java.util.Locale;
import java.util.Optional;

/**
 * The three layout kinds a definition can declare.
 */
public enum LayoutKind {
    GRID,
    TABLE,
    STACK;

    /**
     * @return The name used in definitions and in the generated markup.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param keyword A declared {@code type}, case-insensitive. Can be null.
     * @return The matching kind, if any.
     */
    public static Optional<LayoutKind> fromKeyword(String keyword) {
        if (keyword == null) return Optional.empty();
        for (LayoutKind kind : values()) {
            if (kind.keyword().equalsIgnoreCase(keyword.trim())) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
