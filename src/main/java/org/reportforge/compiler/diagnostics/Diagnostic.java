package org.reportforge.compiler.diagnostics;

import org.reportforge.compiler.api.SourceInfo;

/**
 * Represents a single non-fatal diagnostic warning
 * raised while loading or transforming a layout definition.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param source Where the issue occurred.
 */
public record Diagnostic(
        Type type,
        String message,
        SourceInfo source
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A definition that is accepted but probably not what the author meant. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, source, message);
    }
}
