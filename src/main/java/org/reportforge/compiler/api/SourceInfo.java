package org.reportforge.compiler.api;

/**
 * A pure data class representing a position in a layout definition file.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the definition is located.
 * @param lineNumber The line number, or -1 if unknown.
 */
public record SourceInfo(String fileName, int lineNumber) {

    /** Placeholder for nodes built programmatically rather than loaded from a file. */
    public static final SourceInfo UNKNOWN = new SourceInfo("unknown", -1);

    @Override
    public String toString() {
        return lineNumber >= 0 ? fileName + ":" + lineNumber : fileName;
    }
}
