package org.reportforge.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the translated error messages.
 */
public enum CompilerErrorCode {
    // region Layout Transformation Errors
    /** A column or row track declaration is neither a count, {@code auto} nor a list of sizes. */
    INVALID_TRACK_DEFINITION("invalid_track_definition"),
    /** A content item is neither a label, a field nor a nested layout. */
    UNKNOWN_ELEMENT_TYPE("unknown_element_type"),
    // endregion

    // region Loader Errors
    /** A layout declares no type or a type other than grid, table or stack. */
    UNSUPPORTED_LAYOUT_TYPE("unsupported_layout_type"),
    /** A layout definition has a structurally wrong value, e.g. a number where a list is expected. */
    INVALID_LAYOUT_DEFINITION("invalid_layout_definition"),
    // endregion

    // region General Errors
    /** An I/O error occurred while reading a file. */
    IO_ERROR_READING_FILE("io_error_reading_file");
    // endregion

    private final String tag;

    CompilerErrorCode(String tag) {
        this.tag = tag;
    }

    /**
     * @return The stable snake_case tag of this error, as used in messages and logs.
     */
    public String tag() {
        return tag;
    }
}
