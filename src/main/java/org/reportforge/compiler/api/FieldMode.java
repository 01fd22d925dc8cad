package org.reportforge.compiler.api;

/**
 * How data-bound fields are rendered.
 */
public enum FieldMode {
    /** Resolve each field against the supplied data context and emit the formatted value. */
    VALUES,
    /** Emit runtime references ({@code #record.x}) so the markup can be evaluated later with real data. */
    REFERENCES
}
