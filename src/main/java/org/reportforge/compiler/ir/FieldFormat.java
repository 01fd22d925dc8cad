package org.reportforge.compiler.ir;

import java.util.Locale;
import java.util.Optional;

/**
 * Formatting applied to the resolved value of a data-bound field.
 */
public enum FieldFormat {
    /** Fixed-precision decimal, 0 places unless specified. */
    NUMBER(0),
    /** Dollar-prefixed fixed-precision decimal, 2 places unless specified. */
    CURRENCY(2),
    /**
     * Trailing percent sign, 1 place unless specified. Resolved values are scaled by 100;
     * references expect the record to hold the percentage already.
     */
    PERCENT(1),
    /** ISO calendar date. */
    DATE(0),
    /** ISO date and wall-clock time. */
    DATETIME(0);

    private final int defaultDecimalPlaces;

    FieldFormat(int defaultDecimalPlaces) {
        this.defaultDecimalPlaces = defaultDecimalPlaces;
    }

    public int defaultDecimalPlaces() {
        return defaultDecimalPlaces;
    }

    /**
     * @param keyword The declared format, case-insensitive. Can be null.
     * @return The matching format, if any.
     */
    public static Optional<FieldFormat> fromKeyword(String keyword) {
        if (keyword == null) return Optional.empty();
        try {
            return Optional.of(valueOf(keyword.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
