package org.reportforge.compiler.frontend.irgen;

/**
 * The axis a track declaration sizes.
 */
public enum TrackAxis {
    COLUMNS("columns"),
    ROWS("rows");

    private final String key;

    TrackAxis(String key) {
        this.key = key;
    }

    /**
     * @return The property name of the declaration.
     */
    public String key() {
        return key;
    }
}
