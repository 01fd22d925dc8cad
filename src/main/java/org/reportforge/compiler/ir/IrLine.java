package org.reportforge.compiler.ir;

/**
 * A separator line drawn over a grid or table.
 *
 * @param orientation Horizontal lines sit between rows, vertical ones between columns.
 * @param position The row ({@code y}) or column ({@code x}) boundary.
 * @param start First track the line covers. Can be null.
 * @param end Track the line stops before. Can be null.
 * @param stroke The stroke, or null for the container default.
 */
public record IrLine(Orientation orientation, int position, Integer start, Integer end, IrValue stroke) {

    public enum Orientation {
        HORIZONTAL,
        VERTICAL
    }
}
