package org.reportforge.compiler.ir;

/**
 * Text styling of a label or field. Every attribute is optional.
 *
 * @param fontSize A length string or a number of points.
 * @param fontWeight A weight keyword or a numeric weight.
 * @param fontStyle {@code normal}, {@code italic} or {@code oblique}.
 * @param color A color keyword or a {@code #RRGGBB} string.
 * @param fontFamily The font family name.
 * @param textAlign An alignment keyword or a pair.
 */
public record IrStyle(IrValue fontSize, IrValue fontWeight, String fontStyle,
                      String color, String fontFamily, IrValue textAlign) {

    /**
     * @return Whether no attribute is set. Such a style renders exactly like no style.
     */
    public boolean isEmpty() {
        return fontSize == null && fontWeight == null && fontStyle == null
                && color == null && fontFamily == null && textAlign == null;
    }
}
