package org.reportforge.compiler.ir;

/**
 * @param text The static text, unescaped.
 * @param style The style, or null.
 */
public record IrLabel(String text, IrStyle style) implements IrContent {
}
