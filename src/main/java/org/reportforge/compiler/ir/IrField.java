package org.reportforge.compiler.ir;

import java.util.List;

/**
 * A data-bound value.
 *
 * @param source The key path to resolve, never empty.
 * @param format The format to apply, or null for the raw value.
 * @param decimalPlaces Overrides the format's default precision. Can be null.
 * @param style The style, or null.
 */
public record IrField(List<String> source, FieldFormat format, Integer decimalPlaces, IrStyle style) implements IrContent {
    public IrField {
        source = List.copyOf(source);
    }
}
