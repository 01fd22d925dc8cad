package org.reportforge.compiler.ir;

import java.util.List;
import java.util.Map;

/**
 * @param index Zero-based position within the parent, assigned during lowering.
 * @param properties Height, fill, stroke, align and inset, when set.
 * @param cells The cells of the row in order.
 */
public record IrRow(int index, Map<String, IrValue> properties, List<IrCell> cells) implements IrChild {
    public IrRow {
        properties = IrProperties.freeze(properties);
        cells = List.copyOf(cells);
    }
}
