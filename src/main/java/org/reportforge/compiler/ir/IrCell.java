package org.reportforge.compiler.ir;

import java.util.List;
import java.util.Map;

/**
 * @param x Column position.
 * @param y Row position.
 * @param colspan Number of columns covered, at least 1.
 * @param rowspan Number of rows covered, at least 1.
 * @param properties Align, inset, fill, stroke and breakable, when set.
 * @param content The content items in order. May be empty.
 */
public record IrCell(int x, int y, int colspan, int rowspan,
                     Map<String, IrValue> properties, List<IrContent> content) implements IrChild {
    public IrCell {
        properties = IrProperties.freeze(properties);
        content = List.copyOf(content);
    }

    /**
     * @param item The only content of the cell.
     * @return A cell at the origin with unit span and no properties.
     */
    public static IrCell wrapping(IrContent item) {
        return new IrCell(0, 0, 1, 1, Map.of(), List.of(item));
    }
}
