package org.reportforge.compiler.ir;

import java.util.List;
import java.util.Map;

/**
 * A grid container.
 *
 * @param properties Tracks, gutters, alignment, inset, fill and stroke.
 * @param children Explicit rows first, then loose cells, then wrapped bare items.
 * @param lines Separator lines, emitted just before the container closes.
 */
public record IrGrid(Map<String, IrValue> properties, List<IrChild> children, List<IrLine> lines) implements IrLayout {
    public IrGrid {
        properties = IrProperties.freeze(properties);
        children = List.copyOf(children);
        lines = List.copyOf(lines);
    }

    @Override
    public LayoutKind kind() {
        return LayoutKind.GRID;
    }
}
