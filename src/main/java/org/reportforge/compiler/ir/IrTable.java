package org.reportforge.compiler.ir;

import java.util.List;
import java.util.Map;

/**
 * A table container. Unlike a grid it carries header and footer sections.
 *
 * @param properties Tracks, gutters, alignment, inset, fill and stroke.
 * @param children Explicit rows first, then loose cells, then wrapped bare items.
 * @param headers Header sections in declaration order.
 * @param footers Footer sections in declaration order.
 * @param lines Separator lines, emitted just before the container closes.
 */
public record IrTable(Map<String, IrValue> properties, List<IrChild> children,
                      List<IrHeader> headers, List<IrFooter> footers, List<IrLine> lines) implements IrLayout {
    public IrTable {
        properties = IrProperties.freeze(properties);
        children = List.copyOf(children);
        headers = List.copyOf(headers);
        footers = List.copyOf(footers);
        lines = List.copyOf(lines);
    }

    @Override
    public LayoutKind kind() {
        return LayoutKind.TABLE;
    }
}
