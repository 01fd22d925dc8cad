package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.frontend.irgen.LayoutProperties;
import org.reportforge.compiler.ir.IrCell;
import org.reportforge.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a cell as {@code [content]}, or as {@code grid.cell(...)[content]} /
 * {@code table.cell(...)[content]} when it has spans or properties.
 */
final class CellEmitter {

    private final ContentEmitter content;

    CellEmitter(ContentEmitter content) {
        this.content = content;
    }

    /**
     * @param cell The cell.
     * @param container The container function name, {@code grid} or {@code table}.
     * @param ctx The emission context.
     * @param level The indentation level of the cell.
     * @return The cell expression, without indentation or trailing comma.
     */
    String render(IrCell cell, String container, EmissionContext ctx, int level) {
        String body = "[" + content.renderAll(cell.content(), ctx, level) + "]";
        List<String> params = parameters(cell);
        if (params.isEmpty()) {
            return body;
        }
        return container + ".cell(" + String.join(", ", params) + ")" + body;
    }

    private static List<String> parameters(IrCell cell) {
        List<String> params = new ArrayList<>();
        if (cell.colspan() > 1) {
            params.add("colspan: " + cell.colspan());
        }
        if (cell.rowspan() > 1) {
            params.add("rowspan: " + cell.rowspan());
        }
        for (Map.Entry<String, IrValue> e : cell.properties().entrySet()) {
            if (LayoutProperties.BREAKABLE.equals(e.getKey())) {
                if (e.getValue() instanceof IrValue.Bool b && !b.value()) {
                    params.add("breakable: false");
                }
                continue;
            }
            params.add(PropertyRenderer.parameter(e.getKey(), e.getValue()));
        }
        return params;
    }
}
