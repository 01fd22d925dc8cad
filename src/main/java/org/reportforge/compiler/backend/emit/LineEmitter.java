package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.ir.IrLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders separator lines as {@code grid.hline(...)}, {@code table.vline(...)} and so on.
 */
final class LineEmitter {

    private LineEmitter() {}

    static String render(IrLine line, String container) {
        boolean horizontal = line.orientation() == IrLine.Orientation.HORIZONTAL;
        List<String> params = new ArrayList<>(4);
        params.add((horizontal ? "y: " : "x: ") + line.position());
        if (line.start() != null) {
            params.add("start: " + line.start());
        }
        if (line.end() != null) {
            params.add("end: " + line.end());
        }
        if (line.stroke() != null) {
            params.add("stroke: " + PropertyRenderer.length(line.stroke()));
        }
        return container + (horizontal ? ".hline(" : ".vline(") + String.join(", ", params) + ")";
    }
}
