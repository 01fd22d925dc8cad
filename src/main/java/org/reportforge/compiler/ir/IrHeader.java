package org.reportforge.compiler.ir;

import java.util.List;

/**
 * A table header section.
 *
 * @param repeat Whether the header repeats on every page.
 * @param level The header nesting level, starting at 1.
 * @param rows The rows of the header.
 */
public record IrHeader(boolean repeat, int level, List<IrRow> rows) {
    public IrHeader {
        rows = List.copyOf(rows);
    }
}
