package org.reportforge.compiler.ir;

import java.util.List;

/**
 * A table footer section.
 *
 * @param repeat Whether the footer repeats on every page.
 * @param rows The rows of the footer.
 */
public record IrFooter(boolean repeat, List<IrRow> rows) {
    public IrFooter {
        rows = List.copyOf(rows);
    }
}
