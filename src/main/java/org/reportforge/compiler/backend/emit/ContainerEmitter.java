package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.frontend.irgen.LayoutProperties;
import org.reportforge.compiler.ir.IrCell;
import org.reportforge.compiler.ir.IrChild;
import org.reportforge.compiler.ir.IrFooter;
import org.reportforge.compiler.ir.IrGrid;
import org.reportforge.compiler.ir.IrHeader;
import org.reportforge.compiler.ir.IrLayout;
import org.reportforge.compiler.ir.IrLine;
import org.reportforge.compiler.ir.IrRow;
import org.reportforge.compiler.ir.IrStack;
import org.reportforge.compiler.ir.IrTable;
import org.reportforge.compiler.ir.IrValue;

import java.util.List;
import java.util.Map;

/**
 * Renders grid, table and stack containers.
 * <p>
 * A container opens at its own level, puts every parameter and child one level deeper,
 * each followed by a comma, and closes at its own level. Rows are flattened into their
 * cells. Separator lines come last, right before the closing parenthesis.
 */
final class ContainerEmitter {

    private final CellEmitter cells;

    ContainerEmitter() {
        this.cells = new CellEmitter(new ContentEmitter(this));
    }

    String render(IrLayout layout, EmissionContext ctx, int level) {
        String name = layout.kind().keyword();
        StringBuilder sb = new StringBuilder();
        sb.append(EmissionContext.indent(level)).append('#').append(name).append("(\n");
        parameters(sb, layout.properties(), level + 1);
        if (layout instanceof IrGrid grid) {
            children(sb, grid.children(), name, ctx, level + 1);
            lines(sb, grid.lines(), name, level + 1);
        } else if (layout instanceof IrTable table) {
            for (IrHeader header : table.headers()) {
                header(sb, header, name, ctx, level + 1);
            }
            children(sb, table.children(), name, ctx, level + 1);
            for (IrFooter footer : table.footers()) {
                footer(sb, footer, name, ctx, level + 1);
            }
            lines(sb, table.lines(), name, level + 1);
        } else if (layout instanceof IrStack stack) {
            for (IrCell cell : stack.children()) {
                item(sb, cells.render(cell, name, ctx, level + 1), level + 1);
            }
        }
        sb.append(EmissionContext.indent(level)).append(')');
        return sb.toString();
    }

    private void parameters(StringBuilder sb, Map<String, IrValue> properties, int level) {
        for (Map.Entry<String, IrValue> e : properties.entrySet()) {
            boolean track = LayoutProperties.COLUMNS.equals(e.getKey()) || LayoutProperties.ROWS.equals(e.getKey());
            if (track && e.getValue() instanceof IrValue.ListVal list && list.elements().isEmpty()) {
                continue;
            }
            item(sb, PropertyRenderer.parameter(e.getKey(), e.getValue()), level);
        }
    }

    private void children(StringBuilder sb, List<IrChild> children, String name, EmissionContext ctx, int level) {
        for (IrChild child : children) {
            if (child instanceof IrRow row) {
                rowCells(sb, row, name, ctx, level);
            } else if (child instanceof IrCell cell) {
                item(sb, cells.render(cell, name, ctx, level), level);
            }
        }
    }

    private void rowCells(StringBuilder sb, IrRow row, String name, EmissionContext ctx, int level) {
        for (IrCell cell : row.cells()) {
            item(sb, cells.render(cell, name, ctx, level), level);
        }
    }

    private void header(StringBuilder sb, IrHeader header, String name, EmissionContext ctx, int level) {
        sb.append(EmissionContext.indent(level)).append(name).append(".header(\n");
        item(sb, "repeat: " + header.repeat(), level + 1);
        if (header.level() > 1) {
            item(sb, "level: " + header.level(), level + 1);
        }
        for (IrRow row : header.rows()) {
            rowCells(sb, row, name, ctx, level + 1);
        }
        sb.append(EmissionContext.indent(level)).append("),\n");
    }

    private void footer(StringBuilder sb, IrFooter footer, String name, EmissionContext ctx, int level) {
        sb.append(EmissionContext.indent(level)).append(name).append(".footer(\n");
        item(sb, "repeat: " + footer.repeat(), level + 1);
        for (IrRow row : footer.rows()) {
            rowCells(sb, row, name, ctx, level + 1);
        }
        sb.append(EmissionContext.indent(level)).append("),\n");
    }

    private void lines(StringBuilder sb, List<IrLine> lines, String name, int level) {
        for (IrLine line : lines) {
            item(sb, LineEmitter.render(line, name), level);
        }
    }

    private static void item(StringBuilder sb, String text, int level) {
        sb.append(EmissionContext.indent(level)).append(text).append(",\n");
    }
}
