package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.frontend.parser.ast.CellNode;
import org.reportforge.compiler.frontend.parser.ast.ItemNode;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.frontend.parser.ast.RowNode;
import org.reportforge.compiler.ir.IrCell;
import org.reportforge.compiler.ir.IrChild;
import org.reportforge.compiler.ir.IrRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles rows and cells, delegating content to the {@link ContentLowerer}.
 */
public final class CellAssembler {

    private CellAssembler() {}

    /**
     * Assembles the body of a grid or table. The order is significant: explicit rows
     * in declaration order, then loose cells, then bare items each wrapped in a cell.
     *
     * @param node The grid or table.
     * @param ctx The generation context.
     * @return The children in render order.
     * @throws CompilationException on the first child that fails.
     */
    public static List<IrChild> children(LayoutNode node, IrGenContext ctx) throws CompilationException {
        List<IrChild> children = new ArrayList<>();
        List<RowNode> rows = node.body();
        for (int i = 0; i < rows.size(); i++) {
            children.add(row(rows.get(i), i, ctx));
        }
        for (CellNode cell : node.cells()) {
            children.add(cell(cell, ctx));
        }
        children.addAll(wrapAll(node.elements(), ctx));
        return children;
    }

    /**
     * @param row The declared row.
     * @param index The position of the row within its parent.
     * @param ctx The generation context.
     * @return The assembled row.
     * @throws CompilationException on the first cell that fails.
     */
    public static IrRow row(RowNode row, int index, IrGenContext ctx) throws CompilationException {
        List<IrCell> cells = new ArrayList<>(row.cells().size());
        for (CellNode cell : row.cells()) {
            cells.add(cell(cell, ctx));
        }
        return new IrRow(index, LayoutProperties.row(row.attributes()), cells);
    }

    /**
     * Assembles a cell. Undeclared positions default to (0, 0) and undeclared spans to 1.
     *
     * @param cell The declared cell.
     * @param ctx The generation context.
     * @return The assembled cell.
     * @throws CompilationException if position or span are out of range, or content fails.
     */
    public static IrCell cell(CellNode cell, IrGenContext ctx) throws CompilationException {
        int x = orDefault(cell.x(), 0, 0, "x", cell);
        int y = orDefault(cell.y(), 0, 0, "y", cell);
        int colspan = orDefault(cell.colspan(), 1, 1, "colspan", cell);
        int rowspan = orDefault(cell.rowspan(), 1, 1, "rowspan", cell);
        return new IrCell(x, y, colspan, rowspan,
                LayoutProperties.cell(cell.attributes()),
                ContentLowerer.lowerAll(cell.content(), ctx));
    }

    /**
     * @param item A bare content item.
     * @param ctx The generation context.
     * @return A single-content cell at the origin.
     * @throws CompilationException if the item cannot be lowered.
     */
    public static IrCell wrap(ItemNode item, IrGenContext ctx) throws CompilationException {
        return IrCell.wrapping(ContentLowerer.lower(item, ctx));
    }

    /**
     * @param items Bare content items.
     * @param ctx The generation context.
     * @return One single-content cell per item.
     * @throws CompilationException on the first item that cannot be lowered.
     */
    public static List<IrCell> wrapAll(List<ItemNode> items, IrGenContext ctx) throws CompilationException {
        List<IrCell> cells = new ArrayList<>(items.size());
        for (ItemNode item : items) {
            cells.add(wrap(item, ctx));
        }
        return cells;
    }

    private static int orDefault(Integer declared, int fallback, int minimum, String key, CellNode cell)
            throws CompilationException {
        if (declared == null) {
            return fallback;
        }
        if (declared < minimum) {
            throw new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION,
                    "Cell " + key + " must be at least " + minimum, declared, cell.source());
        }
        return declared;
    }
}
