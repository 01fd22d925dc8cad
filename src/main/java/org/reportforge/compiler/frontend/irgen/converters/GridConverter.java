package org.reportforge.compiler.frontend.irgen.converters;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.frontend.irgen.CellAssembler;
import org.reportforge.compiler.frontend.irgen.ILayoutConverter;
import org.reportforge.compiler.frontend.irgen.IrGenContext;
import org.reportforge.compiler.frontend.irgen.LayoutProperties;
import org.reportforge.compiler.frontend.irgen.LineAssembler;
import org.reportforge.compiler.frontend.irgen.TrackAxis;
import org.reportforge.compiler.frontend.irgen.TrackNormalizer;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.ir.IrGrid;
import org.reportforge.compiler.ir.IrLayout;

import java.util.List;

/**
 * Converts {@code grid} layouts. Grids have no property fallbacks.
 */
public final class GridConverter implements ILayoutConverter {

    @Override
    public IrLayout convert(LayoutNode node, IrGenContext ctx) throws CompilationException {
        List<String> columns = TrackNormalizer.normalize(node.attribute(LayoutProperties.COLUMNS), TrackAxis.COLUMNS, node.source());
        List<String> rows = TrackNormalizer.normalize(node.attribute(LayoutProperties.ROWS), TrackAxis.ROWS, node.source());
        return new IrGrid(
                LayoutProperties.container(node.attributes(), columns, rows, false),
                CellAssembler.children(node, ctx),
                LineAssembler.lines(node.lines()));
    }
}
