package org.reportforge.compiler.frontend.irgen.converters;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.frontend.irgen.CellAssembler;
import org.reportforge.compiler.frontend.irgen.ILayoutConverter;
import org.reportforge.compiler.frontend.irgen.IrGenContext;
import org.reportforge.compiler.frontend.irgen.LayoutProperties;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.ir.IrLayout;
import org.reportforge.compiler.ir.IrStack;

/**
 * Converts {@code stack} layouts. Every element becomes its own single-content cell.
 */
public final class StackConverter implements ILayoutConverter {

    @Override
    public IrLayout convert(LayoutNode node, IrGenContext ctx) throws CompilationException {
        return new IrStack(
                LayoutProperties.stack(node.attributes()),
                CellAssembler.wrapAll(node.elements(), ctx));
    }
}
