package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.ir.IrLayout;

/**
 * Converts a layout of one specific kind into its IR node.
 * <p>
 * Implementations should be stateless. Nested layouts are converted through
 * {@link IrGenContext#transform(LayoutNode)}.
 */
public interface ILayoutConverter {

    /**
     * Converts the given layout.
     *
     * @param node The layout to convert.
     * @param ctx  The IR generation context used to recurse and access diagnostics.
     * @return The IR node of the layout.
     * @throws CompilationException on the first error anywhere in the layout.
     */
    IrLayout convert(LayoutNode node, IrGenContext ctx) throws CompilationException;
}
