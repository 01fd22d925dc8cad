package org.reportforge.compiler.ir;

/**
 * A direct child of a grid or table body: either a full row or a loose cell.
 */
public sealed interface IrChild permits IrRow, IrCell {
}
