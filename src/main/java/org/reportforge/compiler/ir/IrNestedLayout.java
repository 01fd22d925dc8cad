package org.reportforge.compiler.ir;

/**
 * A layout embedded as the content of a cell.
 *
 * @param layout The embedded layout.
 */
public record IrNestedLayout(IrLayout layout) implements IrContent {
}
