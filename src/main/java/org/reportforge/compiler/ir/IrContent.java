package org.reportforge.compiler.ir;

/**
 * The payload of a cell.
 */
public sealed interface IrContent permits IrLabel, IrField, IrNestedLayout {
}
