package org.reportforge.compiler.ir;

import java.util.Map;

/**
 * Root of a normalized layout tree. Instances are immutable and compare structurally.
 */
public sealed interface IrLayout permits IrGrid, IrTable, IrStack {

    /**
     * @return The kind of this layout.
     */
    LayoutKind kind();

    /**
     * @return The resolved properties in canonical order, without absent entries.
     */
    Map<String, IrValue> properties();
}
