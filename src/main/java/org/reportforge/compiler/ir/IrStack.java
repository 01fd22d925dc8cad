package org.reportforge.compiler.ir;

import java.util.List;
import java.util.Map;

/**
 * A directional stack. Its children are always single-content cells created
 * by the transformer, one per declared element.
 *
 * @param properties Direction and spacing.
 * @param children The wrapped elements in order.
 */
public record IrStack(Map<String, IrValue> properties, List<IrCell> children) implements IrLayout {
    public IrStack {
        properties = IrProperties.freeze(properties);
        children = List.copyOf(children);
    }

    @Override
    public LayoutKind kind() {
        return LayoutKind.STACK;
    }
}
