package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.frontend.irgen.converters.GridConverter;
import org.reportforge.compiler.frontend.irgen.converters.StackConverter;
import org.reportforge.compiler.frontend.irgen.converters.TableConverter;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.ir.LayoutKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry mapping layout kinds to converter instances.
 */
public final class IrConverterRegistry {

    private final Map<LayoutKind, ILayoutConverter> byKind = new EnumMap<>(LayoutKind.class);

    private IrConverterRegistry() {}

    /**
     * Registers a converter for the given layout kind, replacing any previous one.
     *
     * @param kind      The layout kind.
     * @param converter The converter handling that kind.
     */
    public void register(LayoutKind kind, ILayoutConverter converter) {
        byKind.put(kind, converter);
    }

    /**
     * Resolves the converter for a layout.
     *
     * @param node The layout to convert.
     * @return A non-null converter.
     * @throws CompilationException if no converter is registered for the layout's kind.
     */
    public ILayoutConverter resolve(LayoutNode node) throws CompilationException {
        ILayoutConverter converter = byKind.get(node.kind());
        if (converter == null) {
            throw new CompilationException(CompilerErrorCode.UNSUPPORTED_LAYOUT_TYPE,
                    "No converter registered for layout type '" + node.kind().keyword() + "'",
                    node.kind(), node.source());
        }
        return converter;
    }

    /**
     * @return An empty registry.
     */
    public static IrConverterRegistry initialize() {
        return new IrConverterRegistry();
    }

    /**
     * @return A registry pre-populated with the grid, table and stack converters.
     */
    public static IrConverterRegistry initializeWithDefaults() {
        IrConverterRegistry reg = initialize();
        reg.register(LayoutKind.GRID, new GridConverter());
        reg.register(LayoutKind.TABLE, new TableConverter());
        reg.register(LayoutKind.STACK, new StackConverter());
        return reg;
    }
}
