package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.diagnostics.CompilerLogger;
import org.reportforge.compiler.diagnostics.DiagnosticsEngine;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.ir.IrLayout;

/**
 * Context passed to converters during IR generation.
 * Provides recursion into nested layouts and diagnostics access.
 */
public final class IrGenContext {

    private final String reportName;
    private final DiagnosticsEngine diagnostics;
    private final IrConverterRegistry registry;
    private int depth;

    /**
     * Constructs a new IR generation context.
     * @param reportName The name of the report being compiled.
     * @param diagnostics The diagnostics engine for reporting warnings.
     * @param registry The registry for resolving layout converters.
     */
    public IrGenContext(String reportName, DiagnosticsEngine diagnostics, IrConverterRegistry registry) {
        this.reportName = reportName;
        this.diagnostics = diagnostics;
        this.registry = registry;
    }

    /**
     * Converts a layout, top-level or nested, with the converter registered for its kind.
     * @param node The layout to convert.
     * @return The IR node.
     * @throws CompilationException on the first error anywhere in the layout tree.
     */
    public IrLayout transform(LayoutNode node) throws CompilationException {
        depth++;
        try {
            if (CompilerLogger.isEnabled(CompilerLogger.TRACE)) {
                CompilerLogger.trace("[" + reportName + "] converting " + node.kind().keyword()
                        + " at depth " + depth + " (" + node.source() + ")");
            }
            return registry.resolve(node).convert(node, this);
        } finally {
            depth--;
        }
    }

    /**
     * @return The diagnostics engine.
     */
    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }
}
