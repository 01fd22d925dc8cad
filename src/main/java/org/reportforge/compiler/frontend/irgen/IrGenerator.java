package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.diagnostics.CompilerLogger;
import org.reportforge.compiler.diagnostics.DiagnosticsEngine;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.frontend.parser.ast.ReportNode;
import org.reportforge.compiler.ir.IrLayout;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase: Generates IR from the authoring AST by delegating each layout to the
 * converter resolved via the {@link IrConverterRegistry}.
 */
public final class IrGenerator {

    private final DiagnosticsEngine diagnostics;
    private final IrConverterRegistry registry;

    /**
     * Creates a new IR generator with a diagnostics engine and a prepared registry.
     *
     * @param diagnostics The diagnostics engine for reporting issues.
     * @param registry    The converter registry.
     */
    public IrGenerator(DiagnosticsEngine diagnostics, IrConverterRegistry registry) {
        this.diagnostics = diagnostics;
        this.registry = registry;
    }

    /**
     * Generates one IR tree per layout of the report, in declaration order.
     *
     * @param report The report AST.
     * @return The IR trees.
     * @throws CompilationException on the first error in any layout.
     */
    public List<IrLayout> generate(ReportNode report) throws CompilationException {
        IrGenContext ctx = new IrGenContext(report.name(), diagnostics, registry);
        List<IrLayout> layouts = new ArrayList<>(report.layouts().size());
        for (LayoutNode node : report.layouts()) {
            layouts.add(ctx.transform(node));
        }
        CompilerLogger.debug("[" + report.name() + "] generated IR for " + layouts.size() + " layout(s)");
        return layouts;
    }

    /**
     * Generates the IR tree of a single layout.
     *
     * @param layout The layout AST.
     * @param reportName The report name used in log messages.
     * @return The IR tree.
     * @throws CompilationException on the first error anywhere in the layout tree.
     */
    public IrLayout generate(LayoutNode layout, String reportName) throws CompilationException {
        return new IrGenContext(reportName, diagnostics, registry).transform(layout);
    }
}
