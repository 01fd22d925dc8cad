package org.reportforge.compiler;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.DocumentOptions;
import org.reportforge.compiler.api.ILayoutCompiler;
import org.reportforge.compiler.api.RenderOptions;
import org.reportforge.compiler.backend.emit.TypstEmitter;
import org.reportforge.compiler.diagnostics.CompilerLogger;
import org.reportforge.compiler.diagnostics.Diagnostic;
import org.reportforge.compiler.diagnostics.DiagnosticsEngine;
import org.reportforge.compiler.frontend.irgen.IrConverterRegistry;
import org.reportforge.compiler.frontend.irgen.IrGenerator;
import org.reportforge.compiler.frontend.parser.LayoutDefinitionParser;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.frontend.parser.ast.ReportNode;
import org.reportforge.compiler.ir.IrLayout;
import org.reportforge.compiler.util.DebugDump;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from a
 * layout definition to Typst markup: loading, IR generation and emission.
 * <p>
 * IR generation and emission hold no shared state. Loading records warnings in a
 * per-instance {@link DiagnosticsEngine}, so one instance should not parse concurrently.
 */
public class LayoutCompiler implements ILayoutCompiler {

    private final IrConverterRegistry registry;
    private final TypstEmitter emitter;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private int loggedDiagnostics;
    private int verbosity = -1;

    /**
     * Creates a compiler with the grid, table and stack converters.
     */
    public LayoutCompiler() {
        this(IrConverterRegistry.initializeWithDefaults(), new TypstEmitter());
    }

    /**
     * @param registry The converters used for IR generation.
     * @param emitter The markup emitter.
     */
    public LayoutCompiler(IrConverterRegistry registry, TypstEmitter emitter) {
        this.registry = registry;
        this.emitter = emitter;
    }

    @Override
    public ReportNode parse(String source, String fileName) throws CompilationException {
        applyVerbosity();
        diagnostics = new DiagnosticsEngine();
        loggedDiagnostics = 0;
        ReportNode report;
        try {
            report = new LayoutDefinitionParser(diagnostics).parseReport(source, fileName);
        } finally {
            logNewDiagnostics();
        }
        CompilerLogger.info("Loaded report '" + report.name() + "' with " + report.layouts().size() + " layout(s)");
        return report;
    }

    @Override
    public IrLayout transform(LayoutNode layout) throws CompilationException {
        applyVerbosity();
        try {
            return new IrGenerator(diagnostics, registry).generate(layout, "layout");
        } finally {
            logNewDiagnostics();
        }
    }

    @Override
    public List<IrLayout> transform(ReportNode report) throws CompilationException {
        applyVerbosity();
        List<IrLayout> layouts;
        try {
            layouts = new IrGenerator(diagnostics, registry).generate(report);
        } finally {
            logNewDiagnostics();
        }
        if (CompilerLogger.isEnabled(CompilerLogger.DEBUG)) {
            DebugDump.dumpIr(report.name(), layouts);
        }
        return layouts;
    }

    @Override
    public String render(IrLayout layout, RenderOptions options) {
        return emitter.render(layout, options);
    }

    @Override
    public String renderReport(List<IrLayout> layouts, RenderOptions options, DocumentOptions documentOptions) {
        return emitter.renderReport(layouts, options, documentOptions);
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The diagnostics of the most recent {@link #parse(String, String)} and the
     *         transformations since.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * Logs the diagnostics recorded since the last call, so each warning is logged once
     * whether it came from loading or from IR generation.
     */
    private void logNewDiagnostics() {
        List<Diagnostic> all = diagnostics.getDiagnostics();
        for (Diagnostic d : all.subList(loggedDiagnostics, all.size())) {
            CompilerLogger.warn(d.toString());
        }
        loggedDiagnostics = all.size();
    }

    private void applyVerbosity() {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
    }
}
