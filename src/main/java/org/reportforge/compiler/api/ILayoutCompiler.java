package org.reportforge.compiler.api;

import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.frontend.parser.ast.ReportNode;
import org.reportforge.compiler.ir.IrLayout;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public, clean interface for the layout compiler.
 */
public interface ILayoutCompiler {

    /**
     * Loads a report definition from HOCON source text.
     *
     * @param source The HOCON text of the definition.
     * @param fileName A name for the definition, used for diagnostics.
     * @return The authoring AST of the report.
     * @throws CompilationException if the definition is structurally invalid.
     */
    ReportNode parse(String source, String fileName) throws CompilationException;

    /**
     * Transforms one declarative layout into its normalized intermediate representation.
     *
     * @param layout The authoring AST of the layout.
     * @return The IR tree of the layout.
     * @throws CompilationException on the first error anywhere in the layout tree.
     */
    IrLayout transform(LayoutNode layout) throws CompilationException;

    /**
     * Transforms all layouts of a report, in declaration order.
     *
     * @param report The authoring AST of the report.
     * @return One IR tree per layout.
     * @throws CompilationException on the first error in any layout.
     */
    List<IrLayout> transform(ReportNode report) throws CompilationException;

    /**
     * Renders a single layout to markup.
     *
     * @param layout The IR tree to render.
     * @param options Data context and field mode.
     * @return The markup text of the layout.
     */
    String render(IrLayout layout, RenderOptions options);

    /**
     * Renders a complete document: optional preamble, then each layout separated by a blank line.
     *
     * @param layouts The IR trees to render.
     * @param options Data context and field mode.
     * @param documentOptions Page and text defaults for the preamble.
     * @return The markup text of the document.
     */
    String renderReport(List<IrLayout> layouts, RenderOptions options, DocumentOptions documentOptions);

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (e.g., 0=quiet, 1=normal, 2=verbose, 3=debug, 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Loads, transforms and renders the report definition stored in a file.
     *
     * @param definitionPath The path to the HOCON definition.
     * @param options Data context and field mode.
     * @param documentOptions Page and text defaults for the preamble.
     * @return The markup text of the document.
     * @throws CompilationException if the definition is invalid or cannot be read.
     */
    default String compile(Path definitionPath, RenderOptions options, DocumentOptions documentOptions) throws CompilationException {
        String source;
        try {
            source = Files.readString(definitionPath);
        } catch (IOException e) {
            throw new CompilationException(CompilerErrorCode.IO_ERROR_READING_FILE,
                    "Cannot read layout definition " + definitionPath, e);
        }
        ReportNode report = parse(source, definitionPath.toString());
        return renderReport(transform(report), options, documentOptions);
    }
}
