package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.api.DocumentOptions;
import org.reportforge.compiler.api.RenderOptions;
import org.reportforge.compiler.diagnostics.CompilerLogger;
import org.reportforge.compiler.ir.IrLayout;

import java.util.ArrayList;
import java.util.List;

/**
 * The final stage of the compiler. It serializes IR trees into Typst markup.
 * <p>
 * Rendering is total over well-formed IR: it never fails, and data lookups that find
 * nothing render as empty text. The emitter holds no mutable state and can be shared.
 */
public class TypstEmitter {

    private final ContainerEmitter containers = new ContainerEmitter();

    /**
     * Renders a single layout at the top level.
     *
     * @param layout The IR tree.
     * @param options The data context and field mode.
     * @return The markup, without a trailing newline.
     */
    public String render(IrLayout layout, RenderOptions options) {
        return containers.render(layout, new EmissionContext(options), 0);
    }

    /**
     * Renders a document: the preamble, if any, then every layout, separated by blank lines.
     *
     * @param layouts The IR trees in order.
     * @param options The data context and field mode.
     * @param documentOptions The preamble settings. Can be null.
     * @return The markup of the document.
     */
    public String renderReport(List<IrLayout> layouts, RenderOptions options, DocumentOptions documentOptions) {
        EmissionContext ctx = new EmissionContext(options);
        List<String> parts = new ArrayList<>(layouts.size() + 1);
        String preamble = PreambleBuilder.build(documentOptions);
        if (!preamble.isEmpty()) {
            parts.add(preamble);
        }
        for (IrLayout layout : layouts) {
            parts.add(containers.render(layout, ctx, 0));
        }
        CompilerLogger.debug("Rendered " + layouts.size() + " layout(s) in " + options.fieldMode() + " mode");
        return String.join("\n\n", parts);
    }
}
