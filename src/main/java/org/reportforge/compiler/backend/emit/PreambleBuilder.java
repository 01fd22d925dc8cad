package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.api.DocumentOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the document preamble. Each directive is emitted only when its option is set,
 * always in the order paper, margin, font, size.
 */
public final class PreambleBuilder {

    private PreambleBuilder() {}

    /**
     * @param options The document options. Can be null.
     * @return The directives, one per line, or the empty string.
     */
    public static String build(DocumentOptions options) {
        if (options == null) {
            return "";
        }
        List<String> lines = new ArrayList<>(4);
        if (options.pageSize() != null) {
            lines.add("#set page(paper: \"" + options.pageSize() + "\")");
        }
        if (options.margin() != null) {
            lines.add("#set page(margin: " + options.margin() + ")");
        }
        if (options.font() != null) {
            lines.add("#set text(font: \"" + options.font() + "\")");
        }
        if (options.fontSize() != null) {
            lines.add("#set text(size: " + options.fontSize() + ")");
        }
        return String.join("\n", lines);
    }
}
