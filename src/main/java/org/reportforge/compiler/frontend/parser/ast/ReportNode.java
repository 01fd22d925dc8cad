package org.reportforge.compiler.frontend.parser.ast;

import org.reportforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * A report definition: a name and its stand-alone layouts in declaration order.
 *
 * @param name The report name.
 * @param layouts The top-level layouts.
 * @param source Where the report was declared.
 */
public record ReportNode(String name, List<LayoutNode> layouts, SourceInfo source) implements AstNode {

    public ReportNode {
        layouts = List.copyOf(layouts);
    }
}
