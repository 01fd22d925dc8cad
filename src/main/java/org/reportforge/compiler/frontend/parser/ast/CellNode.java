package org.reportforge.compiler.frontend.parser.ast;

import org.reportforge.compiler.api.SourceInfo;

import java.util.List;
import java.util.Map;

/**
 * A declared cell. Position and span are null when not declared.
 *
 * @param x The column, or null.
 * @param y The row, or null.
 * @param colspan The column span, or null.
 * @param rowspan The row span, or null.
 * @param attributes Raw values of align, inset, fill, stroke and breakable.
 * @param content The content items in order.
 * @param source Where the cell was declared.
 */
public record CellNode(
        Integer x,
        Integer y,
        Integer colspan,
        Integer rowspan,
        Map<String, Object> attributes,
        List<ItemNode> content,
        SourceInfo source
) implements SectionMember {

    public CellNode {
        attributes = Attributes.freeze(attributes);
        content = content == null ? List.of() : List.copyOf(content);
    }
}
