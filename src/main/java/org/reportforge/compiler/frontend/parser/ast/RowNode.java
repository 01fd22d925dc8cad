package org.reportforge.compiler.frontend.parser.ast;

import org.reportforge.compiler.api.SourceInfo;

import java.util.List;
import java.util.Map;

/**
 * An explicit row.
 *
 * @param attributes Raw values of height, fill, stroke, align and inset.
 * @param cells The cells in order.
 * @param source Where the row was declared.
 */
public record RowNode(Map<String, Object> attributes, List<CellNode> cells, SourceInfo source) implements SectionMember {

    public RowNode {
        attributes = Attributes.freeze(attributes);
        cells = cells == null ? List.of() : List.copyOf(cells);
    }
}
