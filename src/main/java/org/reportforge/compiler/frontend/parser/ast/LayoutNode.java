package org.reportforge.compiler.frontend.parser.ast;

import org.reportforge.compiler.api.SourceInfo;
import org.reportforge.compiler.ir.LayoutKind;

import java.util.List;
import java.util.Map;

/**
 * A declared grid, table or stack.
 * <p>
 * Track declarations and properties stay raw in {@code attributes}; they are validated
 * and normalized during IR generation, not while loading.
 *
 * @param kind The layout kind.
 * @param attributes Raw values of columns, rows, gutters, align, inset, fill, stroke, dir and spacing.
 * @param body Explicit rows in declaration order.
 * @param cells Loose cells declared outside rows.
 * @param elements Bare content items, each wrapped into its own cell.
 * @param headers Header sections, tables only.
 * @param footers Footer sections, tables only.
 * @param lines Separator lines, grids and tables only.
 * @param source Where the layout was declared.
 */
public record LayoutNode(
        LayoutKind kind,
        Map<String, Object> attributes,
        List<RowNode> body,
        List<CellNode> cells,
        List<ItemNode> elements,
        List<SectionNode> headers,
        List<SectionNode> footers,
        List<LineNode> lines,
        SourceInfo source
) implements AstNode {

    public LayoutNode {
        attributes = Attributes.freeze(attributes);
        body = body == null ? List.of() : List.copyOf(body);
        cells = cells == null ? List.of() : List.copyOf(cells);
        elements = elements == null ? List.of() : List.copyOf(elements);
        headers = headers == null ? List.of() : List.copyOf(headers);
        footers = footers == null ? List.of() : List.copyOf(footers);
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * @param key The attribute name.
     * @return The raw value, or null if absent.
     */
    public Object attribute(String key) {
        return attributes.get(key);
    }
}
