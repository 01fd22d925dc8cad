package org.reportforge.compiler.frontend.parser.ast;

import org.reportforge.compiler.api.SourceInfo;

import java.util.Map;

/**
 * A content item as authored. What it becomes is decided by its shape during IR
 * generation: {@code text} makes a label, {@code source} a field, and a layout
 * {@code type} a nested layout.
 *
 * @param attributes The raw attributes of the item, including style attributes.
 * @param layout The parsed nested layout if the item declares a layout type, otherwise null.
 * @param source Where the item was declared.
 */
public record ItemNode(Map<String, Object> attributes, LayoutNode layout, SourceInfo source) implements AstNode {

    public ItemNode {
        attributes = Attributes.freeze(attributes);
    }

    /**
     * @param layout The layout to embed.
     * @return An item wrapping the layout.
     */
    public static ItemNode nested(LayoutNode layout) {
        return new ItemNode(Map.of("type", layout.kind().keyword()), layout, layout.source());
    }

    public boolean has(String key) {
        return attributes.containsKey(key);
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }
}
