package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.frontend.parser.ast.ItemNode;
import org.reportforge.compiler.ir.IrStyle;
import org.reportforge.compiler.ir.IrValue;

import java.util.Map;

/**
 * Collects the style attributes of a content item. Attributes may be given flat on
 * the item or in a nested {@code style} map; the nested map wins per attribute.
 */
public final class StyleBuilder {

    static final String STYLE = "style";
    static final String FONT_SIZE = "font-size";
    static final String FONT_WEIGHT = "font-weight";
    static final String FONT_STYLE = "font-style";
    static final String COLOR = "color";
    static final String FONT_FAMILY = "font-family";
    static final String TEXT_ALIGN = "text-align";

    private StyleBuilder() {}

    /**
     * @param item The content item.
     * @param ctx The generation context, for warnings.
     * @return The style, or null if no attribute is set.
     */
    public static IrStyle build(ItemNode item, IrGenContext ctx) {
        Map<?, ?> nested = Map.of();
        Object styleValue = item.attribute(STYLE);
        if (styleValue instanceof Map<?, ?> map) {
            nested = map;
        } else if (styleValue != null) {
            ctx.diagnostics().reportWarning("Ignoring 'style' that is not a map: " + styleValue, item.source());
        }
        IrStyle style = new IrStyle(
                IrValue.of(pick(item, nested, FONT_SIZE)),
                IrValue.of(pick(item, nested, FONT_WEIGHT)),
                text(pick(item, nested, FONT_STYLE)),
                text(pick(item, nested, COLOR)),
                text(pick(item, nested, FONT_FAMILY)),
                IrValue.of(pick(item, nested, TEXT_ALIGN)));
        return style.isEmpty() ? null : style;
    }

    private static Object pick(ItemNode item, Map<?, ?> nested, String key) {
        Object fromMap = nested.get(key);
        return fromMap != null ? fromMap : item.attribute(key);
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
