package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.ir.IrStyle;
import org.reportforge.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a style into {@code #text(...)} parameters, always in the order
 * size, weight, style, fill, font. Absent attributes are skipped.
 */
public final class TypstStyleResolver {

    private static final Map<String, String> WEIGHTS = Map.of(
            "normal", "regular",
            "regular", "regular",
            "thin", "thin",
            "extralight", "extralight",
            "light", "light",
            "medium", "medium",
            "semibold", "semibold",
            "bold", "bold",
            "extrabold", "extrabold",
            "black", "black");

    private static final Map<String, String> SLANTS = Map.of(
            "italic", "italic",
            "oblique", "oblique");

    private TypstStyleResolver() {}

    /**
     * @param style The style. Can be null.
     * @return The parameters in canonical order, empty for a null or empty style.
     */
    public static List<String> parameters(IrStyle style) {
        List<String> params = new ArrayList<>(5);
        if (style == null) {
            return params;
        }
        if (style.fontSize() != null) {
            params.add("size: " + PropertyRenderer.length(style.fontSize()));
        }
        if (style.fontWeight() != null) {
            params.add("weight: " + weight(style.fontWeight()));
        }
        if (style.fontStyle() != null) {
            String slant = style.fontStyle().toLowerCase(Locale.ROOT);
            if (!"normal".equals(slant)) {
                params.add("style: \"" + SLANTS.getOrDefault(slant, style.fontStyle()) + "\"");
            }
        }
        if (style.color() != null) {
            params.add("fill: " + PropertyRenderer.color(style.color()));
        }
        if (style.fontFamily() != null) {
            params.add("font: \"" + style.fontFamily() + "\"");
        }
        return params;
    }

    /**
     * @param style The style. Can be null.
     * @return The comma-separated parameters, or the empty string if there are none.
     */
    public static String render(IrStyle style) {
        return String.join(", ", parameters(style));
    }

    /**
     * Wraps already rendered content in the text styling of {@code style}, then in its alignment.
     * Content is returned unchanged when the style sets nothing.
     *
     * @param style The style. Can be null.
     * @param content The rendered content.
     * @return The styled content.
     */
    public static String apply(IrStyle style, String content) {
        String params = render(style);
        String styled = params.isEmpty() ? content : "#text(" + params + ")[" + content + "]";
        if (style != null && style.textAlign() != null) {
            styled = "#align(" + PropertyRenderer.alignment(style.textAlign()) + ")[" + styled + "]";
        }
        return styled;
    }

    private static String weight(IrValue value) {
        if (value instanceof IrValue.Int64 i) {
            return Long.toString(i.value());
        }
        String name = value instanceof IrValue.Str s ? s.value() : PropertyRenderer.generic(value);
        return "\"" + WEIGHTS.getOrDefault(name.toLowerCase(Locale.ROOT), name) + "\"";
    }
}
