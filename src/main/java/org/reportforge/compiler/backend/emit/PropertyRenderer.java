package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.frontend.irgen.LayoutProperties;
import org.reportforge.compiler.ir.IrValue;

import java.math.BigDecimal;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders property values as Typst arguments. Numbers in length positions are points,
 * {@code #RRGGBB} colors become {@code rgb(...)}, alignment pairs are added and maps
 * become dictionaries.
 */
public final class PropertyRenderer {

    private PropertyRenderer() {}

    /**
     * @param key The property name.
     * @param value The value.
     * @return The argument text {@code key: value}.
     */
    public static String parameter(String key, IrValue value) {
        return key + ": " + value(key, value);
    }

    /**
     * @param key The property name, deciding how the value is read.
     * @param value The value.
     * @return The Typst expression of the value.
     */
    public static String value(String key, IrValue value) {
        switch (key) {
            case LayoutProperties.COLUMNS:
            case LayoutProperties.ROWS:
                return tracks(value);
            case LayoutProperties.ALIGN:
                return alignment(value);
            case LayoutProperties.FILL:
                return color(value);
            default:
                return generic(value);
        }
    }

    /**
     * @param value A list of track sizes.
     * @return The tracks as an array, e.g. {@code (auto, 1fr)}.
     */
    public static String tracks(IrValue value) {
        if (value instanceof IrValue.ListVal list) {
            return list.elements().stream().map(PropertyRenderer::generic)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
        return generic(value);
    }

    /**
     * @param value A keyword or a {@code [horizontal, vertical]} pair.
     * @return The alignment, e.g. {@code left + top}.
     */
    public static String alignment(IrValue value) {
        if (value instanceof IrValue.ListVal list) {
            return list.elements().stream().map(PropertyRenderer::generic).collect(Collectors.joining(" + "));
        }
        return generic(value);
    }

    /**
     * @param value A color keyword or a {@code #RRGGBB} string.
     * @return The color expression.
     */
    public static String color(IrValue value) {
        if (value instanceof IrValue.Str s) {
            return color(s.value());
        }
        return generic(value);
    }

    /**
     * @param color A color keyword or a {@code #RRGGBB} string.
     * @return {@code rgb("#RRGGBB")} for hex strings, otherwise the keyword unchanged.
     */
    public static String color(String color) {
        return color.startsWith("#") ? "rgb(\"" + color + "\")" : color;
    }

    /**
     * @param value A length as a number of points or a string with unit.
     * @return The length expression.
     */
    public static String length(IrValue value) {
        return generic(value);
    }

    static String generic(IrValue value) {
        if (value instanceof IrValue.Int64 i) return i.value() + "pt";
        if (value instanceof IrValue.Decimal d) return plain(d.value()) + "pt";
        if (value instanceof IrValue.Str s) return s.value().startsWith("#") ? color(s.value()) : s.value();
        if (value instanceof IrValue.Bool b) return Boolean.toString(b.value());
        if (value instanceof IrValue.ListVal l) {
            return l.elements().stream().map(PropertyRenderer::generic).collect(Collectors.joining(", ", "(", ")"));
        }
        return dictionary(((IrValue.MapVal) value).entries());
    }

    private static String dictionary(Map<String, IrValue> entries) {
        if (entries.isEmpty()) {
            return "(:)";
        }
        return entries.entrySet().stream()
                .map(e -> e.getKey() + ": " + value(e.getKey(), e.getValue()))
                .collect(Collectors.joining(", ", "(", ")"));
    }

    static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
