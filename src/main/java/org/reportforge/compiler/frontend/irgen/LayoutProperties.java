package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.ir.IrValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the property maps of layouts, rows and cells. Keys are emitted in a
 * fixed canonical order and absent values are dropped.
 */
public final class LayoutProperties {

    public static final String COLUMNS = "columns";
    public static final String ROWS = "rows";
    public static final String GUTTER = "gutter";
    public static final String COLUMN_GUTTER = "column-gutter";
    public static final String ROW_GUTTER = "row-gutter";
    public static final String ALIGN = "align";
    public static final String INSET = "inset";
    public static final String FILL = "fill";
    public static final String STROKE = "stroke";
    public static final String HEIGHT = "height";
    public static final String BREAKABLE = "breakable";
    public static final String DIR = "dir";
    public static final String SPACING = "spacing";

    static final IrValue TABLE_DEFAULT_STROKE = new IrValue.Str("1pt");
    static final IrValue TABLE_DEFAULT_INSET = new IrValue.Str("5pt");

    private static final List<String> ROW_KEYS = List.of(HEIGHT, FILL, STROKE, ALIGN, INSET);
    private static final List<String> CELL_KEYS = List.of(ALIGN, INSET, FILL, STROKE, BREAKABLE);

    private LayoutProperties() {}

    /**
     * Resolves grid and table properties. Tables fall back to a 1pt stroke and a 5pt
     * inset; grids have no fallbacks. A column or row gutter suppresses the general gutter.
     *
     * @param attributes The raw layout attributes.
     * @param columns The normalized column tracks.
     * @param rows The normalized row tracks.
     * @param tableDefaults Whether table fallbacks apply.
     * @return The resolved properties.
     */
    public static Map<String, IrValue> container(Map<String, Object> attributes, List<String> columns,
                                                 List<String> rows, boolean tableDefaults) {
        Map<String, IrValue> props = new LinkedHashMap<>();
        props.put(COLUMNS, IrValue.strings(columns));
        props.put(ROWS, IrValue.strings(rows));
        IrValue columnGutter = IrValue.of(attributes.get(COLUMN_GUTTER));
        IrValue rowGutter = IrValue.of(attributes.get(ROW_GUTTER));
        if (columnGutter == null && rowGutter == null) {
            put(props, GUTTER, IrValue.of(attributes.get(GUTTER)));
        }
        put(props, COLUMN_GUTTER, columnGutter);
        put(props, ROW_GUTTER, rowGutter);
        put(props, ALIGN, IrValue.of(attributes.get(ALIGN)));
        IrValue inset = IrValue.of(attributes.get(INSET));
        put(props, INSET, inset == null && tableDefaults ? TABLE_DEFAULT_INSET : inset);
        put(props, FILL, IrValue.of(attributes.get(FILL)));
        IrValue stroke = IrValue.of(attributes.get(STROKE));
        put(props, STROKE, stroke == null && tableDefaults ? TABLE_DEFAULT_STROKE : stroke);
        return props;
    }

    /**
     * @param attributes The raw stack attributes.
     * @return Direction and spacing, when set.
     */
    public static Map<String, IrValue> stack(Map<String, Object> attributes) {
        Map<String, IrValue> props = new LinkedHashMap<>();
        put(props, DIR, IrValue.of(attributes.get(DIR)));
        put(props, SPACING, IrValue.of(attributes.get(SPACING)));
        return props;
    }

    /**
     * @param attributes The raw row attributes.
     * @return Height, fill, stroke, align and inset, when set.
     */
    public static Map<String, IrValue> row(Map<String, Object> attributes) {
        return select(attributes, ROW_KEYS);
    }

    /**
     * @param attributes The raw cell attributes.
     * @return Align, inset, fill, stroke and breakable, when set.
     */
    public static Map<String, IrValue> cell(Map<String, Object> attributes) {
        return select(attributes, CELL_KEYS);
    }

    private static Map<String, IrValue> select(Map<String, Object> attributes, List<String> keys) {
        Map<String, IrValue> props = new LinkedHashMap<>();
        for (String key : keys) {
            put(props, key, IrValue.of(attributes.get(key)));
        }
        return props;
    }

    private static void put(Map<String, IrValue> props, String key, IrValue value) {
        if (value != null) {
            props.put(key, value);
        }
    }
}
