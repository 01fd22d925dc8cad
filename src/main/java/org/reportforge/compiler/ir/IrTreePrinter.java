package org.reportforge.compiler.ir;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prints an IR tree as indented text, one node per line. Used for debug dumps
 * and the {@code ir} command.
 */
public final class IrTreePrinter {

    private static final String INDENT = "  ";

    private IrTreePrinter() {}

    /**
     * @param layout The tree to print.
     * @return The textual form, ending with a newline.
     */
    public static String print(IrLayout layout) {
        StringBuilder sb = new StringBuilder();
        layout(sb, layout, 0);
        return sb.toString();
    }

    private static void layout(StringBuilder sb, IrLayout layout, int depth) {
        line(sb, depth, layout.kind().name() + " " + properties(layout.properties()));
        if (layout instanceof IrGrid g) {
            g.children().forEach(c -> child(sb, c, depth + 1));
            g.lines().forEach(l -> line(sb, depth + 1, line(l)));
        } else if (layout instanceof IrTable t) {
            for (IrHeader h : t.headers()) {
                line(sb, depth + 1, "HEADER repeat=" + h.repeat() + " level=" + h.level());
                h.rows().forEach(r -> child(sb, r, depth + 2));
            }
            t.children().forEach(c -> child(sb, c, depth + 1));
            for (IrFooter f : t.footers()) {
                line(sb, depth + 1, "FOOTER repeat=" + f.repeat());
                f.rows().forEach(r -> child(sb, r, depth + 2));
            }
            t.lines().forEach(l -> line(sb, depth + 1, line(l)));
        } else if (layout instanceof IrStack s) {
            s.children().forEach(c -> child(sb, c, depth + 1));
        }
    }

    private static void child(StringBuilder sb, IrChild child, int depth) {
        if (child instanceof IrRow r) {
            line(sb, depth, "ROW " + r.index() + " " + properties(r.properties()));
            r.cells().forEach(c -> child(sb, c, depth + 1));
        } else if (child instanceof IrCell c) {
            line(sb, depth, "CELL (" + c.x() + "," + c.y() + ") span=" + c.colspan() + "x" + c.rowspan()
                    + " " + properties(c.properties()));
            for (IrContent content : c.content()) {
                if (content instanceof IrLabel l) {
                    line(sb, depth + 1, "LABEL \"" + l.text() + "\"" + style(l.style()));
                } else if (content instanceof IrField f) {
                    line(sb, depth + 1, "FIELD " + String.join(".", f.source())
                            + (f.format() != null ? " " + f.format().name().toLowerCase(Locale.ROOT) : "")
                            + (f.decimalPlaces() != null ? "/" + f.decimalPlaces() : "")
                            + style(f.style()));
                } else if (content instanceof IrNestedLayout n) {
                    layout(sb, n.layout(), depth + 1);
                }
            }
        }
    }

    private static String line(IrLine l) {
        return (l.orientation() == IrLine.Orientation.HORIZONTAL ? "HLINE y=" : "VLINE x=") + l.position()
                + (l.start() != null ? " start=" + l.start() : "")
                + (l.end() != null ? " end=" + l.end() : "")
                + (l.stroke() != null ? " stroke=" + value(l.stroke()) : "");
    }

    private static String style(IrStyle style) {
        return style == null ? "" : " " + style;
    }

    private static String properties(Map<String, IrValue> properties) {
        return properties.entrySet().stream()
                .map(e -> e.getKey() + "=" + value(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static String value(IrValue value) {
        if (value instanceof IrValue.Int64 i) return Long.toString(i.value());
        if (value instanceof IrValue.Decimal d) return d.value().toPlainString();
        if (value instanceof IrValue.Str s) return s.value();
        if (value instanceof IrValue.Bool b) return Boolean.toString(b.value());
        if (value instanceof IrValue.ListVal l) return list(l.elements());
        return properties(((IrValue.MapVal) value).entries());
    }

    private static String list(List<IrValue> elements) {
        return elements.stream().map(IrTreePrinter::value).collect(Collectors.joining(", ", "[", "]"));
    }

    private static void line(StringBuilder sb, int depth, String text) {
        sb.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
