package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.ir.IrField;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Emits runtime references instead of values. Fields read from {@code record},
 * label placeholders like {@code [total]} read from {@code data.variables}.
 * Missing numeric values render as {@code "-"} at runtime.
 */
public final class FieldReferenceEmitter {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");
    private static final Pattern VARIABLE = Pattern.compile("\\[([A-Za-z_][A-Za-z0-9_]*)]");

    private FieldReferenceEmitter() {}

    /**
     * @param field The field.
     * @return Markup evaluating the field against {@code record} when the document is compiled.
     */
    public static String reference(IrField field) {
        String path = path("record", field.source());
        if (field.format() == null) {
            return "#" + path;
        }
        int places = field.decimalPlaces() != null ? field.decimalPlaces() : field.format().defaultDecimalPlaces();
        switch (field.format()) {
            case CURRENCY:
                return "\\$" + guarded(path, "calc.round(v, digits: " + places + ")");
            case PERCENT:
                return guarded(path, "str(calc.round(v, digits: " + places + ")) + \"%\"");
            case NUMBER:
                return field.decimalPlaces() == null
                        ? "#" + path
                        : guarded(path, "calc.round(v, digits: " + places + ")");
            default:
                return "#" + path;
        }
    }

    /**
     * Escapes label text and turns {@code [name]} placeholders into variable references.
     *
     * @param text The raw label text.
     * @return The markup.
     */
    public static String label(String text) {
        Matcher m = VARIABLE.matcher(text);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            sb.append(TypstEscaper.escape(text.substring(last, m.start())));
            String reference = "data.variables." + m.group(1);
            boolean glued = m.end() < text.length() && continuesExpression(text.charAt(m.end()));
            sb.append(glued ? "#(" + reference + ")" : "#" + reference);
            last = m.end();
        }
        sb.append(TypstEscaper.escape(text.substring(last)));
        return sb.toString();
    }

    static String path(String root, List<String> keys) {
        StringBuilder sb = new StringBuilder(root);
        for (String key : keys) {
            if (IDENTIFIER.matcher(key).matches()) {
                sb.append('.').append(key);
            } else {
                sb.append(".at(\"").append(key.replace("\\", "\\\\").replace("\"", "\\\"")).append("\")");
            }
        }
        return sb.toString();
    }

    private static String guarded(String path, String expression) {
        return "#{ let v = " + path + "; if v == none { \"-\" } else { " + expression + " } }";
    }

    // Characters Typst would read as part of a preceding #expression.
    private static boolean continuesExpression(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '(' || c == '[';
    }
}
