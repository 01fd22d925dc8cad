package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.api.UnknownElementTypeException;
import org.reportforge.compiler.frontend.parser.ast.ItemNode;
import org.reportforge.compiler.ir.FieldFormat;
import org.reportforge.compiler.ir.IrContent;
import org.reportforge.compiler.ir.IrField;
import org.reportforge.compiler.ir.IrLabel;
import org.reportforge.compiler.ir.IrNestedLayout;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lowers a single content item by its shape: {@code text} makes a label, {@code source}
 * a field and a declared layout a nested layout. Anything else is rejected.
 */
public final class ContentLowerer {

    static final String TEXT = "text";
    static final String SOURCE = "source";
    static final String FORMAT = "format";
    static final String DECIMAL_PLACES = "decimal-places";

    private ContentLowerer() {}

    /**
     * @param item The item to lower.
     * @param ctx The generation context.
     * @return The content node.
     * @throws CompilationException if the item matches no content shape, or a nested layout fails.
     */
    public static IrContent lower(ItemNode item, IrGenContext ctx) throws CompilationException {
        if (item.has(TEXT)) {
            Object text = item.attribute(TEXT);
            return new IrLabel(text == null ? "" : String.valueOf(text), StyleBuilder.build(item, ctx));
        }
        if (item.has(SOURCE)) {
            return field(item, ctx);
        }
        if (item.layout() != null) {
            return new IrNestedLayout(ctx.transform(item.layout()));
        }
        throw new UnknownElementTypeException(item.attributes(), item.source());
    }

    /**
     * @param items The items to lower.
     * @param ctx The generation context.
     * @return The content nodes in order.
     * @throws CompilationException on the first item that cannot be lowered.
     */
    public static List<IrContent> lowerAll(List<ItemNode> items, IrGenContext ctx) throws CompilationException {
        List<IrContent> out = new ArrayList<>(items.size());
        for (ItemNode item : items) {
            out.add(lower(item, ctx));
        }
        return out;
    }

    private static IrField field(ItemNode item, IrGenContext ctx) throws CompilationException {
        List<String> path = sourcePath(item);
        FieldFormat format = null;
        Object declaredFormat = item.attribute(FORMAT);
        if (declaredFormat != null) {
            Optional<FieldFormat> parsed = FieldFormat.fromKeyword(String.valueOf(declaredFormat));
            if (parsed.isPresent()) {
                format = parsed.get();
            } else {
                ctx.diagnostics().reportWarning("Unknown field format '" + declaredFormat
                        + "'; the raw value is rendered", item.source());
            }
        }
        Integer places = null;
        Object declaredPlaces = item.attribute(DECIMAL_PLACES);
        if (declaredPlaces != null) {
            if (!(declaredPlaces instanceof Integer i) || i < 0) {
                throw new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION,
                        "decimal-places must be a non-negative integer", declaredPlaces, item.source());
            }
            places = i;
        }
        return new IrField(path, format, places, StyleBuilder.build(item, ctx));
    }

    private static List<String> sourcePath(ItemNode item) throws CompilationException {
        Object source = item.attribute(SOURCE);
        if (source instanceof String key && !key.isEmpty()) {
            return List.of(key);
        }
        if (source instanceof List<?> keys && !keys.isEmpty()) {
            List<String> path = new ArrayList<>(keys.size());
            for (Object key : keys) {
                if (!(key instanceof String s)) {
                    throw invalidSource(item);
                }
                path.add(s);
            }
            return path;
        }
        throw invalidSource(item);
    }

    private static CompilationException invalidSource(ItemNode item) {
        return new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION,
                "A field source must be a key or a non-empty list of keys", item.attribute(SOURCE), item.source());
    }
}
