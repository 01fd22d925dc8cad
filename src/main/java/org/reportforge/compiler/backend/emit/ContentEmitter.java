package org.reportforge.compiler.backend.emit;

import org.reportforge.compiler.ir.IrContent;
import org.reportforge.compiler.ir.IrField;
import org.reportforge.compiler.ir.IrLabel;
import org.reportforge.compiler.ir.IrNestedLayout;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the content of a cell.
 */
final class ContentEmitter {

    private final ContainerEmitter containers;

    ContentEmitter(ContainerEmitter containers) {
        this.containers = containers;
    }

    /**
     * @param content The items of one cell.
     * @param ctx The emission context.
     * @param level The level of the enclosing cell; nested layouts open there.
     * @return The items separated by single spaces.
     */
    String renderAll(List<IrContent> content, EmissionContext ctx, int level) {
        return content.stream().map(c -> render(c, ctx, level)).collect(Collectors.joining(" "));
    }

    String render(IrContent content, EmissionContext ctx, int level) {
        if (content instanceof IrLabel label) {
            String text = ctx.references()
                    ? FieldReferenceEmitter.label(label.text())
                    : TypstEscaper.escape(label.text());
            return TypstStyleResolver.apply(label.style(), text);
        }
        if (content instanceof IrField field) {
            return TypstStyleResolver.apply(field.style(), field(field, ctx));
        }
        IrNestedLayout nested = (IrNestedLayout) content;
        return containers.render(nested.layout(), ctx, level).stripLeading();
    }

    private static String field(IrField field, EmissionContext ctx) {
        if (ctx.references()) {
            return FieldReferenceEmitter.reference(field);
        }
        Object value = ctx.resolve(field.source());
        return TypstEscaper.escape(ValueFormatter.format(value, field.format(), field.decimalPlaces()));
    }
}
