package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.frontend.parser.ast.CellNode;
import org.reportforge.compiler.frontend.parser.ast.RowNode;
import org.reportforge.compiler.frontend.parser.ast.SectionMember;
import org.reportforge.compiler.frontend.parser.ast.SectionNode;
import org.reportforge.compiler.ir.IrFooter;
import org.reportforge.compiler.ir.IrHeader;
import org.reportforge.compiler.ir.IrRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles table headers and footers. Members are full rows or bare cells; a bare
 * cell is wrapped into a synthetic row whose index is the member's position.
 */
public final class SectionAssembler {

    private SectionAssembler() {}

    /**
     * Headers repeat by default and start at level 1.
     *
     * @param sections The declared headers.
     * @param ctx The generation context.
     * @return The headers in order.
     * @throws CompilationException on the first member that fails.
     */
    public static List<IrHeader> headers(List<SectionNode> sections, IrGenContext ctx) throws CompilationException {
        List<IrHeader> headers = new ArrayList<>(sections.size());
        for (SectionNode section : sections) {
            int level = section.level() == null ? 1 : section.level();
            if (level < 1) {
                throw new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION,
                        "Header level must be at least 1", level, section.source());
            }
            boolean repeat = section.repeat() == null || section.repeat();
            headers.add(new IrHeader(repeat, level, rows(section, ctx)));
        }
        return headers;
    }

    /**
     * Footers do not repeat by default.
     *
     * @param sections The declared footers.
     * @param ctx The generation context.
     * @return The footers in order.
     * @throws CompilationException on the first member that fails.
     */
    public static List<IrFooter> footers(List<SectionNode> sections, IrGenContext ctx) throws CompilationException {
        List<IrFooter> footers = new ArrayList<>(sections.size());
        for (SectionNode section : sections) {
            boolean repeat = section.repeat() != null && section.repeat();
            footers.add(new IrFooter(repeat, rows(section, ctx)));
        }
        return footers;
    }

    private static List<IrRow> rows(SectionNode section, IrGenContext ctx) throws CompilationException {
        List<IrRow> rows = new ArrayList<>(section.members().size());
        for (int i = 0; i < section.members().size(); i++) {
            SectionMember member = section.members().get(i);
            if (member instanceof RowNode row) {
                rows.add(CellAssembler.row(row, i, ctx));
            } else if (member instanceof CellNode cell) {
                rows.add(new IrRow(i, Map.of(), List.of(CellAssembler.cell(cell, ctx))));
            }
        }
        return rows;
    }
}
