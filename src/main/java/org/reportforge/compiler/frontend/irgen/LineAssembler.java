package org.reportforge.compiler.frontend.irgen;

import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.frontend.parser.ast.LineNode;
import org.reportforge.compiler.ir.IrLine;
import org.reportforge.compiler.ir.IrValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers separator line declarations into the trailing line slot of a grid or table.
 */
public final class LineAssembler {

    private LineAssembler() {}

    /**
     * @param lines The declared lines.
     * @return The lines in declaration order.
     * @throws CompilationException if a position or range is negative.
     */
    public static List<IrLine> lines(List<LineNode> lines) throws CompilationException {
        List<IrLine> out = new ArrayList<>(lines.size());
        for (LineNode line : lines) {
            if (line.position() < 0
                    || (line.start() != null && line.start() < 0)
                    || (line.end() != null && line.end() < 0)) {
                throw new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION,
                        "Line position, start and end must not be negative", line, line.source());
            }
            IrLine.Orientation orientation = line.horizontal() ? IrLine.Orientation.HORIZONTAL : IrLine.Orientation.VERTICAL;
            out.add(new IrLine(orientation, line.position(), line.start(), line.end(), IrValue.of(line.stroke())));
        }
        return out;
    }
}
