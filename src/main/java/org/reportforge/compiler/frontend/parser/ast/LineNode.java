package org.reportforge.compiler.frontend.parser.ast;

import org.reportforge.compiler.api.SourceInfo;

/**
 * A separator line declaration. {@code y} declares a horizontal line, {@code x} a vertical one.
 *
 * @param horizontal Whether the line runs between rows.
 * @param position The boundary index.
 * @param start First covered track, or null.
 * @param end Track before which the line stops, or null.
 * @param stroke The raw stroke value, or null.
 * @param source Where the line was declared.
 */
public record LineNode(boolean horizontal, int position, Integer start, Integer end, Object stroke, SourceInfo source)
        implements AstNode {
}
