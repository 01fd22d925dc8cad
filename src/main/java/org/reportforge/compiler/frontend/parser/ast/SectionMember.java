package org.reportforge.compiler.frontend.parser.ast;

/**
 * A member of a table header or footer: a full row or a bare cell.
 */
public sealed interface SectionMember extends AstNode permits RowNode, CellNode {
}
