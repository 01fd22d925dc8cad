package org.reportforge.compiler.frontend.parser.ast;

import org.reportforge.compiler.api.SourceInfo;

/**
 * The base interface for all nodes of the authoring AST.
 */
public interface AstNode {

    /**
     * @return Where the node was declared.
     */
    SourceInfo source();
}
