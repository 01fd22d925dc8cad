package org.reportforge.compiler.frontend.parser.ast;

import org.reportforge.compiler.api.SourceInfo;

import java.util.List;

/**
 * A table header or footer block.
 *
 * @param repeat The declared repeat flag, or null for the section default.
 * @param level The declared header level, or null.
 * @param members Rows and bare cells in order.
 * @param source Where the section was declared.
 */
public record SectionNode(Boolean repeat, Integer level, List<SectionMember> members, SourceInfo source) implements AstNode {

    public SectionNode {
        members = members == null ? List.of() : List.copyOf(members);
    }
}
