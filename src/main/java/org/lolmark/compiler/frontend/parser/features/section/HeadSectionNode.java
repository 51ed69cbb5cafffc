package org.lolmark.compiler.frontend.parser.features.section;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A <code>#MAEK HEAD</code> section. Holds title nodes only and opens no scope.
 *
 * @param start The <code>#MAEK</code> token.
 * @param children The nested nodes in source order.
 */
public record HeadSectionNode(
        Token start,
        List<AstNode> children
) implements AstNode {

    public HeadSectionNode {
        children = List.copyOf(children);
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }
}
