package org.lolmark.compiler.frontend.parser.features.section;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A single list entry, <code>#GIMMEH ITEM ... #MKAY</code>.
 *
 * @param start The <code>#GIMMEH</code> token.
 * @param children The nested nodes in source order.
 */
public record ItemNode(
        Token start,
        List<AstNode> children
) implements AstNode {

    public ItemNode {
        children = List.copyOf(children);
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }
}
