package org.lolmark.compiler.frontend.parser.features.style;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Bold inline content, <code>#GIMMEH BOLD ... #MKAY</code>.
 *
 * @param start The <code>#GIMMEH</code> token.
 * @param children The nested nodes in source order.
 */
public record BoldNode(
        Token start,
        List<AstNode> children
) implements AstNode {

    public BoldNode {
        children = List.copyOf(children);
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }
}
