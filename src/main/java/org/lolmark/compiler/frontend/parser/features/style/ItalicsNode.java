package org.lolmark.compiler.frontend.parser.features.style;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Italic inline content, <code>#GIMMEH ITALICS ... #MKAY</code>.
 *
 * @param start The <code>#GIMMEH</code> token.
 * @param children The nested nodes in source order.
 */
public record ItalicsNode(
        Token start,
        List<AstNode> children
) implements AstNode {

    public ItalicsNode {
        children = List.copyOf(children);
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }
}
