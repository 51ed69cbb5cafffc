package org.lolmark.compiler.frontend.parser.ast;

import org.lolmark.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The root of the tree: everything between <code>#HAI</code> and <code>#KTHXBYE</code>.
 *
 * @param start The <code>#HAI</code> token.
 * @param children The top-level nodes in source order.
 */
public record ProgramNode(
        Token start,
        List<AstNode> children
) implements AstNode {

    public ProgramNode {
        children = List.copyOf(children);
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }
}
