package org.lolmark.compiler.frontend.parser.features.section;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * A <code>#MAEK PARAGRAF</code> section. Variables declared inside it live in its own scope.
 *
 * @param start The <code>#MAEK</code> token.
 * @param children The nested nodes in source order.
 */
public record ParagrafSectionNode(
        Token start,
        List<AstNode> children
) implements AstNode {

    public ParagrafSectionNode {
        children = List.copyOf(children);
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }
}
