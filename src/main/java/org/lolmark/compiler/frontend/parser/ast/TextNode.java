package org.lolmark.compiler.frontend.parser.ast;

import org.lolmark.compiler.frontend.lexer.Token;

/**
 * An AST node for a run of plain text or a bare identifier used as text.
 *
 * @param token The token the text was taken from.
 * @param content The text.
 */
public record TextNode(Token token, String content) implements AstNode {

    /**
     * Creates a text node that carries the token's own text.
     * @param token A {@code TEXT} or {@code VAR_DEF} token.
     * @return The text node.
     */
    public static TextNode of(Token token) {
        return new TextNode(token, token.text());
    }
}
