package org.lolmark.compiler.frontend.parser.ast;

import org.lolmark.compiler.frontend.lexer.Token;

/**
 * An explicit line break, written as <code>#GIMMEH NEWLINE</code>.
 *
 * @param token The <code>#GIMMEH</code> token.
 */
public record NewlineNode(Token token) implements AstNode {
}
