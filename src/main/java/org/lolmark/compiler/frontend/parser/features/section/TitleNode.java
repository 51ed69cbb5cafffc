package org.lolmark.compiler.frontend.parser.features.section;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * The page heading, <code>#GIMMEH TITLE ... #MKAY</code>.
 *
 * @param start The <code>#GIMMEH</code> token.
 * @param content The title words joined by single spaces.
 */
public record TitleNode(Token start, String content) implements AstNode {
}
