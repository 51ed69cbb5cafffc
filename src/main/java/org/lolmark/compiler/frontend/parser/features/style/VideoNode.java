package org.lolmark.compiler.frontend.parser.features.style;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * An embedded video player.
 *
 * @param start The <code>#GIMMEH</code> token.
 * @param url The video source.
 */
public record VideoNode(Token start, String url) implements AstNode {
}
