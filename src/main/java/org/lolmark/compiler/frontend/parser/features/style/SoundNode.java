package org.lolmark.compiler.frontend.parser.features.style;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * An embedded audio player.
 *
 * @param start The <code>#GIMMEH</code> token.
 * @param url The audio source.
 */
public record SoundNode(Token start, String url) implements AstNode {
}
