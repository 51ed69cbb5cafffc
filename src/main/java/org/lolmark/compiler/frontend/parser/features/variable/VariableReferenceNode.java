package org.lolmark.compiler.frontend.parser.features.variable;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * Reads a variable, <code>#LEMME SEE name #MKAY</code>.
 *
 * @param start The <code>#LEMME SEE</code> token.
 * @param name The referenced name.
 */
public record VariableReferenceNode(Token start, String name) implements AstNode {
}
