package org.lolmark.compiler.frontend.parser.features.variable;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * Declares a variable in the innermost open scope, <code>#I HAZ name</code>.
 *
 * @param start The <code>#I HAZ</code> token.
 * @param name The declared name, case-sensitive.
 */
public record VariableDeclarationNode(Token start, String name) implements AstNode {
}
