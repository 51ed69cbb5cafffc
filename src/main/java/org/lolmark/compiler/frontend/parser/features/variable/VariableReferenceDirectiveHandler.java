package org.lolmark.compiler.frontend.parser.features.variable;

import org.lolmark.compiler.frontend.directive.IDirectiveHandler;
import org.lolmark.compiler.frontend.lexer.HashWord;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;
import org.lolmark.compiler.frontend.parser.ParsingContext;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * Handler for the <code>#LEMME SEE</code> directive.
 * The syntax is <code>#LEMME SEE &lt;name&gt; #MKAY</code>.
 */
public class VariableReferenceDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token start = context.advance(); // consume #LEMME SEE
        if (!context.check(TokenType.VAR_DEF)) {
            throw context.error("Expected variable name after #LEMME SEE");
        }
        String name = context.advance().text();
        context.consume(HashWord.MKAY);
        return new VariableReferenceNode(start, name);
    }
}
