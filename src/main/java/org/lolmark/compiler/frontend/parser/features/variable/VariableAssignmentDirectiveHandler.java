package org.lolmark.compiler.frontend.parser.features.variable;

import org.lolmark.compiler.frontend.directive.IDirectiveHandler;
import org.lolmark.compiler.frontend.lexer.HashWord;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;
import org.lolmark.compiler.frontend.parser.Parser;
import org.lolmark.compiler.frontend.parser.ParsingContext;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * Handler for the <code>#IT IZ</code> directive.
 * The syntax is <code>#IT IZ &lt;value&gt; #MKAY</code>. The value tokens are concatenated as they
 * appear; only two adjacent identifiers are separated by a space, so <code>hello, world</code>
 * and <code>hello world</code> keep their spelling.
 */
public class VariableAssignmentDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token start = context.advance(); // consume #IT IZ

        StringBuilder value = new StringBuilder();
        Token last = null;
        while (context.match(TokenType.TEXT, TokenType.VAR_DEF)) {
            Token token = context.previous();
            if (last != null && last.type() == TokenType.VAR_DEF && token.type() == TokenType.VAR_DEF) {
                value.append(' ');
            }
            value.append(token.text());
            last = token;
        }
        context.consume(HashWord.MKAY);

        String target = ((Parser) context).takePendingDeclaration();
        return new VariableAssignmentNode(start, target, value.toString().strip());
    }
}
