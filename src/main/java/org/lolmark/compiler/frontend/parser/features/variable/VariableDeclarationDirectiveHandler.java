package org.lolmark.compiler.frontend.parser.features.variable;

import org.lolmark.compiler.frontend.directive.IDirectiveHandler;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;
import org.lolmark.compiler.frontend.parser.Parser;
import org.lolmark.compiler.frontend.parser.ParsingContext;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * Handler for the <code>#I HAZ</code> directive.
 * The syntax is <code>#I HAZ &lt;name&gt;</code>.
 */
public class VariableDeclarationDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token start = context.advance(); // consume #I HAZ
        if (!context.check(TokenType.VAR_DEF)) {
            throw context.error("Expected variable name after #I HAZ");
        }
        String name = context.advance().text();
        ((Parser) context).notePendingDeclaration(name);
        return new VariableDeclarationNode(start, name);
    }
}
