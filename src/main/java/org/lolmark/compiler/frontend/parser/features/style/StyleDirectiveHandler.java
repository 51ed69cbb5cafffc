package org.lolmark.compiler.frontend.parser.features.style;

import org.lolmark.compiler.frontend.directive.IDirectiveHandler;
import org.lolmark.compiler.frontend.lexer.HashWord;
import org.lolmark.compiler.frontend.lexer.Keyword;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;
import org.lolmark.compiler.frontend.parser.Parser;
import org.lolmark.compiler.frontend.parser.ParsingContext;
import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.parser.ast.NewlineNode;

import java.util.List;

/**
 * Handler for the <code>#GIMMEH</code> directive outside of head and list sections.
 * <ul>
 *     <li><code>#GIMMEH NEWLINE</code> - a line break, no closing <code>#MKAY</code>.</li>
 *     <li><code>#GIMMEH BOLD|ITALICS ... #MKAY</code> - styled inline content.</li>
 *     <li><code>#GIMMEH SOUNDZ|VIDZ url #MKAY</code> - embedded media.</li>
 * </ul>
 */
public class StyleDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token start = context.advance(); // consume #GIMMEH

        Token style = context.peek();
        if (style.type() != TokenType.KEYWORD) {
            throw context.error("Expected style keyword after #GIMMEH");
        }

        if (style.is(Keyword.NEWLINE)) {
            context.advance();
            return new NewlineNode(start);
        }

        if (style.is(Keyword.SOUNDZ) || style.is(Keyword.VIDZ)) {
            context.advance();
            String url = url(context);
            context.consume(HashWord.MKAY);
            return style.is(Keyword.SOUNDZ) ? new SoundNode(start, url) : new VideoNode(start, url);
        }

        if (style.is(Keyword.BOLD) || style.is(Keyword.ITALICS)) {
            context.advance();
            List<AstNode> content = ((Parser) context).inlineContent();
            context.consume(HashWord.MKAY);
            return style.is(Keyword.BOLD) ? new BoldNode(start, content) : new ItalicsNode(start, content);
        }

        throw context.error("Unexpected style '" + style.text() + "' after #GIMMEH");
    }

    /**
     * The lexer splits a URL at its first non-letter, so the pieces are joined back
     * without separators. Newlines inside the URL are dropped.
     */
    private String url(ParsingContext context) {
        StringBuilder url = new StringBuilder();
        while (true) {
            if (context.match(TokenType.TEXT, TokenType.VAR_DEF)) {
                url.append(context.previous().text());
            } else if (!context.match(TokenType.NEWLINE)) {
                return url.toString().strip();
            }
        }
    }
}
