package org.lolmark.compiler.frontend.parser.features.section;

import org.lolmark.compiler.frontend.directive.IDirectiveHandler;
import org.lolmark.compiler.frontend.lexer.HashWord;
import org.lolmark.compiler.frontend.lexer.Keyword;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;
import org.lolmark.compiler.frontend.parser.Parser;
import org.lolmark.compiler.frontend.parser.ParsingContext;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for the <code>#MAEK</code> directive.
 * Parses an entire section block up to and including its closing <code>#OIC</code>.
 * The syntax is <code>#MAEK HEAD|PARAGRAF|LIST ... #OIC</code>.
 */
public class SectionDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token start = context.advance(); // consume #MAEK
        context.skipNewlines();

        Token kind = context.peek();
        if (kind.type() != TokenType.KEYWORD) {
            throw context.error("Expected section type after #MAEK");
        }
        if (kind.is(Keyword.HEAD)) {
            return head(context, start);
        }
        if (kind.is(Keyword.PARAGRAF)) {
            return paragraf(context, start);
        }
        if (kind.is(Keyword.LIST)) {
            return list(context, start);
        }
        throw context.error("Unknown section type '" + kind.text() + "'");
    }

    private HeadSectionNode head(ParsingContext context, Token start) {
        context.consume(Keyword.HEAD);
        context.skipNewlines();

        List<AstNode> titles = new ArrayList<>();
        while (context.check(HashWord.GIMMEH)) {
            titles.add(title(context));
            context.skipNewlines();
        }

        context.consume(HashWord.OIC);
        return new HeadSectionNode(start, titles);
    }

    private TitleNode title(ParsingContext context) {
        Token start = context.consume(HashWord.GIMMEH);
        context.consume(Keyword.TITLE);

        List<String> words = new ArrayList<>();
        while (!context.check(HashWord.MKAY)) {
            if (context.match(TokenType.TEXT, TokenType.VAR_DEF)) {
                words.add(context.previous().text());
            } else if (!context.match(TokenType.NEWLINE)) {
                throw context.error("Unexpected token in TITLE: " + context.peek().describe());
            }
        }

        context.consume(HashWord.MKAY);
        return new TitleNode(start, String.join(" ", words).strip());
    }

    private ParagrafSectionNode paragraf(ParsingContext context, Token start) {
        context.consume(Keyword.PARAGRAF);
        context.skipNewlines();

        Parser parser = (Parser) context;
        List<AstNode> children = new ArrayList<>();
        while (!context.check(HashWord.OIC)) {
            children.add(parser.paragrafContent());
            context.skipNewlines();
        }

        context.consume(HashWord.OIC);
        return new ParagrafSectionNode(start, children);
    }

    private ListSectionNode list(ParsingContext context, Token start) {
        context.consume(Keyword.LIST);
        context.skipNewlines();

        Parser parser = (Parser) context;
        List<AstNode> items = new ArrayList<>();
        while (!context.check(HashWord.OIC)) {
            Token itemStart = context.consume(HashWord.GIMMEH);
            context.consume(Keyword.ITEM);
            List<AstNode> content = parser.inlineContent();
            context.consume(HashWord.MKAY);
            items.add(new ItemNode(itemStart, content));
            context.skipNewlines();
        }

        context.consume(HashWord.OIC);
        return new ListSectionNode(start, items);
    }
}
