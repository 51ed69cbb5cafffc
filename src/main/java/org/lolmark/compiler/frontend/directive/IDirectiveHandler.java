package org.lolmark.compiler.frontend.directive;

import org.lolmark.compiler.frontend.parser.ParsingContext;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * The base interface for all directive handlers.
 * Each handler is responsible for parsing the construct introduced by one hashtag word
 * (e.g. <code>#MAEK</code>).
 */
public interface IDirectiveHandler {

    /**
     * Parses the construct. The current token is the introducing hashtag word, which the
     * handler consumes along with everything up to and including the closing hashtag word.
     *
     * @param context The context that provides access to the token stream.
     * @return The AST node for the construct.
     */
    AstNode parse(ParsingContext context);
}
