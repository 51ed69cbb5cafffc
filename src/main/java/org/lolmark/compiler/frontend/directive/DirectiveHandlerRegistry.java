package org.lolmark.compiler.frontend.directive;

import org.lolmark.compiler.frontend.lexer.HashWord;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;
import org.lolmark.compiler.frontend.parser.features.section.SectionDirectiveHandler;
import org.lolmark.compiler.frontend.parser.features.style.StyleDirectiveHandler;
import org.lolmark.compiler.frontend.parser.features.variable.VariableAssignmentDirectiveHandler;
import org.lolmark.compiler.frontend.parser.features.variable.VariableDeclarationDirectiveHandler;
import org.lolmark.compiler.frontend.parser.features.variable.VariableReferenceDirectiveHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for directive handlers. This class holds a map of hashtag words
 * to the handlers that parse the constructs they introduce.
 */
public class DirectiveHandlerRegistry {
    private final Map<HashWord, IDirectiveHandler> handlers = new EnumMap<>(HashWord.class);

    /**
     * Registers a new directive handler.
     * @param word The hashtag word that introduces the construct.
     * @param handler The handler for the construct.
     */
    public void register(HashWord word, IDirectiveHandler handler) {
        handlers.put(word, handler);
    }

    /**
     * Gets the handler for a given hashtag word.
     * @param word The hashtag word.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IDirectiveHandler> get(HashWord word) {
        return Optional.ofNullable(handlers.get(word));
    }

    /**
     * Gets the handler for the construct the given token starts.
     * @param token Any token.
     * @return The handler, or empty if the token is not a hashtag word that starts a construct.
     */
    public Optional<IDirectiveHandler> get(Token token) {
        if (token.type() != TokenType.HASH_WORD) {
            return Optional.empty();
        }
        return HashWord.fromWord(token.text().substring(1)).flatMap(this::get);
    }

    /**
     * Initializes the directive handler registry with all the built-in handlers.
     * @return A new instance of {@link DirectiveHandlerRegistry} with all handlers registered.
     */
    public static DirectiveHandlerRegistry initialize() {
        DirectiveHandlerRegistry registry = new DirectiveHandlerRegistry();
        registry.register(HashWord.MAEK, new SectionDirectiveHandler());
        registry.register(HashWord.I_HAZ, new VariableDeclarationDirectiveHandler());
        registry.register(HashWord.IT_IZ, new VariableAssignmentDirectiveHandler());
        registry.register(HashWord.LEMME_SEE, new VariableReferenceDirectiveHandler());
        registry.register(HashWord.GIMMEH, new StyleDirectiveHandler());
        return registry;
    }
}
