package org.lolmark.compiler.frontend.parser;

import org.lolmark.compiler.diagnostics.CompilerAbortException;
import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.lexer.HashWord;
import org.lolmark.compiler.frontend.lexer.Keyword;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides directive handlers with access to the token stream and to error reporting
 * without coupling them directly to the parser implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks if the current token is the given hashtag word without consuming it.
     * @param word The hashtag word to check.
     * @return true if the current token is {@code word}.
     */
    boolean check(HashWord word);

    /**
     * Checks if the current token is the given keyword without consuming it.
     * @param keyword The keyword to check.
     * @return true if the current token is {@code keyword}.
     */
    boolean check(Keyword keyword);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is the expected hashtag word, otherwise aborts.
     * @param word The expected hashtag word.
     * @return The consumed token.
     */
    Token consume(HashWord word);

    /**
     * Consumes the current token if it is the expected keyword, otherwise aborts.
     * @param keyword The expected keyword.
     * @return The consumed token.
     */
    Token consume(Keyword keyword);

    /**
     * Skips any number of newline tokens.
     */
    void skipNewlines();

    /**
     * Reports a fatal syntax error at the current token.
     * @param message The error message.
     * @return The exception the caller must throw.
     */
    CompilerAbortException error(String message);

    /**
     * Gets the diagnostics engine for reporting errors.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
