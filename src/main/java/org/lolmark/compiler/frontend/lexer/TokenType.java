package org.lolmark.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A <code>#</code>-prefixed reserved word such as <code>#HAI</code> or <code>#I HAZ</code>. */
    HASH_WORD,
    /** A bare reserved word such as <code>HEAD</code> or <code>BOLD</code>. */
    KEYWORD,
    /** Trimmed free-form content (numbers, punctuation, anything not starting with a letter). */
    TEXT,
    /** An identifier that is not a reserved word. */
    VAR_DEF,
    /** A newline character. */
    NEWLINE,
    /** Represents the end of the source file. */
    END_OF_FILE
}
