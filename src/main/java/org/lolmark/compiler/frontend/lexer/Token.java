package org.lolmark.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The token text. Hashtag words carry their leading <code>#</code> and a normalized
 *             single space (<code>"#I HAZ"</code>), keywords are uppercased, identifiers keep
 *             their original case and text is trimmed.
 * @param line The line number of the token's first character.
 * @param column The column number of the token's first character.
 * @param fileName The logical file name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column,
        String fileName
) {

    /**
     * Checks whether this token is the given hashtag word.
     * @param word The hashtag word to compare with.
     * @return true if this is a {@link TokenType#HASH_WORD} token for {@code word}.
     */
    public boolean is(HashWord word) {
        return type == TokenType.HASH_WORD && word.lexeme().equals(text);
    }

    /**
     * Checks whether this token is the given keyword.
     * @param keyword The keyword to compare with.
     * @return true if this is a {@link TokenType#KEYWORD} token for {@code keyword}.
     */
    public boolean is(Keyword keyword) {
        return type == TokenType.KEYWORD && keyword.name().equals(text);
    }

    /**
     * Describes the token for diagnostics, e.g. <code>HASH_WORD '#MKAY'</code>.
     * @return A short description of type and text.
     */
    public String describe() {
        return switch (type) {
            case NEWLINE, END_OF_FILE -> type.name();
            default -> type.name() + " '" + text + "'";
        };
    }
}
