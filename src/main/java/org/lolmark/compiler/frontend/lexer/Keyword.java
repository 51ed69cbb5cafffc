package org.lolmark.compiler.frontend.lexer;

import java.util.Optional;

/**
 * The closed set of bare reserved words naming section and style kinds.
 */
public enum Keyword {
    HEAD,
    TITLE,
    PARAGRAF,
    BOLD,
    ITALICS,
    LIST,
    ITEM,
    NEWLINE,
    SOUNDZ,
    VIDZ;

    /**
     * Looks up a keyword by its uppercased spelling.
     * @param upperWord The uppercased word.
     * @return The matching keyword, if any.
     */
    public static Optional<Keyword> fromWord(String upperWord) {
        for (Keyword keyword : values()) {
            if (keyword.name().equals(upperWord)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }
}
