package org.lolmark.compiler.frontend.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of <code>#</code>-prefixed words that structure a document.
 */
public enum HashWord {
    HAI("HAI"),
    KTHXBYE("KTHXBYE"),
    OBTW("OBTW"),
    TLDR("TLDR"),
    MAEK("MAEK"),
    OIC("OIC"),
    GIMMEH("GIMMEH"),
    MKAY("MKAY"),
    I_HAZ("I HAZ"),
    IT_IZ("IT IZ"),
    LEMME_SEE("LEMME SEE");

    private static final Map<String, HashWord> BY_WORD = Arrays.stream(values())
            .collect(Collectors.toMap(HashWord::word, Function.identity()));

    private final String word;

    HashWord(String word) {
        this.word = word;
    }

    /**
     * @return The word without the leading <code>#</code>, e.g. <code>I HAZ</code>.
     */
    public String word() {
        return word;
    }

    /**
     * @return The token text as produced by the lexer, e.g. <code>#I HAZ</code>.
     */
    public String lexeme() {
        return "#" + word;
    }

    /**
     * Looks up a hashtag word by its uppercased, space-normalized spelling.
     * @param upperWord The word without the leading <code>#</code>.
     * @return The matching hashtag word, if any.
     */
    public static Optional<HashWord> fromWord(String upperWord) {
        return Optional.ofNullable(BY_WORD.get(upperWord));
    }
}
