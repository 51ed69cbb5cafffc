package org.lolmark.compiler.frontend.lexer;

import org.lolmark.compiler.diagnostics.Diagnostic;
import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the source text into tokens.
 * <p>
 * Tokens are produced on demand through {@link #nextToken()}, so the parser pulls exactly one
 * token at a time. Comments (<code>#OBTW</code> ... <code>#TLDR</code>) and blank text runs are
 * skipped and never reach the caller. Lexical errors are fatal: they are reported to the
 * {@link DiagnosticsEngine} and abort the phase.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    /** First words of the two-word hashtag words, mapped to the only second word they accept. */
    private static final Map<String, String> TWO_WORD_PREFIXES = Map.of(
            "I", "HAZ",
            "IT", "IZ",
            "LEMME", "SEE"
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Tokenizes the remaining input.
     * @return All remaining tokens, the last one being {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        LOG.debug("Scanned {} tokens from {}", tokens.size(), logicalFileName);
        return tokens;
    }

    /**
     * Produces the next token. Once the input is exhausted every call returns
     * {@link TokenType#END_OF_FILE}.
     * @return The next token.
     */
    public Token nextToken() {
        while (true) {
            // Spaces and tabs separate tokens; newlines are tokens of their own.
            while (peek() == ' ' || peek() == '\t') {
                advance();
            }

            int startLine = line;
            int startColumn = column;

            if (isAtEnd()) {
                return token(TokenType.END_OF_FILE, "", startLine, startColumn);
            }

            int c = peek();
            if (c == '\n') {
                advance();
                return token(TokenType.NEWLINE, "\n", startLine, startColumn);
            }
            if (c == '#') {
                Token hashWord = hashWord(startLine, startColumn);
                if (hashWord != null) {
                    return hashWord;
                }
                continue; // a comment was skipped
            }
            if (isAlpha(c)) {
                return word(startLine, startColumn);
            }
            Token text = textLine(startLine, startColumn);
            if (text != null) {
                return text;
            }
        }
    }

    /**
     * Reads a hashtag word. The lookahead for two-word forms is greedy: when the second word does
     * not complete a known pair, the consumed space and word stay consumed and only the first word
     * is looked up.
     *
     * @return The hashtag token, or {@code null} if a comment block was skipped.
     */
    private Token hashWord(int startLine, int startColumn) {
        advance(); // consume '#'
        String first = alphabeticWord().toUpperCase(Locale.ROOT);
        String word = first;

        String expectedSecond = TWO_WORD_PREFIXES.get(first);
        if (expectedSecond != null && peek() == ' ') {
            advance();
            String second = alphabeticWord().toUpperCase(Locale.ROOT);
            if (expectedSecond.equals(second)) {
                word = first + " " + second;
            }
        }

        final String lookup = word;
        HashWord hashWord = HashWord.fromWord(lookup).orElseThrow(() -> diagnostics.fatal(
                Diagnostic.Phase.LEXICAL,
                "Unrecognized hashtag word '#" + lookup + "'",
                logicalFileName, startLine, startColumn));

        if (hashWord == HashWord.OBTW) {
            skipComment();
            return null;
        }
        return token(TokenType.HASH_WORD, hashWord.lexeme(), startLine, startColumn);
    }

    /**
     * Skips a comment body up to and including its closing <code>#TLDR</code>.
     * An unclosed comment is reported at the end of the input.
     */
    private void skipComment() {
        while (true) {
            if (isAtEnd()) {
                throw diagnostics.fatal(
                        Diagnostic.Phase.LEXICAL,
                        "Unclosed comment block - missing #TLDR",
                        logicalFileName, line, column);
            }
            if (peek() == '#') {
                advance();
                if (HashWord.TLDR.word().equals(alphabeticWord().toUpperCase(Locale.ROOT))) {
                    return;
                }
            } else {
                advance();
            }
        }
    }

    private Token word(int startLine, int startColumn) {
        int start = current;
        while (isAlphaNumeric(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        String upper = text.toUpperCase(Locale.ROOT);

        if (Keyword.fromWord(upper).isPresent()) {
            return token(TokenType.KEYWORD, upper, startLine, startColumn);
        }
        return token(TokenType.VAR_DEF, text, startLine, startColumn);
    }

    /**
     * Reads plain text up to the next newline or <code>#</code>.
     * @return The trimmed text token, or {@code null} if the run was blank.
     */
    private Token textLine(int startLine, int startColumn) {
        int start = current;
        while (!isAtEnd() && peek() != '\n' && peek() != '#') {
            advance();
        }
        String trimmed = source.substring(start, current).strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        return token(TokenType.TEXT, trimmed, startLine, startColumn);
    }

    private String alphabeticWord() {
        int start = current;
        while (isAlpha(peek())) {
            advance();
        }
        return source.substring(start, current);
    }

    private Token token(TokenType type, String text, int tokenLine, int tokenColumn) {
        return new Token(type, text, tokenLine, tokenColumn, logicalFileName);
    }

    private int advance() {
        int c = source.codePointAt(current);
        current += Character.charCount(c);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private int peek() {
        if (isAtEnd()) return -1;
        return source.codePointAt(current);
    }

    private boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isAlphaNumeric(int c) {
        return isAlpha(c) || (c >= '0' && c <= '9');
    }
}
