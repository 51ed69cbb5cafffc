package org.lolmark.compiler.frontend;

import org.lolmark.compiler.diagnostics.CompilerAbortException;
import org.lolmark.compiler.diagnostics.Diagnostic;
import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.lexer.Lexer;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer classifies hashtag words, keywords, identifiers and text,
 * tracks source positions, and skips comments.
 */
public class LexerTest {

    private List<Token> scan(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        assertThat(diagnostics.hasErrors()).isFalse();
        return tokens;
    }

    /**
     * Verifies types, texts and positions of a small document header.
     */
    @Test
    @Tag("unit")
    void testTokenizesHeaderWithPositions() {
        List<Token> tokens = scan("#HAI\n#MAEK HEAD\n");

        assertThat(tokens)
                .extracting(Token::type, Token::text, Token::line, Token::column)
                .containsExactly(
                        tuple(TokenType.HASH_WORD, "#HAI", 1, 1),
                        tuple(TokenType.NEWLINE, "\n", 1, 5),
                        tuple(TokenType.HASH_WORD, "#MAEK", 2, 1),
                        tuple(TokenType.KEYWORD, "HEAD", 2, 7),
                        tuple(TokenType.NEWLINE, "\n", 2, 11),
                        tuple(TokenType.END_OF_FILE, "", 3, 1));
    }

    @Test
    @Tag("unit")
    void testMergesTwoWordHashtagsCaseInsensitively() {
        List<Token> tokens = scan("#i haz name #It Iz value #MKAY #lemme see name #mkay");

        assertThat(tokens)
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.HASH_WORD, "#I HAZ"),
                        tuple(TokenType.VAR_DEF, "name"),
                        tuple(TokenType.HASH_WORD, "#IT IZ"),
                        tuple(TokenType.VAR_DEF, "value"),
                        tuple(TokenType.HASH_WORD, "#MKAY"),
                        tuple(TokenType.HASH_WORD, "#LEMME SEE"),
                        tuple(TokenType.VAR_DEF, "name"),
                        tuple(TokenType.HASH_WORD, "#MKAY"),
                        tuple(TokenType.END_OF_FILE, ""));
        assertThat(tokens.get(1).column()).isEqualTo(8);
    }

    @Test
    @Tag("unit")
    void testKeywordsAreUppercasedAndIdentifiersKeepTheirCase() {
        List<Token> tokens = scan("title myVar Item2");

        assertThat(tokens)
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.KEYWORD, "TITLE"),
                        tuple(TokenType.VAR_DEF, "myVar"),
                        tuple(TokenType.VAR_DEF, "Item2"),
                        tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Text runs end at a newline or a <code>#</code> and are trimmed.
     */
    @Test
    @Tag("unit")
    void testTextRunsAreTrimmed() {
        List<Token> tokens = scan("#GIMMEH BOLD   42 apples, 3 pears   #MKAY");

        assertThat(tokens)
                .extracting(Token::type, Token::text)
                .containsExactly(
                        tuple(TokenType.HASH_WORD, "#GIMMEH"),
                        tuple(TokenType.KEYWORD, "BOLD"),
                        tuple(TokenType.TEXT, "42 apples, 3 pears"),
                        tuple(TokenType.HASH_WORD, "#MKAY"),
                        tuple(TokenType.END_OF_FILE, ""));
    }

    @Test
    @Tag("unit")
    void testCarriageReturnsDoNotProduceTokens() {
        List<Token> tokens = scan("#HAI\r\n#KTHXBYE\r\n");

        assertThat(tokens)
                .extracting(Token::type)
                .containsExactly(TokenType.HASH_WORD, TokenType.NEWLINE, TokenType.HASH_WORD, TokenType.NEWLINE, TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testColumnsCountCodePoints() {
        List<Token> tokens = scan("😀 #HAI");

        assertThat(tokens.get(0)).extracting(Token::type, Token::text).containsExactly(TokenType.TEXT, "😀");
        assertThat(tokens.get(1)).extracting(Token::text, Token::column).containsExactly("#HAI", 3);
    }

    /**
     * A well-formed comment between two tokens must leave the token sequence unchanged,
     * even when the comment contains hashtags that would otherwise be errors.
     */
    @Test
    @Tag("unit")
    void testCommentsAreInvisibleToTheTokenSequence() {
        List<Token> plain = scan("#HAI #KTHXBYE");
        List<Token> commented = scan("#HAI #OBTW anything #GIMMEH #nonsense goes\nhere #tldr #KTHXBYE");

        assertThat(commented)
                .extracting(Token::type, Token::text)
                .containsExactlyElementsOf(plain.stream().map(t -> tuple(t.type(), t.text())).toList());
    }

    @Test
    @Tag("unit")
    void testPositionsAfterCommentReflectSource() {
        List<Token> tokens = scan("#OBTW one\ntwo #TLDR\n#HAI");

        assertThat(tokens.get(0)).extracting(Token::type, Token::line, Token::column).containsExactly(TokenType.NEWLINE, 2, 10);
        assertThat(tokens.get(1)).extracting(Token::text, Token::line, Token::column).containsExactly("#HAI", 3, 1);
    }

    @Test
    @Tag("unit")
    void testEndOfFileIsRepeatedForever() {
        Lexer lexer = new Lexer("", new DiagnosticsEngine());

        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.END_OF_FILE);
    }

    /**
     * Verifies that an unknown hashtag is a fatal error reported at the position of the <code>#</code>.
     */
    @Test
    @Tag("unit")
    void testUnknownHashtagIsFatalAtHashPosition() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("#HAI\n  #FOO bar", diagnostics, "page.lol");

        assertThatThrownBy(lexer::scanTokens).isInstanceOf(CompilerAbortException.class);

        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::phase, Diagnostic::message, Diagnostic::fileName, Diagnostic::lineNumber, Diagnostic::columnNumber)
                .containsExactly(tuple(Diagnostic.Phase.LEXICAL, "Unrecognized hashtag word '#FOO'", "page.lol", 2, 3));
    }

    /**
     * The two-word lookahead does not backtrack: <code>#I</code> followed by a word other than
     * <code>HAZ</code> is looked up as <code>#I</code> alone.
     */
    @Test
    @Tag("unit")
    void testTwoWordLookaheadDoesNotBacktrack() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("#I MKAY", diagnostics);

        assertThatThrownBy(lexer::scanTokens).isInstanceOf(CompilerAbortException.class);
        assertThat(diagnostics.getDiagnostics().get(0).message()).isEqualTo("Unrecognized hashtag word '#I'");
    }

    /**
     * An unclosed comment is reported where the input ends, not where the comment started.
     */
    @Test
    @Tag("unit")
    void testUnclosedCommentIsFatalAtEndOfInput() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("#HAI\n#OBTW this has no closing tag", diagnostics);

        assertThatThrownBy(lexer::scanTokens)
                .isInstanceOf(CompilerAbortException.class)
                .hasMessage("Lexical error at line 2, col 30: Unclosed comment block - missing #TLDR");
    }

    @Test
    @Tag("unit")
    void testUnclosedMultiLineCommentIsReportedOnLastLine() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer("#OBTW first\nsecond\n", diagnostics);

        assertThatThrownBy(lexer::scanTokens).isInstanceOf(CompilerAbortException.class);
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::lineNumber, Diagnostic::columnNumber)
                .containsExactly(tuple(3, 1));
    }
}
