package org.lolmark.compiler;

import org.lolmark.compiler.api.CompilationException;
import org.lolmark.compiler.api.HtmlArtifact;
import org.lolmark.compiler.diagnostics.Diagnostic;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;
import org.lolmark.compiler.frontend.parser.ast.ProgramNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * End-to-end tests for the {@link Compiler}: complete documents go in, HTML or diagnostics come out.
 */
public class CompilerTest {

    private final Compiler compiler = new Compiler();

    @Test
    @Tag("unit")
    void testHeadTitleIsRendered() throws Exception {
        HtmlArtifact artifact = compiler.compile(
                "#HAI\n#MAEK HEAD\n#GIMMEH TITLE My Page #MKAY\n#OIC\n#KTHXBYE\n", "page.lol");

        assertThat(artifact.programName()).isEqualTo("page.lol");
        assertThat(artifact.html()).contains("<h1>My Page</h1>");
    }

    @Test
    @Tag("unit")
    void testVariableValueIsSubstituted() throws Exception {
        String source = "#HAI\n#MAEK PARAGRAF\n#I HAZ x\n#IT IZ hello #MKAY\n#LEMME SEE x #MKAY\n#OIC\n#KTHXBYE\n";

        assertThat(compiler.compile(source, "page.lol").html()).contains("<body>\n<p>\nhello </p>\n</body>");
    }

    /**
     * Verifies the diagnostic and its rendering for a reference to an undeclared variable.
     */
    @Test
    @Tag("unit")
    void testUndeclaredVariableFailsWithSingleError() {
        String source = "#HAI\n#MAEK PARAGRAF\n#LEMME SEE y #MKAY\n#OIC\n#KTHXBYE\n";

        CompilationException e = catchThrowableOfType(() -> compiler.compile(source, "page.lol"), CompilationException.class);

        assertThat(e.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("Variable 'y' is used but never declared");
        assertThat(e.getMessage()).isEqualTo("Semantic error at line 3, col 1: Variable 'y' is used but never declared");
    }

    @Test
    @Tag("unit")
    void testUnclosedCommentIsLexicalError() {
        CompilationException e = catchThrowableOfType(
                () -> compiler.compile("#HAI\n#OBTW this has no closing tag", "page.lol"), CompilationException.class);

        assertThat(e.getDiagnostics()).singleElement()
                .extracting(Diagnostic::phase)
                .isEqualTo(Diagnostic.Phase.LEXICAL);
        assertThat(e.getMessage()).isEqualTo("Lexical error at line 2, col 30: Unclosed comment block - missing #TLDR");
    }

    @Test
    @Tag("unit")
    void testListItemsKeepSourceOrder() throws Exception {
        String source = "#HAI\n#MAEK LIST\n#GIMMEH ITEM one #MKAY\n#GIMMEH ITEM two #MKAY\n#OIC\n#KTHXBYE\n";

        assertThat(compiler.compile(source, "list.lol").html())
                .contains("<ul>\n<li>one </li>\n<li>two </li>\n</ul>\n");
    }

    @Test
    @Tag("unit")
    void testSyntaxErrorIsReported() {
        assertThatThrownBy(() -> compiler.compile("#HAI\n#MAEK BOLD\n#OIC\n#KTHXBYE\n", "page.lol"))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Syntax error at line 2, col 7: Unknown section type 'BOLD'");
    }

    /**
     * All semantic errors are reported together, one per line of the message.
     */
    @Test
    @Tag("unit")
    void testAllSemanticErrorsAreReported() {
        String source = """
                #HAI
                #MAEK PARAGRAF
                #LEMME SEE a #MKAY
                #I HAZ b
                #IT IZ one #MKAY
                #I HAZ b
                #OIC
                #KTHXBYE
                """;

        CompilationException e = catchThrowableOfType(() -> compiler.compile(source, "page.lol"), CompilationException.class);

        assertThat(e.getDiagnostics()).hasSize(2);
        assertThat(e.getMessage()).isEqualTo(
                "Semantic error at line 3, col 1: Variable 'a' is used but never declared\n"
                        + "Semantic error at line 6, col 1: Variable 'b' is already declared in this scope");
    }

    /**
     * Inserting a well-formed comment between tokens does not change the generated document.
     */
    @Test
    @Tag("unit")
    void testCommentsDoNotChangeOutput() throws Exception {
        String plain = "#HAI\n#MAEK PARAGRAF\n#I HAZ x\n#IT IZ hi #MKAY\n#LEMME SEE x #MKAY\n#OIC\n#KTHXBYE\n";
        String commented = "#HAI\n#MAEK PARAGRAF #OBTW explains #LEMME SEE nothing #TLDR\n#I HAZ x\n"
                + "#IT IZ hi #OBTW note #TLDR #MKAY\n#LEMME SEE x #MKAY\n#OIC\n#KTHXBYE\n";

        assertThat(compiler.compile(commented, "b.lol").html()).isEqualTo(compiler.compile(plain, "a.lol").html());
    }

    @Test
    @Tag("unit")
    void testCompilationIsRepeatable() throws Exception {
        String source = "#HAI\n#I HAZ g\n#IT IZ global #MKAY\n#MAEK PARAGRAF\n#LEMME SEE g #MKAY\n#OIC\n#KTHXBYE\n";

        HtmlArtifact first = compiler.compile(source, "page.lol");
        HtmlArtifact second = compiler.compile(source, "page.lol");

        assertThat(second.html()).isEqualTo(first.html()).contains("<p>\nglobal </p>\n");
    }

    @Test
    @Tag("unit")
    void testCustomDocumentTitle() throws Exception {
        HtmlArtifact artifact = new Compiler("My Site").compile("#HAI\n#KTHXBYE\n", "page.lol");

        assertThat(artifact.html()).contains("<title>My Site</title>");
    }

    @Test
    @Tag("unit")
    void testTokenizeEndsWithEndOfFile() throws Exception {
        List<Token> tokens = compiler.tokenize("#HAI #KTHXBYE", "page.lol");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.HASH_WORD, TokenType.HASH_WORD, TokenType.END_OF_FILE);
        assertThat(tokens.get(0).fileName()).isEqualTo("page.lol");
    }

    @Test
    @Tag("unit")
    void testCheckReturnsValidatedTree() throws Exception {
        ProgramNode program = compiler.check("#HAI\n#MAEK PARAGRAF text #OIC\n#KTHXBYE\n", "page.lol");

        assertThat(program.children()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testCompilesFromFile(@TempDir Path dir) throws Exception {
        Path source = dir.resolve("page.lol");
        Files.writeString(source, "#HAI\n#MAEK HEAD\n#GIMMEH TITLE Ünïcödé #MKAY\n#OIC\n#KTHXBYE\n");

        HtmlArtifact artifact = compiler.compile(source);

        assertThat(artifact.programName()).isEqualTo(source.toString());
        assertThat(artifact.html()).contains("<h1>Ünïcödé</h1>");
    }
}
