package org.lolmark.compiler.api;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.ProgramNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface for the LOLCODE-markdown compiler.
 * <p>
 * Each method runs the pipeline up to a given stage. Every call starts from a clean state.
 */
public interface ICompiler {

    /**
     * Runs the lexer only.
     *
     * @param source The source text.
     * @param programName A name for the program, used in diagnostics.
     * @return All tokens, ending with {@code END_OF_FILE}.
     * @throws CompilationException if the source contains a lexical error.
     */
    List<Token> tokenize(String source, String programName) throws CompilationException;

    /**
     * Runs the lexer and the parser.
     *
     * @param source The source text.
     * @param programName A name for the program, used in diagnostics.
     * @return The syntax tree.
     * @throws CompilationException on a lexical or syntax error.
     */
    ProgramNode parse(String source, String programName) throws CompilationException;

    /**
     * Runs the semantic analysis on an already parsed tree.
     *
     * @param program The tree returned by {@link #parse(String, String)}.
     * @throws CompilationException listing every semantic error, if any was found.
     */
    void analyze(ProgramNode program) throws CompilationException;

    /**
     * Generates the HTML document for a tree that passed {@link #analyze(ProgramNode)}.
     *
     * @param program The validated tree.
     * @param programName A name for the program, carried into the artifact.
     * @return An {@link HtmlArtifact} holding the generated document.
     */
    HtmlArtifact generate(ProgramNode program, String programName);

    /**
     * Runs the lexer, the parser and the semantic analysis.
     *
     * @param source The source text.
     * @param programName A name for the program, used in diagnostics.
     * @return The validated syntax tree.
     * @throws CompilationException on a lexical or syntax error, or if any semantic error was found.
     */
    ProgramNode check(String source, String programName) throws CompilationException;

    /**
     * Compiles the given source code into an HTML document.
     *
     * @param source The source text.
     * @param programName A name for the program, used in diagnostics.
     * @return An {@link HtmlArtifact} holding the generated document.
     * @throws CompilationException if errors occur during the compilation process.
     */
    HtmlArtifact compile(String source, String programName) throws CompilationException;

    /**
     * Compiles the source code from a file.
     * @param sourcePath The path to the source file.
     * @return An {@link HtmlArtifact} holding the generated document.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default HtmlArtifact compile(Path sourcePath) throws CompilationException, IOException {
        return compile(Files.readString(sourcePath, StandardCharsets.UTF_8), sourcePath.toString());
    }
}
