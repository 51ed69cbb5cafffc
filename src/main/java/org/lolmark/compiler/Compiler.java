package org.lolmark.compiler;

import org.lolmark.compiler.api.CompilationException;
import org.lolmark.compiler.api.HtmlArtifact;
import org.lolmark.compiler.api.ICompiler;
import org.lolmark.compiler.backend.html.HtmlConverterRegistry;
import org.lolmark.compiler.backend.html.HtmlGenerator;
import org.lolmark.compiler.diagnostics.CompilerAbortException;
import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.lexer.Lexer;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.Parser;
import org.lolmark.compiler.frontend.parser.ast.ProgramNode;
import org.lolmark.compiler.frontend.semantics.SemanticAnalyzer;
import org.lolmark.compiler.frontend.semantics.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the entire compilation
 * pipeline from source text to an HTML document. It is not thread-safe.
 * <p>
 * Lexical and syntax errors stop the pipeline at the first error. Semantic errors are
 * collected over the whole tree and reported together; generation only runs when there are none.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final String documentTitle;

    /**
     * Creates a compiler that uses the default document title.
     */
    public Compiler() {
        this(HtmlGenerator.DEFAULT_DOCUMENT_TITLE);
    }

    /**
     * @param documentTitle The text of the generated document's <code>&lt;title&gt;</code> element.
     */
    public Compiler(String documentTitle) {
        this.documentTitle = documentTitle;
    }

    @Override
    public List<Token> tokenize(String source, String programName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            return new Lexer(source, diagnostics, programName).scanTokens();
        } catch (CompilerAbortException e) {
            throw failure(diagnostics, e);
        }
    }

    @Override
    public ProgramNode parse(String source, String programName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        // Phase 1 and 2: the parser pulls tokens from the lexer on demand
        try {
            Parser parser = new Parser(new Lexer(source, diagnostics, programName), diagnostics);
            ProgramNode program = parser.parse();
            LOG.debug("Parsed {}", programName);
            return program;
        } catch (CompilerAbortException e) {
            throw failure(diagnostics, e);
        }
    }

    @Override
    public void analyze(ProgramNode program) throws CompilationException {
        // Phase 3: Semantic analysis
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics, new SymbolTable());
        analyzer.analyze(program);
        if (diagnostics.hasErrors()) {
            throw failure(diagnostics, null);
        }
    }

    @Override
    public HtmlArtifact generate(ProgramNode program, String programName) {
        // Phase 4: HTML generation, with a scope stack of its own
        HtmlGenerator generator = new HtmlGenerator(HtmlConverterRegistry.initializeWithDefaults(), documentTitle);
        String html = generator.generate(program);
        LOG.debug("Generated HTML for {}", programName);
        return new HtmlArtifact(programName, html);
    }

    @Override
    public ProgramNode check(String source, String programName) throws CompilationException {
        ProgramNode program = parse(source, programName);
        analyze(program);
        return program;
    }

    @Override
    public HtmlArtifact compile(String source, String programName) throws CompilationException {
        ProgramNode program = check(source, programName);
        HtmlArtifact artifact = generate(program, programName);
        LOG.info("Compiled {}", programName);
        return artifact;
    }

    private CompilationException failure(DiagnosticsEngine diagnostics, Throwable cause) {
        return new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics(), cause);
    }
}
