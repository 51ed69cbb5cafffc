package org.lolmark.compiler.frontend.parser;

import org.lolmark.compiler.diagnostics.CompilerAbortException;
import org.lolmark.compiler.diagnostics.Diagnostic;
import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.directive.DirectiveHandlerRegistry;
import org.lolmark.compiler.frontend.directive.IDirectiveHandler;
import org.lolmark.compiler.frontend.lexer.HashWord;
import org.lolmark.compiler.frontend.lexer.Keyword;
import org.lolmark.compiler.frontend.lexer.Lexer;
import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.lexer.TokenType;
import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.parser.ast.ProgramNode;
import org.lolmark.compiler.frontend.parser.ast.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The main parser for LOLCODE-markdown. It pulls tokens one at a time from the
 * {@link Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Every hashtag construct is parsed by the {@link IDirectiveHandler} registered for its
 * introducing word. Any grammar violation is fatal: it is reported to the
 * {@link DiagnosticsEngine} and parsing stops, so no partial tree is ever returned.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private final DirectiveHandlerRegistry directiveRegistry;
    private Token current;
    private Token previous;

    /** The most recently declared variable that has not been assigned yet. */
    private String pendingDeclaration;

    /**
     * Constructs a new Parser and reads the first token.
     * @param lexer The token source.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
        this.directiveRegistry = DirectiveHandlerRegistry.initialize();
        this.current = lexer.nextToken();
    }

    /**
     * Parses a complete program: <code>#HAI</code> body <code>#KTHXBYE</code>, followed
     * by nothing but newlines.
     * @return The root of the tree.
     */
    public ProgramNode parse() {
        Token start = consume(HashWord.HAI);
        skipNewlines();

        List<AstNode> body = body();

        skipNewlines();
        consume(HashWord.KTHXBYE);
        skipNewlines();
        if (!isAtEnd()) {
            throw error("Unexpected tokens after #KTHXBYE");
        }

        LOG.debug("Parsed program with {} top-level nodes", body.size());
        return new ProgramNode(start, body);
    }

    private List<AstNode> body() {
        List<AstNode> nodes = new ArrayList<>();
        while (true) {
            skipNewlines();
            if (check(HashWord.KTHXBYE) || isAtEnd()) {
                break;
            }

            if (check(HashWord.I_HAZ)) {
                nodes.add(directive());
                skipNewlines();
                if (check(HashWord.IT_IZ)) {
                    nodes.add(directive());
                }
                continue;
            }

            // Outside a declaration an assignment is not a construct of its own.
            Optional<IDirectiveHandler> handler = check(HashWord.IT_IZ)
                    ? Optional.empty()
                    : directiveRegistry.get(peek());
            if (handler.isPresent()) {
                nodes.add(handler.get().parse(this));
            } else if (match(TokenType.TEXT, TokenType.VAR_DEF)) {
                nodes.add(TextNode.of(previous()));
            } else {
                LOG.debug("Ignoring stray {} at line {}", peek().describe(), peek().line());
                advance();
            }
        }
        return nodes;
    }

    /**
     * Parses one element of a paragraph: a hashtag construct or a piece of text.
     * @return The parsed node.
     */
    public AstNode paragrafContent() {
        Token token = peek();
        if (token.type() == TokenType.HASH_WORD) {
            return directiveRegistry.get(token)
                    .orElseThrow(() -> error("Unexpected hashword in paragraf: " + token.text()))
                    .parse(this);
        }
        if (match(TokenType.TEXT, TokenType.VAR_DEF)) {
            return TextNode.of(previous());
        }
        throw error("Unexpected token in paragraf content");
    }

    /**
     * Parses the content of a bold, italics or list item construct: text, identifiers and
     * variable references. Stops at the first token it cannot absorb without consuming it.
     * @return The parsed nodes in source order.
     */
    public List<AstNode> inlineContent() {
        List<AstNode> content = new ArrayList<>();
        while (true) {
            if (check(HashWord.LEMME_SEE)) {
                content.add(directive());
            } else if (match(TokenType.TEXT, TokenType.VAR_DEF)) {
                content.add(TextNode.of(previous()));
            } else {
                return content;
            }
        }
    }

    private AstNode directive() {
        Token token = peek();
        IDirectiveHandler handler = directiveRegistry.get(token)
                .orElseThrow(() -> new IllegalStateException("No handler registered for " + token.text()));
        return handler.parse(this);
    }

    /**
     * Records a declaration as the target of the next assignment.
     * @param name The declared name.
     */
    public void notePendingDeclaration(String name) {
        pendingDeclaration = name;
    }

    /**
     * Returns and clears the name the next assignment binds to.
     * @return The pending declaration, or {@code null} if there is none.
     */
    public String takePendingDeclaration() {
        String name = pendingDeclaration;
        pendingDeclaration = null;
        return name;
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return current.type() == type;
    }

    @Override
    public boolean check(HashWord word) {
        return current.is(word);
    }

    @Override
    public boolean check(Keyword keyword) {
        return current.is(keyword);
    }

    @Override
    public Token advance() {
        previous = current;
        if (!isAtEnd()) {
            current = lexer.nextToken();
        }
        return previous;
    }

    @Override
    public Token peek() {
        return current;
    }

    @Override
    public Token previous() {
        return previous;
    }

    @Override
    public Token consume(HashWord word) {
        if (check(word)) return advance();
        throw error("Expected '" + word.lexeme() + "' but found " + current.describe());
    }

    @Override
    public Token consume(Keyword keyword) {
        if (check(keyword)) return advance();
        throw error("Expected keyword '" + keyword.name() + "' but found " + current.describe());
    }

    @Override
    public void skipNewlines() {
        while (check(TokenType.NEWLINE)) {
            advance();
        }
    }

    @Override
    public CompilerAbortException error(String message) {
        return diagnostics.fatal(Diagnostic.Phase.SYNTAX, message, current);
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return current.type() == TokenType.END_OF_FILE;
    }
}
