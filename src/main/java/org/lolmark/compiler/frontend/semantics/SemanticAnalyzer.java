package org.lolmark.compiler.frontend.semantics;

import org.lolmark.compiler.diagnostics.Diagnostic;
import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.parser.ast.ProgramNode;
import org.lolmark.compiler.frontend.parser.features.section.ItemNode;
import org.lolmark.compiler.frontend.parser.features.section.ListSectionNode;
import org.lolmark.compiler.frontend.parser.features.section.ParagrafSectionNode;
import org.lolmark.compiler.frontend.parser.features.variable.VariableAssignmentNode;
import org.lolmark.compiler.frontend.parser.features.variable.VariableDeclarationNode;
import org.lolmark.compiler.frontend.parser.features.variable.VariableReferenceNode;
import org.lolmark.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.lolmark.compiler.frontend.semantics.analysis.ScopeAnalysisHandler;
import org.lolmark.compiler.frontend.semantics.analysis.VariableAssignmentAnalysisHandler;
import org.lolmark.compiler.frontend.semantics.analysis.VariableDeclarationAnalysisHandler;
import org.lolmark.compiler.frontend.semantics.analysis.VariableReferenceAnalysisHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Performs semantic analysis on the AST: scope-aware checking of variable declarations,
 * assignments and references.
 * <p>
 * It operates by traversing the AST in source order and dispatching nodes to specific handlers.
 * Unlike lexical and syntax errors, semantic errors do not stop the traversal; all of them are
 * collected in the {@link DiagnosticsEngine}.
 */
public class SemanticAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

    /** Nodes whose content is rendered but not validated. */
    private static final Set<Class<? extends AstNode>> UNCHECKED_CONTENT = Set.of(ItemNode.class);

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param symbolTable The symbol table to use for analysis.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, SymbolTable symbolTable) {
        this.diagnostics = diagnostics;
        this.symbolTable = symbolTable;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        ScopeAnalysisHandler scopeHandler = new ScopeAnalysisHandler();
        handlers.put(ParagrafSectionNode.class, scopeHandler);
        handlers.put(ListSectionNode.class, scopeHandler);
        handlers.put(VariableDeclarationNode.class, new VariableDeclarationAnalysisHandler());
        handlers.put(VariableAssignmentNode.class, new VariableAssignmentAnalysisHandler());
        handlers.put(VariableReferenceNode.class, new VariableReferenceAnalysisHandler());
    }

    /**
     * Analyzes the given program.
     * This is the main entry point for the semantic analysis phase.
     * @param program The root of the tree.
     * @return The semantic errors found, in source order. Empty if the program is valid.
     */
    public List<Diagnostic> analyze(ProgramNode program) {
        traverseAndAnalyze(program.getChildren());

        List<Diagnostic> errors = diagnostics.getDiagnostics().stream()
                .filter(d -> d.phase() == Diagnostic.Phase.SEMANTIC)
                .toList();
        LOG.debug("Semantic analysis finished with {} error(s)", errors.size());
        return errors;
    }

    private void traverseAndAnalyze(List<AstNode> nodes) {
        for (AstNode node : nodes) {
            IAnalysisHandler handler = handlers.get(node.getClass());
            if (handler != null) {
                handler.analyze(node, symbolTable, diagnostics);
            }
            if (!UNCHECKED_CONTENT.contains(node.getClass())) {
                traverseAndAnalyze(node.getChildren());
            }
            if (handler instanceof ScopeAnalysisHandler scopeHandler) {
                scopeHandler.afterChildren(symbolTable);
            }
        }
    }
}
