package org.lolmark.compiler.frontend.semantics.analysis;

import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for analyzing a specific type of AST node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single AST node. Called before the node's children are visited.
     * @param node The node to analyze.
     * @param symbolTable The symbol table for the current scope.
     * @param diagnostics The engine for reporting errors.
     */
    void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
