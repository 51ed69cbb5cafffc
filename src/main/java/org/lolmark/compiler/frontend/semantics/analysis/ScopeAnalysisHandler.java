package org.lolmark.compiler.frontend.semantics.analysis;

import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.semantics.SymbolTable;

/**
 * Handles the semantic analysis of scope-defining nodes (paragraf and list sections).
 * It manages entering and leaving scopes in the symbol table.
 */
public class ScopeAnalysisHandler implements IAnalysisHandler {

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.enterScope();
    }

    /**
     * Special method that is called AFTER the children of a scope have been analyzed.
     * @param symbolTable The symbol table to use.
     */
    public void afterChildren(SymbolTable symbolTable) {
        symbolTable.leaveScope();
    }
}
