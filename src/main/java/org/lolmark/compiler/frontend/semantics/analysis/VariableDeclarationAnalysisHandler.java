package org.lolmark.compiler.frontend.semantics.analysis;

import org.lolmark.compiler.diagnostics.Diagnostic;
import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.parser.features.variable.VariableDeclarationNode;
import org.lolmark.compiler.frontend.semantics.Symbol;
import org.lolmark.compiler.frontend.semantics.SymbolTable;

/**
 * Declares variables in the innermost scope and rejects duplicates within that scope.
 * Shadowing a variable of an enclosing scope is allowed.
 */
public class VariableDeclarationAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        VariableDeclarationNode declaration = (VariableDeclarationNode) node;
        if (symbolTable.isDeclaredInCurrentScope(declaration.name())) {
            diagnostics.reportError(
                    Diagnostic.Phase.SEMANTIC,
                    "Variable '" + declaration.name() + "' is already declared in this scope",
                    declaration.start());
            return;
        }
        symbolTable.define(Symbol.declared(declaration.name(), declaration.start()));
    }
}
