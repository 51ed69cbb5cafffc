package org.lolmark.compiler.frontend.semantics.analysis;

import org.lolmark.compiler.diagnostics.Diagnostic;
import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.parser.features.variable.VariableReferenceNode;
import org.lolmark.compiler.frontend.semantics.Symbol;
import org.lolmark.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * Checks that every referenced variable is visible and has a value.
 */
public class VariableReferenceAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        VariableReferenceNode reference = (VariableReferenceNode) node;
        Optional<Symbol> symbol = symbolTable.resolve(reference.name());

        if (symbol.isEmpty()) {
            diagnostics.reportError(
                    Diagnostic.Phase.SEMANTIC,
                    "Variable '" + reference.name() + "' is used but never declared",
                    reference.start());
        } else if (!symbol.get().isAssigned()) {
            diagnostics.reportError(
                    Diagnostic.Phase.SEMANTIC,
                    "Variable '" + reference.name() + "' is used but never assigned a value",
                    reference.start());
        }
    }
}
