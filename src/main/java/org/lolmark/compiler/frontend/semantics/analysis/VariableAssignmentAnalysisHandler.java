package org.lolmark.compiler.frontend.semantics.analysis;

import org.lolmark.compiler.diagnostics.Diagnostic;
import org.lolmark.compiler.diagnostics.DiagnosticsEngine;
import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.parser.features.variable.VariableAssignmentNode;
import org.lolmark.compiler.frontend.semantics.SymbolTable;

/**
 * Binds assignment values to their target declaration.
 * An assignment without a pending declaration is ignored.
 */
public class VariableAssignmentAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        VariableAssignmentNode assignment = (VariableAssignmentNode) node;
        if (!assignment.hasTarget()) {
            return;
        }
        // The target may have been declared in a section that is already closed.
        if (!symbolTable.assign(assignment.target(), assignment.value())) {
            diagnostics.reportError(
                    Diagnostic.Phase.SEMANTIC,
                    "Cannot assign to undeclared variable '" + assignment.target() + "'",
                    assignment.start());
        }
    }
}
