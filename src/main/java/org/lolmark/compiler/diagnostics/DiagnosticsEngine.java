package org.lolmark.compiler.diagnostics;

import org.lolmark.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the diagnostics produced during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic (lexer, parser, analyzer).
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param phase        The phase reporting the error.
     * @param message      The error message.
     * @param fileName     The file in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column number of the error.
     * @return The recorded diagnostic.
     */
    public Diagnostic reportError(Diagnostic.Phase phase, String message, String fileName, int lineNumber, int columnNumber) {
        Diagnostic diagnostic = new Diagnostic(phase, message, fileName, lineNumber, columnNumber);
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    /**
     * Reports an error located at the given token.
     *
     * @param phase   The phase reporting the error.
     * @param message The error message.
     * @param token   The token the error refers to.
     * @return The recorded diagnostic.
     */
    public Diagnostic reportError(Diagnostic.Phase phase, String message, Token token) {
        return reportError(phase, message, token.fileName(), token.line(), token.column());
    }

    /**
     * Reports a fatal error and returns the exception the caller must throw to abort the phase.
     *
     * @param phase   The phase reporting the error.
     * @param message The error message.
     * @param token   The token the error refers to.
     * @return The exception to throw.
     */
    public CompilerAbortException fatal(Diagnostic.Phase phase, String message, Token token) {
        return new CompilerAbortException(reportError(phase, message, token));
    }

    /**
     * Reports a fatal error at an explicit position and returns the exception to throw.
     *
     * @param phase        The phase reporting the error.
     * @param message      The error message.
     * @param fileName     The file in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column number of the error.
     * @return The exception to throw.
     */
    public CompilerAbortException fatal(Diagnostic.Phase phase, String message, String fileName, int lineNumber, int columnNumber) {
        return new CompilerAbortException(reportError(phase, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
