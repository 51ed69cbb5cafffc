package org.lolmark.compiler.diagnostics;

/**
 * Thrown by the lexer and the parser after a fatal diagnostic has been reported.
 * <p>
 * It unwinds the current phase without further processing. Only the compiler facade
 * catches it and turns it into a {@link org.lolmark.compiler.api.CompilationException}.
 */
public class CompilerAbortException extends RuntimeException {

    private final transient Diagnostic diagnostic;

    /**
     * Constructs a new abort exception for an already reported diagnostic.
     * @param diagnostic The fatal diagnostic.
     */
    public CompilerAbortException(Diagnostic diagnostic) {
        super(diagnostic.toString());
        this.diagnostic = diagnostic;
    }

    /**
     * @return The fatal diagnostic that caused the abort.
     */
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
