package org.lolmark.compiler.api;

import org.lolmark.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 * The message lists every diagnostic, one per line.
 */
public class CompilationException extends Exception {

    private final transient List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception.
     * @param message The detail message.
     * @param diagnostics The diagnostics that caused the failure.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        this(message, diagnostics, null);
    }

    /**
     * Constructs a new compilation exception with the specified cause.
     * @param message The detail message.
     * @param diagnostics The diagnostics that caused the failure.
     * @param cause The cause.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics that caused the failure, in the order they were reported.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
