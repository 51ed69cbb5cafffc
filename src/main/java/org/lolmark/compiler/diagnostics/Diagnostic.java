package org.lolmark.compiler.diagnostics;

/**
 * Represents a single error diagnostic produced during compilation.
 *
 * @param phase The compiler phase that reported the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The 1-based line number of the issue.
 * @param columnNumber The 1-based column number of the issue.
 */
public record Diagnostic(
        Phase phase,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The compiler phase a diagnostic originates from.
     */
    public enum Phase {
        /** Raised by the lexer. Always fatal. */
        LEXICAL("Lexical"),
        /** Raised by the parser. Always fatal. */
        SYNTAX("Syntax"),
        /** Raised by the semantic analyzer. Collected, then fatal as a group. */
        SEMANTIC("Semantic");

        private final String label;

        Phase(String label) {
            this.label = label;
        }

        /**
         * @return The human readable label used when printing diagnostics.
         */
        public String label() {
            return label;
        }
    }

    @Override
    public String toString() {
        return String.format("%s error at line %d, col %d: %s", phase.label(), lineNumber, columnNumber, message);
    }
}
