package org.lolmark.compiler.frontend.semantics;

import org.lolmark.compiler.frontend.lexer.Token;

/**
 * Represents a single variable in the symbol table.
 *
 * @param name The variable name, case-sensitive.
 * @param declaration The token of the declaring <code>#I HAZ</code>, used for diagnostics.
 * @param value The bound value, or {@code null} while the variable is declared but unassigned.
 */
public record Symbol(String name, Token declaration, String value) {

    /**
     * Creates a declared, not yet assigned symbol.
     * @param name The variable name.
     * @param declaration The declaring token.
     * @return The new symbol.
     */
    public static Symbol declared(String name, Token declaration) {
        return new Symbol(name, declaration, null);
    }

    /**
     * @return true if a value has been bound to this symbol.
     */
    public boolean isAssigned() {
        return value != null;
    }

    /**
     * @param newValue The value to bind.
     * @return A copy of this symbol bound to {@code newValue}.
     */
    public Symbol withValue(String newValue) {
        return new Symbol(name, declaration, newValue);
    }
}
