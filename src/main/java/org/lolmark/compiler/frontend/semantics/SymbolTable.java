package org.lolmark.compiler.frontend.semantics;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for managing nested variable scopes.
 * <p>
 * The root scope is global and is never left. Lookups search from the innermost scope
 * outwards, so an inner declaration shadows an outer one with the same name.
 * The semantic analyzer and the HTML generator each use their own instance.
 */
public class SymbolTable {

    /**
     * Represents a single scope in the symbol table.
     */
    public static class Scope {
        private final Scope parent;
        private final Map<String, Symbol> symbols = new HashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }
    }

    private final Scope rootScope;
    private Scope currentScope;
    private int depth = 0;

    /**
     * Constructs a new symbol table containing only the global scope.
     */
    public SymbolTable() {
        this.rootScope = new Scope(null);
        this.currentScope = this.rootScope;
    }

    /**
     * Enters a new scope nested in the current one.
     */
    public void enterScope() {
        currentScope = new Scope(currentScope);
        depth++;
    }

    /**
     * Leaves the current scope and moves to the parent scope. Does nothing in the global scope.
     */
    public void leaveScope() {
        if (currentScope != rootScope) {
            currentScope = currentScope.parent;
            depth--;
        }
    }

    /**
     * @return The number of open scopes above the global one.
     */
    public int depth() {
        return depth;
    }

    /**
     * Checks whether a name is declared in the innermost scope, ignoring enclosing scopes.
     * @param name The variable name.
     * @return true if the current scope declares {@code name}.
     */
    public boolean isDeclaredInCurrentScope(String name) {
        return currentScope.symbols.containsKey(name);
    }

    /**
     * Puts a symbol into the current scope, replacing any symbol with the same name there.
     * @param symbol The symbol to define.
     */
    public void define(Symbol symbol) {
        currentScope.symbols.put(symbol.name(), symbol);
    }

    /**
     * Binds a value to the innermost visible declaration of {@code name}.
     * @param name The variable name.
     * @param value The value to bind.
     * @return true if a declaration was found, false if the name is not visible.
     */
    public boolean assign(String name, String value) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                scope.symbols.put(name, symbol.withValue(value));
                return true;
            }
        }
        return false;
    }

    /**
     * Resolves a name, searching from the current scope outwards.
     * @param name The variable name.
     * @return The innermost visible symbol, or empty if the name is not declared in any open scope.
     */
    public Optional<Symbol> resolve(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }
}
