package org.lolmark.compiler.frontend.parser.features.variable;

import org.lolmark.compiler.frontend.lexer.Token;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * Binds a value, <code>#IT IZ value #MKAY</code>.
 * <p>
 * An assignment names no variable in the source. It binds to the most recently declared
 * variable that has not been assigned yet; the parser resolves that name and stores it
 * in {@code target}.
 *
 * @param start The <code>#IT IZ</code> token.
 * @param target The variable the value binds to, or {@code null} if no declaration was pending.
 * @param value The value text.
 */
public record VariableAssignmentNode(Token start, String target, String value) implements AstNode {

    /**
     * @return true if this assignment has a declaration to bind to.
     */
    public boolean hasTarget() {
        return target != null;
    }
}
