package org.lolmark.compiler.backend.html.converters;

import org.lolmark.compiler.backend.html.HtmlGenContext;
import org.lolmark.compiler.backend.html.IAstNodeToHtmlConverter;
import org.lolmark.compiler.frontend.parser.features.variable.VariableDeclarationNode;
import org.lolmark.compiler.frontend.semantics.Symbol;

/**
 * Declares the variable in the innermost scope. A repeated declaration resets the variable
 * to unassigned. Emits nothing.
 */
public final class VariableDeclarationNodeConverter implements IAstNodeToHtmlConverter<VariableDeclarationNode> {

	@Override
	public String convert(VariableDeclarationNode node, HtmlGenContext ctx) {
		ctx.symbols().define(Symbol.declared(node.name(), node.start()));
		return "";
	}
}
