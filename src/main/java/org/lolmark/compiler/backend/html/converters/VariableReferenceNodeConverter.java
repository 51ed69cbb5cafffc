package org.lolmark.compiler.backend.html.converters;

import org.lolmark.compiler.backend.html.HtmlGenContext;
import org.lolmark.compiler.backend.html.IAstNodeToHtmlConverter;
import org.lolmark.compiler.frontend.parser.features.variable.VariableReferenceNode;
import org.lolmark.compiler.frontend.semantics.Symbol;

/**
 * Substitutes a reference with the variable's current value, followed by a single space.
 * References that do not resolve to an assigned variable render as
 * <code>[undefined: name]</code>, without the space.
 */
public final class VariableReferenceNodeConverter implements IAstNodeToHtmlConverter<VariableReferenceNode> {

	@Override
	public String convert(VariableReferenceNode node, HtmlGenContext ctx) {
		return ctx.symbols().resolve(node.name())
				.filter(Symbol::isAssigned)
				.map(symbol -> symbol.value() + " ")
				.orElse("[undefined: " + node.name() + "]");
	}
}
