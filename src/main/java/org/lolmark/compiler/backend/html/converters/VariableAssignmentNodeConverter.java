package org.lolmark.compiler.backend.html.converters;

import org.lolmark.compiler.backend.html.HtmlGenContext;
import org.lolmark.compiler.backend.html.IAstNodeToHtmlConverter;
import org.lolmark.compiler.frontend.parser.features.variable.VariableAssignmentNode;

/**
 * Binds the assigned value in the generator's scope stack. Emits nothing.
 */
public final class VariableAssignmentNodeConverter implements IAstNodeToHtmlConverter<VariableAssignmentNode> {

	@Override
	public String convert(VariableAssignmentNode node, HtmlGenContext ctx) {
		if (node.hasTarget()) {
			ctx.symbols().assign(node.target(), node.value());
		}
		return "";
	}
}
