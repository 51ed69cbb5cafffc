package org.lolmark.compiler.backend.html.converters;

import org.lolmark.compiler.backend.html.HtmlGenContext;
import org.lolmark.compiler.backend.html.IAstNodeToHtmlConverter;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * Renders a node's children between a fixed opening and closing markup.
 *
 * @param <T> The node type.
 */
public class ElementConverter<T extends AstNode> implements IAstNodeToHtmlConverter<T> {

	private final String open;
	private final String close;

	/**
	 * @param open  Markup emitted before the children.
	 * @param close Markup emitted after the children.
	 */
	public ElementConverter(String open, String close) {
		this.open = open;
		this.close = close;
	}

	@Override
	public String convert(T node, HtmlGenContext ctx) {
		return open + ctx.renderChildren(node) + close;
	}
}
