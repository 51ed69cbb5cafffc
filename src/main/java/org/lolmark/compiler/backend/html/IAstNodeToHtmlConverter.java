package org.lolmark.compiler.backend.html;

import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * Converts a specific AST node type into an HTML fragment.
 * <p>
 * Implementations should be stateless. Scope state lives in the {@link HtmlGenContext};
 * child nodes are rendered through {@link HtmlGenContext#render(AstNode)}.
 *
 * @param <T> The concrete AST node type handled by this converter.
 */
@FunctionalInterface
public interface IAstNodeToHtmlConverter<T extends AstNode> {

	/**
	 * Converts the given AST node into HTML.
	 *
	 * @param node The AST node to convert.
	 * @param ctx  The generation context.
	 * @return The HTML fragment for the node and its children.
	 */
	String convert(T node, HtmlGenContext ctx);
}
