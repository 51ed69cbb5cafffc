package org.lolmark.compiler.backend.html;

import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default/fallback converter used when no specific converter is registered.
 * It renders the node's children and logs a warning about the node itself.
 */
public final class DefaultAstNodeToHtmlConverter implements IAstNodeToHtmlConverter<AstNode> {

	private static final Logger LOG = LoggerFactory.getLogger(DefaultAstNodeToHtmlConverter.class);

	@Override
	public String convert(AstNode node, HtmlGenContext ctx) {
		LOG.warn("No HTML converter registered for node type {}", node.getClass().getSimpleName());
		return ctx.renderChildren(node);
	}
}
