package org.lolmark.compiler.backend.html.converters;

import org.lolmark.compiler.backend.html.HtmlGenContext;
import org.lolmark.compiler.backend.html.IAstNodeToHtmlConverter;
import org.lolmark.compiler.frontend.parser.ast.TextNode;

/**
 * Emits text followed by a single space, which separates it from the next inline fragment.
 */
public final class TextNodeConverter implements IAstNodeToHtmlConverter<TextNode> {

	@Override
	public String convert(TextNode node, HtmlGenContext ctx) {
		return node.content() + " ";
	}
}
