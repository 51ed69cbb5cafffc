package org.lolmark.compiler.backend.html.converters;

import org.lolmark.compiler.backend.html.HtmlGenContext;
import org.lolmark.compiler.backend.html.IAstNodeToHtmlConverter;
import org.lolmark.compiler.frontend.parser.features.section.TitleNode;

/**
 * Converts {@link TitleNode} into a top-level heading.
 */
public final class TitleNodeConverter implements IAstNodeToHtmlConverter<TitleNode> {

	@Override
	public String convert(TitleNode node, HtmlGenContext ctx) {
		return "<h1>" + node.content() + "</h1>\n";
	}
}
