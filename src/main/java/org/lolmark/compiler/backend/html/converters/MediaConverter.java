package org.lolmark.compiler.backend.html.converters;

import org.lolmark.compiler.backend.html.HtmlGenContext;
import org.lolmark.compiler.backend.html.IAstNodeToHtmlConverter;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

import java.util.function.Function;

/**
 * Converts sound and video nodes into an HTML5 media element with native controls.
 *
 * @param <T> The node type.
 */
public final class MediaConverter<T extends AstNode> implements IAstNodeToHtmlConverter<T> {

	private final String tag;
	private final Function<T, String> url;

	/**
	 * @param tag The element name, <code>audio</code> or <code>video</code>.
	 * @param url Extracts the source URL from the node.
	 */
	public MediaConverter(String tag, Function<T, String> url) {
		this.tag = tag;
		this.url = url;
	}

	@Override
	public String convert(T node, HtmlGenContext ctx) {
		return "<" + tag + " controls src=\"" + url.apply(node) + "\"></" + tag + ">\n";
	}
}
