package org.lolmark.compiler.backend.html.converters;

import org.lolmark.compiler.backend.html.HtmlGenContext;
import org.lolmark.compiler.backend.html.IAstNodeToHtmlConverter;
import org.lolmark.compiler.frontend.parser.ast.ProgramNode;

/**
 * Wraps the rendered program body into the HTML document skeleton.
 */
public final class ProgramNodeConverter implements IAstNodeToHtmlConverter<ProgramNode> {

	@Override
	public String convert(ProgramNode node, HtmlGenContext ctx) {
		return "<!DOCTYPE html>\n"
				+ "<html>\n"
				+ "<head>\n"
				+ "<meta charset=\"UTF-8\">\n"
				+ "<title>" + ctx.documentTitle() + "</title>\n"
				+ "</head>\n"
				+ "<body>\n"
				+ ctx.renderChildren(node)
				+ "</body>\n"
				+ "</html>";
	}
}
