package org.lolmark.compiler.backend.html.converters;

import org.lolmark.compiler.backend.html.HtmlGenContext;
import org.lolmark.compiler.frontend.parser.ast.AstNode;

/**
 * An {@link ElementConverter} for sections that open a variable scope.
 * The scope is entered before the children are rendered and left afterwards.
 *
 * @param <T> The node type.
 */
public final class ScopedElementConverter<T extends AstNode> extends ElementConverter<T> {

	public ScopedElementConverter(String open, String close) {
		super(open, close);
	}

	@Override
	public String convert(T node, HtmlGenContext ctx) {
		ctx.symbols().enterScope();
		String html = super.convert(node, ctx);
		ctx.symbols().leaveScope();
		return html;
	}
}
