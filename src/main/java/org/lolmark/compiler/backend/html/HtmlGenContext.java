package org.lolmark.compiler.backend.html;

import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.semantics.SymbolTable;

/**
 * Mutable context passed to converters during HTML generation.
 * Owns the generator's own scope stack, rebuilt from scratch while walking the tree.
 */
public final class HtmlGenContext {

	private final String documentTitle;
	private final HtmlConverterRegistry registry;
	private final SymbolTable symbols = new SymbolTable();

	/**
	 * Constructs a new HTML generation context.
	 * @param documentTitle The text of the document's <code>&lt;title&gt;</code> element.
	 * @param registry The registry for resolving AST node converters.
	 */
	public HtmlGenContext(String documentTitle, HtmlConverterRegistry registry) {
		this.documentTitle = documentTitle;
		this.registry = registry;
	}

	/**
	 * Converts the given AST node by resolving and invoking the appropriate converter.
	 * @param node The node to convert.
	 * @return The HTML for the node.
	 */
	public String render(AstNode node) {
		return registry.resolve(node).convert(node, this);
	}

	/**
	 * Converts the children of a node in order and concatenates the results.
	 * @param node The parent node.
	 * @return The concatenated HTML of all children.
	 */
	public String renderChildren(AstNode node) {
		StringBuilder html = new StringBuilder();
		for (AstNode child : node.getChildren()) {
			html.append(render(child));
		}
		return html.toString();
	}

	/**
	 * @return The scope stack of this generation run.
	 */
	public SymbolTable symbols() {
		return symbols;
	}

	/**
	 * @return The document title.
	 */
	public String documentTitle() {
		return documentTitle;
	}
}
