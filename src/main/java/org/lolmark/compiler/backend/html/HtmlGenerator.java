package org.lolmark.compiler.backend.html;

import org.lolmark.compiler.frontend.parser.ast.ProgramNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase: Generates the HTML document from a validated AST by delegating to converters
 * resolved via the {@link HtmlConverterRegistry}.
 * <p>
 * Variable values are resolved against a fresh scope stack per call, independent of
 * any state left by semantic analysis. Generation never fails: a reference that cannot be
 * resolved renders as a placeholder.
 */
public final class HtmlGenerator {

	/** The document title used when none is configured. */
	public static final String DEFAULT_DOCUMENT_TITLE = "LOLCODE Markdown";

	private static final Logger LOG = LoggerFactory.getLogger(HtmlGenerator.class);

	private final HtmlConverterRegistry registry;
	private final String documentTitle;

	/**
	 * Creates a generator with the built-in converters and the default document title.
	 */
	public HtmlGenerator() {
		this(HtmlConverterRegistry.initializeWithDefaults(), DEFAULT_DOCUMENT_TITLE);
	}

	/**
	 * Creates a new HTML generator with a prepared registry.
	 *
	 * @param registry      The converter registry.
	 * @param documentTitle The text of the document's <code>&lt;title&gt;</code> element.
	 */
	public HtmlGenerator(HtmlConverterRegistry registry, String documentTitle) {
		this.registry = registry;
		this.documentTitle = documentTitle;
	}

	/**
	 * Generates the complete HTML document.
	 *
	 * @param program The semantically validated tree.
	 * @return The HTML document text.
	 */
	public String generate(ProgramNode program) {
		HtmlGenContext ctx = new HtmlGenContext(documentTitle, registry);
		String html = ctx.render(program);
		LOG.debug("Generated {} characters of HTML", html.length());
		return html;
	}
}
