package org.lolmark.compiler.backend.html;

import org.lolmark.compiler.backend.html.converters.ElementConverter;
import org.lolmark.compiler.backend.html.converters.MediaConverter;
import org.lolmark.compiler.backend.html.converters.ProgramNodeConverter;
import org.lolmark.compiler.backend.html.converters.ScopedElementConverter;
import org.lolmark.compiler.backend.html.converters.TextNodeConverter;
import org.lolmark.compiler.backend.html.converters.TitleNodeConverter;
import org.lolmark.compiler.backend.html.converters.VariableAssignmentNodeConverter;
import org.lolmark.compiler.backend.html.converters.VariableDeclarationNodeConverter;
import org.lolmark.compiler.backend.html.converters.VariableReferenceNodeConverter;
import org.lolmark.compiler.frontend.parser.ast.AstNode;
import org.lolmark.compiler.frontend.parser.ast.NewlineNode;
import org.lolmark.compiler.frontend.parser.ast.ProgramNode;
import org.lolmark.compiler.frontend.parser.ast.TextNode;
import org.lolmark.compiler.frontend.parser.features.section.HeadSectionNode;
import org.lolmark.compiler.frontend.parser.features.section.ItemNode;
import org.lolmark.compiler.frontend.parser.features.section.ListSectionNode;
import org.lolmark.compiler.frontend.parser.features.section.ParagrafSectionNode;
import org.lolmark.compiler.frontend.parser.features.section.TitleNode;
import org.lolmark.compiler.frontend.parser.features.style.BoldNode;
import org.lolmark.compiler.frontend.parser.features.style.ItalicsNode;
import org.lolmark.compiler.frontend.parser.features.style.SoundNode;
import org.lolmark.compiler.frontend.parser.features.style.VideoNode;
import org.lolmark.compiler.frontend.parser.features.variable.VariableAssignmentNode;
import org.lolmark.compiler.frontend.parser.features.variable.VariableDeclarationNode;
import org.lolmark.compiler.frontend.parser.features.variable.VariableReferenceNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to HTML converter instances, similar in spirit to
 * the DirectiveHandlerRegistry of the parser.
 * <p>
 * Provides explicit registration and a default converter fallback. The {@link #resolve(AstNode)} method
 * walks the class hierarchy to find the nearest registered converter.
 */
public final class HtmlConverterRegistry {

	private final Map<Class<? extends AstNode>, IAstNodeToHtmlConverter<? extends AstNode>> byClass = new HashMap<>();
	private final IAstNodeToHtmlConverter<AstNode> defaultConverter;

	private HtmlConverterRegistry(IAstNodeToHtmlConverter<AstNode> defaultConverter) {
		this.defaultConverter = defaultConverter;
	}

	/**
	 * Registers a converter for the given AST node class.
	 *
	 * @param nodeType  The concrete AST node class.
	 * @param converter The converter instance handling that class.
	 * @param <T>       Concrete AST type parameter.
	 */
	public <T extends AstNode> void register(Class<T> nodeType, IAstNodeToHtmlConverter<T> converter) {
		byClass.put(nodeType, converter);
	}

	/**
	 * Retrieves the converter strictly registered for the given class (no hierarchy search).
	 *
	 * @param nodeType The AST node class to look up.
	 * @return Optional converter if present.
	 */
	public Optional<IAstNodeToHtmlConverter<? extends AstNode>> get(Class<? extends AstNode> nodeType) {
		return Optional.ofNullable(byClass.get(nodeType));
	}

	/**
	 * Resolves a converter for the given node by searching the node's concrete class,
	 * then walking up its superclasses and interfaces. Falls back to the default converter.
	 *
	 * @param node The AST node instance to resolve a converter for.
	 * @return A non-null converter to handle the node.
	 */
	@SuppressWarnings("unchecked")
	public IAstNodeToHtmlConverter<AstNode> resolve(AstNode node) {
		Class<?> c = node.getClass();
		while (c != null && AstNode.class.isAssignableFrom(c)) {
			IAstNodeToHtmlConverter<?> found = byClass.get(c);
			if (found != null) return (IAstNodeToHtmlConverter<AstNode>) found;
			for (Class<?> i : c.getInterfaces()) {
				if (AstNode.class.isAssignableFrom(i)) {
					found = byClass.get(i.asSubclass(AstNode.class));
					if (found != null) return (IAstNodeToHtmlConverter<AstNode>) found;
				}
			}
			c = c.getSuperclass();
		}
		return defaultConverter;
	}

	/**
	 * Creates a registry with the given default converter and nothing else registered.
	 *
	 * @param defaultConverter The fallback converter used for unknown node types.
	 * @return A new registry instance.
	 */
	public static HtmlConverterRegistry initialize(IAstNodeToHtmlConverter<AstNode> defaultConverter) {
		return new HtmlConverterRegistry(defaultConverter);
	}

	/**
	 * Initializes a registry with the default converter and registers all built-in converters.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static HtmlConverterRegistry initializeWithDefaults() {
		HtmlConverterRegistry reg = initialize(new DefaultAstNodeToHtmlConverter());
		reg.register(ProgramNode.class, new ProgramNodeConverter());
		reg.register(HeadSectionNode.class, new ElementConverter<>("", ""));
		reg.register(ParagrafSectionNode.class, new ScopedElementConverter<>("<p>\n", "</p>\n"));
		reg.register(ListSectionNode.class, new ScopedElementConverter<>("<ul>\n", "</ul>\n"));
		reg.register(ItemNode.class, new ElementConverter<>("<li>", "</li>\n"));
		reg.register(BoldNode.class, new ElementConverter<>("<b>", "</b>"));
		reg.register(ItalicsNode.class, new ElementConverter<>("<i>", "</i>"));
		reg.register(TitleNode.class, new TitleNodeConverter());
		reg.register(TextNode.class, new TextNodeConverter());
		reg.register(NewlineNode.class, (node, ctx) -> "<br>\n");
		reg.register(SoundNode.class, new MediaConverter<>("audio", SoundNode::url));
		reg.register(VideoNode.class, new MediaConverter<>("video", VideoNode::url));
		reg.register(VariableDeclarationNode.class, new VariableDeclarationNodeConverter());
		reg.register(VariableAssignmentNode.class, new VariableAssignmentNodeConverter());
		reg.register(VariableReferenceNode.class, new VariableReferenceNodeConverter());
		return reg;
	}
}
