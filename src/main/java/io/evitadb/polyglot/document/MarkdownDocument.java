package io.evitadb.polyglot.document;

import org.commonmark.Extension;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterVisitor;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.markdown.MarkdownRenderer;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed Markdown file split into its YAML front matter and its body. The body tree is mutable: text nodes may be
 * rewritten and the body rendered back to Markdown. The front matter is carried over untouched.
 */
public class MarkdownDocument {

	/**
	 * Extensions used for the body. Front matter is handled separately, so it is not part of the body tree.
	 */
	public static final List<Extension> BODY_EXTENSIONS = List.of(
		StrikethroughExtension.create(),
		TablesExtension.create(),
		TaskListItemsExtension.create()
	);

	private static final Pattern FRONT_MATTER_PATTERN = Pattern.compile(
		"^---\\s*\\n(.*?)\\n---\\s*\\n?",
		Pattern.DOTALL
	);

	private final String rawMarkdown;
	private final Map<String, List<String>> properties;
	private final Node body;

	/**
	 * Parses the given Markdown content.
	 *
	 * @param markdown the Markdown content to parse
	 */
	public MarkdownDocument(@Nonnull String markdown) {
		Objects.requireNonNull(markdown, "markdown must not be null");
		this.rawMarkdown = markdown.replace("\r\n", "\n");

		final Node fullDocument = Parser.builder()
			.extensions(List.of(YamlFrontMatterExtension.create()))
			.build()
			.parse(this.rawMarkdown);
		final YamlFrontMatterVisitor visitor = new YamlFrontMatterVisitor();
		fullDocument.accept(visitor);
		this.properties = new LinkedHashMap<>(visitor.getData());

		this.body = Parser.builder()
			.extensions(BODY_EXTENSIONS)
			.build()
			.parse(getBodyContent());
	}

	/**
	 * Returns the root node of the parsed body.
	 *
	 * @return body root
	 */
	@Nonnull
	public Node getBody() {
		return this.body;
	}

	/**
	 * Retrieves the first value of a front matter property.
	 *
	 * @param key property name
	 * @return the first value, or empty if the property is missing
	 */
	@Nonnull
	public Optional<String> getProperty(@Nonnull String key) {
		Objects.requireNonNull(key, "key must not be null");
		final List<String> values = this.properties.get(key);
		if (values == null || values.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(values.get(0));
	}

	@Nonnull
	public Map<String, List<String>> getProperties() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(this.properties));
	}

	/**
	 * Returns the markdown body content without front matter.
	 *
	 * @return body content, or the full content if there is no front matter
	 */
	@Nonnull
	public String getBodyContent() {
		final Matcher matcher = FRONT_MATTER_PATTERN.matcher(this.rawMarkdown);
		if (matcher.find()) {
			return this.rawMarkdown.substring(matcher.end());
		}
		return this.rawMarkdown;
	}

	/**
	 * Returns the original front matter block including its `---` delimiters, or an empty string.
	 *
	 * @return front matter exactly as it appeared in the source
	 */
	@Nonnull
	public String getFrontMatter() {
		final Matcher matcher = FRONT_MATTER_PATTERN.matcher(this.rawMarkdown);
		if (matcher.find()) {
			final String block = matcher.group();
			return block.endsWith("\n") ? block : block + "\n";
		}
		return "";
	}

	/**
	 * Renders the current state of the body back to Markdown, prefixed with the original front matter.
	 *
	 * @return Markdown content
	 */
	@Nonnull
	public String render() {
		final MarkdownRenderer renderer = MarkdownRenderer.builder()
			.extensions(BODY_EXTENSIONS)
			.build();
		return getFrontMatter() + renderer.render(this.body);
	}
}
