package io.evitadb.polyglot.document;

import io.evitadb.polyglot.model.Fragment;
import io.evitadb.polyglot.model.FragmentGroup;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Block;
import org.commonmark.node.Node;
import org.commonmark.node.Text;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Document adapter over a {@link MarkdownDocument}. Every text node of the body whose trimmed text has at least
 * {@link #MIN_FRAGMENT_LENGTH} characters becomes a fragment; fragments sharing the nearest block container
 * (paragraph, heading, table cell, ...) form one group. Code spans, code blocks and HTML are never text nodes and are
 * left alone.
 *
 * Fragment handles are indices into an arena of the collected text nodes, so the engine never holds a reference into
 * the document tree. The original literal of a node is captured the first time the node is scanned; scanning again
 * after translations were applied still reports and restores the source text.
 */
public final class MarkdownDocumentAdapter implements DocumentAdapter {

	public static final int MIN_FRAGMENT_LENGTH = 3;

	@Nonnull
	private final MarkdownDocument document;
	private final List<Text> nodes = new ArrayList<>();
	private final Map<Text, String> sourceLiterals = new IdentityHashMap<>();

	public MarkdownDocumentAdapter(@Nonnull MarkdownDocument document) {
		this.document = Objects.requireNonNull(document, "document must not be null");
	}

	@Nonnull
	public MarkdownDocument getDocument() {
		return this.document;
	}

	@Nonnull
	@Override
	public synchronized List<FragmentGroup> scan() {
		this.nodes.clear();

		final Map<Node, List<Text>> byContainer = new LinkedHashMap<>();
		this.document.getBody().accept(new AbstractVisitor() {
			@Override
			public void visit(Text text) {
				if (sourceLiteral(text).trim().length() >= MIN_FRAGMENT_LENGTH) {
					byContainer.computeIfAbsent(containerOf(text), key -> new ArrayList<>()).add(text);
				}
			}
		});

		final List<FragmentGroup> groups = new ArrayList<>(byContainer.size());
		for (final List<Text> texts : byContainer.values()) {
			final int groupId = groups.size();
			final List<Fragment> fragments = new ArrayList<>(texts.size());
			for (final Text text : texts) {
				final int handle = this.nodes.size();
				this.nodes.add(text);
				fragments.add(new Fragment(handle, sourceLiteral(text), groupId));
			}
			groups.add(new FragmentGroup(groupId, fragments));
		}
		return groups;
	}

	@Override
	public synchronized void apply(int handle, @Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		if (handle < 0 || handle >= this.nodes.size()) {
			throw new IllegalArgumentException("Unknown fragment handle: " + handle);
		}
		this.nodes.get(handle).setLiteral(text);
	}

	@Override
	public synchronized void revertAll() {
		for (final Map.Entry<Text, String> entry : this.sourceLiterals.entrySet()) {
			entry.getKey().setLiteral(entry.getValue());
		}
	}

	/**
	 * Renders the document in its current state.
	 *
	 * @return Markdown content including the original front matter
	 */
	@Nonnull
	public synchronized String render() {
		return this.document.render();
	}

	@Nonnull
	private String sourceLiteral(@Nonnull Text text) {
		return this.sourceLiterals.computeIfAbsent(text, Text::getLiteral);
	}

	@Nonnull
	private static Node containerOf(@Nonnull Node node) {
		Node current = node.getParent();
		while (current != null) {
			if (current instanceof Block || current instanceof TableCell) {
				return current;
			}
			current = current.getParent();
		}
		return node;
	}
}
