package io.evitadb.polyglot.document;

import io.evitadb.polyglot.model.FragmentGroup;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Bridge between the translation engine and a concrete document. The adapter owns the document; the engine only
 * sees fragment groups and hands back the opaque fragment handles when it applies a result.
 *
 * Implementations must make {@link #apply(int, String)} and {@link #revertAll()} idempotent and safe to call from
 * any thread.
 */
public interface DocumentAdapter {

	/**
	 * Collects the translatable text of the document.
	 *
	 * @return fragment groups in document order, empty when there is nothing to translate
	 */
	@Nonnull
	List<FragmentGroup> scan();

	/**
	 * Replaces the text behind a fragment handle.
	 *
	 * @param handle fragment id issued by {@link #scan()}
	 * @param text   translated text
	 * @throws IllegalArgumentException if the handle was not issued by this adapter
	 */
	void apply(int handle, @Nonnull String text);

	/**
	 * Restores the original text of every fragment handed out by {@link #scan()}.
	 */
	void revertAll();
}
