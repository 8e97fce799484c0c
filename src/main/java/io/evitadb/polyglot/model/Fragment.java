package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One independently translatable unit of text, as reported by a document adapter.
 * Fragments are immutable once scanned. The id is an opaque handle issued by the adapter
 * and is only ever handed back to it when a translation is applied.
 *
 * @param id           adapter-issued handle of the text this fragment came from
 * @param originalText the source text
 * @param groupId      id of the {@link FragmentGroup} the fragment belongs to
 */
public record Fragment(
	int id,
	@Nonnull String originalText,
	int groupId
) {

	public Fragment {
		Objects.requireNonNull(originalText, "originalText must not be null");
	}

	/**
	 * Returns the number of characters counted against the batch character limit.
	 *
	 * @return length of the original text
	 */
	public int length() {
		return this.originalText.length();
	}
}
