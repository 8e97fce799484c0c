package io.evitadb.polyglot.job;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cuts a long selection into pieces no longer than a limit, preferring soft boundaries. Every boundary character
 * stays at the end of the piece before it, so concatenating the pieces yields the input.
 */
public final class SelectionSplitter {

	private static final String SENTENCE_ENDINGS = ".!?。！？";

	private SelectionSplitter() {
		// Utility class - prevent instantiation
	}

	/**
	 * Splits the text.
	 *
	 * @param text      text to split
	 * @param maxLength maximum piece length, positive
	 * @return the pieces in order; a text within the limit is returned as the only piece
	 */
	@Nonnull
	public static List<String> split(@Nonnull String text, int maxLength) {
		Objects.requireNonNull(text, "text must not be null");
		if (maxLength <= 0) {
			throw new IllegalArgumentException("maxLength must be positive, got " + maxLength);
		}
		final List<String> pieces = new ArrayList<>();
		String remaining = text;
		while (remaining.length() > maxLength) {
			final int cut = findCut(remaining, maxLength);
			pieces.add(remaining.substring(0, cut));
			remaining = remaining.substring(cut);
		}
		if (!remaining.isEmpty() || pieces.isEmpty()) {
			pieces.add(remaining);
		}
		return pieces;
	}

	/**
	 * Finds the end (exclusive) of the next piece within the first `maxLength` characters.
	 */
	private static int findCut(@Nonnull String text, int maxLength) {
		final String window = text.substring(0, maxLength);

		final int lineBreak = window.lastIndexOf('\n');
		if (lineBreak >= 0) {
			return lineBreak + 1;
		}

		for (int i = window.length() - 1; i >= 0; i--) {
			if (SENTENCE_ENDINGS.indexOf(window.charAt(i)) >= 0) {
				return i + 1;
			}
		}

		final int space = window.lastIndexOf(' ');
		if (space >= 0) {
			return space + 1;
		}

		// hard cut, but never between the halves of a surrogate pair
		if (maxLength > 1 && Character.isHighSurrogate(window.charAt(maxLength - 1))) {
			return maxLength - 1;
		}
		return maxLength;
	}
}
