package io.evitadb.polyglot.codec;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Lookup from normalized original text to the request positions that carry it.
 * Positions with identical text are handed out in ascending order, each one at most once.
 * Not thread-safe; one instance serves a single decode call.
 */
public final class MatchIndex {

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final Map<String, Deque<Integer>> positions = new HashMap<>();

	/**
	 * Builds the index over the given request texts.
	 *
	 * @param originals request texts in request order
	 */
	public MatchIndex(@Nonnull List<String> originals) {
		Objects.requireNonNull(originals, "originals must not be null");
		for (int i = 0; i < originals.size(); i++) {
			final String original = originals.get(i);
			if (original == null) {
				continue;
			}
			this.positions
				.computeIfAbsent(normalize(original), key -> new ArrayDeque<>())
				.addLast(i);
		}
	}

	/**
	 * Collapses every whitespace run into a single space and trims both ends.
	 *
	 * @param text text to normalize, may be null
	 * @return normalized text, empty for null
	 */
	@Nonnull
	public static String normalize(@Nullable String text) {
		if (text == null) {
			return "";
		}
		return WHITESPACE.matcher(text).replaceAll(" ").trim();
	}

	/**
	 * Takes the lowest unclaimed position whose original text matches after normalization.
	 *
	 * @param original original text echoed by the backend
	 * @return the claimed position, or empty when no unclaimed position matches
	 */
	@Nonnull
	public OptionalInt claim(@Nonnull String original) {
		final Deque<Integer> queue = this.positions.get(normalize(original));
		if (queue == null || queue.isEmpty()) {
			return OptionalInt.empty();
		}
		return OptionalInt.of(queue.pollFirst());
	}
}
