package io.evitadb.polyglot.job;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Degraded path used when a backend reply cannot be decoded: spreads the raw reply over the fragments of a batch
 * by sentences. The alignment is approximate and callers must mark the batch accordingly.
 */
public final class FallbackSplitter {

	private static final Pattern SENTENCE = Pattern.compile("[^.!?]+[.!?]+");

	private FallbackSplitter() {
		// Utility class - prevent instantiation
	}

	/**
	 * Splits the reply into `count` pieces. A single fragment gets the whole reply. Otherwise the sentences are
	 * distributed in contiguous runs whose sizes differ by at most one; when there are fewer sentences than
	 * fragments the trailing fragments get `null` and keep their original text.
	 *
	 * @param reply raw backend reply
	 * @param count number of fragments in the batch
	 * @return one entry per fragment, `null` where nothing was assigned
	 */
	@Nonnull
	public static List<String> split(@Nonnull String reply, int count) {
		Objects.requireNonNull(reply, "reply must not be null");
		if (count <= 0) {
			return List.of();
		}
		final List<String> result = new ArrayList<>(count);
		if (count == 1) {
			result.add(reply);
			return result;
		}

		final List<String> sentences = sentences(reply);
		if (sentences.size() <= count) {
			for (int i = 0; i < count; i++) {
				result.add(i < sentences.size() ? sentences.get(i).trim() : null);
			}
			return result;
		}

		final int base = sentences.size() / count;
		final int remainder = sentences.size() % count;
		int next = 0;
		for (int i = 0; i < count; i++) {
			final int runLength = base + (i < remainder ? 1 : 0);
			final StringBuilder run = new StringBuilder();
			for (int j = 0; j < runLength; j++) {
				run.append(sentences.get(next++));
			}
			result.add(run.toString().trim());
		}
		return result;
	}

	/**
	 * Cuts text into sentences ending with `.`, `!` or `?`. Trailing text without a terminator is appended to the
	 * last sentence; text without any terminator is a single sentence.
	 *
	 * @param text text to cut
	 * @return sentences in order, never empty for non-blank text
	 */
	@Nonnull
	static List<String> sentences(@Nonnull String text) {
		final List<String> sentences = new ArrayList<>();
		final Matcher matcher = SENTENCE.matcher(text);
		int end = 0;
		while (matcher.find()) {
			sentences.add(matcher.group());
			end = matcher.end();
		}
		if (sentences.isEmpty()) {
			if (!text.isBlank()) {
				sentences.add(text);
			}
			return sentences;
		}
		final String tail = text.substring(end);
		if (!tail.isBlank()) {
			final int last = sentences.size() - 1;
			sentences.set(last, sentences.get(last) + tail);
		}
		return sentences;
	}
}
