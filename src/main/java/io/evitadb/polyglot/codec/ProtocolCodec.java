package io.evitadb.polyglot.codec;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes a list of texts into the XML-like request payload and matches the backend's structured reply back to
 * request positions.
 *
 * Request layout:
 *
 * ```
 * <request>
 * <item>first text</item>
 * <item>second text</item>
 * </request>
 * ```
 *
 * The backend answers with `<item><original>..</original><translated>..</translated></item>` elements. Matching is
 * done by the echoed original text, never by position, because backends reorder, drop and duplicate items.
 */
public final class ProtocolCodec {

	private static final Pattern ITEM_PATTERN = Pattern.compile("<item>(.*?)</item>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
	private static final Pattern ORIGINAL_PATTERN = Pattern.compile("<original>(.*?)</original>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
	private static final Pattern TRANSLATED_PATTERN = Pattern.compile("<translated>(.*?)</translated>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
	private static final Pattern ITEM_MARKER = Pattern.compile("<item", Pattern.CASE_INSENSITIVE);

	private ProtocolCodec() {
		// Utility class - prevent instantiation
	}

	/**
	 * Serializes texts into a request payload, one escaped `item` element per text.
	 *
	 * @param texts texts in request order
	 * @return the request payload
	 */
	@Nonnull
	public static String encode(@Nonnull List<String> texts) {
		Objects.requireNonNull(texts, "texts must not be null");
		final StringBuilder payload = new StringBuilder("<request>\n");
		for (final String text : texts) {
			Objects.requireNonNull(text, "texts must not contain null");
			payload.append("<item>").append(XmlEntities.escape(text)).append("</item>\n");
		}
		payload.append("</request>");
		return payload.toString();
	}

	/**
	 * Parses a backend reply and assigns each translated item to a request position.
	 *
	 * Items lacking either child element or carrying a blank original are skipped. An item whose original matches
	 * no unclaimed position is ignored. A blank translation still claims its position but leaves it `null`, which
	 * means the original text is kept. Translations are stored verbatim.
	 *
	 * @param reply     raw backend reply
	 * @param originals request texts in request order
	 * @return translations aligned with `originals`, or empty when the reply holds no item at all
	 */
	@Nonnull
	public static Optional<List<String>> decode(@Nullable String reply, @Nonnull List<String> originals) {
		Objects.requireNonNull(originals, "originals must not be null");
		if (reply == null || !ITEM_MARKER.matcher(reply).find()) {
			return Optional.empty();
		}

		final String[] results = new String[originals.size()];
		final MatchIndex index = new MatchIndex(originals);
		final Matcher items = ITEM_PATTERN.matcher(reply);
		while (items.find()) {
			final String body = items.group(1);
			final Matcher original = ORIGINAL_PATTERN.matcher(body);
			final Matcher translated = TRANSLATED_PATTERN.matcher(body);
			if (!original.find() || !translated.find()) {
				continue;
			}
			final String originalText = XmlEntities.unescape(original.group(1).trim());
			if (originalText.isBlank()) {
				continue;
			}
			final OptionalInt position = index.claim(originalText);
			final String translatedText = XmlEntities.unescape(translated.group(1));
			if (position.isPresent() && !translatedText.isBlank()) {
				results[position.getAsInt()] = translatedText;
			}
		}
		return Optional.of(new ArrayList<>(Arrays.asList(results)));
	}
}
