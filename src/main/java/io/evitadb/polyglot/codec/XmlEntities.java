package io.evitadb.polyglot.codec;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Escapes and unescapes the five predefined XML entities used by the request/response protocol.
 */
public final class XmlEntities {

	private XmlEntities() {
		// Utility class - prevent instantiation
	}

	/**
	 * Escapes `&`, `<`, `>`, `"` and `'`. The ampersand is replaced first so produced entities are not escaped twice.
	 *
	 * @param text raw text
	 * @return text safe to embed in an element body
	 */
	@Nonnull
	public static String escape(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		return text
			.replace("&", "&amp;")
			.replace("<", "&lt;")
			.replace(">", "&gt;")
			.replace("\"", "&quot;")
			.replace("'", "&apos;");
	}

	/**
	 * Reverses {@link #escape(String)}. The ampersand entity is resolved last.
	 *
	 * @param text escaped text
	 * @return raw text
	 */
	@Nonnull
	public static String unescape(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		return text
			.replace("&lt;", "<")
			.replace("&gt;", ">")
			.replace("&quot;", "\"")
			.replace("&apos;", "'")
			.replace("&amp;", "&");
	}
}
