package io.evitadb.polyglot.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProtocolCodec should encode requests and match replies back to request positions")
class ProtocolCodecTest {

	@Test
	@DisplayName("encodes one escaped item per text and keeps line breaks")
	void shouldEncodeItemsWithEscaping() {
		final String payload = ProtocolCodec.encode(List.of("a < b & c", "line one\nline two"));

		assertEquals(
			"<request>\n<item>a &lt; b &amp; c</item>\n<item>line one\nline two</item>\n</request>",
			payload
		);
	}

	@Test
	@DisplayName("decodes translations of an echoing reply in original order")
	void shouldDecodeEchoedReplyInOrder() {
		final List<String> texts = List.of("Hello world", "Tom & \"Jerry\"", "It's <b>bold</b>", "  spaced   text ");
		final String reply = echoReply(texts, " [de]");

		final Optional<List<String>> decoded = ProtocolCodec.decode(reply, texts);

		assertTrue(decoded.isPresent());
		assertEquals(
			List.of("Hello world [de]", "Tom & \"Jerry\" [de]", "It's <b>bold</b> [de]", "  spaced   text  [de]"),
			decoded.get()
		);
	}

	@Test
	@DisplayName("matches reordered items by their original text")
	void shouldMatchReorderedItems() {
		final List<String> texts = List.of("first", "second", "third");
		final String reply = "<response>" +
			item("third", "dritte") +
			item("first", "erste") +
			item("second", "zweite") +
			"</response>";

		assertEquals(List.of("erste", "zweite", "dritte"), ProtocolCodec.decode(reply, texts).orElseThrow());
	}

	@Test
	@DisplayName("assigns duplicates in first-seen order")
	void shouldAssignDuplicatesFifo() {
		// FIFO per normalized text is a heuristic; a backend swapping duplicate items cannot be detected
		final List<String> texts = List.of("a", "a", "b");
		final String reply = "<response>" +
			item("a", "a-result#1") +
			item("b", "b-result") +
			item("a", "a-result#2") +
			"</response>";

		assertEquals(List.of("a-result#1", "a-result#2", "b-result"), ProtocolCodec.decode(reply, texts).orElseThrow());
	}

	@Test
	@DisplayName("returns empty result when reply contains no items")
	void shouldReturnEmptyWithoutItems() {
		assertTrue(ProtocolCodec.decode("Hallo Welt. Wie geht es?", List.of("Hello world.", "How are you?")).isEmpty());
		assertTrue(ProtocolCodec.decode("", List.of("x")).isEmpty());
		assertTrue(ProtocolCodec.decode(null, List.of("x")).isEmpty());
	}

	@Test
	@DisplayName("leaves slot unset when translation is blank")
	void shouldLeaveBlankTranslationsUnset() {
		final List<String> texts = List.of("keep me", "translate me");
		final String reply = "<response>" + item("keep me", "   ") + item("translate me", "übersetzt") + "</response>";

		assertEquals(Arrays.asList(null, "übersetzt"), ProtocolCodec.decode(reply, texts).orElseThrow());
	}

	@Test
	@DisplayName("ignores malformed, unknown and surplus items")
	void shouldIgnoreNoise() {
		final List<String> texts = List.of("one", "two");
		final String reply = "Sure! Here it is:\n<response>\n" +
			"<item><original>one</original></item>\n" +
			item("", "nothing") +
			item("unknown", "unbekannt") +
			item("two", "zwei") +
			item("two", "zwei again") +
			"</response>";

		assertEquals(Arrays.asList(null, "zwei"), ProtocolCodec.decode(reply, texts).orElseThrow());
	}

	@Test
	@DisplayName("matches originals whose whitespace was reflowed")
	void shouldMatchNormalizedWhitespace() {
		final List<String> texts = List.of("multi\n  line\ttext");
		final String reply = "<RESPONSE><ITEM><Original> multi line text </Original><Translated>mehrzeilig</Translated></ITEM></RESPONSE>";

		assertEquals(List.of("mehrzeilig"), ProtocolCodec.decode(reply, texts).orElseThrow());
	}

	private static String echoReply(List<String> texts, String suffix) {
		final StringBuilder reply = new StringBuilder("<response>\n");
		for (final String text : texts) {
			reply.append(item(text, text + suffix)).append('\n');
		}
		return reply.append("</response>").toString();
	}

	private static String item(String original, String translated) {
		return "<item><original>" + XmlEntities.escape(original) + "</original><translated>" +
			XmlEntities.escape(translated) + "</translated></item>";
	}
}
