package io.evitadb.polyglot.llm;

import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.polyglot.provider.ProviderKind;
import io.evitadb.polyglot.provider.ProviderSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChatModelFactory should create models for every provider protocol")
class ChatModelFactoryTest {

	@Test
	@DisplayName("creates OpenAI model with the default endpoint")
	void shouldCreateOpenAiModel() {
		final ChatModel model = ChatModelFactory.create(ProviderKind.OPENAI, ProviderSettings.of("sk-test", null, "gpt-4o-mini"));
		assertNotNull(model);
	}

	@Test
	@DisplayName("creates OpenAI-compatible model without a key")
	void shouldCreateCompatibleModelWithoutKey() {
		final ChatModel model = ChatModelFactory.create(
			ProviderKind.OPENAI_COMPATIBLE,
			ProviderSettings.of(null, "http://localhost:8080/v1/", "local-model")
		);
		assertNotNull(model);
	}

	@Test
	@DisplayName("creates Anthropic model")
	void shouldCreateAnthropicModel() {
		final ChatModel model = ChatModelFactory.create(ProviderKind.ANTHROPIC, ProviderSettings.of("sk-ant", null, "claude-sonnet-4-20250514"));
		assertNotNull(model);
	}

	@Test
	@DisplayName("creates Gemini and Ollama models")
	void shouldCreateGeminiAndOllamaModels() {
		assertNotNull(ChatModelFactory.create(ProviderKind.GEMINI, ProviderSettings.of("key", null, "gemini-1.5-flash")));
		assertNotNull(ChatModelFactory.create(ProviderKind.OLLAMA, ProviderSettings.of(null, null, "llama3")));
	}

	@Test
	@DisplayName("requires a model name")
	void shouldRequireModel() {
		final Exception exception = assertThrows(IllegalArgumentException.class, () ->
			ChatModelFactory.create(ProviderKind.OPENAI, ProviderSettings.of("sk-test", null, " ")));
		assertTrue(exception.getMessage().contains("model"));
	}

	@Test
	@DisplayName("requires a base URL for compatible providers")
	void shouldRequireBaseUrlForCompatibleProvider() {
		final Exception exception = assertThrows(IllegalArgumentException.class, () ->
			ChatModelFactory.create(ProviderKind.ANTHROPIC_COMPATIBLE, ProviderSettings.of("key", null, "model")));
		assertTrue(exception.getMessage().contains("base URL"));
	}
}
