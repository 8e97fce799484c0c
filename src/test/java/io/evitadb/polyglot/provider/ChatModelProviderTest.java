package io.evitadb.polyglot.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.evitadb.polyglot.llm.PromptTemplates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("ChatModelProvider should translate payloads through a chat model")
class ChatModelProviderTest {

	private ChatModel mockModel;
	private ModelCatalog catalog;

	@BeforeEach
	void setUp() {
		mockModel = mock(ChatModel.class);
		catalog = mock(ModelCatalog.class);
	}

	@Test
	@DisplayName("returns the trimmed reply and counts tokens")
	void shouldReturnTrimmedReply() {
		when(mockModel.chat(anyList())).thenReturn(
			ChatResponse.builder()
				.aiMessage(AiMessage.from("\n<response></response>\n"))
				.tokenUsage(new TokenUsage(12, 3))
				.build()
		);
		final ChatModelProvider provider = provider(ProviderKind.OPENAI, ProviderSettings.of("sk", null, "gpt-4o"));

		final String reply = provider.translate("<request>\n</request>", "de", "en").toCompletableFuture().join();

		assertEquals("<response></response>", reply);
		assertEquals(12, provider.getInputTokens());
		assertEquals(3, provider.getOutputTokens());
	}

	@Test
	@DisplayName("fails with invalid configuration before calling the model")
	void shouldFailOnInvalidConfiguration() {
		final ChatModelProvider provider = provider(ProviderKind.OPENAI, ProviderSettings.of(null, null, "gpt-4o"));

		final CompletableFuture<String> result = provider.translate("payload", "de", "en").toCompletableFuture();

		final CompletionException exception = assertThrows(CompletionException.class, result::join);
		final TranslationProviderException cause = assertInstanceOf(TranslationProviderException.class, exception.getCause());
		assertEquals(TranslationProviderException.Kind.INVALID_CONFIGURATION, cause.getKind());
		assertEquals("Invalid openai configuration", cause.getMessage());
		verifyNoInteractions(mockModel);
	}

	@Test
	@DisplayName("classifies chat model failures")
	void shouldClassifyModelFailure() {
		when(mockModel.chat(anyList())).thenThrow(new AuthenticationException("Incorrect API key provided"));
		final ChatModelProvider provider = provider(ProviderKind.ANTHROPIC, ProviderSettings.of("sk", null, "claude"));

		final CompletionException exception = assertThrows(
			CompletionException.class,
			() -> provider.translate("payload", "de", "auto").toCompletableFuture().join()
		);

		final TranslationProviderException cause = assertInstanceOf(TranslationProviderException.class, exception.getCause());
		assertEquals(TranslationProviderException.Kind.AUTHENTICATION, cause.getKind());
		assertEquals("Invalid API key for anthropic", cause.getMessage());
	}

	@Test
	@DisplayName("validates configuration per provider kind")
	void shouldValidateConfigurationPerKind() {
		assertTrue(provider(ProviderKind.GEMINI, ProviderSettings.of("key", null, "gemini")).validateConfig());
		assertFalse(provider(ProviderKind.GEMINI, ProviderSettings.of("key", null, null)).validateConfig());
		assertTrue(provider(ProviderKind.OPENAI_COMPATIBLE, ProviderSettings.of(null, "http://localhost:1234/v1", "m")).validateConfig());
		assertFalse(provider(ProviderKind.ANTHROPIC_COMPATIBLE, ProviderSettings.of("key", null, "m")).validateConfig());
		assertTrue(provider(ProviderKind.OLLAMA, ProviderSettings.of(null, null, "llama3")).validateConfig());
		assertFalse(provider(ProviderKind.OLLAMA, ProviderSettings.of(null, null, "")).validateConfig());
	}

	@Test
	@DisplayName("delegates model listing and connection test to the catalog")
	void shouldDelegateModelListing() {
		final ProviderSettings settings = ProviderSettings.of("sk", null, "gpt-4o");
		when(catalog.listModels(ProviderKind.OPENAI, settings)).thenReturn(List.of("gpt-4o"));
		when(catalog.listModels(eq(ProviderKind.OLLAMA), any())).thenReturn(List.of());

		assertEquals(List.of("gpt-4o"), provider(ProviderKind.OPENAI, settings).getModels());
		assertTrue(provider(ProviderKind.OPENAI, settings).testConnection());
		assertFalse(provider(ProviderKind.OLLAMA, ProviderSettings.of(null, null, "llama3")).testConnection());
	}

	private ChatModelProvider provider(ProviderKind kind, ProviderSettings settings) {
		return new ChatModelProvider(kind, settings, mockModel, Runnable::run, catalog, new PromptTemplates());
	}
}
