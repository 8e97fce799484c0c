package io.evitadb.polyglot.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.evitadb.polyglot.provider.ProviderKind;
import io.evitadb.polyglot.provider.ProviderSettings;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;

/**
 * Factory for LangChain4j ChatModel instances, one builder per provider protocol.
 */
public final class ChatModelFactory {

	private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

	private ChatModelFactory() {
		// Utility class - prevent instantiation
	}

	/**
	 * Creates a ChatModel for the given provider.
	 *
	 * @param kind     the provider kind
	 * @param settings the provider's configuration
	 * @return configured ChatModel instance
	 * @throws IllegalArgumentException if the model name or a required base URL is missing
	 */
	@Nonnull
	public static ChatModel create(@Nonnull ProviderKind kind, @Nonnull ProviderSettings settings) {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(settings, "settings must not be null");
		if (!settings.hasModel()) {
			throw new IllegalArgumentException("Provider " + kind.getConfigName() + " requires a model name");
		}
		final String baseUrl = settings.effectiveBaseUrl(kind);
		if (baseUrl == null) {
			throw new IllegalArgumentException("Provider " + kind.getConfigName() + " requires a base URL");
		}

		return switch (kind) {
			case OPENAI, OPENAI_COMPATIBLE -> createOpenAiModel(baseUrl, settings);
			case ANTHROPIC, ANTHROPIC_COMPATIBLE -> createAnthropicModel(baseUrl, settings);
			case GEMINI -> createGeminiModel(settings);
			case OLLAMA -> createOllamaModel(baseUrl, settings);
		};
	}

	/**
	 * Creates an OpenAI-compatible ChatModel.
	 *
	 * @param baseUrl  the base URL for the API
	 * @param settings provider settings
	 * @return configured OpenAiChatModel instance
	 */
	@Nonnull
	private static ChatModel createOpenAiModel(@Nonnull String baseUrl, @Nonnull ProviderSettings settings) {
		return OpenAiChatModel.builder()
			.baseUrl(baseUrl)
			// Some OpenAI-compatible servers reject requests without any key
			.apiKey(keyOrPlaceholder(settings.apiKey()))
			.modelName(settings.model())
			.temperature(settings.effectiveTemperature())
			.maxTokens(settings.effectiveMaxTokens())
			.timeout(DEFAULT_TIMEOUT)
			.logRequests(false)
			.logResponses(false)
			.build();
	}

	@Nonnull
	private static ChatModel createAnthropicModel(@Nonnull String baseUrl, @Nonnull ProviderSettings settings) {
		final AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
			.baseUrl(baseUrl)
			.modelName(settings.model())
			.temperature(settings.effectiveTemperature())
			.maxTokens(settings.effectiveMaxTokens())
			.timeout(DEFAULT_TIMEOUT)
			.logRequests(false)
			.logResponses(false);

		if (settings.hasApiKey()) {
			builder.apiKey(settings.apiKey());
		}

		return builder.build();
	}

	@Nonnull
	private static ChatModel createGeminiModel(@Nonnull ProviderSettings settings) {
		return GoogleAiGeminiChatModel.builder()
			.apiKey(settings.apiKey())
			.modelName(settings.model())
			.temperature(settings.effectiveTemperature())
			.maxOutputTokens(settings.effectiveMaxTokens())
			.timeout(DEFAULT_TIMEOUT)
			.build();
	}

	@Nonnull
	private static ChatModel createOllamaModel(@Nonnull String baseUrl, @Nonnull ProviderSettings settings) {
		return OllamaChatModel.builder()
			.baseUrl(baseUrl)
			.modelName(settings.model())
			.temperature(settings.effectiveTemperature())
			.numPredict(settings.effectiveMaxTokens())
			.timeout(DEFAULT_TIMEOUT)
			.build();
	}

	@Nonnull
	private static String keyOrPlaceholder(@Nullable String apiKey) {
		return apiKey != null && !apiKey.isBlank() ? apiKey : "none";
	}
}
