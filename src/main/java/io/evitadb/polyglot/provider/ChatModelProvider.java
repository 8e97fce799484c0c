package io.evitadb.polyglot.provider;

import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.polyglot.llm.ChatModelFactory;
import io.evitadb.polyglot.llm.LlmClient;
import io.evitadb.polyglot.llm.PromptTemplates;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Translation provider backed by a LangChain4j chat model. One class serves every {@link ProviderKind}; the kind
 * selects the chat model builder, the configuration rules and the model listing endpoint.
 *
 * The chat model is created on the first translation, so a provider that is only asked for its models never needs a
 * valid model configuration.
 */
public final class ChatModelProvider implements TranslationProvider {

	@Nonnull
	private final ProviderKind kind;
	@Nonnull
	private final ProviderSettings settings;
	@Nonnull
	private final Executor executor;
	@Nonnull
	private final ModelCatalog catalog;
	@Nonnull
	private final PromptTemplates prompts;
	@Nonnull
	private final Supplier<ChatModel> modelSupplier;
	private volatile LlmClient client;

	public ChatModelProvider(
		@Nonnull ProviderKind kind,
		@Nonnull ProviderSettings settings,
		@Nonnull Executor executor,
		@Nonnull ModelCatalog catalog,
		@Nonnull PromptTemplates prompts
	) {
		this(kind, settings, executor, catalog, prompts, () -> ChatModelFactory.create(kind, settings));
	}

	/**
	 * Creates a provider around an existing chat model.
	 *
	 * @param kind     provider kind
	 * @param settings provider settings
	 * @param model    chat model to use instead of building one
	 * @param executor executor the blocking chat calls run on
	 * @param catalog  model listing
	 * @param prompts  prompt templates
	 */
	public ChatModelProvider(
		@Nonnull ProviderKind kind,
		@Nonnull ProviderSettings settings,
		@Nonnull ChatModel model,
		@Nonnull Executor executor,
		@Nonnull ModelCatalog catalog,
		@Nonnull PromptTemplates prompts
	) {
		this(kind, settings, executor, catalog, prompts, () -> model);
		Objects.requireNonNull(model, "model must not be null");
	}

	private ChatModelProvider(
		@Nonnull ProviderKind kind,
		@Nonnull ProviderSettings settings,
		@Nonnull Executor executor,
		@Nonnull ModelCatalog catalog,
		@Nonnull PromptTemplates prompts,
		@Nonnull Supplier<ChatModel> modelSupplier
	) {
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
		this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
		this.modelSupplier = modelSupplier;
	}

	@Nonnull
	@Override
	public CompletionStage<String> translate(
		@Nonnull String payload,
		@Nonnull String targetLanguage,
		@Nonnull String sourceLanguage
	) {
		Objects.requireNonNull(payload, "payload must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");

		if (!validateConfig()) {
			return CompletableFuture.failedFuture(new TranslationProviderException(
				TranslationProviderException.Kind.INVALID_CONFIGURATION,
				getName(),
				"Invalid " + getName() + " configuration"
			));
		}

		return CompletableFuture.supplyAsync(() -> {
			try {
				final String systemPrompt = this.prompts.systemPrompt(targetLanguage, sourceLanguage);
				final String userPrompt = this.prompts.userPrompt(payload, targetLanguage, sourceLanguage);
				return client().chat(systemPrompt, userPrompt).trim();
			} catch (RuntimeException e) {
				throw TranslationProviderException.from(getName(), e);
			}
		}, this.executor);
	}

	@Nonnull
	@Override
	public List<String> getModels() {
		return this.catalog.listModels(this.kind, this.settings);
	}

	@Nonnull
	@Override
	public String getName() {
		return this.kind.getConfigName();
	}

	@Override
	public boolean validateConfig() {
		return switch (this.kind) {
			case OPENAI, ANTHROPIC, GEMINI -> this.settings.hasApiKey() && this.settings.hasModel();
			case OPENAI_COMPATIBLE, ANTHROPIC_COMPATIBLE -> this.settings.hasBaseUrl() && this.settings.hasModel();
			case OLLAMA -> this.settings.hasModel();
		};
	}

	@Nonnull
	public ProviderKind getKind() {
		return this.kind;
	}

	public long getInputTokens() {
		final LlmClient current = this.client;
		return current != null ? current.getInputTokens() : 0;
	}

	public long getOutputTokens() {
		final LlmClient current = this.client;
		return current != null ? current.getOutputTokens() : 0;
	}

	@Nonnull
	private LlmClient client() {
		LlmClient current = this.client;
		if (current == null) {
			synchronized (this) {
				current = this.client;
				if (current == null) {
					current = new LlmClient(this.modelSupplier.get());
					this.client = current;
				}
			}
		}
		return current;
	}
}
