package io.evitadb.polyglot.provider;

import io.evitadb.polyglot.llm.PromptTemplates;

import javax.annotation.Nonnull;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Resolves translation providers by their configuration name. Providers are created lazily and cached, so repeated
 * jobs share one chat model and its token counters.
 */
public final class ProviderRegistry {

	@Nonnull
	private final Map<ProviderKind, ProviderSettings> settings;
	@Nonnull
	private final Executor executor;
	@Nonnull
	private final ModelCatalog catalog;
	private final PromptTemplates prompts = new PromptTemplates();
	private final Map<String, TranslationProvider> providers = new ConcurrentHashMap<>();

	/**
	 * Creates a registry.
	 *
	 * @param settings configuration of the known providers; providers missing here are treated as disabled
	 * @param executor executor the chat calls run on
	 * @param catalog  model listing shared by all providers
	 */
	public ProviderRegistry(
		@Nonnull Map<ProviderKind, ProviderSettings> settings,
		@Nonnull Executor executor,
		@Nonnull ModelCatalog catalog
	) {
		Objects.requireNonNull(settings, "settings must not be null");
		this.settings = settings.isEmpty() ? new EnumMap<>(ProviderKind.class) : new EnumMap<>(settings);
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
	}

	/**
	 * Returns the provider registered under the given name, creating it on first use.
	 *
	 * @param name provider configuration name
	 * @return the provider
	 * @throws IllegalArgumentException      if the name is unknown
	 * @throws TranslationProviderException if the provider is not configured or disabled
	 */
	@Nonnull
	public TranslationProvider get(@Nonnull String name) {
		Objects.requireNonNull(name, "name must not be null");
		final String key = name.trim().toLowerCase(Locale.ROOT);
		final TranslationProvider registered = this.providers.get(key);
		if (registered != null) {
			return registered;
		}

		final ProviderKind kind = ProviderKind.fromName(key);
		final ProviderSettings providerSettings = this.settings.get(kind);
		if (providerSettings == null || !providerSettings.enabled()) {
			throw new TranslationProviderException(
				TranslationProviderException.Kind.INVALID_CONFIGURATION,
				kind.getConfigName(),
				"Provider " + kind.getConfigName() + " is not enabled"
			);
		}
		return this.providers.computeIfAbsent(
			key,
			k -> new ChatModelProvider(kind, providerSettings, this.executor, this.catalog, this.prompts)
		);
	}

	/**
	 * Registers a provider instance under its own name, replacing any provider of that name.
	 *
	 * @param provider provider to register
	 */
	public void register(@Nonnull TranslationProvider provider) {
		Objects.requireNonNull(provider, "provider must not be null");
		this.providers.put(provider.getName().trim().toLowerCase(Locale.ROOT), provider);
	}
}
