package io.evitadb.polyglot.provider;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * A translation backend. The page job depends only on this contract, so implementations are interchangeable.
 */
public interface TranslationProvider {

	/**
	 * Sends a request payload to the backend and returns its raw reply.
	 * The returned stage completes exceptionally with {@link TranslationProviderException} when the call fails.
	 *
	 * @param payload        encoded request payload
	 * @param targetLanguage target language code
	 * @param sourceLanguage source language code, or "auto" to let the backend detect it
	 * @return stage completing with the reply payload
	 */
	@Nonnull
	CompletionStage<String> translate(@Nonnull String payload, @Nonnull String targetLanguage, @Nonnull String sourceLanguage);

	/**
	 * Lists the models the backend offers. Best effort: failures yield an empty list.
	 *
	 * @return model names, possibly empty
	 */
	@Nonnull
	List<String> getModels();

	/**
	 * Returns the configuration name of the provider.
	 *
	 * @return provider name
	 */
	@Nonnull
	String getName();

	/**
	 * Checks that the configuration carries everything the provider needs to make a call.
	 *
	 * @return true if the provider is usable
	 */
	boolean validateConfig();

	/**
	 * Checks that the backend is reachable with the current configuration.
	 *
	 * @return true if the backend reported at least one model
	 */
	default boolean testConnection() {
		return !getModels().isEmpty();
	}
}
