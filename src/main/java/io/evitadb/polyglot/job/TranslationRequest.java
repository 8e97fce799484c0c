package io.evitadb.polyglot.job;

import io.evitadb.polyglot.model.TranslationSettings;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Parameters of one translation request. Missing or blank values fall back to the settings defaults.
 *
 * @param targetLanguage target language code, or null for the default
 * @param sourceLanguage source language code, or null for the default
 * @param providerName   provider configuration name, or null for the default
 */
public record TranslationRequest(
	@Nullable String targetLanguage,
	@Nullable String sourceLanguage,
	@Nullable String providerName
) {

	/**
	 * Creates a request using every default.
	 *
	 * @return request without explicit values
	 */
	@Nonnull
	public static TranslationRequest defaults() {
		return new TranslationRequest(null, null, null);
	}

	@Nonnull
	public String resolveTargetLanguage(@Nonnull TranslationSettings settings) {
		return firstNonBlank(this.targetLanguage, settings.defaultTargetLanguage());
	}

	@Nonnull
	public String resolveSourceLanguage(@Nonnull TranslationSettings settings) {
		return firstNonBlank(
			this.sourceLanguage,
			firstNonBlank(settings.defaultSourceLanguage(), TranslationSettings.AUTO_LANGUAGE)
		);
	}

	@Nonnull
	public String resolveProviderName(@Nonnull TranslationSettings settings) {
		return firstNonBlank(this.providerName, settings.defaultProvider());
	}

	@Nonnull
	private static String firstNonBlank(@Nullable String value, @Nonnull String fallback) {
		Objects.requireNonNull(fallback, "fallback must not be null");
		return value != null && !value.isBlank() ? value.trim() : fallback;
	}
}
