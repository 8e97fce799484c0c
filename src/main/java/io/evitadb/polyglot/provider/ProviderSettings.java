package io.evitadb.polyglot.provider;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Per-provider configuration.
 *
 * @param enabled     disabled providers are refused by the {@link ProviderRegistry}
 * @param apiKey      API key, may be null for local endpoints
 * @param baseUrl     endpoint override, null means the provider's default
 * @param model       model name
 * @param temperature sampling temperature, null means {@link #DEFAULT_TEMPERATURE}
 * @param maxTokens   output token cap, null means {@link #DEFAULT_MAX_TOKENS}
 */
public record ProviderSettings(
	boolean enabled,
	@Nullable String apiKey,
	@Nullable String baseUrl,
	@Nullable String model,
	@Nullable Double temperature,
	@Nullable Integer maxTokens
) {

	public static final double DEFAULT_TEMPERATURE = 0.3;
	public static final int DEFAULT_MAX_TOKENS = 2000;

	/**
	 * Creates enabled settings with default temperature and token cap.
	 *
	 * @param apiKey  API key
	 * @param baseUrl endpoint override
	 * @param model   model name
	 * @return settings
	 */
	@Nonnull
	public static ProviderSettings of(@Nullable String apiKey, @Nullable String baseUrl, @Nullable String model) {
		return new ProviderSettings(true, apiKey, baseUrl, model, null, null);
	}

	/**
	 * Returns the configured base URL, or the provider's default one, without trailing slashes.
	 *
	 * @param kind provider the settings belong to
	 * @return effective base URL, or null when neither is set
	 */
	@Nullable
	public String effectiveBaseUrl(@Nonnull ProviderKind kind) {
		final String url = hasText(this.baseUrl) ? this.baseUrl : kind.getDefaultBaseUrl();
		if (url == null) {
			return null;
		}
		String normalized = url.trim();
		while (normalized.endsWith("/")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return normalized;
	}

	public double effectiveTemperature() {
		return this.temperature != null ? this.temperature : DEFAULT_TEMPERATURE;
	}

	public int effectiveMaxTokens() {
		return this.maxTokens != null ? this.maxTokens : DEFAULT_MAX_TOKENS;
	}

	public boolean hasApiKey() {
		return hasText(this.apiKey);
	}

	public boolean hasModel() {
		return hasText(this.model);
	}

	public boolean hasBaseUrl() {
		return hasText(this.baseUrl);
	}

	private static boolean hasText(@Nullable String value) {
		return value != null && !value.isBlank();
	}
}
