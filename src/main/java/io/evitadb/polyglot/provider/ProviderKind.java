package io.evitadb.polyglot.provider;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Translation backends known to the plugin, addressed by their configuration name.
 */
public enum ProviderKind {

	OPENAI("openai", "https://api.openai.com/v1", true),
	OPENAI_COMPATIBLE("openai-compatible", null, false),
	ANTHROPIC("anthropic", "https://api.anthropic.com/v1", true),
	ANTHROPIC_COMPATIBLE("anthropic-compatible", null, false),
	GEMINI("gemini", "https://generativelanguage.googleapis.com/v1beta", true),
	OLLAMA("ollama", "http://127.0.0.1:11434", false);

	@Nonnull
	private final String configName;
	@Nullable
	private final String defaultBaseUrl;
	private final boolean apiKeyRequired;

	ProviderKind(@Nonnull String configName, @Nullable String defaultBaseUrl, boolean apiKeyRequired) {
		this.configName = configName;
		this.defaultBaseUrl = defaultBaseUrl;
		this.apiKeyRequired = apiKeyRequired;
	}

	/**
	 * Resolves a provider by its configuration name, ignoring case and surrounding whitespace.
	 *
	 * @param name configuration name such as "openai" or "anthropic-compatible"
	 * @return the matching provider kind
	 * @throws IllegalArgumentException if the name is unknown
	 */
	@Nonnull
	public static ProviderKind fromName(@Nonnull String name) {
		Objects.requireNonNull(name, "name must not be null");
		final String normalized = name.trim().toLowerCase(Locale.ROOT);
		for (final ProviderKind kind : values()) {
			if (kind.configName.equals(normalized)) {
				return kind;
			}
		}
		throw new IllegalArgumentException(
			"Unknown provider: " + name + ". Supported providers: " + supportedNames()
		);
	}

	/**
	 * Returns the comma separated configuration names of all providers.
	 *
	 * @return supported provider names
	 */
	@Nonnull
	public static String supportedNames() {
		return Arrays.stream(values())
			.map(ProviderKind::getConfigName)
			.collect(Collectors.joining(", "));
	}

	@Nonnull
	public String getConfigName() {
		return this.configName;
	}

	/**
	 * Returns the endpoint used when no base URL is configured. The `-compatible` kinds have none.
	 *
	 * @return default base URL or null
	 */
	@Nullable
	public String getDefaultBaseUrl() {
		return this.defaultBaseUrl;
	}

	public boolean isApiKeyRequired() {
		return this.apiKeyRequired;
	}

	/**
	 * Returns true for kinds that speak the OpenAI chat completion protocol.
	 *
	 * @return true for {@link #OPENAI} and {@link #OPENAI_COMPATIBLE}
	 */
	public boolean isOpenAiProtocol() {
		return this == OPENAI || this == OPENAI_COMPATIBLE;
	}

	/**
	 * Returns true for kinds that speak the Anthropic messages protocol.
	 *
	 * @return true for {@link #ANTHROPIC} and {@link #ANTHROPIC_COMPATIBLE}
	 */
	public boolean isAnthropicProtocol() {
		return this == ANTHROPIC || this == ANTHROPIC_COMPATIBLE;
	}
}
