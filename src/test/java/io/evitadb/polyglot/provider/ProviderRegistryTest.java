package io.evitadb.polyglot.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("ProviderRegistry should resolve providers by name")
class ProviderRegistryTest {

	private final ModelCatalog catalog = mock(ModelCatalog.class);

	@Test
	@DisplayName("creates enabled providers once and ignores name case")
	void shouldCacheProviders() {
		final ProviderRegistry registry = new ProviderRegistry(
			Map.of(ProviderKind.OPENAI, ProviderSettings.of("sk", null, "gpt-4o")),
			Runnable::run,
			catalog
		);

		final TranslationProvider provider = registry.get("openai");

		assertEquals("openai", provider.getName());
		assertSame(provider, registry.get(" OpenAI "));
	}

	@Test
	@DisplayName("rejects unknown provider names")
	void shouldRejectUnknownName() {
		final ProviderRegistry registry = new ProviderRegistry(Map.of(), Runnable::run, catalog);

		final IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> registry.get("deepl"));
		assertTrue(exception.getMessage().contains("Unknown provider: deepl"));
		assertTrue(exception.getMessage().contains("openai-compatible"));
	}

	@Test
	@DisplayName("rejects providers that are missing or disabled")
	void shouldRejectDisabledProvider() {
		final ProviderRegistry registry = new ProviderRegistry(
			Map.of(ProviderKind.ANTHROPIC, new ProviderSettings(false, "sk", null, "claude", null, null)),
			Runnable::run,
			catalog
		);

		final TranslationProviderException disabled = assertThrows(TranslationProviderException.class, () -> registry.get("anthropic"));
		assertEquals(TranslationProviderException.Kind.INVALID_CONFIGURATION, disabled.getKind());
		assertEquals("Provider anthropic is not enabled", disabled.getMessage());
		assertThrows(TranslationProviderException.class, () -> registry.get("gemini"));
	}

	@Test
	@DisplayName("returns registered custom providers")
	void shouldReturnRegisteredProvider() {
		final ProviderRegistry registry = new ProviderRegistry(Map.of(), Runnable::run, catalog);
		final TranslationProvider custom = new TranslationProvider() {
			@Override
			public CompletionStage<String> translate(String payload, String targetLanguage, String sourceLanguage) {
				return CompletableFuture.completedFuture(payload);
			}

			@Override
			public List<String> getModels() {
				return List.of("echo");
			}

			@Override
			public String getName() {
				return "echo";
			}

			@Override
			public boolean validateConfig() {
				return true;
			}
		};

		registry.register(custom);

		assertSame(custom, registry.get("ECHO"));
	}
}
