package io.evitadb.polyglot.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lists the models a backend offers through its HTTP model listing endpoint. Best effort: every failure is logged
 * as a warning and yields an empty list.
 */
public class ModelCatalog {

	static final String ANTHROPIC_VERSION = "2023-06-01";
	private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

	@Nonnull
	private final HttpClient httpClient;
	@Nonnull
	private final ObjectMapper objectMapper;
	@Nonnull
	private final Log log;

	public ModelCatalog(@Nonnull Log log) {
		this(
			HttpClient.newBuilder()
				.connectTimeout(REQUEST_TIMEOUT)
				.followRedirects(HttpClient.Redirect.NORMAL)
				.build(),
			new ObjectMapper(),
			log
		);
	}

	public ModelCatalog(@Nonnull HttpClient httpClient, @Nonnull ObjectMapper objectMapper, @Nonnull Log log) {
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Fetches the model names of a provider.
	 *
	 * @param kind     provider kind
	 * @param settings provider settings carrying endpoint and key
	 * @return model names, empty on any failure
	 */
	@Nonnull
	public List<String> listModels(@Nonnull ProviderKind kind, @Nonnull ProviderSettings settings) {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(settings, "settings must not be null");

		final String baseUrl = settings.effectiveBaseUrl(kind);
		if (baseUrl == null) {
			this.log.warn("Cannot list models of " + kind.getConfigName() + ": no base URL configured");
			return List.of();
		}

		try {
			final HttpResponse<String> response = this.httpClient.send(
				buildRequest(kind, settings, baseUrl),
				HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)
			);
			if (response.statusCode() != 200) {
				this.log.warn("Failed to fetch models from " + kind.getConfigName() + ": HTTP " + response.statusCode());
				return List.of();
			}
			return parseModelIds(kind, response.body());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.log.warn("Interrupted while fetching models from " + kind.getConfigName());
			return List.of();
		} catch (IOException | IllegalArgumentException e) {
			this.log.warn("Failed to fetch models from " + kind.getConfigName() + ": " + e.getMessage());
			return List.of();
		}
	}

	/**
	 * Extracts model names from a listing response body.
	 *
	 * @param kind provider kind that produced the body
	 * @param body JSON response body
	 * @return model names in the provider's order, sorted and filtered to chat models for OpenAI
	 * @throws IOException if the body is not valid JSON
	 */
	@Nonnull
	List<String> parseModelIds(@Nonnull ProviderKind kind, @Nonnull String body) throws IOException {
		final JsonNode root = this.objectMapper.readTree(body);
		final List<String> ids = new ArrayList<>();
		switch (kind) {
			case OPENAI, OPENAI_COMPATIBLE, ANTHROPIC, ANTHROPIC_COMPATIBLE -> {
				for (final JsonNode model : root.path("data")) {
					final String id = model.path("id").asText("");
					if (!id.isEmpty()) {
						ids.add(id);
					}
				}
			}
			case GEMINI, OLLAMA -> {
				for (final JsonNode model : root.path("models")) {
					final String name = model.path("name").asText("").replace("models/", "");
					if (!name.isEmpty()) {
						ids.add(name);
					}
				}
			}
		}
		if (kind == ProviderKind.OPENAI) {
			ids.removeIf(id -> !id.contains("gpt"));
			Collections.sort(ids);
		}
		return ids;
	}

	@Nonnull
	private static HttpRequest buildRequest(
		@Nonnull ProviderKind kind,
		@Nonnull ProviderSettings settings,
		@Nonnull String baseUrl
	) {
		final HttpRequest.Builder builder = HttpRequest.newBuilder()
			.timeout(REQUEST_TIMEOUT)
			.header("Accept", "application/json")
			.GET();
		switch (kind) {
			case OPENAI, OPENAI_COMPATIBLE -> {
				builder.uri(URI.create(baseUrl + "/models"));
				if (settings.hasApiKey()) {
					builder.header("Authorization", "Bearer " + settings.apiKey());
				}
			}
			case ANTHROPIC, ANTHROPIC_COMPATIBLE -> {
				builder.uri(URI.create(baseUrl + "/models"));
				builder.header("anthropic-version", ANTHROPIC_VERSION);
				if (settings.hasApiKey()) {
					builder.header("x-api-key", settings.apiKey());
				}
			}
			case GEMINI -> builder.uri(URI.create(
				baseUrl + "/models?key=" + URLEncoder.encode(
					settings.apiKey() != null ? settings.apiKey() : "", StandardCharsets.UTF_8
				)
			));
			case OLLAMA -> builder.uri(URI.create(baseUrl + "/api/tags"));
		}
		return builder.build();
	}
}
