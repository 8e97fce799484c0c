package io.evitadb.polyglot.llm;

import io.evitadb.polyglot.model.TranslationSettings;

import javax.annotation.Nonnull;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads the batch translation prompt from `META-INF/prompts/` and fills in its `{{name}}` placeholders.
 * Templates are read once and cached.
 */
public final class PromptTemplates {

	public static final String SYSTEM_TEMPLATE = "translate-batch-system.txt";
	public static final String USER_TEMPLATE = "translate-batch-user.txt";

	private static final String PROMPTS_PATH = "META-INF/prompts/";
	private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{(\\w+)}}");
	private static final String DETECTED_SOURCE_LANGUAGE = "the detected source language";

	private final Map<String, String> templateCache = new ConcurrentHashMap<>();

	/**
	 * Builds the system prompt for translating one request payload.
	 *
	 * @param targetLanguage target language code
	 * @param sourceLanguage source language code or "auto"
	 * @return system prompt
	 */
	@Nonnull
	public String systemPrompt(@Nonnull String targetLanguage, @Nonnull String sourceLanguage) {
		return render(SYSTEM_TEMPLATE, Map.of(
			"sourceLanguage", describeSource(sourceLanguage),
			"targetLanguage", targetLanguage
		));
	}

	/**
	 * Builds the user prompt carrying the request payload.
	 *
	 * @param payload        encoded request payload
	 * @param targetLanguage target language code
	 * @param sourceLanguage source language code or "auto"
	 * @return user prompt
	 */
	@Nonnull
	public String userPrompt(@Nonnull String payload, @Nonnull String targetLanguage, @Nonnull String sourceLanguage) {
		Objects.requireNonNull(payload, "payload must not be null");
		return render(USER_TEMPLATE, Map.of(
			"sourceLanguage", describeSource(sourceLanguage),
			"targetLanguage", targetLanguage,
			"requestPayload", payload
		));
	}

	/**
	 * Replaces `{{name}}` placeholders. Placeholders without a value are left unchanged.
	 *
	 * @param template template text
	 * @param values   placeholder values
	 * @return interpolated text
	 */
	@Nonnull
	static String interpolate(@Nonnull String template, @Nonnull Map<String, String> values) {
		final Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
		final StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			final String value = values.get(matcher.group(1));
			matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : matcher.group()));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	@Nonnull
	private String render(@Nonnull String templateName, @Nonnull Map<String, String> values) {
		return interpolate(this.templateCache.computeIfAbsent(templateName, PromptTemplates::load), values);
	}

	@Nonnull
	private static String describeSource(@Nonnull String sourceLanguage) {
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		return TranslationSettings.AUTO_LANGUAGE.equalsIgnoreCase(sourceLanguage.trim())
			? DETECTED_SOURCE_LANGUAGE
			: sourceLanguage;
	}

	@Nonnull
	private static String load(@Nonnull String templateName) {
		final String resourcePath = PROMPTS_PATH + templateName;
		final InputStream inputStream = PromptTemplates.class.getClassLoader().getResourceAsStream(resourcePath);
		if (inputStream == null) {
			throw new IllegalArgumentException("Prompt template not found: " + resourcePath);
		}
		try (final BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
			return reader.lines().collect(Collectors.joining("\n"));
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read prompt template: " + resourcePath, e);
		}
	}
}
