package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Read-only settings consumed by the translation engine.
 *
 * @param batchMaxChars           soft ceiling on the characters sent in one backend call
 * @param batchMaxItems           soft ceiling on the fragments sent in one backend call
 * @param defaultProvider         provider used when a request does not name one
 * @param defaultSourceLanguage   source language used when a request does not name one; {@link #AUTO_LANGUAGE} lets the backend detect it
 * @param defaultTargetLanguage   target language used when a request does not name one
 * @param throttleMillis          pause between two consecutive batches of one job
 * @param selectionChunkMaxLength maximum length of one piece of a selection translation
 */
public record TranslationSettings(
	int batchMaxChars,
	int batchMaxItems,
	@Nonnull String defaultProvider,
	@Nonnull String defaultSourceLanguage,
	@Nonnull String defaultTargetLanguage,
	long throttleMillis,
	int selectionChunkMaxLength
) {

	public static final String AUTO_LANGUAGE = "auto";
	public static final int DEFAULT_BATCH_MAX_CHARS = 64000;
	public static final int DEFAULT_BATCH_MAX_ITEMS = 20;
	public static final String DEFAULT_PROVIDER = "openai";
	public static final String DEFAULT_TARGET_LANGUAGE = "en";
	public static final long DEFAULT_THROTTLE_MILLIS = 100;
	public static final int DEFAULT_SELECTION_CHUNK_MAX_LENGTH = 2000;

	public TranslationSettings {
		Objects.requireNonNull(defaultProvider, "defaultProvider must not be null");
		Objects.requireNonNull(defaultSourceLanguage, "defaultSourceLanguage must not be null");
		Objects.requireNonNull(defaultTargetLanguage, "defaultTargetLanguage must not be null");
		if (batchMaxChars <= 0) {
			throw new IllegalArgumentException("batchMaxChars must be positive");
		}
		if (batchMaxItems <= 0) {
			throw new IllegalArgumentException("batchMaxItems must be positive");
		}
		if (throttleMillis < 0) {
			throw new IllegalArgumentException("throttleMillis must not be negative");
		}
		if (selectionChunkMaxLength <= 0) {
			throw new IllegalArgumentException("selectionChunkMaxLength must be positive");
		}
	}

	/**
	 * Creates settings with all defaults.
	 *
	 * @return default settings
	 */
	@Nonnull
	public static TranslationSettings defaults() {
		return new TranslationSettings(
			DEFAULT_BATCH_MAX_CHARS,
			DEFAULT_BATCH_MAX_ITEMS,
			DEFAULT_PROVIDER,
			AUTO_LANGUAGE,
			DEFAULT_TARGET_LANGUAGE,
			DEFAULT_THROTTLE_MILLIS,
			DEFAULT_SELECTION_CHUNK_MAX_LENGTH
		);
	}

	@Nonnull
	public TranslationSettings withBatchLimits(int maxChars, int maxItems) {
		return new TranslationSettings(
			maxChars, maxItems, this.defaultProvider, this.defaultSourceLanguage,
			this.defaultTargetLanguage, this.throttleMillis, this.selectionChunkMaxLength
		);
	}

	@Nonnull
	public TranslationSettings withThrottleMillis(long millis) {
		return new TranslationSettings(
			this.batchMaxChars, this.batchMaxItems, this.defaultProvider, this.defaultSourceLanguage,
			this.defaultTargetLanguage, millis, this.selectionChunkMaxLength
		);
	}

	@Nonnull
	public TranslationSettings withSelectionChunkMaxLength(int maxLength) {
		return new TranslationSettings(
			this.batchMaxChars, this.batchMaxItems, this.defaultProvider, this.defaultSourceLanguage,
			this.defaultTargetLanguage, this.throttleMillis, maxLength
		);
	}
}
