package io.evitadb.polyglot.provider;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Failure of a single backend call. The page job records it against the affected batch and carries on.
 */
public class TranslationProviderException extends RuntimeException {

	/**
	 * Classification of provider failures.
	 */
	public enum Kind {
		AUTHENTICATION,
		RATE_LIMIT,
		NETWORK,
		INVALID_CONFIGURATION,
		OTHER
	}

	@Nonnull
	private final Kind kind;
	@Nonnull
	private final String providerName;

	public TranslationProviderException(
		@Nonnull Kind kind,
		@Nonnull String providerName,
		@Nonnull String message,
		@Nullable Throwable cause
	) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.providerName = Objects.requireNonNull(providerName, "providerName must not be null");
	}

	public TranslationProviderException(@Nonnull Kind kind, @Nonnull String providerName, @Nonnull String message) {
		this(kind, providerName, message, null);
	}

	/**
	 * Wraps an arbitrary failure of a provider call, classifying it by exception type first and by message second.
	 * Already classified exceptions are returned unchanged. The resulting message is user facing; the original failure
	 * stays available as the cause.
	 *
	 * @param providerName name of the failing provider
	 * @param failure      the failure, possibly wrapped in a completion exception
	 * @return classified exception
	 */
	@Nonnull
	public static TranslationProviderException from(@Nonnull String providerName, @Nonnull Throwable failure) {
		Objects.requireNonNull(failure, "failure must not be null");
		final Throwable cause = unwrap(failure);
		if (cause instanceof TranslationProviderException translationProviderException) {
			return translationProviderException;
		}
		final String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
		final Kind kind = classify(cause);
		final String message = switch (kind) {
			case AUTHENTICATION -> "Invalid API key for " + providerName;
			case RATE_LIMIT -> "Rate limit exceeded for " + providerName;
			case NETWORK -> "Network error when connecting to " + providerName;
			case INVALID_CONFIGURATION -> "Invalid " + providerName + " configuration";
			case OTHER -> "Translation failed: " + detail;
		};
		return new TranslationProviderException(kind, providerName, message, cause);
	}

	/**
	 * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
	 *
	 * @param failure possibly wrapped failure
	 * @return the innermost meaningful cause
	 */
	@Nonnull
	public static Throwable unwrap(@Nonnull Throwable failure) {
		Throwable current = failure;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
			&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	@Nonnull
	private static Kind classify(@Nonnull Throwable cause) {
		if (cause instanceof AuthenticationException) {
			return Kind.AUTHENTICATION;
		}
		if (cause instanceof RateLimitException) {
			return Kind.RATE_LIMIT;
		}
		if (cause instanceof IOException || cause instanceof UncheckedIOException) {
			return Kind.NETWORK;
		}
		final String message = cause.getMessage() == null ? "" : cause.getMessage().toLowerCase(Locale.ROOT);
		if (message.contains("api key") || message.contains("unauthorized") || message.contains("401")) {
			return Kind.AUTHENTICATION;
		}
		if (message.contains("rate limit") || message.contains("429")) {
			return Kind.RATE_LIMIT;
		}
		if (cause instanceof RetriableException || message.contains("network") || message.contains("timeout")
			|| message.contains("timed out") || message.contains("connect")) {
			return Kind.NETWORK;
		}
		return Kind.OTHER;
	}

	@Nonnull
	public Kind getKind() {
		return this.kind;
	}

	@Nonnull
	public String getProviderName() {
		return this.providerName;
	}
}
