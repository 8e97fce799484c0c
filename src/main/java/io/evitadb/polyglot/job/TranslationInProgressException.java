package io.evitadb.polyglot.job;

import javax.annotation.Nonnull;

/**
 * Thrown when a translation is requested while another one of the same kind is still running.
 */
public class TranslationInProgressException extends RuntimeException {

	public TranslationInProgressException(@Nonnull String message) {
		super(message);
	}
}
