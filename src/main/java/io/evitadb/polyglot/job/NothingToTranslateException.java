package io.evitadb.polyglot.job;

import javax.annotation.Nonnull;

/**
 * Thrown when a document scan yields no translatable text. The job ends without contacting the backend.
 */
public class NothingToTranslateException extends RuntimeException {

	public NothingToTranslateException(@Nonnull String message) {
		super(message);
	}
}
