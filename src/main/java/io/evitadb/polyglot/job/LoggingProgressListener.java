package io.evitadb.polyglot.job;

import io.evitadb.polyglot.model.JobState;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Writes job progress to the Maven log, prefixed with a label identifying the document.
 */
public final class LoggingProgressListener implements ProgressListener {

	@Nonnull
	private final Log log;
	@Nonnull
	private final String label;

	public LoggingProgressListener(@Nonnull Log log, @Nonnull String label) {
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.label = Objects.requireNonNull(label, "label must not be null");
	}

	@Override
	public void onStatus(@Nonnull JobState state, @Nonnull String message) {
		final String line = "[" + this.label + "] " + message;
		switch (state) {
			case COMPLETED_WITH_ERRORS -> this.log.warn(line);
			case FAILED -> this.log.error(line);
			default -> this.log.info(line);
		}
	}

	@Override
	public void onGroupSettled(int groupId) {
		if (this.log.isDebugEnabled()) {
			this.log.debug("[" + this.label + "] Block " + (groupId + 1) + " settled");
		}
	}
}
