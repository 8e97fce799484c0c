package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record containing the final report of one page translation job.
 * Per-batch failures are aggregated here instead of being thrown while the job runs.
 *
 * @param state              terminal state of the job
 * @param batchCount         number of batches the document was split into
 * @param translatedGroups   number of groups settled by a successful batch
 * @param errorCount         number of failed batches
 * @param errors             one message per failed batch, e.g. "Blocks 3, 4: Rate limit exceeded"
 * @param emptyTranslations  number of fragments for which the backend returned an empty translation
 * @param batchOutcomes      outcome of every batch, in batch order
 */
public record JobSummary(
	@Nonnull JobState state,
	int batchCount,
	int translatedGroups,
	int errorCount,
	@Nonnull List<String> errors,
	int emptyTranslations,
	@Nonnull List<BatchOutcome> batchOutcomes
) {

	public JobSummary {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(errors, "errors must not be null");
		Objects.requireNonNull(batchOutcomes, "batchOutcomes must not be null");
		errors = List.copyOf(errors);
		batchOutcomes = List.copyOf(batchOutcomes);
	}

	/**
	 * Returns true if the job ran to the end without any failed batch.
	 *
	 * @return true for {@link JobState#COMPLETED}
	 */
	public boolean isAllSuccessful() {
		return this.state == JobState.COMPLETED;
	}

	/**
	 * Returns true if at least one batch failed.
	 *
	 * @return true if errors were recorded
	 */
	public boolean hasFailures() {
		return this.errorCount > 0;
	}

	/**
	 * Returns the number of batches that had to fall back to the approximate sentence split.
	 *
	 * @return count of degraded batches
	 */
	public int fallbackCount() {
		int count = 0;
		for (final BatchOutcome outcome : this.batchOutcomes) {
			if (outcome.fallbackUsed()) {
				count++;
			}
		}
		return count;
	}

	@Override
	public String toString() {
		return String.format(
			"JobSummary[state=%s, batches=%d, translatedGroups=%d, errors=%d, empty=%d, fallback=%d]",
			this.state, this.batchCount, this.translatedGroups, this.errorCount,
			this.emptyTranslations, fallbackCount()
		);
	}
}
