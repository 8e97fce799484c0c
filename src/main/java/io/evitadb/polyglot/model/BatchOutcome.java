package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * What happened to one batch of a finished job.
 *
 * @param batchIndex      zero-based batch index
 * @param state           terminal state of the batch
 * @param fallbackUsed    true when the reply could not be decoded and the degraded sentence split was applied
 * @param appliedCount    number of fragments whose translation was written to the document
 * @param groupIds        ids of the groups the batch contained
 * @param errorMessage    failure message, only set for {@link BatchState#FAILED}
 */
public record BatchOutcome(
	int batchIndex,
	@Nonnull BatchState state,
	boolean fallbackUsed,
	int appliedCount,
	@Nonnull List<Integer> groupIds,
	@Nullable String errorMessage
) {

	public BatchOutcome {
		Objects.requireNonNull(state, "state must not be null");
		Objects.requireNonNull(groupIds, "groupIds must not be null");
		groupIds = List.copyOf(groupIds);
	}

	@Nonnull
	public static BatchOutcome applied(int batchIndex, @Nonnull List<Integer> groupIds, int appliedCount, boolean fallbackUsed) {
		return new BatchOutcome(batchIndex, BatchState.APPLIED, fallbackUsed, appliedCount, groupIds, null);
	}

	@Nonnull
	public static BatchOutcome failed(int batchIndex, @Nonnull List<Integer> groupIds, @Nonnull String errorMessage) {
		return new BatchOutcome(batchIndex, BatchState.FAILED, false, 0, groupIds, errorMessage);
	}

	@Nonnull
	public static BatchOutcome discarded(int batchIndex, @Nonnull List<Integer> groupIds) {
		return new BatchOutcome(batchIndex, BatchState.DISCARDED, false, 0, groupIds, null);
	}
}
