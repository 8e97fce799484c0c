package io.evitadb.polyglot.job;

import io.evitadb.polyglot.model.JobState;

import javax.annotation.Nonnull;

/**
 * Receives the progress of a page translation job. Callbacks may arrive on any thread, but never concurrently for
 * one job.
 */
@FunctionalInterface
public interface ProgressListener {

	/**
	 * Listener that ignores every event.
	 */
	ProgressListener NONE = (state, message) -> {
	};

	/**
	 * Reports the transient status line, e.g. "Translating batch 2/5".
	 *
	 * @param state   current job state
	 * @param message human readable status
	 */
	void onStatus(@Nonnull JobState state, @Nonnull String message);

	/**
	 * Called when the batch containing the group is sent to the backend.
	 *
	 * @param groupId id of the group
	 */
	default void onGroupLoading(int groupId) {
	}

	/**
	 * Called exactly once per dispatched group, after all its fragments were resolved.
	 *
	 * @param groupId id of the group
	 */
	default void onGroupSettled(int groupId) {
	}
}
