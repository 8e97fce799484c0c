package io.evitadb.polyglot.model;

/**
 * Lifecycle of a batch within a page translation job.
 */
public enum BatchState {

	PENDING,
	IN_FLIGHT,
	/**
	 * The backend answered and the results were applied (possibly via the degraded fallback).
	 */
	APPLIED,
	/**
	 * The backend call failed; all fragments of the batch keep their original text.
	 */
	FAILED,
	/**
	 * The job was cancelled before the results of this batch could be applied.
	 */
	DISCARDED;

	public boolean isTerminal() {
		return this == APPLIED || this == FAILED || this == DISCARDED;
	}
}
