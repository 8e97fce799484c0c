package io.evitadb.polyglot.model;

/**
 * States of a page translation job.
 *
 * IDLE -> SCANNING -> RUNNING -> {COMPLETED, COMPLETED_WITH_ERRORS, CANCELLED}.
 * A scan that finds nothing to translate ends the job in FAILED.
 */
public enum JobState {

	IDLE,
	SCANNING,
	RUNNING,
	COMPLETED,
	COMPLETED_WITH_ERRORS,
	CANCELLED,
	FAILED;

	public boolean isTerminal() {
		return this == COMPLETED || this == COMPLETED_WITH_ERRORS || this == CANCELLED || this == FAILED;
	}
}
