package io.evitadb.polyglot.job;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a job and whoever may cancel it. Once cancelled it stays cancelled.
 */
public final class CancellationToken {

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	/**
	 * Requests cancellation.
	 *
	 * @return true if this call cancelled the token, false if it was already cancelled
	 */
	public boolean cancel() {
		return this.cancelled.compareAndSet(false, true);
	}

	public boolean isCancelled() {
		return this.cancelled.get();
	}
}
