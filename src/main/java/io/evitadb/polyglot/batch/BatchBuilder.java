package io.evitadb.polyglot.batch;

import io.evitadb.polyglot.model.Batch;
import io.evitadb.polyglot.model.FragmentGroup;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Packs fragment groups into size-bounded batches so that one backend call carries as many groups as the limits
 * allow. Groups are never split and never reordered. A group that alone exceeds a limit forms its own batch; the
 * limits are soft ceilings and never truncate a group.
 */
public final class BatchBuilder {

	private BatchBuilder() {
		// Utility class - prevent instantiation
	}

	/**
	 * Partitions the groups into batches.
	 *
	 * @param groups   groups in scan order
	 * @param maxChars maximum summed fragment length of one batch
	 * @param maxItems maximum fragment count of one batch
	 * @return batches in scan order, indexed from zero
	 * @throws IllegalArgumentException if a limit is not positive
	 */
	@Nonnull
	public static List<Batch> build(@Nonnull List<FragmentGroup> groups, int maxChars, int maxItems) {
		Objects.requireNonNull(groups, "groups must not be null");
		if (maxChars <= 0) {
			throw new IllegalArgumentException("maxChars must be positive, got " + maxChars);
		}
		if (maxItems <= 0) {
			throw new IllegalArgumentException("maxItems must be positive, got " + maxItems);
		}

		final List<Batch> batches = new ArrayList<>();
		List<FragmentGroup> current = new ArrayList<>();
		int currentChars = 0;
		int currentItems = 0;

		for (final FragmentGroup group : groups) {
			if (group.isEmpty()) {
				continue;
			}
			final int groupChars = group.charCount();
			final int groupItems = group.size();
			final boolean overflows = currentChars + groupChars > maxChars || currentItems + groupItems > maxItems;
			if (overflows && !current.isEmpty()) {
				batches.add(new Batch(batches.size(), current));
				current = new ArrayList<>();
				currentChars = 0;
				currentItems = 0;
			}
			current.add(group);
			currentChars += groupChars;
			currentItems += groupItems;
		}

		if (!current.isEmpty()) {
			batches.add(new Batch(batches.size(), current));
		}
		return batches;
	}
}
