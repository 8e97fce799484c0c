package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The unit of a single backend call: an ordered list of whole fragment groups.
 *
 * @param index  zero-based position of the batch in the job's queue
 * @param groups the groups contained in this batch, in scan order
 */
public record Batch(
	int index,
	@Nonnull List<FragmentGroup> groups
) {

	public Batch {
		if (index < 0) {
			throw new IllegalArgumentException("index must be non-negative");
		}
		Objects.requireNonNull(groups, "groups must not be null");
		groups = List.copyOf(groups);
	}

	/**
	 * Returns all fragments of the batch flattened in group order.
	 *
	 * @return fragments of the batch
	 */
	@Nonnull
	public List<Fragment> fragments() {
		final List<Fragment> result = new ArrayList<>();
		for (final FragmentGroup group : this.groups) {
			result.addAll(group.fragments());
		}
		return result;
	}

	/**
	 * Returns the original texts of all fragments, in the same order as {@link #fragments()}.
	 *
	 * @return texts to be encoded into the request payload
	 */
	@Nonnull
	public List<String> texts() {
		final List<String> result = new ArrayList<>();
		for (final FragmentGroup group : this.groups) {
			for (final Fragment fragment : group.fragments()) {
				result.add(fragment.originalText());
			}
		}
		return result;
	}

	public int size() {
		int count = 0;
		for (final FragmentGroup group : this.groups) {
			count += group.size();
		}
		return count;
	}

	public int charCount() {
		int sum = 0;
		for (final FragmentGroup group : this.groups) {
			sum += group.charCount();
		}
		return sum;
	}
}
