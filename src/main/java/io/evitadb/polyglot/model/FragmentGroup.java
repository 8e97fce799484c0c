package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Fragments that must be settled together, typically because they were co-located in one
 * container of the source document (a paragraph, a heading, a table cell). A group is never
 * split across two batches.
 *
 * @param groupId   id of the group, unique within one scan
 * @param fragments the member fragments in document order
 */
public record FragmentGroup(
	int groupId,
	@Nonnull List<Fragment> fragments
) {

	public FragmentGroup {
		Objects.requireNonNull(fragments, "fragments must not be null");
		fragments = List.copyOf(fragments);
		for (final Fragment fragment : fragments) {
			if (fragment.groupId() != groupId) {
				throw new IllegalArgumentException(
					"Fragment " + fragment.id() + " belongs to group " + fragment.groupId() + ", not " + groupId
				);
			}
		}
	}

	/**
	 * Returns the number of fragments in this group.
	 *
	 * @return fragment count
	 */
	public int size() {
		return this.fragments.size();
	}

	/**
	 * Returns the total character count of all member fragments.
	 *
	 * @return sum of fragment lengths
	 */
	public int charCount() {
		int sum = 0;
		for (final Fragment fragment : this.fragments) {
			sum += fragment.length();
		}
		return sum;
	}

	public boolean isEmpty() {
		return this.fragments.isEmpty();
	}
}
