package org.imagesift;

import java.util.List;

/**
 * Ordered set of records judged similar by the {@link SimilarityGrouper}.
 *
 * <p>
 * The first member is the representative every candidate was compared against.
 *
 * @param members group members in insertion order, never empty
 */
public record DuplicateGroup(List<ImageRecord> members) {

	public DuplicateGroup {
		if (members.isEmpty()) {
			throw new IllegalArgumentException("A duplicate group cannot be empty");
		}
		members = List.copyOf(members);
	}

	public ImageRecord representative() {
		return members.get(0);
	}

	public int size() {
		return members.size();
	}

	/**
	 * Members other than the given keeper, in group order.
	 */
	public List<ImageRecord> redundant(ImageRecord keeper) {
		return members.stream().filter(member -> member != keeper).toList();
	}

}
