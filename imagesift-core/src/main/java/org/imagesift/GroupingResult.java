package org.imagesift;

import java.util.List;

/**
 * Output of {@link SimilarityGrouper#group(List, int)}.
 *
 * @param duplicates groups with more than one member, in creation order
 * @param singletons records that matched nothing, in input order
 */
public record GroupingResult(List<DuplicateGroup> duplicates, List<ImageRecord> singletons) {

	public GroupingResult {
		duplicates = List.copyOf(duplicates);
		singletons = List.copyOf(singletons);
	}

	public int redundantCount() {
		return duplicates.stream().mapToInt(group -> group.size() - 1).sum();
	}

}
