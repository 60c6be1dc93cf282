package org.imagesift;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy clustering of {@link ImageRecord}s by perceptual-hash distance.
 *
 * <p>
 * Records are visited in input order. A record joins the first existing group whose
 * representative (or, under {@link GroupingStrictness#ANY_MEMBER}, any member) lies
 * within the threshold; otherwise it opens a new group. Groups are never merged, so the
 * result depends on input order and similarity is not treated as transitive.
 */
public class SimilarityGrouper {

	private static final Logger logger = LoggerFactory.getLogger(SimilarityGrouper.class);

	private final GroupingStrictness strictness;

	public SimilarityGrouper() {
		this(GroupingStrictness.REPRESENTATIVE);
	}

	public SimilarityGrouper(GroupingStrictness strictness) {
		this.strictness = strictness;
	}

	/**
	 * Partition records into duplicate groups and singletons.
	 * @param records records in stable input order
	 * @param threshold maximum combined Hamming distance; 0 requires identical hashes
	 * @return groups of size > 1 in creation order, plus the remaining singletons
	 */
	public GroupingResult group(List<ImageRecord> records, int threshold) {
		if (threshold < 0) {
			throw new IllegalArgumentException("Threshold must be >= 0, got " + threshold);
		}

		List<List<ImageRecord>> groups = new ArrayList<>();
		for (ImageRecord record : records) {
			@Nullable
			List<ImageRecord> target = null;
			for (List<ImageRecord> group : groups) {
				if (joins(record, group, threshold)) {
					target = group;
					break;
				}
			}
			if (target != null) {
				target.add(record);
			}
			else {
				List<ImageRecord> created = new ArrayList<>();
				created.add(record);
				groups.add(created);
			}
		}

		List<DuplicateGroup> duplicates = new ArrayList<>();
		List<ImageRecord> singletons = new ArrayList<>();
		for (List<ImageRecord> group : groups) {
			if (group.size() > 1) {
				duplicates.add(new DuplicateGroup(group));
			}
			else {
				singletons.add(group.get(0));
			}
		}

		logger.debug("Grouped {} records into {} duplicate groups and {} singletons (threshold={}, strictness={})",
				records.size(), duplicates.size(), singletons.size(), threshold, strictness.code());
		return new GroupingResult(duplicates, singletons);
	}

	private boolean joins(ImageRecord record, List<ImageRecord> group, int threshold) {
		if (strictness == GroupingStrictness.REPRESENTATIVE) {
			return similar(record, group.get(0), threshold);
		}
		return group.stream().anyMatch(member -> similar(record, member, threshold));
	}

	/**
	 * Whether two records are within {@code threshold}.
	 */
	public static boolean similar(ImageRecord a, ImageRecord b, int threshold) {
		if (threshold == 0) {
			return a.averageHash() == b.averageHash() && a.differenceHash() == b.differenceHash();
		}
		return distance(a, b) <= threshold;
	}

	/**
	 * Combined Hamming distance of both hashes.
	 */
	public static int distance(ImageRecord a, ImageRecord b) {
		return HashComputer.hamming(a.averageHash(), b.averageHash())
				+ HashComputer.hamming(a.differenceHash(), b.differenceHash());
	}

	/**
	 * Select the member to keep; ties go to the first-encountered member.
	 */
	public static ImageRecord keep(DuplicateGroup group, KeepStrategy strategy) {
		Comparator<ImageRecord> better = switch (strategy) {
			case FIRST -> (a, b) -> 0;
			case LARGEST -> Comparator.comparingLong(ImageRecord::resolution);
			case LARGEST_FILE -> Comparator.comparingLong(ImageRecord::byteSize);
			case NEWEST -> Comparator.comparing(ImageRecord::modifiedTime);
			case OLDEST -> Comparator.comparing(ImageRecord::modifiedTime).reversed();
		};
		ImageRecord keeper = group.representative();
		for (ImageRecord member : group.members()) {
			if (better.compare(member, keeper) > 0) {
				keeper = member;
			}
		}
		return keeper;
	}

}
