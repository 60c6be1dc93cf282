package org.imagesift;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SimilarityGrouper Tests")
class SimilarityGrouperTest {

	private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

	private SimilarityGrouper grouper;

	@BeforeEach
	void setUp() {
		grouper = new SimilarityGrouper();
	}

	private static ImageRecord record(String name, long averageHash, long differenceHash) {
		return record(name, averageHash, differenceHash, 100, 10, 10, T0);
	}

	private static ImageRecord record(String name, long averageHash, long differenceHash, long size, int width,
			int height, Instant modified) {
		return new ImageRecord(Path.of(name), size, width, height, averageHash, differenceHash, modified);
	}

	private static List<String> names(List<ImageRecord> records) {
		return records.stream().map(r -> r.path().toString()).toList();
	}

	@Nested
	@DisplayName("Grouping")
	class GroupingTest {

		@Test
		@DisplayName("Threshold 0 groups only bit-identical hash pairs")
		void thresholdZeroRequiresEqualHashes() {
			ImageRecord a = record("a", 0xAAL, 0x55L);
			ImageRecord b = record("b", 0xAAL, 0x55L);
			ImageRecord c = record("c", 0xAAL, 0x54L);

			GroupingResult result = grouper.group(List.of(a, b, c), 0);

			assertThat(result.duplicates()).hasSize(1);
			assertThat(names(result.duplicates().get(0).members())).containsExactly("a", "b");
			assertThat(names(result.singletons())).containsExactly("c");
			assertThat(result.redundantCount()).isEqualTo(1);
		}

		@Test
		@DisplayName("Distance adds both Hamming distances")
		void distanceSumsBothHashes() {
			ImageRecord a = record("a", 0b0000L, 0b0000L);
			ImageRecord b = record("b", 0b0011L, 0b0001L);

			assertThat(SimilarityGrouper.distance(a, b)).isEqualTo(3);
			assertThat(SimilarityGrouper.similar(a, b, 3)).isTrue();
			assertThat(SimilarityGrouper.similar(a, b, 2)).isFalse();
		}

		@Test
		@DisplayName("Only the representative is compared, so chains are not transitive")
		void representativeOnlyComparison() {
			ImageRecord a = record("a", 0L, 0L);
			ImageRecord b = record("b", 0b111L, 0L);
			ImageRecord c = record("c", 0b111111L, 0L);

			GroupingResult result = grouper.group(List.of(a, b, c), 4);

			assertThat(result.duplicates()).hasSize(1);
			assertThat(names(result.duplicates().get(0).members())).containsExactly("a", "b");
			assertThat(names(result.singletons())).containsExactly("c");
		}

		@Test
		@DisplayName("Any-member strictness joins a group through any member")
		void anyMemberStrictnessChains() {
			ImageRecord a = record("a", 0L, 0L);
			ImageRecord b = record("b", 0b111L, 0L);
			ImageRecord c = record("c", 0b111111L, 0L);

			GroupingResult result = new SimilarityGrouper(GroupingStrictness.ANY_MEMBER).group(List.of(a, b, c), 4);

			assertThat(result.duplicates()).hasSize(1);
			assertThat(names(result.duplicates().get(0).members())).containsExactly("a", "b", "c");
			assertThat(result.singletons()).isEmpty();
		}

		@Test
		@DisplayName("A record joins the first matching group in creation order")
		void firstMatchingGroupWins() {
			ImageRecord a = record("a", 0L, 0L);
			ImageRecord b = record("b", 0b1111L, 0L);
			ImageRecord c = record("c", 0b0011L, 0L);

			GroupingResult result = grouper.group(List.of(a, b, c), 2);

			assertThat(result.duplicates()).hasSize(1);
			assertThat(names(result.duplicates().get(0).members())).containsExactly("a", "c");
			assertThat(names(result.singletons())).containsExactly("b");
		}

		@Test
		@DisplayName("Every record lands in exactly one group or singleton")
		void resultIsPartition() {
			List<ImageRecord> records = new ArrayList<>();
			for (int i = 0; i < 20; i++) {
				records.add(record("r" + i, i % 4, (i % 3) * 7L));
			}

			GroupingResult result = grouper.group(records, 1);

			List<ImageRecord> seen = new ArrayList<>(result.singletons());
			result.duplicates().forEach(group -> seen.addAll(group.members()));
			assertThat(seen).hasSize(records.size()).containsExactlyInAnyOrderElementsOf(records);
			assertThat(result.duplicates()).allSatisfy(group -> assertThat(group.size()).isGreaterThan(1));
		}

		@Test
		@DisplayName("Empty input gives an empty result")
		void emptyInput() {
			GroupingResult result = grouper.group(List.of(), 5);

			assertThat(result.duplicates()).isEmpty();
			assertThat(result.singletons()).isEmpty();
		}

		@Test
		@DisplayName("Negative threshold is rejected")
		void negativeThresholdRejected() {
			assertThatThrownBy(() -> grouper.group(List.of(), -1)).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Keeper selection")
	class KeeperTest {

		private final ImageRecord small = record("small", 0, 0, 900, 10, 10, T0.plusSeconds(30));

		private final ImageRecord wide = record("wide", 0, 0, 200, 40, 30, T0);

		private final ImageRecord heavy = record("heavy", 0, 0, 5000, 20, 20, T0.plusSeconds(60));

		private final DuplicateGroup group = new DuplicateGroup(List.of(small, wide, heavy));

		@Test
		@DisplayName("FIRST keeps the representative")
		void firstKeepsRepresentative() {
			assertThat(SimilarityGrouper.keep(group, KeepStrategy.FIRST)).isSameAs(small);
		}

		@Test
		@DisplayName("LARGEST keeps the highest pixel count")
		void largestKeepsResolution() {
			assertThat(SimilarityGrouper.keep(group, KeepStrategy.LARGEST)).isSameAs(wide);
		}

		@Test
		@DisplayName("LARGEST_FILE keeps the biggest file")
		void largestFileKeepsByteSize() {
			assertThat(SimilarityGrouper.keep(group, KeepStrategy.LARGEST_FILE)).isSameAs(heavy);
		}

		@Test
		@DisplayName("NEWEST and OLDEST compare modification times")
		void newestAndOldest() {
			assertThat(SimilarityGrouper.keep(group, KeepStrategy.NEWEST)).isSameAs(heavy);
			assertThat(SimilarityGrouper.keep(group, KeepStrategy.OLDEST)).isSameAs(wide);
		}

		@ParameterizedTest
		@EnumSource(KeepStrategy.class)
		@DisplayName("Ties go to the first-encountered member")
		void tiesGoToFirstMember(KeepStrategy strategy) {
			ImageRecord first = record("first", 0, 0, 100, 10, 10, T0);
			ImageRecord second = record("second", 0, 0, 100, 10, 10, T0);

			assertThat(SimilarityGrouper.keep(new DuplicateGroup(List.of(first, second)), strategy)).isSameAs(first);
		}

		@Test
		@DisplayName("Redundant members exclude the keeper")
		void redundantExcludesKeeper() {
			assertThat(group.redundant(wide)).containsExactly(small, heavy);
		}

	}

}
