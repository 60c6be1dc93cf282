package org.imagesift;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ClassifyStage Tests")
class ClassifyStageTest {

	private static ClassifyStage ratioStage(String ratios, double tolerance, boolean snap) {
		return new ClassifyStage(PipelineConfiguration.ClassifySettings.ratios(ratios, tolerance, snap));
	}

	@Nested
	@DisplayName("Ratio mode")
	class RatioModeTest {

		@Test
		@DisplayName("Matching ratio gives a folder-safe label, others go to other")
		void matchOrOther() {
			ClassifyStage stage = ratioStage("4:3", 0.05, false);

			assertThat(stage.classify(800, 600, false)).isEqualTo("4x3");
			assertThat(stage.classify(1000, 400, false)).isEqualTo(ClassifyStage.OTHER);
		}

		@ParameterizedTest
		@CsvSource({ "1920, 1080, 16x9", "1080, 1080, 1x1", "3000, 2000, 3x2", "2560, 1080, 21x9", "1024, 768, 4x3" })
		@DisplayName("Default ratios cover common camera and screen sizes")
		void defaultRatios(int width, int height, String label) {
			assertThat(ratioStage("", 0.03, false).classify(width, height, false)).isEqualTo(label);
		}

		@Test
		@DisplayName("The first ratio within tolerance wins even when a later one is closer")
		void firstMatchWins() {
			ClassifyStage stage = ratioStage("4:3,3:2", 0.2, false);

			assertThat(stage.classify(1500, 1000, false)).isEqualTo("4x3");
		}

		@Test
		@DisplayName("Snap assigns the closest ratio instead of other")
		void snapToClosest() {
			ClassifyStage stage = ratioStage("16:9,1:1", 0.01, true);

			assertThat(stage.classify(1000, 400, false)).isEqualTo("16x9");
			assertThat(stage.classify(500, 600, false)).isEqualTo("1x1");
		}

		@Test
		@DisplayName("An empty ratio list without snap labels everything other")
		void noRatiosGivesOther() {
			ClassifyStage stage = new ClassifyStage(new PipelineConfiguration.ClassifySettings(ClassifyMode.RATIO,
					List.of(), 0.03, true, 0.05, false));

			assertThat(stage.classify(800, 600, false)).isEqualTo(ClassifyStage.OTHER);
		}

	}

	@Nested
	@DisplayName("Shape mode")
	class ShapeModeTest {

		private final ClassifyStage stage = new ClassifyStage(new PipelineConfiguration.ClassifySettings(
				ClassifyMode.SHAPE, List.of(), 0.03, false, 0.05, false));

		@Test
		@DisplayName("Near-square images are square")
		void square() {
			assertThat(stage.classify(100, 100, false)).isEqualTo("square");
			assertThat(stage.classify(104, 100, false)).isEqualTo("square");
		}

		@Test
		@DisplayName("Wide and tall images are landscape and portrait")
		void landscapeAndPortrait() {
			assertThat(stage.classify(300, 100, false)).isEqualTo("landscape");
			assertThat(stage.classify(100, 300, false)).isEqualTo("portrait");
		}

	}

	@Test
	@DisplayName("Animated images are routed under animated when separation is on")
	void animatedSeparation() {
		ClassifyStage separating = new ClassifyStage(new PipelineConfiguration.ClassifySettings(ClassifyMode.RATIO,
				AspectRatio.parseList("4:3"), 0.05, false, 0.05, true));
		ClassifyStage mixing = ratioStage("4:3", 0.05, false);

		assertThat(separating.classify(800, 600, true)).isEqualTo("animated/4x3");
		assertThat(separating.classify(800, 600, false)).isEqualTo("4x3");
		assertThat(mixing.classify(800, 600, true)).isEqualTo("4x3");
	}

}
