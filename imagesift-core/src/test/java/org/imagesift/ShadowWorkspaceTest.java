package org.imagesift;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ShadowWorkspace Tests")
class ShadowWorkspaceTest {

	@TempDir
	Path tempDir;

	private Path sources;

	private ShadowWorkspace workspace;

	@BeforeEach
	void setUp() throws Exception {
		sources = Files.createDirectories(tempDir.resolve("sources"));
		workspace = new ShadowWorkspace(tempDir.resolve("cache"));
		workspace.ensure();
	}

	@Nested
	@DisplayName("Layout")
	class LayoutTest {

		@Test
		@DisplayName("Should create input, final and trash under the root")
		void ensureCreatesLayout() {
			assertThat(workspace.exists()).isTrue();
			assertThat(workspace.inputDir()).isDirectory().isEqualTo(workspace.root().resolve("input"));
			assertThat(workspace.finalDir()).isDirectory().isEqualTo(workspace.root().resolve("final"));
			assertThat(workspace.trashDir()).isDirectory().isEqualTo(workspace.root().resolve("trash"));
		}

		@Test
		@DisplayName("Ensure is idempotent and safe to call concurrently")
		void ensureIsIdempotent() throws Exception {
			Path marker = Files.writeString(workspace.inputDir().resolve("keep.txt"), "x");
			List<CompletableFuture<Void>> calls = new ArrayList<>();
			for (int i = 0; i < 8; i++) {
				calls.add(CompletableFuture.runAsync(workspace::ensure));
			}
			CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).join();

			assertThat(marker).exists();
			assertThat(workspace.finalDir()).isDirectory();
		}

		@Test
		@DisplayName("Teardown removes the whole tree and reset recreates it empty")
		void teardownAndReset() throws Exception {
			Files.writeString(workspace.finalDir().resolve("a.png"), "x");

			workspace.teardown();
			assertThat(workspace.root()).doesNotExist();
			assertThat(workspace.exists()).isFalse();

			workspace.reset();
			assertThat(workspace.finalDir()).isEmptyDirectory();
		}

		@Test
		@DisplayName("Close tears the workspace down")
		void closeTearsDown() {
			try (ShadowWorkspace scoped = new ShadowWorkspace(tempDir.resolve("scoped"))) {
				scoped.ensure();
				assertThat(scoped.root()).isDirectory();
			}
			assertThat(tempDir.resolve("scoped")).doesNotExist();
		}

	}

	@Nested
	@DisplayName("Staging")
	class StagingTest {

		@Test
		@DisplayName("Should copy inputs and remember their origin")
		void stageInputRecordsOrigin() throws Exception {
			Path source = Files.writeString(sources.resolve("a.png"), "pixels");

			Path staged = workspace.stageInput(source, Path.of("nested/a.png"));

			assertThat(staged).hasContent("pixels").isEqualTo(workspace.inputDir().resolve("nested/a.png"));
			assertThat(source).exists();
			assertThat(workspace.originOf(staged)).isEqualTo(source.toAbsolutePath().normalize());
		}

		@Test
		@DisplayName("Origins follow derived files through renames")
		void originFollowsDerivations() throws Exception {
			Path source = Files.writeString(sources.resolve("a.png"), "pixels");
			Path staged = workspace.stageInput(source, Path.of("a.png"));

			Path renamed = workspace.simulateRename(staged, workspace.finalDir().resolve("4x3/a.png"));
			Path converted = Files.writeString(workspace.finalDir().resolve("4x3/a.bmp"), "converted");
			workspace.recordDerived(converted, renamed);

			assertThat(staged).doesNotExist();
			assertThat(workspace.originOf(renamed)).isEqualTo(source.toAbsolutePath().normalize());
			assertThat(workspace.originOf(converted)).isEqualTo(source.toAbsolutePath().normalize());
		}

		@Test
		@DisplayName("Staging into final never overwrites")
		void stageFinalIsNonColliding() throws Exception {
			Path first = workspace.stageInput(Files.writeString(sources.resolve("a.png"), "1"), Path.of("a.png"));
			Path second = workspace.stageInput(Files.writeString(sources.resolve("b.png"), "2"), Path.of("b.png"));

			Path one = workspace.stageFinal(first, Path.of("a.png"));
			Path two = workspace.stageFinal(second, Path.of("a.png"));

			assertThat(one.getFileName()).hasToString("a.png");
			assertThat(two.getFileName()).hasToString("a_1.png");
			assertThat(two).hasContent("2");
		}

		@Test
		@DisplayName("Simulated deletes land in trash under distinct names")
		void simulateDeleteIsNonColliding() throws Exception {
			Path one = Files.createDirectories(workspace.finalDir().resolve("x")).resolve("dup.png");
			Path two = Files.createDirectories(workspace.finalDir().resolve("y")).resolve("dup.png");
			Files.writeString(one, "1");
			Files.writeString(two, "2");

			Path trashedOne = workspace.simulateDelete(one);
			Path trashedTwo = workspace.simulateDelete(two);

			assertThat(one).doesNotExist();
			assertThat(two).doesNotExist();
			assertThat(trashedOne.getParent()).isEqualTo(workspace.trashDir());
			assertThat(trashedTwo.getFileName()).hasToString("dup_1.png");
			assertThat(trashedTwo).hasContent("2");
		}

		@Test
		@DisplayName("Discard really deletes the staged file")
		void discardDeletes() throws Exception {
			Path staged = workspace.stageInput(Files.writeString(sources.resolve("a.png"), "x"), Path.of("a.png"));

			workspace.discard(staged);

			assertThat(staged).doesNotExist();
			assertThat(workspace.originOf(staged)).isNull();
		}

	}

	@Nested
	@DisplayName("Isolation")
	class IsolationTest {

		@Test
		@DisplayName("Mutations outside the root are refused")
		void outsidePathsRejected() throws Exception {
			Path outside = Files.writeString(sources.resolve("a.png"), "x");

			assertThatThrownBy(() -> workspace.simulateDelete(outside)).isInstanceOf(IllegalStateException.class);
			assertThatThrownBy(() -> workspace.discard(outside)).isInstanceOf(IllegalStateException.class);
			assertThatThrownBy(() -> workspace.simulateRename(outside, workspace.finalDir().resolve("a.png")))
				.isInstanceOf(IllegalStateException.class);
			assertThatThrownBy(() -> workspace.stageInput(outside, Path.of("../../escape.png")))
				.isInstanceOf(IllegalStateException.class);
			assertThat(outside).exists().hasContent("x");
		}

		@Test
		@DisplayName("Paths are compared after normalisation")
		void insideCheckNormalises() {
			assertThat(workspace.isInside(workspace.finalDir().resolve("a/../b.png"))).isTrue();
			assertThat(workspace.isInside(workspace.finalDir().resolve("../../other.png"))).isFalse();
		}

	}

	@Nested
	@DisplayName("Result root")
	class ResultRootTest {

		@Test
		@DisplayName("Plain final directory is the result root")
		void plainFinal() throws Exception {
			Files.writeString(workspace.finalDir().resolve("a.png"), "x");

			assertThat(workspace.resultRoot()).isEqualTo(workspace.finalDir());
		}

		@Test
		@DisplayName("Descends through sole nested final directories")
		void descendsNestedFinal() throws Exception {
			Path nested = Files.createDirectories(workspace.finalDir().resolve("final/final"));
			Files.writeString(nested.resolve("a.png"), "x");

			assertThat(workspace.resultRoot()).isEqualTo(nested);
		}

		@Test
		@DisplayName("Stops at a sole directory with another name")
		void stopsAtOtherNames() throws Exception {
			Files.createDirectories(workspace.finalDir().resolve("4x3"));

			assertThat(workspace.resultRoot()).isEqualTo(workspace.finalDir());
		}

	}

}
