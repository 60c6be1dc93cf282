package org.imagesift;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ImageFiles Tests")
class ImageFilesTest {

	@TempDir
	Path tempDir;

	private Path touch(String relative) throws Exception {
		Path file = tempDir.resolve(relative);
		Files.createDirectories(file.getParent());
		return Files.writeString(file, "x");
	}

	@ParameterizedTest
	@CsvSource({ "JPEG, jpg", ".png, png", "  Tiff , tiff", "jpg, jpg" })
	@DisplayName("Extensions are lower case, dotless and fold jpeg into jpg")
	void normalizesExtensions(String raw, String expected) {
		assertThat(ImageFiles.normalizeExtension(raw)).isEqualTo(expected);
	}

	@Test
	@DisplayName("Stem and extension split on the last dot")
	void stemAndExtension() {
		assertThat(ImageFiles.extensionOf(Path.of("dir/archive.tar.JPEG"))).isEqualTo("jpg");
		assertThat(ImageFiles.stemOf(Path.of("dir/archive.tar.JPEG"))).isEqualTo("archive.tar");
		assertThat(ImageFiles.extensionOf(Path.of(".hidden"))).isEmpty();
		assertThat(ImageFiles.stemOf(Path.of("README"))).isEqualTo("README");
	}

	@Test
	@DisplayName("Scan returns supported files sorted and honours exclusions")
	void scanSortsAndExcludes() throws Exception {
		Path b = touch("b.png");
		Path a = touch("sub/a.JPG");
		touch("notes.txt");
		touch(".imagesift-cache/final/c.png");

		List<Path> found = ImageFiles.scan(tempDir, true, List.of(tempDir.resolve(".imagesift-cache")));

		assertThat(found).containsExactly(b.toAbsolutePath().normalize(), a.toAbsolutePath().normalize());
	}

	@Test
	@DisplayName("Non-recursive scan stays in the top directory")
	void nonRecursiveScan() throws Exception {
		Path top = touch("top.gif");
		touch("sub/deep.gif");

		assertThat(ImageFiles.scan(tempDir, false, List.of())).containsExactly(top.toAbsolutePath().normalize());
	}

	@Test
	@DisplayName("A single file input is scanned as itself")
	void singleFileInput() throws Exception {
		Path file = touch("one.bmp");

		assertThat(ImageFiles.scan(file, true, List.of())).containsExactly(file.toAbsolutePath().normalize());
	}

	@Test
	@DisplayName("A missing input is rejected")
	void missingInput() {
		assertThatThrownBy(() -> ImageFiles.scan(tempDir.resolve("nope"), true, List.of()))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
