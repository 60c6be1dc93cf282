package org.imagesift;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PreviewSignature Tests")
class PreviewSignatureTest {

	@TempDir
	Path tempDir;

	private PreviewSignature signature;

	private Path file;

	private PipelineConfiguration configuration;

	@BeforeEach
	void setUp() throws Exception {
		signature = new PreviewSignature(ObjectMapperFactory.create());
		file = Files.writeString(tempDir.resolve("a.png"), "pixels");
		configuration = PipelineConfiguration.builder(tempDir, tempDir.resolve("out"))
			.workers(2)
			.convert(PipelineConfiguration.ConvertSettings.to("bmp"))
			.build();
	}

	@Test
	@DisplayName("Same configuration and inputs give the same SHA-256 hex digest")
	void stableDigest() {
		String first = signature.compute(configuration, List.of(file));
		String second = signature.compute(configuration, List.of(file));

		assertThat(first).isEqualTo(second).hasSize(64).matches("[0-9a-f]+");
	}

	@Test
	@DisplayName("Execution mode does not change the signature")
	void modeIsIgnored() {
		assertThat(signature.compute(configuration.withMode(ExecutionMode.COMMIT), List.of(file)))
			.isEqualTo(signature.compute(configuration, List.of(file)));
	}

	@Test
	@DisplayName("Settings, content size and modification time all change the signature")
	void changesAreDetected() throws Exception {
		String original = signature.compute(configuration, List.of(file));
		PipelineConfiguration otherFormat = PipelineConfiguration.builder(tempDir, tempDir.resolve("out"))
			.workers(2)
			.convert(PipelineConfiguration.ConvertSettings.to("png"))
			.build();

		assertThat(signature.compute(otherFormat, List.of(file))).isNotEqualTo(original);

		Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() - 60_000));
		String touched = signature.compute(configuration, List.of(file));
		assertThat(touched).isNotEqualTo(original);

		Files.writeString(file, "more pixels");
		assertThat(signature.compute(configuration, List.of(file))).isNotEqualTo(touched);
	}

	@Test
	@DisplayName("Missing inputs are fingerprinted instead of failing")
	void missingInputs() {
		Path missing = tempDir.resolve("gone.png");

		assertThat(signature.compute(configuration, List.of(missing)))
			.isNotEqualTo(signature.compute(configuration, List.of()));
	}

}
