package org.imagesift;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link PipelineResult} as pretty-printed JSON.
 */
public class RunReportWriter {

	private static final Logger logger = LoggerFactory.getLogger(RunReportWriter.class);

	private final ObjectMapper objectMapper;

	public RunReportWriter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public void write(PipelineResult result, Path file) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), result);
		logger.info("Wrote run report to {}", file);
	}

}
