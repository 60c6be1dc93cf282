package org.imagesift;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Persistent event log: appends one JSON object per event to a file (JSON lines).
 *
 * <p>
 * Only ever called from the {@link EventChannel} dispatcher thread.
 */
public class EventLogFileWriter implements PipelineEventListener, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(EventLogFileWriter.class);

	private final ObjectMapper objectMapper;

	private final BufferedWriter writer;

	private final Path file;

	public EventLogFileWriter(Path file, ObjectMapper objectMapper) throws IOException {
		this.file = file;
		this.objectMapper = objectMapper;
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
				StandardOpenOption.APPEND);
		logger.info("Writing event log to {}", file);
	}

	@Override
	public void onEvent(PipelineEvent event) {
		try {
			writer.write(objectMapper.writeValueAsString(event));
			writer.newLine();
			writer.flush();
		}
		catch (JsonProcessingException e) {
			logger.warn("Failed to serialize event {}: {}", event, e.getMessage());
		}
		catch (IOException e) {
			logger.warn("Failed to write event log {}: {}", file, e.getMessage());
		}
	}

	public Path getFile() {
		return file;
	}

	@Override
	public void close() throws IOException {
		writer.close();
	}

}
