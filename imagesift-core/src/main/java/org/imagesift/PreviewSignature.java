package org.imagesift;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Fingerprint of a run's inputs: SHA-256 over the serialized configuration (as a
 * preview) plus every input path with its size and modification time. Two runs with the
 * same signature would produce the same shadow result.
 */
public final class PreviewSignature {

	private final ObjectMapper objectMapper;

	public PreviewSignature(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public String compute(PipelineConfiguration configuration, List<Path> inputs) {
		MessageDigest digest;
		try {
			digest = MessageDigest.getInstance("SHA-256");
		}
		catch (NoSuchAlgorithmException e) {
			throw new PipelineException("SHA-256 not available", e);
		}

		try {
			byte[] config = objectMapper.writeValueAsBytes(configuration.withMode(ExecutionMode.PREVIEW));
			digest.update(config);
		}
		catch (JsonProcessingException e) {
			throw new PipelineException("Failed to serialize configuration", e);
		}

		for (Path input : inputs) {
			StringBuilder entry = new StringBuilder("\n").append(input.toAbsolutePath().normalize());
			try {
				entry.append('|').append(Files.size(input)).append('|').append(Files.getLastModifiedTime(input).toMillis());
			}
			catch (IOException e) {
				entry.append("|missing");
			}
			digest.update(entry.toString().getBytes(StandardCharsets.UTF_8));
		}
		return HexFormat.of().formatHex(digest.digest());
	}

}
