package org.imagesift;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Structured per-file log entry published by pipeline stages.
 *
 * @param stage the stage that produced the event
 * @param sourcePath the file the work started from
 * @param destPath the file the work produced, if any
 * @param outcome what happened
 * @param message human readable detail (failure reason, classification label, ...)
 * @param timestamp when the event was created
 */
public record PipelineEvent(PipelineStage stage, @Nullable Path sourcePath, @Nullable Path destPath,
		EventOutcome outcome, String message, Instant timestamp) {

	public static PipelineEvent of(PipelineStage stage, @Nullable Path sourcePath, @Nullable Path destPath,
			EventOutcome outcome, String message) {
		return new PipelineEvent(stage, sourcePath, destPath, outcome, message, Instant.now());
	}

	public boolean failed() {
		return outcome == EventOutcome.FAILED;
	}

}
