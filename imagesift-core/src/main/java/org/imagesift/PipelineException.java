package org.imagesift;

/**
 * Failure of the pipeline machinery itself (workspace cannot be created, worker pool
 * interrupted). Per-file failures never surface as this exception.
 */
public class PipelineException extends RuntimeException {

	public PipelineException(String message) {
		super(message);
	}

	public PipelineException(String message, Throwable cause) {
		super(message, cause);
	}

}
