package org.imagesift;

import java.nio.file.Path;

/**
 * Raised when an image cannot be read or is corrupt.
 *
 * <p>
 * Never fatal: the affected file is passed through the stage unchanged.
 */
public class DecodeException extends Exception {

	private final Path path;

	public DecodeException(Path path, String message) {
		super(message);
		this.path = path;
	}

	public DecodeException(Path path, String message, Throwable cause) {
		super(message, cause);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

}
