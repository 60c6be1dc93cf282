package org.imagesift;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Hash and metadata snapshot of one decoded image.
 *
 * @param path the file the record was computed from (identity)
 * @param byteSize size of the file on disk in bytes
 * @param width decoded width in pixels
 * @param height decoded height in pixels
 * @param averageHash 64-bit average hash
 * @param differenceHash 64-bit difference hash
 * @param modifiedTime last modification time of the file
 */
public record ImageRecord(Path path, long byteSize, int width, int height, long averageHash, long differenceHash,
		Instant modifiedTime) {

	/**
	 * Returns the pixel count used by the {@link KeepStrategy#LARGEST} strategy.
	 */
	public long resolution() {
		return (long) width * height;
	}

}
