package org.imagesift;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Boundary to the image codec library.
 *
 * <p>
 * The pipeline never interprets pixel formats itself; decoding, encoding and
 * format-specific parameters are the codec's concern. Implementations must be safe to
 * call from several worker threads at once.
 */
public interface ImageCodec {

	/**
	 * Decode an image file into a pixel grid.
	 * @param path file to decode
	 * @return the decoded image
	 * @throws DecodeException if the file is unreadable or not a supported image
	 */
	DecodedImage decode(Path path) throws DecodeException;

	/**
	 * Re-encode {@code source} into {@code target} using the given options.
	 * @param source existing image file
	 * @param target file to create or replace
	 * @param options target format and pass-through options
	 * @throws DecodeException if the source cannot be decoded
	 * @throws IOException if the target cannot be written or the format is unsupported
	 */
	void encode(Path source, Path target, EncodeOptions options) throws DecodeException, IOException;

	/**
	 * Formats this codec can write, lower case.
	 */
	Set<String> writableFormats();

}
