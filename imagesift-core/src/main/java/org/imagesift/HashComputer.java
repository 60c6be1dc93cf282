package org.imagesift;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Computes 64-bit perceptual fingerprints of decoded images.
 *
 * <p>
 * Both hashes work on a grayscale thumbnail produced by box averaging:
 * <ul>
 * <li>average hash: 8x8 thumbnail, bit {@code i} (row-major) is set when cell {@code i}
 * is at least the mean of all cells</li>
 * <li>difference hash: 9x8 thumbnail, bit {@code row * 8 + col} is set when the cell is
 * brighter than its right neighbour</li>
 * </ul>
 * Hashing is pure and deterministic; the same pixels always give the same hashes.
 */
public class HashComputer {

	private static final Logger logger = LoggerFactory.getLogger(HashComputer.class);

	static final int HASH_SIZE = 8;

	private final ImageCodec codec;

	public HashComputer(ImageCodec codec) {
		this.codec = codec;
	}

	/**
	 * Hash an already decoded image.
	 */
	public ImageHashes compute(DecodedImage image) {
		return new ImageHashes(averageHash(image), differenceHash(image));
	}

	/**
	 * Decode a file and build its {@link ImageRecord}.
	 * @param path image file
	 * @return the record, or empty when the file cannot be decoded or read, or the codec
	 * fails on it
	 */
	public Optional<ImageRecord> computeRecord(Path path) {
		try {
			DecodedImage image = codec.decode(path);
			ImageHashes hashes = compute(image);
			return Optional.of(new ImageRecord(path, Files.size(path), image.width(), image.height(),
					hashes.averageHash(), hashes.differenceHash(), Files.getLastModifiedTime(path).toInstant()));
		}
		catch (DecodeException e) {
			logger.warn("Skipping undecodable image {}: {}", path, e.getMessage());
			return Optional.empty();
		}
		catch (IOException e) {
			logger.warn("Cannot read metadata of {}: {}", path, e.getMessage());
			return Optional.empty();
		}
		catch (RuntimeException e) {
			logger.warn("Codec failed on {}, excluded from comparison", path, e);
			return Optional.empty();
		}
	}

	static long averageHash(DecodedImage image) {
		double[] cells = grayscaleThumbnail(image, HASH_SIZE, HASH_SIZE);
		double sum = 0;
		for (double cell : cells) {
			sum += cell;
		}
		double mean = sum / cells.length;

		long hash = 0L;
		for (int i = 0; i < cells.length; i++) {
			if (cells[i] >= mean) {
				hash |= 1L << i;
			}
		}
		return hash;
	}

	static long differenceHash(DecodedImage image) {
		int columns = HASH_SIZE + 1;
		double[] cells = grayscaleThumbnail(image, columns, HASH_SIZE);

		long hash = 0L;
		for (int row = 0; row < HASH_SIZE; row++) {
			for (int col = 0; col < HASH_SIZE; col++) {
				double left = cells[row * columns + col];
				double right = cells[row * columns + col + 1];
				if (left > right) {
					hash |= 1L << (row * HASH_SIZE + col);
				}
			}
		}
		return hash;
	}

	/**
	 * Box-average the luma of {@code image} down to {@code targetWidth x targetHeight}.
	 * Images smaller than the target repeat source pixels.
	 */
	static double[] grayscaleThumbnail(DecodedImage image, int targetWidth, int targetHeight) {
		double[] cells = new double[targetWidth * targetHeight];
		for (int ty = 0; ty < targetHeight; ty++) {
			int y0 = ty * image.height() / targetHeight;
			int y1 = Math.max(y0 + 1, (ty + 1) * image.height() / targetHeight);
			for (int tx = 0; tx < targetWidth; tx++) {
				int x0 = tx * image.width() / targetWidth;
				int x1 = Math.max(x0 + 1, (tx + 1) * image.width() / targetWidth);
				long sum = 0;
				for (int y = y0; y < y1; y++) {
					for (int x = x0; x < x1; x++) {
						sum += luma(image.pixel(x, y));
					}
				}
				cells[ty * targetWidth + tx] = (double) sum / ((long) (x1 - x0) * (y1 - y0));
			}
		}
		return cells;
	}

	static int luma(int argb) {
		int r = (argb >> 16) & 0xFF;
		int g = (argb >> 8) & 0xFF;
		int b = argb & 0xFF;
		return (r * 299 + g * 587 + b * 114) / 1000;
	}

	/**
	 * Number of differing bits between two hashes.
	 */
	public static int hamming(long a, long b) {
		return Long.bitCount(a ^ b);
	}

}
