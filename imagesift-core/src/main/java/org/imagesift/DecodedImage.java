package org.imagesift;

/**
 * Decoded pixel grid handed out by an {@link ImageCodec}.
 *
 * <p>
 * Pixels are packed ARGB integers in row-major order, {@code width * height} entries.
 *
 * @param width width in pixels
 * @param height height in pixels
 * @param argb packed ARGB pixels
 * @param frameCount number of frames in the source file (1 for still images)
 */
public record DecodedImage(int width, int height, int[] argb, int frameCount) {

	public DecodedImage {
		if (width <= 0 || height <= 0) {
			throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
		}
		if (argb.length != width * height) {
			throw new IllegalArgumentException(
					"Pixel count " + argb.length + " does not match dimensions " + width + "x" + height);
		}
	}

	public DecodedImage(int width, int height, int[] argb) {
		this(width, height, argb, 1);
	}

	public int pixel(int x, int y) {
		return argb[y * width + x];
	}

	public boolean animated() {
		return frameCount > 1;
	}

}
