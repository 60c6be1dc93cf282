package org.imagesift;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link ImageCodec} backed by the JDK's {@code javax.imageio} plugins.
 *
 * <p>
 * Supported extras:
 * <ul>
 * <li>{@code background} - hex RGB used to flatten transparency for formats without an
 * alpha channel (default {@code ffffff})</li>
 * <li>{@code palette} - {@code true} to write an indexed-color image</li>
 * <li>{@code square} - {@code true} to pad the image onto a square transparent canvas</li>
 * </ul>
 */
public class ImageIoCodec implements ImageCodec {

	private static final Logger logger = LoggerFactory.getLogger(ImageIoCodec.class);

	private static final Set<String> OPAQUE_FORMATS = Set.of("jpg", "jpeg", "bmp");

	@Override
	public DecodedImage decode(Path path) throws DecodeException {
		if (!Files.isRegularFile(path)) {
			throw new DecodeException(path, "Not a regular file: " + path);
		}
		try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
			if (input == null) {
				throw new DecodeException(path, "Cannot open image stream: " + path);
			}
			Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
			if (!readers.hasNext()) {
				throw new DecodeException(path, "No image reader for " + path);
			}
			ImageReader reader = readers.next();
			try {
				reader.setInput(input, false, true);
				BufferedImage image = reader.read(0);
				int frames = countFrames(reader);
				int width = image.getWidth();
				int height = image.getHeight();
				int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
				return new DecodedImage(width, height, argb, frames);
			}
			finally {
				reader.dispose();
			}
		}
		catch (DecodeException e) {
			throw e;
		}
		catch (IOException | RuntimeException e) {
			throw new DecodeException(path, "Failed to decode " + path + ": " + e.getMessage(), e);
		}
	}

	private int countFrames(ImageReader reader) {
		try {
			return Math.max(1, reader.getNumImages(true));
		}
		catch (IOException | IllegalStateException e) {
			logger.debug("Frame count unavailable, assuming still image: {}", e.getMessage());
			return 1;
		}
	}

	@Override
	public void encode(Path source, Path target, EncodeOptions options) throws DecodeException, IOException {
		String format = normalize(options.format());
		if (!writableFormats().contains(format)) {
			throw new IOException("Unsupported target format: " + options.format());
		}

		DecodedImage decoded = decode(source);
		BufferedImage image = toBufferedImage(decoded);
		if (Boolean.parseBoolean(options.extra("square"))) {
			image = padToSquare(image);
		}
		if (OPAQUE_FORMATS.contains(format)) {
			image = flatten(image, parseBackground(options.extra("background")));
		}
		else if (Boolean.parseBoolean(options.extra("palette"))) {
			image = toIndexed(image);
		}

		Path parent = target.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		write(image, target, format, options);
	}

	private void write(BufferedImage image, Path target, String format, EncodeOptions options) throws IOException {
		Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format);
		if (!writers.hasNext()) {
			throw new IOException("No image writer for format " + format);
		}
		ImageWriter writer = writers.next();
		Files.deleteIfExists(target);
		try (ImageOutputStream output = ImageIO.createImageOutputStream(target.toFile())) {
			writer.setOutput(output);
			ImageWriteParam param = writer.getDefaultWriteParam();
			Integer quality = options.quality();
			if (quality != null && param.canWriteCompressed()) {
				param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
				String[] types = param.getCompressionTypes();
				if (types != null && types.length > 0 && param.getCompressionType() == null) {
					param.setCompressionType(types[0]);
				}
				param.setCompressionQuality(Math.max(1, Math.min(100, quality)) / 100f);
			}
			writer.write(null, new IIOImage(image, null, null), param);
		}
		finally {
			writer.dispose();
		}
		logger.debug("Encoded {} as {}", target, format);
	}

	@Override
	public Set<String> writableFormats() {
		return Arrays.stream(ImageIO.getWriterFormatNames())
			.map(ImageIoCodec::normalize)
			.collect(Collectors.toUnmodifiableSet());
	}

	private static String normalize(String format) {
		String lower = format.trim().toLowerCase(Locale.ROOT);
		return lower.equals("jpeg") ? "jpg" : lower;
	}

	static BufferedImage toBufferedImage(DecodedImage decoded) {
		BufferedImage image = new BufferedImage(decoded.width(), decoded.height(), BufferedImage.TYPE_INT_ARGB);
		image.setRGB(0, 0, decoded.width(), decoded.height(), decoded.argb(), 0, decoded.width());
		return image;
	}

	private static BufferedImage flatten(BufferedImage image, Color background) {
		BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g = rgb.createGraphics();
		try {
			g.setColor(background);
			g.fillRect(0, 0, image.getWidth(), image.getHeight());
			g.drawImage(image, 0, 0, null);
		}
		finally {
			g.dispose();
		}
		return rgb;
	}

	private static BufferedImage toIndexed(BufferedImage image) {
		BufferedImage indexed = new BufferedImage(image.getWidth(), image.getHeight(),
				BufferedImage.TYPE_BYTE_INDEXED);
		Graphics2D g = indexed.createGraphics();
		try {
			g.drawImage(image, 0, 0, null);
		}
		finally {
			g.dispose();
		}
		return indexed;
	}

	private static BufferedImage padToSquare(BufferedImage image) {
		int side = Math.max(image.getWidth(), image.getHeight());
		if (image.getWidth() == side && image.getHeight() == side) {
			return image;
		}
		BufferedImage square = new BufferedImage(side, side, BufferedImage.TYPE_INT_ARGB);
		Graphics2D g = square.createGraphics();
		try {
			g.drawImage(image, (side - image.getWidth()) / 2, (side - image.getHeight()) / 2, null);
		}
		finally {
			g.dispose();
		}
		return square;
	}

	private static Color parseBackground(@Nullable String hex) {
		if (hex == null || hex.isBlank()) {
			return Color.WHITE;
		}
		try {
			return new Color(Integer.parseInt(hex.replace("#", ""), 16));
		}
		catch (NumberFormatException e) {
			logger.warn("Invalid background color '{}', using white", hex);
			return Color.WHITE;
		}
	}

}
