package org.imagesift;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * File name helpers and input discovery.
 */
public final class ImageFiles {

	private static final Logger logger = LoggerFactory.getLogger(ImageFiles.class);

	/** Extensions (normalised, without dot) picked up when scanning an input directory. */
	public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("jpg", "png", "webp", "gif", "bmp", "tif", "tiff",
			"ico");

	private ImageFiles() {
	}

	/**
	 * Lower case, no leading dot, {@code jpeg} folded into {@code jpg}.
	 */
	public static String normalizeExtension(String extension) {
		String normalized = extension.trim().toLowerCase(Locale.ROOT);
		while (normalized.startsWith(".")) {
			normalized = normalized.substring(1);
		}
		return normalized.equals("jpeg") ? "jpg" : normalized;
	}

	/**
	 * Normalised extension of a file name, empty when there is none.
	 */
	public static String extensionOf(Path path) {
		String name = path.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot > 0 ? normalizeExtension(name.substring(dot + 1)) : "";
	}

	/**
	 * File name without its extension.
	 */
	public static String stemOf(Path path) {
		String name = path.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	public static boolean isSupported(Path path) {
		return SUPPORTED_EXTENSIONS.contains(extensionOf(path));
	}

	/**
	 * Collect supported image files under {@code root} in stable path order.
	 * @param root a directory, or a single file
	 * @param recursive descend into sub-directories
	 * @param excluded directories whose contents are never returned (the workspace)
	 * @return matching files, sorted
	 */
	public static List<Path> scan(Path root, boolean recursive, Collection<Path> excluded) {
		Path normalizedRoot = root.toAbsolutePath().normalize();
		if (Files.isRegularFile(normalizedRoot)) {
			return isSupported(normalizedRoot) ? List.of(normalizedRoot) : List.of();
		}
		if (!Files.isDirectory(normalizedRoot)) {
			throw new IllegalArgumentException("Input does not exist: " + root);
		}
		List<Path> skip = excluded.stream().map(path -> path.toAbsolutePath().normalize()).toList();
		try (Stream<Path> files = recursive ? Files.walk(normalizedRoot) : Files.list(normalizedRoot)) {
			List<Path> found = files.filter(Files::isRegularFile)
				.filter(ImageFiles::isSupported)
				.filter(file -> skip.stream().noneMatch(file::startsWith))
				.sorted()
				.toList();
			logger.info("Found {} images under {}", found.size(), normalizedRoot);
			return found;
		}
		catch (IOException e) {
			throw new PipelineException("Failed to scan input " + normalizedRoot, e);
		}
	}

}
