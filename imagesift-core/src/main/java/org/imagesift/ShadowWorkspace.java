package org.imagesift;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Private sandbox where every pipeline mutation is performed.
 *
 * <p>
 * Layout under the root:
 * <ul>
 * <li>{@code input/} - copies of the user's sources</li>
 * <li>{@code final/} - files produced by the stages, materialised on commit</li>
 * <li>{@code trash/} - files removed in preview mode</li>
 * </ul>
 * Every mutating method refuses paths outside the root, so a preview can never touch
 * user files. Origins of staged files are tracked so that later stages and the purge step
 * can map any derived file back to the source it came from.
 */
public class ShadowWorkspace implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ShadowWorkspace.class);

	public static final String INPUT_DIR = "input";

	public static final String FINAL_DIR = "final";

	public static final String TRASH_DIR = "trash";

	private final Path root;

	private final Map<Path, Path> origins = new ConcurrentHashMap<>();

	public ShadowWorkspace(Path root) {
		this.root = root.toAbsolutePath().normalize();
	}

	/**
	 * Create the workspace directories. Idempotent.
	 */
	public synchronized void ensure() {
		try {
			Files.createDirectories(inputDir());
			Files.createDirectories(finalDir());
			Files.createDirectories(trashDir());
		}
		catch (IOException e) {
			throw new PipelineException("Failed to create workspace at " + root, e);
		}
	}

	public Path root() {
		return root;
	}

	public Path inputDir() {
		return root.resolve(INPUT_DIR);
	}

	public Path finalDir() {
		return root.resolve(FINAL_DIR);
	}

	public Path trashDir() {
		return root.resolve(TRASH_DIR);
	}

	public boolean exists() {
		return Files.isDirectory(root);
	}

	/**
	 * Copy a user source into {@code input/relative} and remember where it came from.
	 * @return the staged copy
	 */
	public Path stageInput(Path source, Path relative) throws IOException {
		Path target = requireInside(inputDir().resolve(relative));
		createParent(target);
		Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
		origins.put(target, source.toAbsolutePath().normalize());
		return target;
	}

	/**
	 * Copy a staged file into {@code final/relative}, keeping its origin.
	 * @return the copy inside {@code final}
	 */
	public Path stageFinal(Path path, Path relative) throws IOException {
		Path source = requireInside(path);
		Path target = ConflictResolver.nonColliding(requireInside(finalDir().resolve(relative)), Files::exists);
		createParent(target);
		Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
		recordDerived(target, source);
		return target;
	}

	/**
	 * Move a staged file into {@code trash} under a non-colliding name.
	 * @return the trashed path
	 */
	public Path simulateDelete(Path path) throws IOException {
		Path source = requireInside(path);
		Path target = ConflictResolver.nonColliding(trashDir().resolve(source.getFileName()), Files::exists);
		createParent(target);
		Files.move(source, target);
		recordDerived(target, source);
		logger.debug("Moved {} to trash as {}", source, target);
		return target;
	}

	/**
	 * Move a staged file to another location inside the workspace, replacing any file
	 * already there.
	 */
	public Path simulateRename(Path source, Path target) throws IOException {
		Path from = requireInside(source);
		Path to = requireInside(target);
		if (from.equals(to)) {
			return to;
		}
		createParent(to);
		Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
		recordDerived(to, from);
		return to;
	}

	/**
	 * Permanently delete a staged file.
	 */
	public void discard(Path path) throws IOException {
		Path staged = requireInside(path);
		Files.deleteIfExists(staged);
		origins.remove(staged);
	}

	/**
	 * Record that {@code derived} was produced from {@code from}. The derived file
	 * inherits the origin of {@code from}.
	 */
	public void recordDerived(Path derived, Path from) {
		Path key = normalize(derived);
		Path parent = normalize(from);
		origins.put(key, origins.getOrDefault(parent, parent));
	}

	/**
	 * The user source a staged file ultimately derives from, or null when unknown.
	 */
	@Nullable
	public Path originOf(Path staged) {
		return origins.get(normalize(staged));
	}

	/**
	 * Reject any path outside the workspace root.
	 * @return the normalised absolute path
	 * @throws IllegalStateException when the path escapes the workspace
	 */
	public Path requireInside(Path path) {
		Path normalized = normalize(path);
		if (!normalized.startsWith(root)) {
			throw new IllegalStateException("Refusing to touch " + normalized + " outside workspace " + root);
		}
		return normalized;
	}

	public boolean isInside(Path path) {
		return normalize(path).startsWith(root);
	}

	/**
	 * Deepest populated {@code final} subtree: descends while the only entry is a
	 * directory itself named {@code final}.
	 */
	public Path resultRoot() {
		Path current = finalDir();
		while (true) {
			List<Path> entries;
			try (Stream<Path> stream = Files.list(current)) {
				entries = stream.toList();
			}
			catch (IOException e) {
				return current;
			}
			if (entries.size() != 1 || !Files.isDirectory(entries.get(0))
					|| !FINAL_DIR.equals(entries.get(0).getFileName().toString())) {
				return current;
			}
			current = entries.get(0);
		}
	}

	/**
	 * Recursively remove the workspace. Failures are logged, never thrown.
	 */
	public synchronized void teardown() {
		origins.clear();
		if (!Files.exists(root)) {
			return;
		}
		try (Stream<Path> walk = Files.walk(root)) {
			walk.sorted(Comparator.reverseOrder()).forEach(path -> {
				try {
					Files.delete(path);
				}
				catch (IOException e) {
					logger.warn("Failed to delete workspace entry: {}", path);
				}
			});
			logger.debug("Removed workspace {}", root);
		}
		catch (IOException | UncheckedIOException e) {
			logger.warn("Failed to remove workspace {}: {}", root, e.getMessage());
		}
	}

	public synchronized void reset() {
		teardown();
		ensure();
	}

	@Override
	public void close() {
		teardown();
	}

	private static void createParent(Path target) throws IOException {
		Path parent = target.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
	}

	private static Path normalize(Path path) {
		return path.toAbsolutePath().normalize();
	}

}
