package org.imagesift;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Predicate;

/**
 * Computes a non-colliding destination path.
 *
 * <p>
 * The existence check is injected so the same logic serves the real filesystem and the
 * shadow workspace.
 */
public final class ConflictResolver {

	/** Upper bound on {@code stem_N.ext} candidates before giving up. */
	public static final int MAX_ATTEMPTS = 10_000;

	private ConflictResolver() {
	}

	/**
	 * Resolve {@code desired} against existing entries.
	 * @param desired the preferred destination
	 * @param source the file being moved there, if any; a destination equal to the source
	 * is never a conflict
	 * @param exists existence check for candidate paths
	 * @param policy {@link OverwritePolicy#OVERWRITE} or {@link OverwritePolicy#RENAME}
	 * @return the path to write
	 * @throws IllegalArgumentException for {@link OverwritePolicy#SKIP}, which callers
	 * handle before asking for a destination
	 * @throws ConflictUnresolvedException when no free name is found
	 */
	public static Path resolve(Path desired, @Nullable Path source, Predicate<Path> exists, OverwritePolicy policy)
			throws ConflictUnresolvedException {
		switch (policy) {
			case OVERWRITE:
				return desired;
			case SKIP:
				throw new IllegalArgumentException("SKIP must be handled by the caller before resolving " + desired);
			default:
				break;
		}

		if (isSame(desired, source) || !exists.test(desired)) {
			return desired;
		}

		String fileName = desired.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
		String ext = dot > 0 ? fileName.substring(dot) : "";

		for (int n = 1; n <= MAX_ATTEMPTS; n++) {
			Path candidate = desired.resolveSibling(stem + "_" + n + ext);
			if (isSame(candidate, source) || !exists.test(candidate)) {
				return candidate;
			}
		}
		throw new ConflictUnresolvedException(desired, MAX_ATTEMPTS);
	}

	/**
	 * Convenience for the common rename case.
	 */
	public static Path nonColliding(Path desired, Predicate<Path> exists) throws IOException {
		return resolve(desired, null, exists, OverwritePolicy.RENAME);
	}

	private static boolean isSame(Path candidate, @Nullable Path source) {
		return source != null && candidate.toAbsolutePath().normalize().equals(source.toAbsolutePath().normalize());
	}

}
