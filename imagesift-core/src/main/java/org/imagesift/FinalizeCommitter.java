package org.imagesift;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Materialises the shadow result tree into the real output directory.
 *
 * <p>
 * The only component that writes outside the shadow workspace, and it runs only in
 * commit mode after every stage finished without cancellation.
 */
public class FinalizeCommitter {

	private static final Logger logger = LoggerFactory.getLogger(FinalizeCommitter.class);

	/**
	 * Copy the shadow result into the output directory and optionally purge sources.
	 * Result files cannot be traced back to their sources, so a single failed copy
	 * suppresses the whole purge.
	 * @see #finalize(Path, Path, boolean, Path, Collection, Collection, Function)
	 */
	public FinalizeSummary finalize(Path shadowFinalRoot, Path realOutputRoot, boolean purgeSources, Path sourceRoot,
			Collection<Path> processedSources, Collection<Path> preserved) {
		return finalize(shadowFinalRoot, realOutputRoot, purgeSources, sourceRoot, processedSources, preserved,
				file -> null);
	}

	/**
	 * Copy the shadow result into the output directory and optionally purge sources.
	 *
	 * <p>
	 * A source is never purged when one of the result files derived from it failed to
	 * copy. When a failed file has no known origin nothing is purged at all.
	 * @param shadowFinalRoot result root inside the workspace
	 * @param realOutputRoot user-visible output directory
	 * @param purgeSources whether processed sources are deleted afterwards
	 * @param sourceRoot root of the user's input tree
	 * @param processedSources sources that were staged and processed without failure
	 * @param preserved paths inside the output that must survive clearing (the workspace)
	 * @param originOf maps a result file to the user source it derives from, null when
	 * unknown
	 * @return copy and purge counters
	 */
	public FinalizeSummary finalize(Path shadowFinalRoot, Path realOutputRoot, boolean purgeSources, Path sourceRoot,
			Collection<Path> processedSources, Collection<Path> preserved,
			Function<Path, @Nullable Path> originOf) {
		Path output = realOutputRoot.toAbsolutePath().normalize();
		Path source = sourceRoot.toAbsolutePath().normalize();
		Set<Path> keep = new HashSet<>();
		preserved.forEach(path -> keep.add(path.toAbsolutePath().normalize()));

		try {
			Files.createDirectories(output);
		}
		catch (IOException e) {
			throw new PipelineException("Failed to create output directory: " + output, e);
		}

		if (output.startsWith(source) || source.startsWith(output)) {
			logger.warn("Output {} overlaps input {}, existing output is not cleared", output, source);
		}
		else {
			clear(output, keep);
		}

		int copied = 0;
		int failed = 0;
		Set<Path> written = new HashSet<>();
		Set<Path> uncommitted = new HashSet<>();
		boolean untraced = false;
		for (Path file : resultFiles(shadowFinalRoot)) {
			Path relative = shadowFinalRoot.relativize(file);
			Path target = output.resolve(relative).normalize();
			try {
				Path parent = target.getParent();
				if (parent != null) {
					Files.createDirectories(parent);
				}
				Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
				written.add(target);
				copied++;
			}
			catch (IOException e) {
				logger.warn("Failed to copy {} to {}: {}", file, target, e.getMessage());
				failed++;
				Path origin = originOf.apply(file);
				if (origin != null) {
					uncommitted.add(origin.toAbsolutePath().normalize());
				}
				else {
					untraced = true;
				}
			}
		}
		logger.info("Committed {} files to {} ({} failed)", copied, output, failed);

		int purged = 0;
		int purgeFailed = 0;
		int purgeSkipped = 0;
		if (purgeSources && untraced) {
			logger.warn("Not purging any source: {} result files failed to copy and cannot be traced to a source",
					failed);
			purgeSkipped = processedSources.size();
		}
		else if (purgeSources) {
			for (Path processed : processedSources) {
				Path candidate = processed.toAbsolutePath().normalize();
				if (!candidate.startsWith(source) || source.relativize(candidate).startsWith("..")) {
					logger.warn("Not purging {}: outside source root {}", candidate, source);
					purgeSkipped++;
					continue;
				}
				if (uncommitted.contains(candidate)) {
					logger.warn("Not purging {}: its result was not copied to the output", candidate);
					purgeSkipped++;
					continue;
				}
				if (written.contains(candidate)) {
					logger.debug("Not purging {}: it is a committed result", candidate);
					purgeSkipped++;
					continue;
				}
				try {
					Files.deleteIfExists(candidate);
					purged++;
				}
				catch (IOException e) {
					logger.warn("Failed to purge source {}: {}", candidate, e.getMessage());
					purgeFailed++;
				}
			}
			logger.info("Purged {} source files ({} failed, {} skipped)", purged, purgeFailed, purgeSkipped);
		}

		return new FinalizeSummary(copied, failed, purged, purgeFailed, purgeSkipped);
	}

	/**
	 * Regular files of the result tree, skipping any {@code trash} subtree, in path order.
	 */
	static List<Path> resultFiles(Path shadowFinalRoot) {
		if (!Files.isDirectory(shadowFinalRoot)) {
			return List.of();
		}
		try (Stream<Path> walk = Files.walk(shadowFinalRoot)) {
			return walk.filter(Files::isRegularFile)
				.filter(file -> !containsSegment(shadowFinalRoot.relativize(file), ShadowWorkspace.TRASH_DIR))
				.sorted()
				.toList();
		}
		catch (IOException e) {
			throw new PipelineException("Failed to walk result tree " + shadowFinalRoot, e);
		}
	}

	private static boolean containsSegment(Path relative, String name) {
		for (Path segment : relative) {
			if (segment.toString().equals(name)) {
				return true;
			}
		}
		return false;
	}

	private void clear(Path directory, Set<Path> keep) {
		List<Path> children;
		try (Stream<Path> list = Files.list(directory)) {
			children = list.toList();
		}
		catch (IOException e) {
			logger.warn("Failed to list output directory {}: {}", directory, e.getMessage());
			return;
		}
		for (Path child : children) {
			Path normalized = child.toAbsolutePath().normalize();
			if (keep.contains(normalized)) {
				continue;
			}
			if (keep.stream().anyMatch(path -> path.startsWith(normalized)) && Files.isDirectory(normalized)) {
				clear(normalized, keep);
				continue;
			}
			deleteRecursively(normalized);
		}
	}

	private void deleteRecursively(Path path) {
		try (Stream<Path> walk = Files.walk(path)) {
			walk.sorted(Comparator.reverseOrder()).forEach(entry -> {
				try {
					Files.delete(entry);
				}
				catch (IOException e) {
					logger.warn("Failed to delete: {}", entry);
				}
			});
		}
		catch (IOException | UncheckedIOException e) {
			logger.warn("Failed to clear {}: {}", path, e.getMessage());
		}
	}

}
