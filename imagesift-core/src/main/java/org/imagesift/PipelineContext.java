package org.imagesift;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one pipeline run, shared by all stages.
 *
 * <p>
 * The working file list is replaced wholesale by each stage, never edited in place.
 * Counters, labels and reservations are safe to update from worker threads.
 */
public class PipelineContext {

	private final PipelineConfiguration configuration;

	private final ShadowWorkspace workspace;

	private final ImageCodec codec;

	private final EventChannel events;

	private final ParallelExecutor executor;

	private final AtomicBoolean cancelled;

	private final AtomicInteger converted = new AtomicInteger();

	private final AtomicInteger skipped = new AtomicInteger();

	private final AtomicInteger failed = new AtomicInteger();

	private final Map<Path, String> labels = new ConcurrentHashMap<>();

	private final Set<Path> reserved = new HashSet<>();

	private final Set<Path> failedOrigins = ConcurrentHashMap.newKeySet();

	private final Set<Path> stagedSources = new LinkedHashSet<>();

	private final List<PendingMove> pendingMoves = new ArrayList<>();

	private List<Path> files = List.of();

	private int duplicateGroups;

	private int redundantFiles;

	public PipelineContext(PipelineConfiguration configuration, ShadowWorkspace workspace, ImageCodec codec,
			EventChannel events, ParallelExecutor executor, AtomicBoolean cancelled) {
		this.configuration = configuration;
		this.workspace = workspace;
		this.codec = codec;
		this.events = events;
		this.executor = executor;
		this.cancelled = cancelled;
	}

	public PipelineConfiguration configuration() {
		return configuration;
	}

	public ShadowWorkspace workspace() {
		return workspace;
	}

	public ImageCodec codec() {
		return codec;
	}

	public ParallelExecutor executor() {
		return executor;
	}

	public ExecutionMode mode() {
		return configuration.mode();
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	public List<Path> files() {
		return files;
	}

	public void replaceFiles(List<Path> newFiles) {
		this.files = List.copyOf(newFiles);
	}

	// Events and counters

	public void publish(PipelineStage stage, @Nullable Path source, @Nullable Path dest, EventOutcome outcome,
			String message) {
		events.publish(PipelineEvent.of(stage, source, dest, outcome, message));
	}

	public void progress(PipelineStage stage, int done, int total) {
		events.progress(stage, done, total);
	}

	public void converted(PipelineStage stage, Path source, Path dest, String message) {
		converted.incrementAndGet();
		publish(stage, source, dest, EventOutcome.OK, message);
	}

	public void skipped(PipelineStage stage, Path source, String message) {
		skipped.incrementAndGet();
		publish(stage, source, source, EventOutcome.SKIPPED, message);
	}

	public void failed(PipelineStage stage, Path source, Exception cause) {
		failed.incrementAndGet();
		String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
		publish(stage, source, null, EventOutcome.FAILED, message);
	}

	public int convertedCount() {
		return converted.get();
	}

	public int skippedCount() {
		return skipped.get();
	}

	public int failedCount() {
		return failed.get();
	}

	// Classification labels follow a file through later stages

	public void label(Path staged, String label) {
		labels.put(staged.toAbsolutePath().normalize(), label);
	}

	public String labelOf(Path staged) {
		return labels.getOrDefault(staged.toAbsolutePath().normalize(), "");
	}

	/**
	 * Record that {@code to} replaces {@code from}: origin and label carry over.
	 */
	public void derived(Path to, Path from) {
		workspace.recordDerived(to, from);
		String label = labels.get(from.toAbsolutePath().normalize());
		if (label != null) {
			label(to, label);
		}
	}

	/**
	 * Reserve a non-colliding destination. Safe to call from several workers at once.
	 */
	public synchronized Path reserve(Path desired, @Nullable Path source) throws IOException {
		Path resolved = ConflictResolver.resolve(desired, source,
				candidate -> reserved.contains(candidate.toAbsolutePath().normalize()) || Files.exists(candidate),
				OverwritePolicy.RENAME);
		reserved.add(resolved.toAbsolutePath().normalize());
		return resolved;
	}

	/**
	 * Remember that a user source was copied into the workspace.
	 */
	public synchronized void sourceStaged(Path source) {
		stagedSources.add(source.toAbsolutePath().normalize());
	}

	/**
	 * Sources that reached the workspace and did not fail in any stage, in staging order.
	 */
	public synchronized List<Path> processedSources() {
		List<Path> processed = new ArrayList<>(stagedSources.size());
		for (Path source : stagedSources) {
			if (!failedOrigins.contains(source)) {
				processed.add(source);
			}
		}
		return processed;
	}

	/**
	 * Remember that a user source produced nothing usable and must not be purged.
	 */
	public void sourceFailed(Path staged) {
		Path origin = workspace.originOf(staged);
		if (origin != null) {
			failedOrigins.add(origin);
		}
	}

	// Deduplication bookkeeping

	public void duplicatesFound(int groups, int redundant) {
		this.duplicateGroups += groups;
		this.redundantFiles += redundant;
	}

	public int duplicateGroups() {
		return duplicateGroups;
	}

	public int redundantFiles() {
		return redundantFiles;
	}

	public synchronized void scheduleMove(Path staged, Path directory, Path source) {
		pendingMoves.add(new PendingMove(staged, directory, source));
	}

	public synchronized List<PendingMove> pendingMoves() {
		return List.copyOf(pendingMoves);
	}

	/**
	 * A redundant copy waiting to be copied to the move directory after commit.
	 *
	 * @param staged the copy inside the workspace
	 * @param directory destination directory
	 * @param source the staged path it was before removal
	 */
	public record PendingMove(Path staged, Path directory, Path source) {
	}

}
