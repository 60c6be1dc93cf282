package org.imagesift;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs Classify, Convert, Dedupe and Rename in that fixed order against a shadow
 * workspace and, in commit mode, materialises the result.
 *
 * <p>
 * One run at a time per instance. {@link #cancel()} may be called from any thread; the
 * flag is checked before each stage, at the start of every pooled task and between files
 * in sequential loops. Commit finalization never runs after cancellation.
 */
public class PipelineOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

	private final ImageCodec codec;

	private final HashComputer hashComputer;

	private final FinalizeCommitter committer;

	private final PreviewSignature previewSignature;

	private final List<PipelineEventListener> listeners = new CopyOnWriteArrayList<>();

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	@Nullable
	private ShadowWorkspace workspace;

	@Nullable
	private PipelineResult lastPreview;

	public PipelineOrchestrator(ImageCodec codec, FinalizeCommitter committer, ObjectMapper objectMapper) {
		this.codec = codec;
		this.hashComputer = new HashComputer(codec);
		this.committer = committer;
		this.previewSignature = new PreviewSignature(objectMapper);
	}

	public void addListener(PipelineEventListener listener) {
		listeners.add(listener);
	}

	public void removeListener(PipelineEventListener listener) {
		listeners.remove(listener);
	}

	/**
	 * Request cooperative cancellation of the running pipeline.
	 */
	public void cancel() {
		if (!cancelled.getAndSet(true)) {
			logger.info("Cancellation requested");
		}
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	/**
	 * Execute one pipeline run.
	 * @param configuration immutable run configuration
	 * @return the run summary
	 * @throws PipelineException if the workspace or the input cannot be set up
	 */
	public synchronized PipelineResult run(PipelineConfiguration configuration) {
		cancelled.set(false);
		ShadowWorkspace shadow = workspaceFor(configuration);
		Path sourceBase = sourceBase(configuration.inputRoot());
		List<Path> inputs = ImageFiles.scan(configuration.inputRoot(), configuration.recursive(),
				excludedFrom(configuration));
		String signature = previewSignature.compute(configuration, inputs);

		PipelineResult cached = lastPreview;
		if (configuration.mode() == ExecutionMode.PREVIEW && cached != null && cached.signature().equals(signature)
				&& cached.status() == RunStatus.COMPLETED && shadow.exists()) {
			logger.info("Inputs and settings unchanged, reusing previous preview");
			return cached.reused();
		}
		lastPreview = null;

		logger.info("Starting {} of {} images from {} (workers={})", configuration.mode(), inputs.size(),
				configuration.inputRoot(), configuration.workers());
		shadow.reset();

		try (EventChannel events = new EventChannel(listeners);
				ParallelExecutor executor = new ParallelExecutor(configuration.workers(), cancelled)) {
			PipelineContext context = new PipelineContext(configuration, shadow, codec, events, executor, cancelled);
			context.replaceFiles(stageInputs(inputs, sourceBase, context));

			for (AbstractStage stage : stagesFor(configuration)) {
				stage.run(context);
			}

			if (cancelled.get()) {
				logger.warn("Run cancelled, nothing was committed");
				events.flush();
				return result(RunStatus.CANCELLED, context, signature, null);
			}

			stageLeftovers(context);
			if (configuration.mode() == ExecutionMode.PREVIEW) {
				events.flush();
				PipelineResult result = result(RunStatus.COMPLETED, context, signature, null);
				lastPreview = result;
				logPreview(result);
				return result;
			}

			FinalizeSummary summary = commit(context, sourceBase);
			events.flush();
			PipelineResult result = result(RunStatus.COMPLETED, context, signature, summary);
			shadow.teardown();
			logger.info("Commit finished: converted={}, skipped={}, failed={}, copied={}", result.converted(),
					result.skipped(), result.failed(), summary.copied());
			return result;
		}
	}

	private void logPreview(PipelineResult result) {
		logger.info("Preview finished: converted={}, skipped={}, failed={}, {} result files in {}", result.converted(),
				result.skipped(), result.failed(), result.finalFiles().size(), result.resultRoot());
	}

	List<AbstractStage> stagesFor(PipelineConfiguration configuration) {
		List<AbstractStage> stages = new ArrayList<>();
		PipelineConfiguration.ClassifySettings classify = configuration.classify();
		if (classify != null) {
			stages.add(new ClassifyStage(classify));
		}
		PipelineConfiguration.ConvertSettings convert = configuration.convert();
		if (convert != null) {
			stages.add(new ConvertStage(convert, configuration.purgeSources()));
		}
		PipelineConfiguration.DedupeSettings dedupe = configuration.dedupe();
		if (dedupe != null) {
			stages.add(new DedupeStage(dedupe, hashComputer));
		}
		PipelineConfiguration.RenameSettings rename = configuration.rename();
		if (rename != null) {
			stages.add(new RenameStage(rename, classify != null));
		}
		return stages;
	}

	private List<Path> stageInputs(List<Path> inputs, Path sourceBase, PipelineContext context) {
		ShadowWorkspace shadow = context.workspace();
		List<Path> staged = new ArrayList<>(inputs.size());
		int done = 0;
		for (Path input : inputs) {
			if (context.isCancelled()) {
				break;
			}
			try {
				Path copy = shadow.stageInput(input, sourceBase.relativize(input));
				context.sourceStaged(input);
				staged.add(copy);
			}
			catch (IOException | RuntimeException e) {
				context.failed(PipelineStage.STAGE_INPUT, input, e);
			}
			context.progress(PipelineStage.STAGE_INPUT, ++done, inputs.size());
		}
		return staged;
	}

	/**
	 * Copy every working file that no stage moved into {@code final}.
	 */
	private void stageLeftovers(PipelineContext context) {
		ShadowWorkspace shadow = context.workspace();
		List<Path> result = new ArrayList<>(context.files().size());
		for (Path file : context.files()) {
			Path normalized = file.toAbsolutePath().normalize();
			if (normalized.startsWith(shadow.finalDir())) {
				result.add(normalized);
				continue;
			}
			Path relative = normalized.startsWith(shadow.inputDir()) ? shadow.inputDir().relativize(normalized)
					: normalized.getFileName();
			try {
				Path copy = shadow.stageFinal(normalized, relative);
				context.derived(copy, normalized);
				result.add(copy);
			}
			catch (IOException | RuntimeException e) {
				context.failed(PipelineStage.FINALIZE, file, e);
				context.sourceFailed(file);
			}
		}
		context.replaceFiles(result);
	}

	private FinalizeSummary commit(PipelineContext context, Path sourceBase) {
		PipelineConfiguration configuration = context.configuration();
		ShadowWorkspace shadow = context.workspace();

		FinalizeSummary summary = committer.finalize(shadow.resultRoot(), configuration.outputRoot(),
				configuration.purgeSources(), sourceBase, context.processedSources(), List.of(shadow.root()),
				shadow::originOf);
		context.publish(PipelineStage.FINALIZE, shadow.resultRoot(), configuration.outputRoot(),
				summary.failed() > 0 ? EventOutcome.FAILED : EventOutcome.OK,
				"copied " + summary.copied() + ", failed " + summary.failed());
		if (configuration.purgeSources()) {
			context.publish(PipelineStage.PURGE, sourceBase, null, EventOutcome.OK, "purged " + summary.purged()
					+ ", failed " + summary.purgeFailed() + ", skipped " + summary.purgeSkipped());
		}

		for (PipelineContext.PendingMove move : context.pendingMoves()) {
			try {
				Files.createDirectories(move.directory());
				Path target = ConflictResolver.nonColliding(move.directory().resolve(move.source().getFileName()),
						Files::exists);
				Files.copy(move.staged(), target);
				shadow.discard(move.staged());
				context.publish(PipelineStage.DEDUPE, move.source(), target, EventOutcome.MOVED, "moved duplicate");
			}
			catch (IOException | RuntimeException e) {
				context.failed(PipelineStage.DEDUPE, move.source(), e);
			}
		}
		return summary;
	}

	private PipelineResult result(RunStatus status, PipelineContext context, String signature,
			@Nullable FinalizeSummary summary) {
		ShadowWorkspace shadow = context.workspace();
		Path resultRoot = shadow.resultRoot();
		List<Path> finalFiles = FinalizeCommitter.resultFiles(resultRoot)
			.stream()
			.map(resultRoot::relativize)
			.toList();
		int failed = context.failedCount() + (summary != null ? summary.failed() : 0);
		return new PipelineResult(status, context.mode(), context.convertedCount(), context.skippedCount(), failed,
				context.duplicateGroups(), context.redundantFiles(), finalFiles, resultRoot, summary, signature, false);
	}

	private ShadowWorkspace workspaceFor(PipelineConfiguration configuration) {
		Path root = configuration.workspaceRoot().toAbsolutePath().normalize();
		ShadowWorkspace current = workspace;
		if (current != null && current.root().equals(root)) {
			return current;
		}
		if (current != null) {
			logger.info("Workspace location changed, removing {}", current.root());
			current.teardown();
		}
		lastPreview = null;
		ShadowWorkspace created = new ShadowWorkspace(root);
		workspace = created;
		return created;
	}

	private static List<Path> excludedFrom(PipelineConfiguration configuration) {
		List<Path> excluded = new ArrayList<>();
		excluded.add(configuration.workspaceRoot());
		Path input = configuration.inputRoot().toAbsolutePath().normalize();
		Path output = configuration.outputRoot().toAbsolutePath().normalize();
		if (!output.equals(input) && output.startsWith(input)) {
			excluded.add(output);
		}
		PipelineConfiguration.DedupeSettings dedupe = configuration.dedupe();
		if (dedupe != null && dedupe.moveDirectory() != null) {
			excluded.add(dedupe.moveDirectory());
		}
		return excluded;
	}

	private static Path sourceBase(Path inputRoot) {
		Path normalized = inputRoot.toAbsolutePath().normalize();
		if (Files.isRegularFile(normalized) && normalized.getParent() != null) {
			return normalized.getParent();
		}
		return normalized;
	}

	/**
	 * Remove the current workspace, if any.
	 */
	public synchronized void close() {
		ShadowWorkspace current = workspace;
		if (current != null) {
			current.teardown();
		}
		workspace = null;
		lastPreview = null;
	}

}
