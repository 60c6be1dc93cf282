package org.imagesift;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-encodes images into the target format on the worker pool.
 *
 * <p>
 * Output goes to {@code final/<same relative dir>/<stem>.<fmt>}. Files already in the
 * target format pass through unless same-format processing is enabled; undecodable files
 * pass through as skipped; encode failures are excluded from the working list and, when
 * sources will be purged, quarantined under {@code final/failed/}.
 */
public class ConvertStage extends AbstractStage {

	static final String FAILED_DIR = "failed";

	private final PipelineConfiguration.ConvertSettings settings;

	private final boolean quarantineFailures;

	public ConvertStage(PipelineConfiguration.ConvertSettings settings, boolean quarantineFailures) {
		this.settings = settings;
		this.quarantineFailures = quarantineFailures;
	}

	@Override
	public PipelineStage stage() {
		return PipelineStage.CONVERT;
	}

	@Override
	protected List<Path> process(List<Path> files, PipelineContext context) {
		List<@Nullable Outcome> outcomes = context.executor().map(files, file -> convert(file, context),
				(done, total) -> context.progress(stage(), done, total));

		List<Path> result = new ArrayList<>(files.size());
		for (int i = 0; i < files.size(); i++) {
			Outcome outcome = outcomes.get(i);
			if (outcome == null) {
				// not started because of cancellation
				result.add(files.get(i));
			}
			else if (outcome.path() != null) {
				result.add(outcome.path());
			}
		}
		return result;
	}

	private Outcome convert(Path file, PipelineContext context) {
		if (ImageFiles.extensionOf(file).equals(settings.format()) && !settings.processSameFormat()) {
			context.skipped(stage(), file, "already " + settings.format());
			return new Outcome(file);
		}

		ShadowWorkspace workspace = context.workspace();
		Path target;
		try {
			Path desired = finalDirectoryFor(file, workspace).resolve(ImageFiles.stemOf(file) + "." + settings.format());
			target = workspace.requireInside(context.reserve(desired, file));
		}
		catch (IOException | RuntimeException e) {
			return failure(file, context, e);
		}

		try {
			context.codec().encode(file, target, settings.encodeOptions());
		}
		catch (DecodeException e) {
			context.skipped(stage(), file, "not decodable, left unconverted: " + e.getMessage());
			return new Outcome(file);
		}
		catch (IOException | RuntimeException e) {
			if (!target.equals(file.toAbsolutePath().normalize())) {
				discardQuietly(target, context);
			}
			return failure(file, context, e);
		}

		context.derived(target, file);
		context.converted(stage(), file, target, "converted to " + settings.format());
		if (!target.equals(file.toAbsolutePath().normalize()) && file.toAbsolutePath().normalize()
			.startsWith(workspace.finalDir())) {
			discardQuietly(file, context);
		}
		return new Outcome(target);
	}

	private Outcome failure(Path file, PipelineContext context, Exception cause) {
		context.failed(stage(), file, cause);
		if (!quarantineFailures) {
			context.sourceFailed(file);
			return new Outcome(null);
		}
		try {
			ShadowWorkspace workspace = context.workspace();
			Path quarantine = context.reserve(workspace.finalDir().resolve(FAILED_DIR).resolve(file.getFileName()),
					file);
			Path moved = workspace.simulateRename(file, quarantine);
			context.publish(stage(), file, moved, EventOutcome.QUARANTINED, "kept under " + FAILED_DIR + "/");
		}
		catch (IOException | RuntimeException e) {
			context.sourceFailed(file);
			context.publish(stage(), file, null, EventOutcome.FAILED, "quarantine failed: " + e.getMessage());
		}
		return new Outcome(null);
	}

	private void discardQuietly(Path leftover, PipelineContext context) {
		try {
			context.workspace().discard(leftover);
		}
		catch (IOException e) {
			context.publish(stage(), leftover, null, EventOutcome.FAILED,
					"could not remove intermediate copy: " + e.getMessage());
		}
	}

	/**
	 * Per-file result; a null path means the file leaves the working list.
	 */
	private record Outcome(@Nullable Path path) {
	}

}
