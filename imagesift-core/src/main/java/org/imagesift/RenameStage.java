package org.imagesift;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renames files in place according to a pattern.
 *
 * <p>
 * Runs sequentially in input order. The sequence restarts per directory when
 * classification produced label folders, otherwise one sequence spans all files.
 */
public class RenameStage extends AbstractStage {

	private final PipelineConfiguration.RenameSettings settings;

	private final RenamePattern pattern;

	private final boolean perDirectory;

	public RenameStage(PipelineConfiguration.RenameSettings settings, boolean perDirectory) {
		this.settings = settings;
		this.pattern = new RenamePattern(settings.pattern(), settings.width());
		this.perDirectory = perDirectory;
	}

	@Override
	public PipelineStage stage() {
		return PipelineStage.RENAME;
	}

	@Override
	protected List<Path> process(List<Path> files, PipelineContext context) {
		ShadowWorkspace workspace = context.workspace();
		Map<Path, Long> sequences = new HashMap<>();
		List<Path> result = new ArrayList<>(files.size());

		int done = 0;
		for (Path file : files) {
			if (context.isCancelled()) {
				result.add(file);
				continue;
			}
			Path directory = file.toAbsolutePath().normalize().getParent();
			Path sequenceKey = perDirectory ? directory : workspace.root();
			long index = sequences.getOrDefault(sequenceKey, (long) settings.start());
			sequences.put(sequenceKey, index + settings.step());

			if (!Files.exists(file)) {
				// replaced by an earlier overwrite
				context.skipped(stage(), file, "no longer present");
				continue;
			}

			Path origin = workspace.originOf(file);
			try {
				String name = pattern.expand(ImageFiles.stemOf(file),
						ImageFiles.extensionOf(origin != null ? origin : file), ImageFiles.extensionOf(file), index,
						context.labelOf(file));
				Path desired = directory.resolve(name).normalize();
				result.add(rename(file, desired, result, context));
			}
			catch (IOException | RuntimeException e) {
				context.failed(stage(), file, e);
				result.add(file);
			}
			context.progress(stage(), ++done, files.size());
		}
		return result;
	}

	private Path rename(Path file, Path desired, List<Path> renamed, PipelineContext context) throws IOException {
		Path source = file.toAbsolutePath().normalize();
		if (desired.equals(source)) {
			return file;
		}
		Path target = desired;
		if (Files.exists(desired)) {
			switch (settings.overwrite()) {
				case SKIP:
					context.skipped(stage(), file, "target exists: " + desired.getFileName());
					return file;
				case RENAME:
					target = ConflictResolver.resolve(desired, source, Files::exists, OverwritePolicy.RENAME);
					break;
				case OVERWRITE:
					renamed.remove(desired);
					break;
				default:
					throw new IllegalStateException("Unhandled policy " + settings.overwrite());
			}
		}
		Path moved = context.workspace().simulateRename(source, target);
		context.derived(moved, source);
		context.publish(stage(), file, moved, EventOutcome.OK, "renamed to " + moved.getFileName());
		return moved;
	}

}
