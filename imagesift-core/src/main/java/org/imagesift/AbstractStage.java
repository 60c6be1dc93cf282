package org.imagesift;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Base class for pipeline stages.
 *
 * <p>
 * {@link #run(PipelineContext)} is the template: it skips the stage when the run is
 * already cancelled, hands the current file list to {@link #process} and installs the
 * returned list as the new working list.
 */
public abstract class AbstractStage {

	private static final Logger logger = LoggerFactory.getLogger(AbstractStage.class);

	/**
	 * The stage reported in events.
	 */
	public abstract PipelineStage stage();

	/**
	 * Transform the working list. Implementations catch per-file failures themselves and
	 * report them through the context; they never abort the run for a single file.
	 * @param files current working list, in stable order
	 * @param context run state
	 * @return the new working list
	 */
	protected abstract List<Path> process(List<Path> files, PipelineContext context);

	public final void run(PipelineContext context) {
		if (context.isCancelled()) {
			logger.info("Skipping {}: run cancelled", stage());
			return;
		}
		List<Path> input = context.files();
		logger.info("{} started with {} files", stage(), input.size());
		long start = System.currentTimeMillis();
		List<Path> output = process(input, context);
		context.replaceFiles(output);
		logger.info("{} finished with {} files in {} ms", stage(), output.size(), System.currentTimeMillis() - start);
	}

	/**
	 * Directory inside {@code final} that mirrors the location of a staged file.
	 */
	protected static Path finalDirectoryFor(Path staged, ShadowWorkspace workspace) {
		Path parent = staged.toAbsolutePath().normalize().getParent();
		if (parent.startsWith(workspace.finalDir())) {
			return parent;
		}
		if (parent.startsWith(workspace.inputDir())) {
			return workspace.finalDir().resolve(workspace.inputDir().relativize(parent));
		}
		return workspace.finalDir();
	}

}
