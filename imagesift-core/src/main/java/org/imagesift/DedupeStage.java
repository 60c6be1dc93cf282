package org.imagesift;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds near-duplicate images and applies the configured action to redundant copies.
 *
 * <p>
 * Hashing runs on the worker pool; grouping and keeper selection run sequentially over
 * the records in input order. Groups are reported largest first.
 */
public class DedupeStage extends AbstractStage {

	private static final Logger logger = LoggerFactory.getLogger(DedupeStage.class);

	private final PipelineConfiguration.DedupeSettings settings;

	private final HashComputer hashComputer;

	private final SimilarityGrouper grouper;

	public DedupeStage(PipelineConfiguration.DedupeSettings settings, HashComputer hashComputer) {
		this.settings = settings;
		this.hashComputer = hashComputer;
		this.grouper = new SimilarityGrouper(settings.strictness());
	}

	@Override
	public PipelineStage stage() {
		return PipelineStage.DEDUPE;
	}

	@Override
	protected List<Path> process(List<Path> files, PipelineContext context) {
		List<@Nullable Optional<ImageRecord>> hashed = context.executor().map(files, hashComputer::computeRecord,
				(done, total) -> context.progress(stage(), done, total));

		List<ImageRecord> records = new ArrayList<>();
		for (int i = 0; i < files.size(); i++) {
			Optional<ImageRecord> record = hashed.get(i);
			if (record == null) {
				continue;
			}
			if (record.isPresent()) {
				records.add(record.get());
			}
			else {
				context.publish(stage(), files.get(i), files.get(i), EventOutcome.SKIPPED,
						"not decodable, excluded from comparison");
			}
		}
		if (context.isCancelled()) {
			return files;
		}

		GroupingResult grouping = grouper.group(records, settings.threshold());
		List<DuplicateGroup> groups = new ArrayList<>(grouping.duplicates());
		groups.sort(Comparator.comparingInt(DuplicateGroup::size).reversed());
		context.duplicatesFound(groups.size(), grouping.redundantCount());
		logger.info("Found {} duplicate groups with {} redundant files", groups.size(), grouping.redundantCount());

		Set<Path> removed = new HashSet<>();
		int number = 1;
		for (DuplicateGroup group : groups) {
			if (context.isCancelled()) {
				break;
			}
			ImageRecord keeper = SimilarityGrouper.keep(group, settings.keep());
			String groupName = "group " + number + " (" + group.size() + " files)";
			context.publish(stage(), keeper.path(), keeper.path(), EventOutcome.KEPT,
					groupName + ", kept by " + settings.keep().code());
			for (ImageRecord redundant : group.redundant(keeper)) {
				if (apply(redundant.path(), groupName, context)) {
					removed.add(redundant.path());
				}
			}
			number++;
		}

		List<Path> result = new ArrayList<>(files.size());
		for (Path file : files) {
			if (!removed.contains(file)) {
				result.add(file);
			}
		}
		return result;
	}

	/**
	 * Apply the action to one redundant copy.
	 * @return true when the file leaves the working list
	 */
	private boolean apply(Path redundant, String groupName, PipelineContext context) {
		ShadowWorkspace workspace = context.workspace();
		try {
			switch (settings.action()) {
				case LIST:
					context.publish(stage(), redundant, null, EventOutcome.LISTED, groupName + ", duplicate");
					return false;
				case DELETE:
					if (context.mode() == ExecutionMode.PREVIEW) {
						Path trashed = workspace.simulateDelete(redundant);
						context.publish(stage(), redundant, trashed, EventOutcome.REMOVED,
								groupName + ", moved to trash (preview)");
					}
					else {
						workspace.discard(redundant);
						context.publish(stage(), redundant, null, EventOutcome.REMOVED, groupName + ", deleted");
					}
					return true;
				case MOVE:
					Path directory = Objects.requireNonNull(settings.moveDirectory(), "move directory");
					Path parked = workspace.simulateDelete(redundant);
					if (context.mode() == ExecutionMode.PREVIEW) {
						context.publish(stage(), redundant, directory, EventOutcome.MOVED,
								groupName + ", would move to " + directory + " (preview)");
					}
					else {
						context.scheduleMove(parked, directory, redundant);
					}
					return true;
				default:
					throw new IllegalStateException("Unhandled action " + settings.action());
			}
		}
		catch (Exception e) {
			context.failed(stage(), redundant, e);
			return false;
		}
	}

}
