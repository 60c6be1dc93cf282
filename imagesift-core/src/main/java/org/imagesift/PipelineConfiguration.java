package org.imagesift;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of everything one pipeline run needs.
 *
 * <p>
 * A {@code null} stage settings value means the stage is disabled and behaves as the
 * identity. Instances are built once by the caller (usually from
 * {@link ParsedConfiguration}) and never change during a run.
 *
 * @param inputRoot file or directory holding the user's sources
 * @param outputRoot directory receiving committed results
 * @param cacheDirectory parent of the shadow workspace, or null for
 * {@code <outputRoot>/.imagesift-cache}
 * @param mode preview or commit
 * @param workers worker pool size, at least 1
 * @param recursive whether sub-directories of the input are scanned
 * @param purgeSources delete processed sources after a successful commit
 * @param classify classification settings, null when disabled
 * @param convert conversion settings, null when disabled
 * @param dedupe deduplication settings, null when disabled
 * @param rename rename settings, null when disabled
 */
public record PipelineConfiguration(Path inputRoot, Path outputRoot, @Nullable Path cacheDirectory,
		ExecutionMode mode, int workers, boolean recursive, boolean purgeSources, @Nullable ClassifySettings classify,
		@Nullable ConvertSettings convert, @Nullable DedupeSettings dedupe, @Nullable RenameSettings rename) {

	/** Workspace directory name used when no cache directory is configured. */
	public static final String DEFAULT_CACHE_NAME = ".imagesift-cache";

	public PipelineConfiguration {
		if (workers < 1) {
			throw new IllegalArgumentException("Worker count must be at least 1: " + workers);
		}
	}

	/**
	 * Root of the shadow workspace for this run.
	 */
	public Path workspaceRoot() {
		return cacheDirectory != null ? cacheDirectory : outputRoot.resolve(DEFAULT_CACHE_NAME);
	}

	public PipelineConfiguration withMode(ExecutionMode newMode) {
		return new PipelineConfiguration(inputRoot, outputRoot, cacheDirectory, newMode, workers, recursive,
				purgeSources, classify, convert, dedupe, rename);
	}

	public static Builder builder(Path inputRoot, Path outputRoot) {
		return new Builder(inputRoot, outputRoot);
	}

	/**
	 * Classification stage settings.
	 *
	 * @param mode ratio or shape classification
	 * @param ratios candidate ratios in match order (ratio mode)
	 * @param ratioTolerance maximum relative deviation from a ratio
	 * @param snap assign the closest ratio instead of {@code other}
	 * @param shapeTolerance maximum deviation of {@code w/h} from 1 for {@code square}
	 * @param separateAnimated route multi-frame images under {@code animated/}
	 */
	public record ClassifySettings(ClassifyMode mode, List<AspectRatio> ratios, double ratioTolerance, boolean snap,
			double shapeTolerance, boolean separateAnimated) {

		public ClassifySettings {
			ratios = List.copyOf(ratios);
			if (ratioTolerance < 0 || shapeTolerance < 0) {
				throw new IllegalArgumentException("Tolerances must not be negative");
			}
		}

		public static ClassifySettings ratios(String ratioText, double tolerance, boolean snap) {
			return new ClassifySettings(ClassifyMode.RATIO, AspectRatio.parseList(ratioText), tolerance, snap, 0.05,
					false);
		}

	}

	/**
	 * Conversion stage settings.
	 *
	 * @param format target format, lower case without dot
	 * @param quality lossy quality 1..100, or null for the codec default
	 * @param processSameFormat re-encode files already in the target format
	 * @param options codec pass-through options
	 */
	public record ConvertSettings(String format, @Nullable Integer quality, boolean processSameFormat,
			Map<String, String> options) {

		public ConvertSettings {
			if (format.isBlank()) {
				throw new IllegalArgumentException("Target format must not be blank");
			}
			format = ImageFiles.normalizeExtension(format);
			if (quality != null && (quality < 1 || quality > 100)) {
				throw new IllegalArgumentException("Quality must be within 1..100: " + quality);
			}
			options = Map.copyOf(options);
		}

		public static ConvertSettings to(String format) {
			return new ConvertSettings(format, null, false, Map.of());
		}

		public EncodeOptions encodeOptions() {
			return new EncodeOptions(format, quality, options);
		}

	}

	/**
	 * Deduplication stage settings.
	 *
	 * @param threshold maximum combined Hamming distance, 0 for exact hash matches
	 * @param keep keeper strategy
	 * @param action what happens to redundant copies
	 * @param moveDirectory destination for {@link DedupeAction#MOVE}
	 * @param strictness grouping strictness
	 */
	public record DedupeSettings(int threshold, KeepStrategy keep, DedupeAction action, @Nullable Path moveDirectory,
			GroupingStrictness strictness) {

		public DedupeSettings {
			if (threshold < 0 || threshold > 128) {
				throw new IllegalArgumentException("Threshold must be within 0..128: " + threshold);
			}
			if (action == DedupeAction.MOVE && moveDirectory == null) {
				throw new IllegalArgumentException("Action 'move' requires a move directory");
			}
		}

		public static DedupeSettings of(int threshold, KeepStrategy keep, DedupeAction action) {
			return new DedupeSettings(threshold, keep, action, null, GroupingStrictness.REPRESENTATIVE);
		}

	}

	/**
	 * Rename stage settings.
	 *
	 * @param pattern name pattern with {@code {name}}, {@code {ext}}, {@code {fmt}},
	 * {@code {index}}, {@code {index:N}} and {@code {ratio}} tokens
	 * @param start first sequence number
	 * @param step sequence increment
	 * @param width zero padding of {@code {index}}, 0 for none
	 * @param overwrite conflict policy
	 */
	public record RenameSettings(String pattern, int start, int step, int width, OverwritePolicy overwrite) {

		public RenameSettings {
			if (pattern.isBlank()) {
				throw new IllegalArgumentException("Rename pattern must not be blank");
			}
			RenamePattern.validate(pattern, width);
		}

		public static RenameSettings of(String pattern) {
			return new RenameSettings(pattern, 1, 1, 0, OverwritePolicy.RENAME);
		}

	}

	/**
	 * Fluent builder; unset stages stay disabled.
	 */
	public static final class Builder {

		private final Path inputRoot;

		private final Path outputRoot;

		@Nullable
		private Path cacheDirectory;

		private ExecutionMode mode = ExecutionMode.PREVIEW;

		private int workers = Runtime.getRuntime().availableProcessors();

		private boolean recursive = true;

		private boolean purgeSources = false;

		@Nullable
		private ClassifySettings classify;

		@Nullable
		private ConvertSettings convert;

		@Nullable
		private DedupeSettings dedupe;

		@Nullable
		private RenameSettings rename;

		private Builder(Path inputRoot, Path outputRoot) {
			this.inputRoot = inputRoot;
			this.outputRoot = outputRoot;
		}

		public Builder cacheDirectory(@Nullable Path cacheDirectory) {
			this.cacheDirectory = cacheDirectory;
			return this;
		}

		public Builder mode(ExecutionMode mode) {
			this.mode = mode;
			return this;
		}

		public Builder workers(int workers) {
			this.workers = workers;
			return this;
		}

		public Builder recursive(boolean recursive) {
			this.recursive = recursive;
			return this;
		}

		public Builder purgeSources(boolean purgeSources) {
			this.purgeSources = purgeSources;
			return this;
		}

		public Builder classify(@Nullable ClassifySettings classify) {
			this.classify = classify;
			return this;
		}

		public Builder convert(@Nullable ConvertSettings convert) {
			this.convert = convert;
			return this;
		}

		public Builder dedupe(@Nullable DedupeSettings dedupe) {
			this.dedupe = dedupe;
			return this;
		}

		public Builder rename(@Nullable RenameSettings rename) {
			this.rename = rename;
			return this;
		}

		public PipelineConfiguration build() {
			return new PipelineConfiguration(inputRoot, outputRoot, cacheDirectory, mode, workers, recursive,
					purgeSources, classify, convert, dedupe, rename);
		}

	}

}
