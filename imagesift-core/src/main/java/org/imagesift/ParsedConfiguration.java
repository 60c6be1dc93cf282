package org.imagesift;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Locations
	@Nullable
	public String input;

	@Nullable
	public String output;

	@Nullable
	public String cacheDirectory;

	@Nullable
	public String eventLog;

	@Nullable
	public String report;

	// Run flags
	public ExecutionMode mode = ExecutionMode.PREVIEW;

	public int workers;

	public boolean recursive;

	public boolean purgeSources = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	// Classification
	public boolean classify = false;

	public String classifyMode = "ratio";

	public String ratios;

	public double ratioTolerance;

	public boolean snap = false;

	public double shapeTolerance;

	public boolean separateAnimated = false;

	// Conversion
	@Nullable
	public String convertFormat = null; // null = conversion disabled

	public int quality;

	public boolean processSameFormat = false;

	public Map<String, String> convertOptions = new LinkedHashMap<>();

	// Deduplication
	public boolean dedupe = false;

	public int threshold;

	public String keepStrategy;

	public String dedupeAction;

	@Nullable
	public String moveDirectory = null;

	public String strictness = "representative";

	// Rename
	@Nullable
	public String renamePattern = null; // null = rename disabled

	public int renameStart;

	public int renameStep;

	public int renameWidth;

	public String overwritePolicy;

	public ParsedConfiguration(PipelineProperties defaultProperties) {
		// Initialize with defaults
		this.workers = defaultProperties.getWorkers();
		this.cacheDirectory = defaultProperties.getCacheDirectory();
		this.recursive = defaultProperties.isRecursive();
		this.verbose = defaultProperties.isVerbose();
		this.ratios = defaultProperties.getRatios();
		this.ratioTolerance = defaultProperties.getRatioTolerance();
		this.shapeTolerance = defaultProperties.getShapeTolerance();
		this.quality = defaultProperties.getQuality();
		this.threshold = defaultProperties.getThreshold();
		this.keepStrategy = defaultProperties.getKeepStrategy();
		this.dedupeAction = defaultProperties.getDedupeAction();
		this.renameStart = defaultProperties.getRenameStart();
		this.renameStep = defaultProperties.getRenameStep();
		this.renameWidth = defaultProperties.getRenameWidth();
		this.overwritePolicy = defaultProperties.getOverwritePolicy();
	}

	/**
	 * Output directory, defaulting to the input directory (or the parent of a single
	 * input file).
	 */
	public Path outputPath() {
		if (output != null) {
			return Path.of(output);
		}
		Path in = Path.of(requireInput()).toAbsolutePath().normalize();
		if (in.toFile().isFile() && in.getParent() != null) {
			return in.getParent();
		}
		return in;
	}

	/**
	 * Build the immutable run configuration. Enumerated values are decoded here, once.
	 * @throws IllegalArgumentException if a value cannot be decoded
	 */
	public PipelineConfiguration toPipelineConfiguration() {
		PipelineConfiguration.Builder builder = PipelineConfiguration.builder(Path.of(requireInput()), outputPath())
			.cacheDirectory(cacheDirectory != null ? Path.of(cacheDirectory) : null)
			.mode(mode)
			.workers(workers)
			.recursive(recursive)
			.purgeSources(purgeSources);

		if (classify) {
			builder.classify(new PipelineConfiguration.ClassifySettings(ClassifyMode.fromCode(classifyMode),
					AspectRatio.parseList(ratios), ratioTolerance, snap, shapeTolerance, separateAnimated));
		}
		if (convertFormat != null) {
			builder.convert(new PipelineConfiguration.ConvertSettings(convertFormat, quality,
					processSameFormat, convertOptions));
		}
		if (dedupe) {
			builder.dedupe(new PipelineConfiguration.DedupeSettings(threshold, KeepStrategy.fromCode(keepStrategy),
					DedupeAction.fromCode(dedupeAction), moveDirectory != null ? Path.of(moveDirectory) : null,
					GroupingStrictness.fromCode(strictness)));
		}
		if (renamePattern != null) {
			builder.rename(new PipelineConfiguration.RenameSettings(renamePattern, renameStart, renameStep,
					renameWidth, OverwritePolicy.fromCode(overwritePolicy)));
		}
		return builder.build();
	}

	private String requireInput() {
		if (input == null) {
			throw new IllegalArgumentException("Input path is required");
		}
		return input;
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "input='" + input + '\'' + ", output='" + output + '\'' + ", mode=" + mode
				+ ", workers=" + workers + ", recursive=" + recursive + ", purgeSources=" + purgeSources
				+ ", classify=" + classify + ", classifyMode='" + classifyMode + '\'' + ", ratios='" + ratios + '\''
				+ ", convertFormat='" + convertFormat + '\'' + ", dedupe=" + dedupe + ", threshold=" + threshold
				+ ", keepStrategy='" + keepStrategy + '\'' + ", dedupeAction='" + dedupeAction + '\''
				+ ", renamePattern='" + renamePattern + '\'' + ", overwritePolicy='" + overwritePolicy + '\''
				+ ", helpRequested=" + helpRequested + '}';
	}

}
