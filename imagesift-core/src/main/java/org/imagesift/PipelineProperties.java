package org.imagesift;

import org.jspecify.annotations.Nullable;

/**
 * Default values for pipeline runs.
 *
 * <p>
 * Command-line options override these values; {@link EnvironmentSupport#applyTo} applies
 * {@code IMAGESIFT_WORKERS} and {@code IMAGESIFT_CACHE_DIR} on top of the built-in
 * defaults. In the Spring application the bean is bound from {@code imagesift.*}
 * properties.
 */
public class PipelineProperties {

	/**
	 * Number of worker threads used for decoding, conversion and hashing.
	 */
	private int workers = Runtime.getRuntime().availableProcessors();

	/**
	 * Directory holding the shadow workspace; {@code null} places it under the output
	 * directory.
	 */
	@Nullable
	private String cacheDirectory = null;

	/**
	 * Scan sub-directories of the input.
	 */
	private boolean recursive = true;

	/**
	 * Candidate aspect ratios for classification.
	 */
	private String ratios = "16:9,4:3,1:1";

	/**
	 * Maximum relative deviation from a candidate ratio.
	 */
	private double ratioTolerance = 0.03;

	/**
	 * Maximum deviation of {@code w/h} from 1 for a square shape.
	 */
	private double shapeTolerance = 0.05;

	/**
	 * Default conversion target format.
	 */
	private String convertFormat = "png";

	/**
	 * Default lossy encoding quality (1..100).
	 */
	private int quality = 90;

	/**
	 * Default combined Hamming distance for duplicate detection.
	 */
	private int threshold = 0;

	/**
	 * Default keeper strategy code.
	 */
	private String keepStrategy = "largest";

	/**
	 * Default action applied to redundant copies.
	 */
	private String dedupeAction = "list";

	/**
	 * Default rename pattern.
	 */
	private String renamePattern = "{name}_{index}.{fmt}";

	/**
	 * First rename sequence number.
	 */
	private int renameStart = 1;

	/**
	 * Rename sequence increment.
	 */
	private int renameStep = 1;

	/**
	 * Zero padding of the {@code {index}} token, 0 for none.
	 */
	private int renameWidth = 0;

	/**
	 * Default conflict policy for renames.
	 */
	private String overwritePolicy = "overwrite";

	/**
	 * Enable verbose logging output.
	 */
	private boolean verbose = false;

	/**
	 * Returns the number of worker threads.
	 * @return the worker count
	 */
	public int getWorkers() {
		return workers;
	}

	/**
	 * Sets the number of worker threads.
	 * @param workers the worker count
	 */
	public void setWorkers(int workers) {
		this.workers = workers;
	}

	/**
	 * Returns the directory holding the shadow workspace.
	 * @return the cache directory, or null
	 */
	@Nullable
	public String getCacheDirectory() {
		return cacheDirectory;
	}

	/**
	 * Sets the directory holding the shadow workspace.
	 * @param cacheDirectory the cache directory, or null
	 */
	public void setCacheDirectory(@Nullable String cacheDirectory) {
		this.cacheDirectory = cacheDirectory;
	}

	/**
	 * Returns whether to scan sub-directories of the input.
	 * @return true when scanning recursively
	 */
	public boolean isRecursive() {
		return recursive;
	}

	/**
	 * Sets whether to scan sub-directories of the input.
	 * @param recursive true when scanning recursively
	 */
	public void setRecursive(boolean recursive) {
		this.recursive = recursive;
	}

	/**
	 * Returns the candidate aspect ratios for classification.
	 * @return the ratio text
	 */
	public String getRatios() {
		return ratios;
	}

	/**
	 * Sets the candidate aspect ratios for classification.
	 * @param ratios the ratio text
	 */
	public void setRatios(String ratios) {
		this.ratios = ratios;
	}

	/**
	 * Returns the maximum relative deviation from a candidate ratio.
	 * @return the ratio tolerance
	 */
	public double getRatioTolerance() {
		return ratioTolerance;
	}

	/**
	 * Sets the maximum relative deviation from a candidate ratio.
	 * @param ratioTolerance the ratio tolerance
	 */
	public void setRatioTolerance(double ratioTolerance) {
		this.ratioTolerance = ratioTolerance;
	}

	/**
	 * Returns the maximum deviation of {@code w/h} from 1 for a square shape.
	 * @return the shape tolerance
	 */
	public double getShapeTolerance() {
		return shapeTolerance;
	}

	/**
	 * Sets the maximum deviation of {@code w/h} from 1 for a square shape.
	 * @param shapeTolerance the shape tolerance
	 */
	public void setShapeTolerance(double shapeTolerance) {
		this.shapeTolerance = shapeTolerance;
	}

	/**
	 * Returns the default conversion target format.
	 * @return the target format
	 */
	public String getConvertFormat() {
		return convertFormat;
	}

	/**
	 * Sets the default conversion target format.
	 * @param convertFormat the target format
	 */
	public void setConvertFormat(String convertFormat) {
		this.convertFormat = convertFormat;
	}

	/**
	 * Returns the default lossy encoding quality (1..100).
	 * @return the quality
	 */
	public int getQuality() {
		return quality;
	}

	/**
	 * Sets the default lossy encoding quality (1..100).
	 * @param quality the quality
	 */
	public void setQuality(int quality) {
		this.quality = quality;
	}

	/**
	 * Returns the default combined Hamming distance for duplicate detection.
	 * @return the threshold
	 */
	public int getThreshold() {
		return threshold;
	}

	/**
	 * Sets the default combined Hamming distance for duplicate detection.
	 * @param threshold the threshold
	 */
	public void setThreshold(int threshold) {
		this.threshold = threshold;
	}

	/**
	 * Returns the default keeper strategy code.
	 * @return the keep strategy code
	 */
	public String getKeepStrategy() {
		return keepStrategy;
	}

	/**
	 * Sets the default keeper strategy code.
	 * @param keepStrategy the keep strategy code
	 */
	public void setKeepStrategy(String keepStrategy) {
		this.keepStrategy = keepStrategy;
	}

	/**
	 * Returns the default action applied to redundant copies.
	 * @return the action code
	 */
	public String getDedupeAction() {
		return dedupeAction;
	}

	/**
	 * Sets the default action applied to redundant copies.
	 * @param dedupeAction the action code
	 */
	public void setDedupeAction(String dedupeAction) {
		this.dedupeAction = dedupeAction;
	}

	/**
	 * Returns the default rename pattern.
	 * @return the rename pattern
	 */
	public String getRenamePattern() {
		return renamePattern;
	}

	/**
	 * Sets the default rename pattern.
	 * @param renamePattern the rename pattern
	 */
	public void setRenamePattern(String renamePattern) {
		this.renamePattern = renamePattern;
	}

	/**
	 * Returns the first rename sequence number.
	 * @return the start value
	 */
	public int getRenameStart() {
		return renameStart;
	}

	/**
	 * Sets the first rename sequence number.
	 * @param renameStart the start value
	 */
	public void setRenameStart(int renameStart) {
		this.renameStart = renameStart;
	}

	/**
	 * Returns the rename sequence increment.
	 * @return the step
	 */
	public int getRenameStep() {
		return renameStep;
	}

	/**
	 * Sets the rename sequence increment.
	 * @param renameStep the step
	 */
	public void setRenameStep(int renameStep) {
		this.renameStep = renameStep;
	}

	/**
	 * Returns the zero padding of the {@code {index}} token, 0 for none.
	 * @return the width
	 */
	public int getRenameWidth() {
		return renameWidth;
	}

	/**
	 * Sets the zero padding of the {@code {index}} token, 0 for none.
	 * @param renameWidth the width
	 */
	public void setRenameWidth(int renameWidth) {
		this.renameWidth = renameWidth;
	}

	/**
	 * Returns the default conflict policy for renames.
	 * @return the overwrite policy code
	 */
	public String getOverwritePolicy() {
		return overwritePolicy;
	}

	/**
	 * Sets the default conflict policy for renames.
	 * @param overwritePolicy the overwrite policy code
	 */
	public void setOverwritePolicy(String overwritePolicy) {
		this.overwritePolicy = overwritePolicy;
	}

	/**
	 * Returns whether to enable verbose logging output.
	 * @return true when verbose
	 */
	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * Sets whether to enable verbose logging output.
	 * @param verbose true when verbose
	 */
	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
