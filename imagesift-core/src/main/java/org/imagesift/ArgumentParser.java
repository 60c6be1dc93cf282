package org.imagesift;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the imagesift pipeline. Pure Java implementation with
 * no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private final PipelineProperties defaultProperties;

	public ArgumentParser(PipelineProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-i", "--input":
					config.input = getRequiredValue(args, i, "input");
					i++; // Skip next argument since we consumed it
					break;

				case "-o", "--output":
					config.output = getRequiredValue(args, i, "output");
					i++;
					break;

				case "--preview":
					config.mode = ExecutionMode.PREVIEW;
					break;

				case "--commit":
					config.mode = ExecutionMode.COMMIT;
					break;

				case "-w", "--workers":
					config.workers = parseInt(getRequiredValue(args, i, "workers"), "workers");
					i++;
					break;

				case "--no-recursive":
					config.recursive = false;
					break;

				case "--purge-sources":
					config.purgeSources = true;
					break;

				case "--cache-dir":
					config.cacheDirectory = getRequiredValue(args, i, "cache-dir");
					i++;
					break;

				case "--event-log":
					config.eventLog = getRequiredValue(args, i, "event-log");
					i++;
					break;

				case "--report":
					config.report = getRequiredValue(args, i, "report");
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				// Classification
				case "--classify":
					config.classify = true;
					break;

				case "--classify-mode":
					config.classifyMode = getRequiredValue(args, i, "classify-mode");
					config.classify = true; // a mode implies classification
					i++;
					break;

				case "--ratios":
					config.ratios = getRequiredValue(args, i, "ratios");
					i++;
					break;

				case "--ratio-tolerance":
					config.ratioTolerance = parseDouble(getRequiredValue(args, i, "ratio-tolerance"),
							"ratio-tolerance");
					i++;
					break;

				case "--snap":
					config.snap = true;
					break;

				case "--shape-tolerance":
					config.shapeTolerance = parseDouble(getRequiredValue(args, i, "shape-tolerance"),
							"shape-tolerance");
					i++;
					break;

				case "--separate-animated":
					config.separateAnimated = true;
					break;

				// Conversion
				case "--convert":
					config.convertFormat = getRequiredValue(args, i, "convert");
					i++;
					break;

				case "--quality":
					config.quality = parseInt(getRequiredValue(args, i, "quality"), "quality");
					i++;
					break;

				case "--process-same":
					config.processSameFormat = true;
					break;

				case "--convert-option":
					String option = getRequiredValue(args, i, "convert-option");
					int eq = option.indexOf('=');
					if (eq <= 0) {
						throw new IllegalArgumentException(
								"Invalid convert option '" + option + "': must be in key=value format");
					}
					config.convertOptions.put(option.substring(0, eq).trim(), option.substring(eq + 1).trim());
					i++;
					break;

				// Deduplication
				case "--dedupe":
					config.dedupe = true;
					break;

				case "--threshold":
					config.threshold = parseInt(getRequiredValue(args, i, "threshold"), "threshold");
					i++;
					break;

				case "--keep":
					config.keepStrategy = getRequiredValue(args, i, "keep");
					i++;
					break;

				case "--action":
					config.dedupeAction = getRequiredValue(args, i, "action");
					i++;
					break;

				case "--move-dir":
					config.moveDirectory = getRequiredValue(args, i, "move-dir");
					i++;
					break;

				case "--strictness":
					config.strictness = getRequiredValue(args, i, "strictness");
					i++;
					break;

				// Rename
				case "--rename":
					config.renamePattern = getRequiredValue(args, i, "rename");
					i++;
					break;

				case "--start":
					config.renameStart = parseInt(getRequiredValue(args, i, "start"), "start");
					i++;
					break;

				case "--step":
					config.renameStep = parseInt(getRequiredValue(args, i, "step"), "step");
					i++;
					break;

				case "--width":
					config.renameWidth = parseInt(getRequiredValue(args, i, "width"), "width");
					i++;
					break;

				case "--overwrite":
					config.overwritePolicy = getRequiredValue(args, i, "overwrite");
					i++;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					// A bare argument is accepted as the input path
					if (config.input == null) {
						config.input = arg;
					}
					else {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					break;
			}
		}

		if (!config.helpRequested) {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: imagesift --input DIR|FILE [OPTIONS]\n");
		help.append("\n");
		help.append("Classify, convert, deduplicate and rename images. Runs as a preview by default;\n");
		help.append("nothing outside the cache directory changes until --commit is given.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -i, --input PATH        Image file or directory to process (required)\n");
		help.append("    -o, --output DIR        Output directory (default: the input directory)\n");
		help.append("    --preview               Simulate the run in the cache directory (default)\n");
		help.append("    --commit                Write results to the output directory\n");
		help.append("    -w, --workers N         Worker threads (default: ")
			.append(defaultProperties.getWorkers())
			.append(")\n");
		help.append("    --no-recursive          Do not descend into sub-directories\n");
		help.append("    --purge-sources         Delete processed sources after a commit\n");
		help.append("    --cache-dir DIR         Shadow workspace location (default: <output>/")
			.append(PipelineConfiguration.DEFAULT_CACHE_NAME)
			.append(")\n");
		help.append("    --event-log FILE        Append per-file events as JSON lines\n");
		help.append("    --report FILE           Write the run summary as JSON\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("\n");
		help.append("CLASSIFY OPTIONS:\n");
		help.append("    --classify              Sort images into folders by aspect ratio\n");
		help.append("    --classify-mode MODE    ratio or shape (default: ratio)\n");
		help.append("    --ratios TEXT           Candidate ratios, e.g. \"16:9,4:3\" (default: ")
			.append(defaultProperties.getRatios())
			.append(")\n");
		help.append("    --ratio-tolerance D     Relative tolerance (default: ")
			.append(defaultProperties.getRatioTolerance())
			.append(")\n");
		help.append("    --snap                  Use the closest ratio instead of 'other'\n");
		help.append("    --shape-tolerance D     Square tolerance in shape mode (default: ")
			.append(defaultProperties.getShapeTolerance())
			.append(")\n");
		help.append("    --separate-animated     Put animated images under animated/\n");
		help.append("\n");
		help.append("CONVERT OPTIONS:\n");
		help.append("    --convert FMT           Convert to FMT (e.g. png, jpg, bmp)\n");
		help.append("    --quality N             Lossy quality 1..100 (default: ")
			.append(defaultProperties.getQuality())
			.append(")\n");
		help.append("    --process-same          Re-encode files already in the target format\n");
		help.append("    --convert-option K=V    Codec option (palette=true, square=true, background=ffffff)\n");
		help.append("\n");
		help.append("DEDUPE OPTIONS:\n");
		help.append("    --dedupe                Detect near-duplicate images\n");
		help.append("    --threshold N           Max combined hash distance, 0 = identical (default: ")
			.append(defaultProperties.getThreshold())
			.append(")\n");
		help.append("    --keep STRATEGY         ").append(KeepStrategy.codes()).append(" (default: ")
			.append(defaultProperties.getKeepStrategy())
			.append(")\n");
		help.append("    --action ACTION         list, delete, move (default: ")
			.append(defaultProperties.getDedupeAction())
			.append(")\n");
		help.append("    --move-dir DIR          Destination for --action move\n");
		help.append("    --strictness MODE       representative, any-member (default: representative)\n");
		help.append("\n");
		help.append("RENAME OPTIONS:\n");
		help.append("    --rename PATTERN        Tokens: {name} {ext} {fmt} {index} {index:N} {ratio}\n");
		help.append("    --start N               First index (default: ")
			.append(defaultProperties.getRenameStart())
			.append(")\n");
		help.append("    --step N                Index increment (default: ")
			.append(defaultProperties.getRenameStep())
			.append(")\n");
		help.append("    --width N               Zero padding of {index} (default: ")
			.append(defaultProperties.getRenameWidth())
			.append(")\n");
		help.append("    --overwrite POLICY      overwrite, skip, rename (default: ")
			.append(defaultProperties.getOverwritePolicy())
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ").append(EnvironmentSupport.WORKERS).append("       Default worker count\n");
		help.append("    ").append(EnvironmentSupport.CACHE_DIR).append("     Default cache directory\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    # Preview a conversion with sequential names\n");
		help.append("    imagesift -i photos --convert png --rename \"{name}_{index:03}.{fmt}\"\n");
		help.append("\n");
		help.append("    # Remove exact duplicates, keeping the biggest file\n");
		help.append("    imagesift -i photos --dedupe --keep largest-file --action delete --commit\n");
		help.append("\n");
		help.append("    # Sort by aspect ratio into another directory\n");
		help.append("    imagesift -i photos -o sorted --classify --ratios \"16:9,4:3\" --snap --commit\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate the environment the run depends on.
	 * @throws IllegalStateException if the input does not exist
	 */
	public void validateEnvironment(ParsedConfiguration config) {
		if (config.input != null && !Files.exists(Path.of(config.input))) {
			throw new IllegalStateException("Input path does not exist: " + config.input);
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parseInt(String value, String optionName) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be an integer");
		}
	}

	private double parseDouble(String value, String optionName) {
		try {
			return Double.parseDouble(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + optionName + " '" + value + "': must be a number");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.input == null || config.input.isBlank()) {
			errors.add("Input path is required (--input)");
		}

		if (config.workers <= 0) {
			errors.add("Worker count must be positive (got: " + config.workers + ")");
		}

		if (config.classify) {
			validateCode(errors, () -> ClassifyMode.fromCode(config.classifyMode));
			if (config.ratioTolerance < 0) {
				errors.add("Ratio tolerance must not be negative (got: " + config.ratioTolerance + ")");
			}
			if (config.shapeTolerance < 0) {
				errors.add("Shape tolerance must not be negative (got: " + config.shapeTolerance + ")");
			}
			if (AspectRatio.parseList(config.ratios).isEmpty()) {
				errors.add("No valid ratio in '" + config.ratios + "'");
			}
		}

		if (config.convertFormat != null) {
			if (config.convertFormat.isBlank()) {
				errors.add("Conversion format must not be blank");
			}
			if (config.quality < 1 || config.quality > 100) {
				errors.add("Quality must be within 1..100 (got: " + config.quality + ")");
			}
		}

		if (config.dedupe) {
			if (config.threshold < 0 || config.threshold > 128) {
				errors.add("Threshold must be within 0..128 (got: " + config.threshold + ")");
			}
			validateCode(errors, () -> KeepStrategy.fromCode(config.keepStrategy));
			validateCode(errors, () -> GroupingStrictness.fromCode(config.strictness));
			try {
				if (DedupeAction.fromCode(config.dedupeAction) == DedupeAction.MOVE && config.moveDirectory == null) {
					errors.add("Action 'move' requires --move-dir");
				}
			}
			catch (IllegalArgumentException e) {
				errors.add(e.getMessage());
			}
		}

		if (config.renamePattern != null) {
			String pattern = config.renamePattern;
			if (pattern.isBlank()) {
				errors.add("Rename pattern must not be blank");
			}
			validateCode(errors, () -> RenamePattern.validate(pattern, config.renameWidth));
			validateCode(errors, () -> OverwritePolicy.fromCode(config.overwritePolicy));
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private static void validateCode(List<String> errors, Runnable decode) {
		try {
			decode.run();
		}
		catch (IllegalArgumentException e) {
			errors.add(e.getMessage());
		}
	}

}
