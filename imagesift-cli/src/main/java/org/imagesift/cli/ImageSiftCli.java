package org.imagesift.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.imagesift.*;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

/**
 * ImageSift CLI Application
 *
 * Plain Java command-line application that classifies, converts, deduplicates and
 * renames images. No Spring dependencies - uses ImageSiftBuilder for service wiring.
 *
 * Usage: java -jar imagesift-cli.jar --input DIR [OPTIONS]
 *
 * Environment Variables: IMAGESIFT_WORKERS - worker pool size, IMAGESIFT_CACHE_DIR -
 * shadow workspace location
 *
 * Examples: java -jar imagesift-cli.jar -i photos --classify --dedupe java -jar
 * imagesift-cli.jar -i photos -o sorted --convert png --rename "{name}_{index:03}.{fmt}"
 * --commit
 */
public class ImageSiftCli {

	private static final Logger logger = LoggerFactory.getLogger(ImageSiftCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_ERROR = 1;

	static final int EXIT_FILE_FAILURES = 2;

	static final int EXIT_CANCELLED = 3;

	/** How long a shutdown waits for the cancelled run to report. */
	static final long SHUTDOWN_GRACE_MILLIS = 60_000;

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != EXIT_OK) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Pipeline failed: {}", e.getMessage());
			System.exit(EXIT_ERROR);
		}
	}

	public static int run(String[] args) throws Exception {
		// Defaults with IMAGESIFT_* overrides applied
		ImageSiftBuilder builder = ImageSiftBuilder.create().propertiesFromEnv();
		ArgumentParser argumentParser = builder.buildArgumentParser();

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		argumentParser.validateEnvironment(config);
		logConfiguration(config);

		PipelineConfiguration configuration = config.toPipelineConfiguration();
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		builder.objectMapper(objectMapper);

		EventLogFileWriter eventLog = config.eventLog != null
				? new EventLogFileWriter(Path.of(config.eventLog), objectMapper) : null;
		ShutdownCanceller canceller = null;
		int exitCode = EXIT_ERROR;
		try {
			if (eventLog != null) {
				builder.listener(eventLog);
			}
			PipelineOrchestrator orchestrator = builder.buildOrchestrator();
			canceller = new ShutdownCanceller(orchestrator, SHUTDOWN_GRACE_MILLIS, Runtime.getRuntime()::halt);
			Runtime.getRuntime().addShutdownHook(canceller);

			PipelineResult result = orchestrator.run(configuration);
			if (config.report != null) {
				new RunReportWriter(objectMapper).write(result, Path.of(config.report));
			}
			logResults(result, config.verbose);
			exitCode = exitCode(result);
			return exitCode;
		}
		finally {
			try {
				if (eventLog != null) {
					eventLog.close();
				}
			}
			finally {
				if (canceller != null) {
					canceller.finished(exitCode);
					removeShutdownHook(canceller);
				}
			}
		}
	}

	/**
	 * Map a finished run onto the process exit code.
	 */
	static int exitCode(PipelineResult result) {
		if (result.status() == RunStatus.CANCELLED) {
			return EXIT_CANCELLED;
		}
		return result.hasFailures() ? EXIT_FILE_FAILURES : EXIT_OK;
	}

	static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Input: {}", config.input);
		logger.info("  Output: {}", config.outputPath());
		logger.info("  Mode: {}", config.mode);
		logger.info("  Workers: {}", config.workers);
		logger.info("  Recursive: {}", config.recursive);
		logger.info("  Purge sources: {}", config.purgeSources);
		logger.info("  Cache directory: {}", valueOrDefault(config.cacheDirectory));
		logger.info("  Classify: {}", config.classify ? config.classifyMode + " " + config.ratios : "off");
		logger.info("  Convert: {}", config.convertFormat != null ? config.convertFormat : "off");
		logger.info("  Dedupe: {}", config.dedupe ? "threshold=" + config.threshold + ", keep=" + config.keepStrategy
				+ ", action=" + config.dedupeAction : "off");
		logger.info("  Rename: {}", config.renamePattern != null ? config.renamePattern : "off");
		logger.info("  Event log: {}", valueOrDefault(config.eventLog));
		logger.info("  Report: {}", valueOrDefault(config.report));
	}

	static void logResults(PipelineResult result, boolean verbose) {
		if (result.status() == RunStatus.CANCELLED) {
			logger.warn("Run cancelled before completion; no output was written");
			return;
		}
		logger.info("{} completed{}", result.mode(), result.reusedPreview() ? " (reused previous preview)" : "");
		logger.info("Converted: {}", result.converted());
		logger.info("Skipped: {}", result.skipped());
		logger.info("Failed: {}", result.failed());
		logger.info("Duplicate groups: {} ({} redundant files)", result.duplicateGroups(), result.redundantFiles());
		logger.info("Result files: {}", result.finalFiles().size());

		FinalizeSummary summary = result.finalizeSummary();
		if (summary != null) {
			logger.info("Copied to output: {} ({} failed)", summary.copied(), summary.failed());
			if (summary.purged() + summary.purgeFailed() + summary.purgeSkipped() > 0) {
				logger.info("Purged sources: {} ({} failed, {} skipped)", summary.purged(), summary.purgeFailed(),
						summary.purgeSkipped());
			}
		}
		else {
			logger.info("Preview available in: {}", result.resultRoot());
		}

		if (verbose && !result.finalFiles().isEmpty()) {
			logger.info("Result files:");
			for (Path file : result.finalFiles()) {
				logger.info("  - {}", file);
			}
		}
	}

	private static void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		}
		catch (IllegalStateException e) {
			// JVM already shutting down, the hook ends the process with this run's exit code
			logger.debug("Shutdown in progress: {}", e.getMessage());
		}
	}

	private static String valueOrDefault(@Nullable String value) {
		return value != null ? value : "(default)";
	}

	/**
	 * Shutdown hook that cancels the running pipeline and waits for it to finish.
	 *
	 * <p>
	 * {@code System.exit} blocks while shutdown hooks run, so once the run has reported,
	 * the hook ends the process itself with the run's exit code. If the run does not
	 * finish within the grace period the JVM exits with the signal's status.
	 */
	static final class ShutdownCanceller extends Thread {

		private final PipelineOrchestrator orchestrator;

		private final long graceMillis;

		private final IntConsumer halt;

		private final CountDownLatch finished = new CountDownLatch(1);

		private volatile int exitCode = EXIT_CANCELLED;

		ShutdownCanceller(PipelineOrchestrator orchestrator, long graceMillis, IntConsumer halt) {
			super("imagesift-shutdown");
			this.orchestrator = orchestrator;
			this.graceMillis = graceMillis;
			this.halt = halt;
		}

		@Override
		public void run() {
			logger.warn("Shutdown requested, cancelling the running pipeline");
			orchestrator.cancel();
			try {
				if (finished.await(graceMillis, TimeUnit.MILLISECONDS)) {
					halt.accept(exitCode);
				}
				else {
					logger.error("Pipeline did not stop within {} ms, output may be incomplete", graceMillis);
				}
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Interrupted while waiting for the pipeline to stop");
			}
		}

		/**
		 * Called by the thread running the pipeline once the result has been reported.
		 */
		void finished(int code) {
			this.exitCode = code;
			finished.countDown();
		}

	}

}
