package org.imagesift.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.imagesift.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

import java.nio.file.Path;

/**
 * ImageSift CLI Application
 *
 * Spring Boot command-line application running the same pipeline as
 * {@link ImageSiftCli}, with services taken from {@link ImageSiftConfig}.
 *
 * Usage: java -cp imagesift-cli.jar org.imagesift.cli.ImageSiftApp --input DIR [OPTIONS]
 */
@SpringBootApplication
@ComponentScan(basePackages = { "org.imagesift", "org.imagesift.cli" })
public class ImageSiftApp implements CommandLineRunner, ExitCodeGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ImageSiftApp.class);

	private final PipelineOrchestrator orchestrator;

	private final ArgumentParser argumentParser;

	private final RunReportWriter runReportWriter;

	private final ObjectMapper objectMapper;

	private int exitCode = ImageSiftCli.EXIT_OK;

	public ImageSiftApp(PipelineOrchestrator orchestrator, ArgumentParser argumentParser,
			RunReportWriter runReportWriter, ObjectMapper objectMapper) {
		this.orchestrator = orchestrator;
		this.argumentParser = argumentParser;
		this.runReportWriter = runReportWriter;
		this.objectMapper = objectMapper;
	}

	public static void main(String[] args) {
		// Configure Spring Boot to run as console application
		SpringApplication app = new SpringApplication(ImageSiftApp.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		System.exit(SpringApplication.exit(app.run(args)));
	}

	@Override
	public void run(String... args) throws Exception {
		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return;
		}

		ParsedConfiguration config = argumentParser.parseAndValidate(args);
		argumentParser.validateEnvironment(config);
		ImageSiftCli.logConfiguration(config);

		EventLogFileWriter eventLog = null;
		try {
			if (config.eventLog != null) {
				eventLog = new EventLogFileWriter(Path.of(config.eventLog), objectMapper);
				orchestrator.addListener(eventLog);
			}
			PipelineResult result = orchestrator.run(config.toPipelineConfiguration());
			if (config.report != null) {
				runReportWriter.write(result, Path.of(config.report));
			}
			ImageSiftCli.logResults(result, config.verbose);
			exitCode = ImageSiftCli.exitCode(result);
		}
		catch (Exception e) {
			logger.error("Pipeline failed: {}", e.getMessage());
			if (config.verbose) {
				logger.error("Stack trace:", e);
			}
			exitCode = ImageSiftCli.EXIT_ERROR;
		}
		finally {
			if (eventLog != null) {
				orchestrator.removeListener(eventLog);
				eventLog.close();
			}
		}
	}

	@Override
	public int getExitCode() {
		return exitCode;
	}

}
