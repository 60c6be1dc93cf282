package org.imagesift;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the pipeline services.
 */
@Configuration
public class ImageSiftConfig {

	@Bean
	public PipelineProperties pipelineProperties() {
		return EnvironmentSupport.applyTo(new PipelineProperties());
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public ImageCodec imageCodec() {
		return new ImageIoCodec();
	}

	@Bean
	public FinalizeCommitter finalizeCommitter() {
		return new FinalizeCommitter();
	}

	@Bean
	public LoggingEventListener loggingEventListener() {
		return new LoggingEventListener();
	}

	@Bean
	public PipelineOrchestrator pipelineOrchestrator(ImageCodec imageCodec, FinalizeCommitter finalizeCommitter,
			ObjectMapper objectMapper, List<PipelineEventListener> listeners) {
		PipelineOrchestrator orchestrator = new PipelineOrchestrator(imageCodec, finalizeCommitter, objectMapper);
		listeners.forEach(orchestrator::addListener);
		return orchestrator;
	}

	@Bean
	public ArgumentParser argumentParser(PipelineProperties pipelineProperties) {
		return new ArgumentParser(pipelineProperties);
	}

	@Bean
	public RunReportWriter runReportWriter(ObjectMapper objectMapper) {
		return new RunReportWriter(objectMapper);
	}

}
