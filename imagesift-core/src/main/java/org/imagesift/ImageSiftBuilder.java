package org.imagesift;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for creating the pipeline without Spring.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Defaults: javax.imageio codec, SLF4J event logging
 * PipelineOrchestrator orchestrator = ImageSiftBuilder.create().buildOrchestrator();
 *
 * // For testing with a mock codec
 * ImageCodec codec = mock(ImageCodec.class);
 * PipelineOrchestrator testOrchestrator = ImageSiftBuilder.create()
 *     .codec(codec)
 *     .loggingEvents(false)
 *     .buildOrchestrator();
 *
 * PipelineResult result = orchestrator.run(configuration);
 * }
 * </pre>
 */
public class ImageSiftBuilder {

	private PipelineProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private ImageCodec codec;

	@Nullable
	private FinalizeCommitter committer;

	private boolean loggingEvents = true;

	private final List<PipelineEventListener> listeners = new ArrayList<>();

	private ImageSiftBuilder() {
		this.properties = new PipelineProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ImageSiftBuilder
	 */
	public static ImageSiftBuilder create() {
		return new ImageSiftBuilder();
	}

	/**
	 * Set pipeline properties.
	 * @param properties default values (null to use defaults)
	 * @return this builder
	 */
	public ImageSiftBuilder properties(@Nullable PipelineProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Apply {@code IMAGESIFT_*} environment overrides to the current properties.
	 * @return this builder
	 */
	public ImageSiftBuilder propertiesFromEnv() {
		EnvironmentSupport.applyTo(this.properties);
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ImageSiftBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom ImageCodec implementation. Useful for testing with mocks or for
	 * codecs with more formats than {@code javax.imageio}.
	 * @param codec custom codec (null to use {@link ImageIoCodec})
	 * @return this builder
	 */
	public ImageSiftBuilder codec(@Nullable ImageCodec codec) {
		this.codec = codec;
		return this;
	}

	/**
	 * Set a custom FinalizeCommitter.
	 * @param committer custom committer (null to use default)
	 * @return this builder
	 */
	public ImageSiftBuilder committer(@Nullable FinalizeCommitter committer) {
		this.committer = committer;
		return this;
	}

	/**
	 * Register an additional event listener.
	 * @param listener listener to add
	 * @return this builder
	 */
	public ImageSiftBuilder listener(PipelineEventListener listener) {
		this.listeners.add(listener);
		return this;
	}

	/**
	 * Whether events are also written to the SLF4J log (default true).
	 * @return this builder
	 */
	public ImageSiftBuilder loggingEvents(boolean loggingEvents) {
		this.loggingEvents = loggingEvents;
		return this;
	}

	/**
	 * Build a PipelineOrchestrator.
	 * @return configured orchestrator
	 */
	public PipelineOrchestrator buildOrchestrator() {
		Components components = buildComponents();
		PipelineOrchestrator orchestrator = new PipelineOrchestrator(components.codec(), components.committer(),
				components.objectMapper());
		if (loggingEvents) {
			orchestrator.addListener(new LoggingEventListener());
		}
		listeners.forEach(orchestrator::addListener);
		return orchestrator;
	}

	/**
	 * Build an ArgumentParser using the configured properties.
	 * @return argument parser
	 */
	public ArgumentParser buildArgumentParser() {
		return new ArgumentParser(properties);
	}

	public PipelineProperties getProperties() {
		return properties;
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		ImageCodec imageCodec = this.codec != null ? this.codec : new ImageIoCodec();
		FinalizeCommitter finalizeCommitter = this.committer != null ? this.committer : new FinalizeCommitter();
		return new Components(imageCodec, finalizeCommitter, mapper);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(ImageCodec codec, FinalizeCommitter committer, ObjectMapper objectMapper) {
	}

}
