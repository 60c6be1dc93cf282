package org.imagesift;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes pipeline events to the SLF4J log. Failures are logged at WARN, everything else
 * at INFO; progress updates at DEBUG.
 */
public class LoggingEventListener implements PipelineEventListener {

	private static final Logger logger = LoggerFactory.getLogger(LoggingEventListener.class);

	@Override
	public void onEvent(PipelineEvent event) {
		if (event.failed()) {
			logger.warn("[{}] {} {} -> {}: {}", event.stage(), event.outcome(), event.sourcePath(), event.destPath(),
					event.message());
		}
		else {
			logger.info("[{}] {} {} -> {}: {}", event.stage(), event.outcome(), event.sourcePath(), event.destPath(),
					event.message());
		}
	}

	@Override
	public void onProgress(PipelineStage stage, int done, int total) {
		logger.debug("[{}] {}/{}", stage, done, total);
	}

}
