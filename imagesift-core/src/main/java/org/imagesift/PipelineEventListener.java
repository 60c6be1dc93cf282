package org.imagesift;

/**
 * Receives pipeline events and progress updates.
 *
 * <p>
 * Listeners are invoked from a single dispatcher thread owned by {@link EventChannel}, so
 * implementations observe a total order and need no synchronization of their own.
 */
public interface PipelineEventListener {

	/**
	 * Called once per published event.
	 * @param event the event
	 */
	void onEvent(PipelineEvent event);

	/**
	 * Called when a stage finishes a unit of work.
	 * @param stage the reporting stage
	 * @param done units completed so far
	 * @param total units in the stage
	 */
	default void onProgress(PipelineStage stage, int done, int total) {
		// Default implementation ignores progress
	}

}
