package org.imagesift;

/**
 * Whether a run only stages its results or also materializes them.
 */
public enum ExecutionMode {

	/** All work happens in the shadow workspace; user paths are never touched. */
	PREVIEW,

	/** Stage in the shadow workspace, then copy the result to the output location. */
	COMMIT

}
