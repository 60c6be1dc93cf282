package org.imagesift;

/**
 * Result of one unit of work reported in a {@link PipelineEvent}.
 */
public enum EventOutcome {

	OK,

	SKIPPED,

	FAILED,

	KEPT,

	REMOVED,

	MOVED,

	LISTED,

	QUARANTINED

}
