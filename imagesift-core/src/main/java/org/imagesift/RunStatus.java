package org.imagesift;

/**
 * Terminal state of a pipeline run.
 */
public enum RunStatus {

	COMPLETED,

	CANCELLED

}
