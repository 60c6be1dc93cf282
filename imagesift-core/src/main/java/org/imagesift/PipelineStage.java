package org.imagesift;

/**
 * Origin of a {@link PipelineEvent}. The four processing stages run in declaration
 * order; the others are bookkeeping steps around them.
 */
public enum PipelineStage {

	STAGE_INPUT,

	CLASSIFY,

	CONVERT,

	DEDUPE,

	RENAME,

	FINALIZE,

	PURGE

}
