package org.imagesift;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Terminal summary of a pipeline run.
 *
 * @param status completed or cancelled
 * @param mode preview or commit
 * @param converted files successfully converted
 * @param skipped files passed through or left alone (same format, undecodable, rename
 * conflict under skip)
 * @param failed per-file failures, including commit copy failures
 * @param duplicateGroups duplicate groups found
 * @param redundantFiles redundant copies across all groups
 * @param finalFiles result files relative to the result root, in path order
 * @param resultRoot the shadow result root the files were read from
 * @param finalizeSummary commit counters, null for previews and cancelled runs
 * @param signature input fingerprint
 * @param reusedPreview true when an unchanged preview was returned from cache
 */
public record PipelineResult(RunStatus status, ExecutionMode mode, int converted, int skipped, int failed,
		int duplicateGroups, int redundantFiles, List<Path> finalFiles, Path resultRoot,
		@Nullable FinalizeSummary finalizeSummary, String signature, boolean reusedPreview) {

	public PipelineResult {
		finalFiles = List.copyOf(finalFiles);
	}

	public boolean hasFailures() {
		return failed > 0;
	}

	PipelineResult reused() {
		return new PipelineResult(status, mode, converted, skipped, failed, duplicateGroups, redundantFiles,
				finalFiles, resultRoot, finalizeSummary, signature, true);
	}

}
