package org.imagesift;

/**
 * Counters reported by {@link FinalizeCommitter}.
 *
 * @param copied files materialised into the output directory
 * @param failed files that could not be copied
 * @param purged source files deleted after a successful commit
 * @param purgeFailed source files whose deletion failed
 * @param purgeSkipped source files left alone (outside the source root, or identical to
 * a written output)
 */
public record FinalizeSummary(int copied, int failed, int purged, int purgeFailed, int purgeSkipped) {

	public static FinalizeSummary empty() {
		return new FinalizeSummary(0, 0, 0, 0, 0);
	}

}
