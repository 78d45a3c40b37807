package org.springaicommunity.github.stalerepos;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a scan.
 *
 * @param staleRepositories stale repositories, most inactive first
 * @param reportFiles reports written, empty when skipped
 */
public record ScanResult(List<ClassificationResult> staleRepositories, List<Path> reportFiles) {

	public ScanResult {
		staleRepositories = List.copyOf(staleRepositories);
		reportFiles = List.copyOf(reportFiles);
	}

	public boolean reportsWritten() {
		return !reportFiles.isEmpty();
	}

}
