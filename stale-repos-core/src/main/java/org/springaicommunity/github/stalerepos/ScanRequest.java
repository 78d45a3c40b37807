package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Parameters of a single stale repository scan.
 *
 * @param organization organization to scan, or {@code null} for the repositories owned by
 * the token owner
 * @param policy classification policy
 * @param outputDirectory directory the reports are written to
 * @param skipEmptyReports do not write reports when nothing is stale
 */
public record ScanRequest(@Nullable String organization, Policy policy, Path outputDirectory,
		boolean skipEmptyReports) {

	public ScanRequest {
		Objects.requireNonNull(policy, "policy");
		Objects.requireNonNull(outputDirectory, "outputDirectory");
	}

	public static ScanRequest from(ParsedConfiguration config) {
		return new ScanRequest(config.organization, config.toPolicy(), config.outputPath(), config.skipEmptyReports);
	}

}
