package org.springaicommunity.github.stalerepos;

import java.nio.file.Path;
import java.util.Set;

/**
 * What a report writer needs besides the results.
 *
 * @param inactiveDays threshold the results were classified with
 * @param activityMethod which activity the threshold applied to
 * @param additionalMetrics metrics that get their own report columns
 * @param outputDirectory directory the report files are written to
 */
public record ReportContext(int inactiveDays, ActivityMethod activityMethod, Set<SupplementalMetric> additionalMetrics,
		Path outputDirectory) {

	public ReportContext {
		additionalMetrics = Set.copyOf(additionalMetrics);
	}

	public static ReportContext of(Policy policy, Path outputDirectory) {
		return new ReportContext(policy.inactiveDays(), policy.activityMethod(), policy.additionalMetrics(),
				outputDirectory);
	}

}
