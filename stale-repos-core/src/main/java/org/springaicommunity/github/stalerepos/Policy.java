package org.springaicommunity.github.stalerepos;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable classification policy, assembled once from configuration and passed into the
 * {@link Classifier}.
 *
 * @param inactiveDays repositories inactive for strictly more days than this are stale
 * @param exemptRepoPatterns repository name patterns ({@code *}, {@code ?}, {@code [..]}),
 * case-sensitive, evaluated in order
 * @param exemptTopics topics that exempt a repository
 * @param activityMethod which timestamp counts as last activity
 * @param additionalMetrics supplemental metrics to attach to each stale repository
 */
public record Policy(int inactiveDays, List<String> exemptRepoPatterns, Set<String> exemptTopics,
		ActivityMethod activityMethod, Set<SupplementalMetric> additionalMetrics) {

	public Policy {
		if (inactiveDays < 0) {
			throw new IllegalArgumentException("Inactive days must not be negative (got: " + inactiveDays + ")");
		}
		exemptRepoPatterns = List.copyOf(new LinkedHashSet<>(exemptRepoPatterns));
		exemptTopics = Set.copyOf(exemptTopics);
		additionalMetrics = Set.copyOf(additionalMetrics);
	}

	/**
	 * Policy with no exemptions, push-based activity and no supplemental metrics.
	 */
	public static Policy of(int inactiveDays) {
		return new Policy(inactiveDays, List.of(), Set.of(), ActivityMethod.PUSHED, Set.of());
	}

	public boolean requests(SupplementalMetric metric) {
		return additionalMetrics.contains(metric);
	}

}
