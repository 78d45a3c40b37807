package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Classifies repositories as stale.
 *
 * <p>
 * For each repository, in iteration order:
 * <ol>
 * <li>archived repositories are skipped without a notice</li>
 * <li>exempt repositories are skipped ({@link ExemptionFilter})</li>
 * <li>repositories without a resolvable activity time are skipped
 * ({@link ActivityResolver})</li>
 * <li>repositories inactive for at most the threshold are skipped</li>
 * <li>the requested supplemental metrics are attached
 * ({@link SupplementalMetricsFetcher})</li>
 * </ol>
 * Results keep the input order; sorting for display is left to the report writers.
 *
 * <p>
 * Work is strictly sequential. A provider failure that is not one of the known soft
 * failures propagates and aborts the whole classification, so a partial result is never
 * returned as if it were complete.
 */
public class Classifier {

	private static final Logger logger = LoggerFactory.getLogger(Classifier.class);

	private final ActivityResolver activityResolver;

	private final SupplementalMetricsFetcher metricsFetcher;

	private final Clock clock;

	public Classifier(Clock clock) {
		this(new ActivityResolver(), new SupplementalMetricsFetcher(clock), clock);
	}

	public Classifier(ActivityResolver activityResolver, SupplementalMetricsFetcher metricsFetcher, Clock clock) {
		this.activityResolver = activityResolver;
		this.metricsFetcher = metricsFetcher;
		this.clock = clock;
	}

	public List<ClassificationResult> classify(Iterable<? extends RepositorySummary> repositories, Policy policy) {
		return classify(repositories, policy, null);
	}

	/**
	 * Classify repositories against a policy.
	 * @param repositories repositories to evaluate, consumed once
	 * @param policy classification policy
	 * @param organization organization name used in the summary notice, or null
	 * @return stale repositories in input order
	 * @throws GitHubHttpClient.GitHubApiException on unrecoverable provider failures
	 */
	public List<ClassificationResult> classify(Iterable<? extends RepositorySummary> repositories, Policy policy,
			@Nullable String organization) {
		ExemptionFilter exemptionFilter = ExemptionFilter.from(policy);
		List<ClassificationResult> staleRepos = new ArrayList<>();

		for (RepositorySummary repo : repositories) {
			if (repo.archived()) {
				logger.debug("Skipping archived repository {}", repo.url());
				continue;
			}
			if (exemptionFilter.isExempt(repo)) {
				continue;
			}

			SignalLookup<Instant> activity = activityResolver.resolve(repo, policy.activityMethod());
			if (!activity.isFound()) {
				logger.debug("Skipping {}: no last activity ({})", repo.url(), activity.status());
				continue;
			}
			Instant lastActive = activity.asOptional().orElseThrow();

			int daysInactive = SupplementalMetricsFetcher.daysBetween(lastActive, clock.instant());
			if (daysInactive <= policy.inactiveDays()) {
				continue;
			}

			ClassificationResult result = new ClassificationResult(repo.url(), daysInactive,
					LocalDate.ofInstant(lastActive, ZoneOffset.UTC), repo.visibility(),
					fetchMetric(repo, policy, SupplementalMetric.RELEASE, metricsFetcher::daysSinceLastRelease),
					fetchMetric(repo, policy, SupplementalMetric.PR, metricsFetcher::daysSinceLastPullRequest));
			staleRepos.add(result);
			logger.info("{}: {} days inactive", repo.url(), daysInactive);
		}

		if (organization != null && !organization.isBlank()) {
			logger.info("Found {} stale repos in {}", staleRepos.size(), organization);
		}
		else {
			logger.info("Found {} stale repos", staleRepos.size());
		}
		return staleRepos;
	}

	/**
	 * Resolve one supplemental metric. Provider errors become FAILED so a metric never
	 * decides whether the repository is reported; bad credentials still abort the run.
	 */
	private SignalLookup<Integer> fetchMetric(RepositorySummary repo, Policy policy, SupplementalMetric metric,
			Function<RepositorySummary, SignalLookup<Integer>> lookup) {
		if (!policy.requests(metric)) {
			return SignalLookup.notRequested();
		}
		try {
			return lookup.apply(repo);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isAuthenticationFailure()) {
				throw e;
			}
			logger.warn("Failed to fetch {} metric for {}: {}", metric.value(), repo.url(), e.getMessage());
			return SignalLookup.failed(e.getMessage());
		}
	}

}
