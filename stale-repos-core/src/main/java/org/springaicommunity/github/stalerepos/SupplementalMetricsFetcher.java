package org.springaicommunity.github.stalerepos;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Computes the optional release and pull request recency metrics.
 *
 * <p>
 * A missing release or pull request is {@link SignalLookup.Status#ABSENT}. An author that
 * no longer resolves (ghost account) is {@link SignalLookup.Status#FAILED}. Any other
 * provider exception propagates so the caller decides whether it is fatal.
 */
public class SupplementalMetricsFetcher {

	private static final Logger logger = LoggerFactory.getLogger(SupplementalMetricsFetcher.class);

	private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

	private final Clock clock;

	public SupplementalMetricsFetcher(Clock clock) {
		this.clock = clock;
	}

	/**
	 * Days since the most recent release was published (created, for drafts).
	 * @param repo repository
	 * @return FOUND with the day count, ABSENT without releases, FAILED for an
	 * unresolvable release author
	 */
	public SignalLookup<Integer> daysSinceLastRelease(RepositorySummary repo) {
		Optional<Release> release;
		try {
			release = repo.latestRelease();
		}
		catch (UnexpectedPayloadException e) {
			logger.warn("Ignoring latest release of {}: {}", repo.url(), e.getMessage());
			return SignalLookup.failed(e.getMessage());
		}
		return release.map(r -> SignalLookup.found(daysSince(r.effectiveDate())))
			.orElseGet(SignalLookup::absent);
	}

	/**
	 * Days since the most recently created pull request, open, closed or merged.
	 * @param repo repository
	 * @return FOUND with the day count, ABSENT without pull requests, FAILED for an
	 * unresolvable author
	 */
	public SignalLookup<Integer> daysSinceLastPullRequest(RepositorySummary repo) {
		Optional<PullRequest> pullRequest;
		try {
			pullRequest = repo.latestPullRequest();
		}
		catch (UnexpectedPayloadException e) {
			logger.warn("Ignoring latest pull request of {}: {}", repo.url(), e.getMessage());
			return SignalLookup.failed(e.getMessage());
		}
		return pullRequest.map(pr -> SignalLookup.found(daysSince(pr.createdAt())))
			.orElseGet(SignalLookup::absent);
	}

	int daysSince(Instant instant) {
		return daysBetween(instant, clock.instant());
	}

	/**
	 * Whole days from {@code from} to {@code to}, rounded down (floor, also for negative
	 * spans).
	 */
	static int daysBetween(Instant from, Instant to) {
		long seconds = Duration.between(from, to).getSeconds();
		return Math.toIntExact(Math.floorDiv(seconds, SECONDS_PER_DAY));
	}

}
