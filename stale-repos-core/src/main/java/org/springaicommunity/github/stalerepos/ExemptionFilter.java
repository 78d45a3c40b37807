package org.springaicommunity.github.stalerepos;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a repository is exempt from the staleness check.
 *
 * <p>
 * Rules run in a fixed order and the first one that matches wins:
 * <ol>
 * <li>name matches one of the exempt name patterns</li>
 * <li>one of the repository's topics is an exempt topic</li>
 * </ol>
 * A rule with nothing configured never matches and performs no lookup, so a name match
 * means topics are never fetched.
 */
public class ExemptionFilter {

	private static final Logger logger = LoggerFactory.getLogger(ExemptionFilter.class);

	private final List<GlobPattern> namePatterns;

	private final Set<String> exemptTopics;

	private final List<ExemptionRule> rules;

	public ExemptionFilter(Collection<String> exemptRepoPatterns, Collection<String> exemptTopics) {
		this.namePatterns = exemptRepoPatterns.stream().map(GlobPattern::compile).toList();
		this.exemptTopics = Set.copyOf(exemptTopics);
		this.rules = List.of(this::matchName, this::matchTopic);
	}

	public static ExemptionFilter from(Policy policy) {
		return new ExemptionFilter(policy.exemptRepoPatterns(), policy.exemptTopics());
	}

	/**
	 * Evaluate the rules for a repository, logging a notice when it is exempt.
	 * @param repo repository to check
	 * @return true if the repository must be skipped
	 * @throws GitHubHttpClient.GitHubApiException if the topic lookup fails with anything
	 * other than 404
	 */
	public boolean isExempt(RepositorySummary repo) {
		for (ExemptionRule rule : rules) {
			Optional<String> reason = rule.evaluate(repo);
			if (reason.isPresent()) {
				logger.info("{} is exempt from stale repo check ({})", repo.url(), reason.get());
				return true;
			}
		}
		return false;
	}

	private Optional<String> matchName(RepositorySummary repo) {
		for (GlobPattern pattern : namePatterns) {
			if (pattern.matches(repo.name())) {
				return Optional.of("name matches '" + pattern.glob() + "'");
			}
		}
		return Optional.empty();
	}

	private Optional<String> matchTopic(RepositorySummary repo) {
		if (exemptTopics.isEmpty()) {
			return Optional.empty();
		}
		List<String> topics;
		try {
			topics = repo.topics();
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (!e.isNotFound()) {
				throw e;
			}
			// Seen on restricted and temporary private forks
			logger.warn("Topics not available for {}, treating it as not exempt: {}", repo.url(), e.getMessage());
			return Optional.empty();
		}
		return topics.stream().filter(exemptTopics::contains).findFirst().map(topic -> "topic '" + topic + "'");
	}

	/**
	 * One exemption check. Returns a short description of the match, or empty when the
	 * rule does not apply.
	 */
	@FunctionalInterface
	interface ExemptionRule {

		Optional<String> evaluate(RepositorySummary repo);

	}

}
