package org.springaicommunity.github.stalerepos;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Resolves the timestamp that counts as a repository's last activity.
 */
public class ActivityResolver {

	private static final Logger logger = LoggerFactory.getLogger(ActivityResolver.class);

	/**
	 * Resolve last activity according to the configured method.
	 *
	 * <p>
	 * Recoverable lookup failures come back as {@link SignalLookup.Status#FAILED}; an
	 * authentication failure is not recoverable and is rethrown.
	 * @param repo repository
	 * @param method activity method
	 * @return FOUND with the activity time, ABSENT when the repository has none, FAILED
	 * when the default branch could not be resolved
	 */
	public SignalLookup<Instant> resolve(RepositorySummary repo, ActivityMethod method) {
		switch (method) {
			case PUSHED:
				Instant pushedAt = repo.pushedAt();
				return pushedAt != null ? SignalLookup.found(pushedAt) : SignalLookup.absent();
			case DEFAULT_BRANCH_UPDATED:
				return resolveDefaultBranchCommit(repo);
			default:
				throw new IllegalArgumentException("Unsupported activity method: " + method);
		}
	}

	private SignalLookup<Instant> resolveDefaultBranchCommit(RepositorySummary repo) {
		try {
			return SignalLookup.found(repo.defaultBranchCommitDate());
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isAuthenticationFailure()) {
				throw e;
			}
			logger.warn("Could not resolve default branch '{}' of {}: {}", repo.defaultBranch(), repo.url(),
					e.getMessage());
			return SignalLookup.failed(e.getMessage());
		}
		catch (UnexpectedPayloadException e) {
			logger.warn("Could not resolve default branch '{}' of {}: {}", repo.defaultBranch(), repo.url(),
					e.getMessage());
			return SignalLookup.failed(e.getMessage());
		}
	}

}
