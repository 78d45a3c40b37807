package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Interface for the GitHub REST API operations a stale repository scan needs.
 *
 * <p>
 * Returns strongly-typed records instead of raw JSON. Failures surface as
 * {@link GitHubHttpClient.GitHubApiException} (transport or HTTP status) or
 * {@link UnexpectedPayloadException} (response shape).
 */
public interface RestService {

	/**
	 * List repositories of an organization, or those owned by the authenticated user.
	 *
	 * <p>
	 * The returned iterable is lazy: pages are requested as iteration advances, and every
	 * new iteration starts again from the first page.
	 * @param organization organization login, or null for the token owner's repositories
	 * @return repositories in provider order
	 */
	Iterable<RepositoryInfo> listRepositories(@Nullable String organization);

	/**
	 * Get the topics attached to a repository.
	 * @param fullName repository in "owner/repo" format
	 * @return topic names, possibly empty
	 */
	List<String> getTopics(String fullName);

	/**
	 * Get the committer date of the commit at the tip of a branch.
	 * @param fullName repository in "owner/repo" format
	 * @param branch branch name
	 * @return committer timestamp
	 * @throws UnexpectedPayloadException if the commit carries no committer date
	 */
	Instant getBranchHeadCommitDate(String fullName, String branch);

	/**
	 * Get the most recent release, newest first as ordered by GitHub.
	 * @param fullName repository in "owner/repo" format
	 * @return latest release, or empty when the repository has none
	 * @throws UnexpectedPayloadException if the release author cannot be resolved
	 */
	Optional<Release> getLatestRelease(String fullName);

	/**
	 * Get the most recently created pull request in any state.
	 * @param fullName repository in "owner/repo" format
	 * @return latest pull request, or empty when the repository has none
	 * @throws UnexpectedPayloadException if the pull request author cannot be resolved
	 */
	Optional<PullRequest> getLatestPullRequest(String fullName);

}
