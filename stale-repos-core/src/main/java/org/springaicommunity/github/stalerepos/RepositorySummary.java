package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one repository as seen by the classification engine.
 *
 * <p>
 * Plain attributes come from the repository listing. The remaining accessors perform a
 * provider lookup each time they are called and may fail with
 * {@link GitHubHttpClient.GitHubApiException} (for example a 404 on a restricted fork) or
 * {@link UnexpectedPayloadException}.
 */
public interface RepositorySummary {

	String url();

	String name();

	/**
	 * Repository in "owner/repo" format.
	 */
	String fullName();

	boolean archived();

	Visibility visibility();

	/**
	 * Time of the last push, null when the provider has none.
	 */
	@Nullable
	Instant pushedAt();

	String defaultBranch();

	List<String> topics();

	Instant defaultBranchCommitDate();

	Optional<Release> latestRelease();

	Optional<PullRequest> latestPullRequest();

}
