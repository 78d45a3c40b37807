package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * {@link RepositorySummary} backed by a listing entry and a {@link RestService} for the
 * lazily fetched parts.
 */
public class GitHubRepositorySummary implements RepositorySummary {

	private final RepositoryInfo info;

	private final RestService restService;

	public GitHubRepositorySummary(RepositoryInfo info, RestService restService) {
		this.info = info;
		this.restService = restService;
	}

	@Override
	public String url() {
		return info.htmlUrl();
	}

	@Override
	public String name() {
		return info.name();
	}

	@Override
	public String fullName() {
		return info.fullName();
	}

	@Override
	public boolean archived() {
		return info.archived();
	}

	@Override
	public Visibility visibility() {
		return Visibility.fromPrivateFlag(info.isPrivate());
	}

	@Override
	@Nullable
	public Instant pushedAt() {
		return info.pushedAt();
	}

	@Override
	public String defaultBranch() {
		return info.defaultBranch();
	}

	@Override
	public List<String> topics() {
		return restService.getTopics(info.fullName());
	}

	@Override
	public Instant defaultBranchCommitDate() {
		return restService.getBranchHeadCommitDate(info.fullName(), info.defaultBranch());
	}

	@Override
	public Optional<Release> latestRelease() {
		return restService.getLatestRelease(info.fullName());
	}

	@Override
	public Optional<PullRequest> latestPullRequest() {
		return restService.getLatestPullRequest(info.fullName());
	}

	/**
	 * Adapt a lazy listing into summaries without materializing it.
	 * @param repositories listing, typically from {@link RestService#listRepositories}
	 * @param restService service used for per-repository lookups
	 * @return lazily adapted repositories
	 */
	public static Iterable<RepositorySummary> adapt(Iterable<RepositoryInfo> repositories, RestService restService) {
		return () -> new Iterator<>() {

			private final Iterator<RepositoryInfo> delegate = repositories.iterator();

			@Override
			public boolean hasNext() {
				return delegate.hasNext();
			}

			@Override
			public RepositorySummary next() {
				return new GitHubRepositorySummary(delegate.next(), restService);
			}
		};
	}

	@Override
	public String toString() {
		return "GitHubRepositorySummary{" + info.fullName() + "}";
	}

}
