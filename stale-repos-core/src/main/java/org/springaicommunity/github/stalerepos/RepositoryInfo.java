package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Repository metadata as returned by the GitHub repository listing endpoints.
 *
 * @param id the unique repository ID
 * @param name the repository name (without owner)
 * @param fullName the full repository name in "owner/repo" format
 * @param htmlUrl the web URL for the repository
 * @param isPrivate whether the repository is private, null when the payload omits it
 * @param archived whether the repository is archived
 * @param pushedAt time of the last push, null for repositories never pushed to
 * @param defaultBranch the default branch name
 */
public record RepositoryInfo(long id, String name, String fullName, String htmlUrl, @Nullable Boolean isPrivate,
		boolean archived, @Nullable Instant pushedAt, String defaultBranch) {

}
