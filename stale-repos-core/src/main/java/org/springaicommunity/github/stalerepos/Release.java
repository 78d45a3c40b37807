package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Represents a GitHub release.
 *
 * @param id the unique GitHub release ID
 * @param tagName the Git tag name (e.g., "v1.0.0")
 * @param draft whether this is a draft release
 * @param createdAt when the release was created
 * @param publishedAt when the release was published (null for drafts)
 * @param author the account that created the release
 */
public record Release(long id, String tagName, boolean draft, Instant createdAt, @Nullable Instant publishedAt,
		Author author) {

	/**
	 * Publication time, falling back to creation time for drafts.
	 */
	public Instant effectiveDate() {
		return publishedAt != null ? publishedAt : createdAt;
	}

}
