package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Pull request summary as returned by the pull request listing endpoint.
 *
 * @param number the pull request number
 * @param state "open" or "closed"
 * @param createdAt when the pull request was opened
 * @param mergedAt when it was merged, null otherwise
 * @param author the account that opened it
 */
public record PullRequest(int number, String state, Instant createdAt, @Nullable Instant mergedAt, Author author) {
}
