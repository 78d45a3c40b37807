package org.springaicommunity.github.stalerepos;

/**
 * Account that created a release or opened a pull request.
 *
 * @param login the GitHub login
 */
public record Author(String login) {
}
