package org.springaicommunity.github.stalerepos;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * Keeps {@link GitHubRestService} independent of the transport so tests can substitute a
 * mock returning canned JSON payloads.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String getWithQuery(String path, String queryString);

}
