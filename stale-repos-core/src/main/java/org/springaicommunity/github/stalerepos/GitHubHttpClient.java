package org.springaicommunity.github.stalerepos;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link GitHubClient} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Talks to github.com by default, or to a GitHub Enterprise Server instance when an
 * enterprise URL is supplied (requests then go to {@code <url>/api/v3}). The credential is
 * sent as a {@code Bearer} token: a personal access token, a GitHub App installation token
 * or, for the installation token exchange itself, the app JWT.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	static final String GITHUB_API_BASE = "https://api.github.com";

	private static final int LOW_RATE_LIMIT_WARNING = 100;

	private final HttpClient httpClient;

	private final String token;

	private final String apiBase;

	public GitHubHttpClient(String token) {
		this(token, null);
	}

	public GitHubHttpClient(String token, @Nullable String enterpriseUrl) {
		this(token, enterpriseUrl,
				HttpClient.newBuilder()
					.connectTimeout(Duration.ofSeconds(30))
					.followRedirects(HttpClient.Redirect.NORMAL)
					.build());
	}

	GitHubHttpClient(String token, @Nullable String enterpriseUrl, HttpClient httpClient) {
		this.token = token;
		this.apiBase = resolveApiBase(enterpriseUrl);
		this.httpClient = httpClient;
	}

	/**
	 * Resolve the REST API base URL for github.com or a GitHub Enterprise Server host.
	 * @param enterpriseUrl enterprise host URL, blank or null for github.com
	 * @return API base URL without a trailing slash
	 */
	static String resolveApiBase(@Nullable String enterpriseUrl) {
		if (enterpriseUrl == null || enterpriseUrl.isBlank()) {
			return GITHUB_API_BASE;
		}
		String base = enterpriseUrl.trim();
		while (base.endsWith("/")) {
			base = base.substring(0, base.length() - 1);
		}
		return base.endsWith("/api/v3") ? base : base + "/api/v3";
	}

	public String getApiBase() {
		return apiBase;
	}

	@Override
	public String get(String path) {
		return send("GET", path, null);
	}

	/**
	 * POST a JSON body. Used for the GitHub App installation token exchange.
	 * @param path API path or absolute URL
	 * @param jsonBody request body
	 * @return response body
	 */
	public String post(String path, String jsonBody) {
		return send("POST", path, jsonBody);
	}

	private String send(String method, String path, @Nullable String body) {
		String url = path.startsWith("http") ? path : apiBase + path;
		logger.debug("{} {}", method, url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", "2022-11-28")
			.header("User-Agent", "stale-repos")
			.method(method, body != null ? HttpRequest.BodyPublishers.ofString(body)
					: HttpRequest.BodyPublishers.noBody())
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("{} {} completed in {}ms ({} bytes)", method, url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("{} {} failed after {}ms: {}", method, url, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	@Override
	public String getWithQuery(String path, String queryString) {
		String url = apiBase + path;
		if (!queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			if (remaining >= 0 && remaining < LOW_RATE_LIMIT_WARNING) {
				logger.info("Rate limit low: {} requests remaining", remaining);
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new GitHubApiException(
						"Unauthorized: Bad credentials. Check GH_TOKEN or the GitHub App credentials.", statusCode,
						response.body());
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded", statusCode, response.body());
				}
				throw new GitHubApiException("Forbidden: " + request.uri(), statusCode, response.body());
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, response.body());
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body());
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * The status code lets callers tell recoverable lookups (404 on a restricted fork)
	 * from failures that must stop the scan (401 bad credentials).
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		@Nullable
		private final String responseBody;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
		}

		public int getStatusCode() {
			return statusCode;
		}

		@Nullable
		public String getResponseBody() {
			return responseBody;
		}

		public boolean isNotFound() {
			return statusCode == 404;
		}

		public boolean isAuthenticationFailure() {
			return statusCode == 401;
		}

	}

}
