package org.springaicommunity.github.stalerepos;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Builder for wiring the stale repository scan.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * StaleRepoScanService scanner = StaleReposBuilder.create()
 *     .token(System.getenv("GH_TOKEN"))
 *     .buildScanService();
 *
 * // GitHub App installation instead of a token
 * StaleRepoScanService appScanner = StaleReposBuilder.create()
 *     .appCredentials(appId, installationId, privateKeyPem, false)
 *     .buildScanService();
 *
 * ScanResult result = scanner.scan(new ScanRequest("my-org", Policy.of(365), Path.of("."), true));
 *
 * // For testing with mock HTTP client
 * GitHubClient mockClient = mock(GitHubClient.class);
 * RestService rest = StaleReposBuilder.create()
 *     .httpClient(mockClient)
 *     .buildRestService();
 * }
 * </pre>
 */
public class StaleReposBuilder {

	private @Nullable String token;

	private @Nullable String enterpriseUrl;

	private @Nullable Long appId;

	private @Nullable Long appInstallationId;

	private @Nullable String appPrivateKey;

	private boolean appEnterpriseOnly;

	private @Nullable HttpClient transport;

	private ScanProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private Clock clock = Clock.systemUTC();

	private @Nullable Path workflowSummaryFile;

	private @Nullable Path stepOutputFile;

	private StaleReposBuilder() {
		this.properties = new ScanProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new StaleReposBuilder
	 */
	public static StaleReposBuilder create() {
		return new StaleReposBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public StaleReposBuilder token(@Nullable String token) {
		this.token = token;
		return this;
	}

	/**
	 * Authenticate as a GitHub App installation. Takes precedence over {@link #token}
	 * when all three credentials are set.
	 * @param appId GitHub App id
	 * @param installationId installation id
	 * @param privateKey PEM private key of the app
	 * @param enterpriseOnly exchange and scan against the enterprise URL instead of
	 * github.com
	 * @return this builder
	 */
	public StaleReposBuilder appCredentials(@Nullable Long appId, @Nullable Long installationId,
			@Nullable String privateKey, boolean enterpriseOnly) {
		this.appId = appId;
		this.appInstallationId = installationId;
		this.appPrivateKey = privateKey;
		this.appEnterpriseOnly = enterpriseOnly;
		return this;
	}

	/**
	 * Point the client at a GitHub Enterprise Server.
	 * @param enterpriseUrl base URL of the server (null for github.com)
	 * @return this builder
	 */
	public StaleReposBuilder enterpriseUrl(@Nullable String enterpriseUrl) {
		this.enterpriseUrl = enterpriseUrl;
		return this;
	}

	/**
	 * Set scan properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public StaleReposBuilder properties(@Nullable ScanProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public StaleReposBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. When a custom client is provided, the
	 * token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public StaleReposBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the clock used for all day computations.
	 * @param clock clock (null to use the UTC system clock)
	 * @return this builder
	 */
	public StaleReposBuilder clock(@Nullable Clock clock) {
		this.clock = clock != null ? clock : Clock.systemUTC();
		return this;
	}

	// Test seam for the JDK client behind GitHubHttpClient
	StaleReposBuilder transport(@Nullable HttpClient transport) {
		this.transport = transport;
		return this;
	}

	public StaleReposBuilder workflowSummaryFile(@Nullable Path workflowSummaryFile) {
		this.workflowSummaryFile = workflowSummaryFile;
		return this;
	}

	public StaleReposBuilder stepOutputFile(@Nullable Path stepOutputFile) {
		this.stepOutputFile = stepOutputFile;
		return this;
	}

	/**
	 * Build the RestService directly (for advanced usage).
	 * @return configured RestService
	 */
	public RestService buildRestService() {
		validateToken();
		return buildComponents().restService;
	}

	public Classifier buildClassifier() {
		return new Classifier(clock);
	}

	/**
	 * Build the full scan: listing, classification and both reports.
	 * @return configured StaleRepoScanService
	 */
	public StaleRepoScanService buildScanService() {
		validateToken();
		Components components = buildComponents();
		List<ReportWriter> writers = List.of(
				new MarkdownReportWriter(properties.getMarkdownFile(), workflowSummaryFile),
				new JsonReportWriter(components.objectMapper, properties.getJsonFile(), stepOutputFile));
		return new StaleRepoScanService(components.restService, buildClassifier(), writers);
	}

	private void validateToken() {
		// Skip token validation if a custom httpClient or app credentials are provided
		if (httpClient != null || usesAppAuthentication()) {
			return;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or appCredentials() first.");
		}
	}

	private boolean usesAppAuthentication() {
		return appId != null && appInstallationId != null && appPrivateKey != null;
	}

	/**
	 * Base URL for app authentication: the enterprise server only when the app is
	 * enterprise-only, github.com otherwise.
	 */
	@Nullable
	String appBaseUrl() {
		return appEnterpriseOnly ? enterpriseUrl : null;
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient client = this.httpClient != null ? this.httpClient : buildHttpClient(mapper);
		GitHubRestService restService = new GitHubRestService(client, mapper, properties.getPageSize());
		return new Components(restService, mapper);
	}

	private GitHubHttpClient buildHttpClient(ObjectMapper mapper) {
		if (usesAppAuthentication()) {
			GitHubAppAuthenticator authenticator = new GitHubAppAuthenticator(Objects.requireNonNull(appId),
					Objects.requireNonNull(appInstallationId), Objects.requireNonNull(appPrivateKey), mapper, clock);
			String baseUrl = appBaseUrl();
			String installationToken = authenticator.fetchInstallationToken(jwt -> newHttpClient(jwt, baseUrl));
			return newHttpClient(installationToken, baseUrl);
		}
		return newHttpClient(Objects.requireNonNull(token), enterpriseUrl);
	}

	private GitHubHttpClient newHttpClient(String credential, @Nullable String baseUrl) {
		return transport != null ? new GitHubHttpClient(credential, baseUrl, transport)
				: new GitHubHttpClient(credential, baseUrl);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(RestService restService, ObjectMapper objectMapper) {
	}

}
