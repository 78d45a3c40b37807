package org.springaicommunity.github.stalerepos;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Service for GitHub REST API operations.
 *
 * <p>
 * Converts GitHub API JSON responses to strongly-typed records at the service boundary.
 */
public class GitHubRestService implements RestService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestService.class);

	static final int DEFAULT_PAGE_SIZE = 100;

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final int pageSize;

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this(httpClient, objectMapper, DEFAULT_PAGE_SIZE);
	}

	public GitHubRestService(GitHubClient httpClient, ObjectMapper objectMapper, int pageSize) {
		if (pageSize <= 0 || pageSize > 100) {
			throw new IllegalArgumentException("Page size must be between 1 and 100 (got: " + pageSize + ")");
		}
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.pageSize = pageSize;
	}

	@Override
	public Iterable<RepositoryInfo> listRepositories(@Nullable String organization) {
		String path;
		String query;
		if (organization != null && !organization.isBlank()) {
			path = "/orgs/" + encodePathSegment(organization) + "/repos";
			query = "type=all";
		}
		else {
			path = "/user/repos";
			query = "affiliation=owner";
		}
		return () -> new RepositoryPageIterator(path, query);
	}

	@Override
	public List<String> getTopics(String fullName) {
		JsonNode node = readTree(httpClient.get("/repos/" + fullName + "/topics"));
		List<String> topics = new ArrayList<>();
		for (JsonNode name : node.path("names")) {
			topics.add(name.asText());
		}
		return topics;
	}

	@Override
	public Instant getBranchHeadCommitDate(String fullName, String branch) {
		JsonNode node = readTree(httpClient.get("/repos/" + fullName + "/branches/" + encodePathSegment(branch)));
		String committedAt = node.path("commit").path("commit").path("committer").path("date").asText(null);
		Instant date = parseInstant(committedAt);
		if (date == null) {
			throw new UnexpectedPayloadException(
					"Branch " + branch + " of " + fullName + " has no resolvable committer date");
		}
		return date;
	}

	@Override
	public Optional<Release> getLatestRelease(String fullName) {
		JsonNode nodes = readTree(httpClient.getWithQuery("/repos/" + fullName + "/releases", "per_page=1"));
		if (!nodes.isArray() || nodes.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(parseRelease(nodes.get(0), fullName));
	}

	@Override
	public Optional<PullRequest> getLatestPullRequest(String fullName) {
		JsonNode nodes = readTree(httpClient.getWithQuery("/repos/" + fullName + "/pulls",
				"state=all&sort=created&direction=desc&per_page=1"));
		if (!nodes.isArray() || nodes.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(parsePullRequest(nodes.get(0), fullName));
	}

	// ========== JSON Parsing Methods ==========

	private JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new UnexpectedPayloadException("Response is not valid JSON: " + e.getOriginalMessage(), e);
		}
	}

	RepositoryInfo parseRepository(JsonNode node) {
		JsonNode privateNode = node.path("private");
		Boolean isPrivate = privateNode.isBoolean() ? privateNode.asBoolean() : null;
		return new RepositoryInfo(node.path("id").asLong(), node.path("name").asText(""),
				node.path("full_name").asText(""), node.path("html_url").asText(""), isPrivate,
				node.path("archived").asBoolean(false), parseInstant(node.path("pushed_at").asText(null)),
				node.path("default_branch").asText("main"));
	}

	private Release parseRelease(JsonNode node, String fullName) {
		Author author = parseAuthor(node.path("author"));
		if (author == null) {
			throw new UnexpectedPayloadException("Release " + node.path("tag_name").asText("?") + " of " + fullName
					+ " has no resolvable author");
		}
		Instant createdAt = parseInstant(node.path("created_at").asText(null));
		if (createdAt == null) {
			throw new UnexpectedPayloadException("Release of " + fullName + " has no creation date");
		}
		return new Release(node.path("id").asLong(), node.path("tag_name").asText(""),
				node.path("draft").asBoolean(false), createdAt, parseInstant(node.path("published_at").asText(null)),
				author);
	}

	private PullRequest parsePullRequest(JsonNode node, String fullName) {
		Author author = parseAuthor(node.path("user"));
		if (author == null) {
			throw new UnexpectedPayloadException(
					"Pull request #" + node.path("number").asInt() + " of " + fullName + " has no resolvable author");
		}
		Instant createdAt = parseInstant(node.path("created_at").asText(null));
		if (createdAt == null) {
			throw new UnexpectedPayloadException("Pull request of " + fullName + " has no creation date");
		}
		return new PullRequest(node.path("number").asInt(), node.path("state").asText(""), createdAt,
				parseInstant(node.path("merged_at").asText(null)), author);
	}

	@Nullable
	private Author parseAuthor(JsonNode node) {
		if (node.isMissingNode() || node.isNull() || node.path("login").asText("").isEmpty()) {
			return null;
		}
		return new Author(node.path("login").asText());
	}

	@Nullable
	static Instant parseInstant(@Nullable String dateTimeStr) {
		if (dateTimeStr == null || dateTimeStr.isEmpty()) {
			return null;
		}
		try {
			return OffsetDateTime.parse(dateTimeStr).toInstant();
		}
		catch (DateTimeParseException e) {
			try {
				// Offset-less timestamps are UTC
				return LocalDateTime.parse(dateTimeStr).toInstant(ZoneOffset.UTC);
			}
			catch (DateTimeParseException ignored) {
				logger.warn("Failed to parse datetime: {}", dateTimeStr);
				return null;
			}
		}
	}

	private static String encodePathSegment(String segment) {
		return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20").replace("%2F", "/");
	}

	/**
	 * Walks {@code page=1,2,...} until a page comes back shorter than the page size.
	 */
	private final class RepositoryPageIterator implements Iterator<RepositoryInfo> {

		private final String path;

		private final String query;

		private final Deque<RepositoryInfo> buffer = new ArrayDeque<>();

		private int nextPage = 1;

		private boolean lastPageFetched = false;

		private RepositoryPageIterator(String path, String query) {
			this.path = path;
			this.query = query;
		}

		@Override
		public boolean hasNext() {
			while (buffer.isEmpty() && !lastPageFetched) {
				fetchNextPage();
			}
			return !buffer.isEmpty();
		}

		@Override
		public RepositoryInfo next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return buffer.removeFirst();
		}

		private void fetchNextPage() {
			String pageQuery = query + "&per_page=" + pageSize + "&page=" + nextPage;
			JsonNode nodes = readTree(httpClient.getWithQuery(path, pageQuery));
			int count = 0;
			if (nodes.isArray()) {
				for (JsonNode node : nodes) {
					buffer.addLast(parseRepository(node));
					count++;
				}
			}
			logger.debug("Fetched page {} of {} ({} repositories)", nextPage, path, count);
			lastPageFetched = count < pageSize;
			nextPage++;
		}

	}

}
