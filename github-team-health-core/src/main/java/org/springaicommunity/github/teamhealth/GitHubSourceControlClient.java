package org.springaicommunity.github.teamhealth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link SourceControlClient} backed by the GitHub REST API, plus one GraphQL query for
 * closing-issue references.
 *
 * <p>
 * Converts GitHub JSON responses to records at this boundary. Pagination is sequential
 * and stops at the first page shorter than the page size.
 */
public class GitHubSourceControlClient implements SourceControlClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubSourceControlClient.class);

	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

	private static final String CLOSING_ISSUES_QUERY = """
			query($owner: String!, $repo: String!, $number: Int!) {
			    repository(owner: $owner, name: $repo) {
			        pullRequest(number: $number) {
			            closingIssuesReferences(first: 10) {
			                nodes {
			                    number
			                }
			            }
			        }
			    }
			}
			""";

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final int pageSize;

	public GitHubSourceControlClient(GitHubClient httpClient, ObjectMapper objectMapper, int pageSize) {
		if (pageSize < 1 || pageSize > 100) {
			throw new IllegalArgumentException("pageSize must be between 1 and 100, got " + pageSize);
		}
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.pageSize = pageSize;
	}

	@Override
	public RepositoryInfo getRepositoryInfo(String owner, String repo) {
		JsonNode node = readTree(httpClient.get(repoPath(owner, repo)));
		return new RepositoryInfo(node.path("id").asLong(), node.path("owner").path("login").asText(owner),
				node.path("name").asText(repo), node.path("full_name").asText(owner + "/" + repo),
				textOrNull(node.path("description")), node.path("html_url").asText(""),
				node.path("private").asBoolean(false), node.path("default_branch").asText("main"));
	}

	@Override
	public List<GitHubUser> getContributors(String owner, String repo) {
		List<GitHubUser> users = new ArrayList<>();
		for (JsonNode node : fetchAllPages(repoPath(owner, repo) + "/contributors", "")) {
			users.add(parseUser(node));
		}
		logger.debug("Fetched {} contributors for {}/{}", users.size(), owner, repo);
		return users;
	}

	@Override
	public List<GitHubUser> getCollaborators(String owner, String repo) {
		List<GitHubUser> users = new ArrayList<>();
		for (JsonNode node : fetchAllPages(repoPath(owner, repo) + "/collaborators", "affiliation=all")) {
			users.add(parseUser(node));
		}
		logger.debug("Fetched {} collaborators for {}/{}", users.size(), owner, repo);
		return users;
	}

	@Override
	public List<GitHubIssue> getIssues(String owner, String repo, @Nullable LocalDateTime since) {
		String query = "state=all&sort=updated&direction=desc";
		if (since != null) {
			query += "&since=" + URLEncoder.encode(formatTimestamp(since), StandardCharsets.UTF_8);
		}

		List<GitHubIssue> issues = new ArrayList<>();
		int pullRequests = 0;
		for (JsonNode node : fetchAllPages(repoPath(owner, repo) + "/issues", query)) {
			// The issues endpoint also lists pull requests
			if (node.has("pull_request")) {
				pullRequests++;
				continue;
			}
			issues.add(parseIssue(node));
		}
		logger.debug("Fetched {} issues for {}/{} (skipped {} pull requests)", issues.size(), owner, repo,
				pullRequests);
		return issues;
	}

	/**
	 * The pulls endpoint has no {@code since} parameter, so results are requested most
	 * recently updated first and filtered here. Paging stops at the first page holding an
	 * older pull request.
	 */
	@Override
	public List<GitHubPullRequest> getPullRequests(String owner, String repo, @Nullable LocalDateTime since) {
		String path = repoPath(owner, repo) + "/pulls";
		List<GitHubPullRequest> pullRequests = new ArrayList<>();
		for (int page = 1;; page++) {
			JsonNode nodes = fetchPage(path, "state=all&sort=updated&direction=desc", page);
			boolean reachedOlder = false;
			for (JsonNode node : nodes) {
				GitHubPullRequest pullRequest = parsePullRequest(node);
				if (since != null && pullRequest.updatedAt().isBefore(since)) {
					reachedOlder = true;
					continue;
				}
				pullRequests.add(pullRequest);
			}
			if (nodes.size() < pageSize || reachedOlder) {
				break;
			}
		}
		logger.debug("Fetched {} pull requests for {}/{}", pullRequests.size(), owner, repo);
		return pullRequests;
	}

	@Override
	public List<Integer> getLinkedIssuesForPullRequest(String owner, String repo, int prNumber) {
		JsonNode response = executeGraphQL(CLOSING_ISSUES_QUERY,
				Map.of("owner", owner, "repo", repo, "number", prNumber));
		JsonNode nodes = response.path("data")
			.path("repository")
			.path("pullRequest")
			.path("closingIssuesReferences")
			.path("nodes");
		List<Integer> numbers = new ArrayList<>();
		for (JsonNode node : nodes) {
			if (node.has("number")) {
				numbers.add(node.path("number").asInt());
			}
		}
		return numbers;
	}

	// ========== Pagination ==========

	private List<JsonNode> fetchAllPages(String path, String query) {
		List<JsonNode> all = new ArrayList<>();
		for (int page = 1;; page++) {
			JsonNode nodes = fetchPage(path, query, page);
			nodes.forEach(all::add);
			if (nodes.size() < pageSize) {
				return all;
			}
		}
	}

	private JsonNode fetchPage(String path, String query, int page) {
		String pageQuery = (query.isEmpty() ? "" : query + "&") + "per_page=" + pageSize + "&page=" + page;
		JsonNode nodes = readTree(httpClient.getWithQuery(path, pageQuery));
		if (!nodes.isArray()) {
			throw new GitHubHttpClient.GitHubApiException("Expected a JSON array from " + path, 200,
					nodes.toString());
		}
		return nodes;
	}

	// ========== JSON Parsing Methods (at service boundary) ==========

	private GitHubUser parseUser(JsonNode node) {
		return new GitHubUser(node.path("login").asText(""), node.path("id").asLong(0),
				textOrNull(node.path("name")));
	}

	private GitHubIssue parseIssue(JsonNode node) {
		JsonNode assignee = node.path("assignee");
		if (assignee.isMissingNode() || assignee.isNull()) {
			JsonNode assignees = node.path("assignees");
			assignee = assignees.isArray() && assignees.size() > 0 ? assignees.get(0) : assignee;
		}
		LocalDateTime createdAt = requireDateTime(node, "created_at");
		LocalDateTime updatedAt = parseDateTime(textOrNull(node.path("updated_at")));
		return new GitHubIssue(node.path("number").asInt(), node.path("title").asText(""),
				textOrNull(node.path("body")), node.path("state").asText(Issue.STATE_OPEN),
				textOrNull(node.path("user").path("login")), textOrNull(assignee.path("login")), createdAt,
				updatedAt != null ? updatedAt : createdAt, parseDateTime(textOrNull(node.path("closed_at"))),
				node.path("html_url").asText(""));
	}

	private GitHubPullRequest parsePullRequest(JsonNode node) {
		LocalDateTime createdAt = requireDateTime(node, "created_at");
		LocalDateTime updatedAt = parseDateTime(textOrNull(node.path("updated_at")));
		return new GitHubPullRequest(node.path("number").asInt(), node.path("title").asText(""),
				textOrNull(node.path("body")), node.path("state").asText(Issue.STATE_OPEN),
				textOrNull(node.path("user").path("login")), createdAt, updatedAt != null ? updatedAt : createdAt,
				parseDateTime(textOrNull(node.path("merged_at"))), node.path("html_url").asText(""));
	}

	private LocalDateTime requireDateTime(JsonNode node, String field) {
		LocalDateTime value = parseDateTime(textOrNull(node.path(field)));
		if (value == null) {
			throw new GitHubHttpClient.GitHubApiException(
					"Missing or invalid " + field + " on #" + node.path("number").asText("?"), 200, null);
		}
		return value;
	}

	static @Nullable LocalDateTime parseDateTime(@Nullable String dateTimeStr) {
		if (dateTimeStr == null || dateTimeStr.isEmpty()) {
			return null;
		}
		try {
			return LocalDateTime.parse(dateTimeStr, ISO_FORMATTER);
		}
		catch (DateTimeParseException e) {
			logger.warn("Failed to parse datetime: {}", dateTimeStr);
			return null;
		}
	}

	static String formatTimestamp(LocalDateTime dateTime) {
		return DateTimeFormatter.ISO_INSTANT.format(dateTime.toInstant(ZoneOffset.UTC));
	}

	private static @Nullable String textOrNull(JsonNode node) {
		return node.isMissingNode() || node.isNull() ? null : node.asText();
	}

	private static String repoPath(String owner, String repo) {
		return "/repos/" + owner + "/" + repo;
	}

	// ========== Internal JSON / GraphQL Execution ==========

	private JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Malformed JSON from GitHub: " + e.getOriginalMessage(),
					e);
		}
	}

	private JsonNode executeGraphQL(String query, Map<String, Object> variables) {
		String requestBody;
		try {
			requestBody = objectMapper.writeValueAsString(Map.of("query", query, "variables", variables));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Could not serialize GraphQL request", e);
		}
		JsonNode response = readTree(httpClient.postGraphQL(requestBody));
		JsonNode errors = response.path("errors");
		if (errors.isArray() && errors.size() > 0) {
			throw new GitHubHttpClient.GitHubApiException(
					"GraphQL error: " + errors.get(0).path("message").asText("unknown"), 200, response.toString());
		}
		return response;
	}

}
