package org.springaicommunity.github.teamhealth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves linked pull requests from the issue timeline.
 *
 * <p>
 * A pull request counts as linked when the timeline holds a {@code cross-referenced}
 * event whose source is a pull request of the same repository, and it has been merged.
 * The diff sent to the evaluator is the concatenated file patches cut at the configured
 * character limit; when GitHub returns no patches it falls back to one
 * {@code [status] file (+a/-d)} line per file.
 */
public class GitHubLinkedPullRequestResolver implements LinkedPullRequestResolver {

	private static final Logger logger = LoggerFactory.getLogger(GitHubLinkedPullRequestResolver.class);

	private static final String TRUNCATION_MARKER = "\n... (diff truncated)";

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	private final int diffCharacterLimit;

	public GitHubLinkedPullRequestResolver(GitHubClient httpClient, ObjectMapper objectMapper,
			int diffCharacterLimit) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.diffCharacterLimit = diffCharacterLimit;
	}

	@Override
	public List<LinkedPullRequest> findLinkedPullRequests(TrackedRepository repository, int issueNumber) {
		String repoPath = "/repos/" + repository.ownerName() + "/" + repository.repoName();
		Set<Integer> candidates = referencingPullRequestNumbers(repository, repoPath, issueNumber);

		List<LinkedPullRequest> linked = new ArrayList<>();
		for (int number : candidates) {
			JsonNode pr = readTree(httpClient.get(repoPath + "/pulls/" + number));
			if (pr.path("merged_at").isNull() || pr.path("merged_at").isMissingNode()) {
				logger.debug("Skipping unmerged PR #{} referencing issue #{}", number, issueNumber);
				continue;
			}
			JsonNode files = readTree(httpClient.getWithQuery(repoPath + "/pulls/" + number + "/files", "per_page=100"));
			linked.add(new LinkedPullRequest(number, pr.path("title").asText(""),
					pr.path("body").isNull() ? null : pr.path("body").asText(null), pr.path("html_url").asText(""),
					buildDiff(files), pr.path("changed_files").asInt(files.size()), pr.path("additions").asInt(0),
					pr.path("deletions").asInt(0)));
		}
		logger.debug("Issue #{} of {} has {} linked merged pull requests", issueNumber, repository.fullName(),
				linked.size());
		return linked;
	}

	private Set<Integer> referencingPullRequestNumbers(TrackedRepository repository, String repoPath,
			int issueNumber) {
		JsonNode events = readTree(
				httpClient.getWithQuery(repoPath + "/issues/" + issueNumber + "/timeline", "per_page=100"));
		Set<Integer> numbers = new LinkedHashSet<>();
		for (JsonNode event : events) {
			if (!"cross-referenced".equals(event.path("event").asText())) {
				continue;
			}
			JsonNode source = event.path("source").path("issue");
			if (!source.has("pull_request")) {
				continue;
			}
			String sourceRepo = source.path("repository").path("full_name").asText(repository.fullName());
			if (sourceRepo.equalsIgnoreCase(repository.fullName())) {
				numbers.add(source.path("number").asInt());
			}
		}
		return numbers;
	}

	String buildDiff(JsonNode files) {
		StringBuilder patches = new StringBuilder();
		StringBuilder summary = new StringBuilder();
		for (JsonNode file : files) {
			String filename = file.path("filename").asText("");
			summary.append('[')
				.append(file.path("status").asText("modified"))
				.append("] ")
				.append(filename)
				.append(" (+")
				.append(file.path("additions").asInt(0))
				.append("/-")
				.append(file.path("deletions").asInt(0))
				.append(")\n");
			if (file.hasNonNull("patch")) {
				patches.append("--- ").append(filename).append('\n').append(file.path("patch").asText()).append('\n');
			}
		}
		String diff = patches.length() > 0 ? patches.toString() : summary.toString();
		if (diff.length() > diffCharacterLimit) {
			return diff.substring(0, diffCharacterLimit) + TRUNCATION_MARKER;
		}
		return diff;
	}

	private JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Malformed JSON from GitHub: " + e.getOriginalMessage(),
					e);
		}
	}

}
