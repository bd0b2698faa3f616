package org.springaicommunity.github.teamhealth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Judges whether the merged pull requests referencing an issue implement what it asks
 * for, using an AI model against {@link EvaluationCriteria#CONSISTENCY}.
 */
public class ConsistencyEvaluator {

	private static final Logger logger = LoggerFactory.getLogger(ConsistencyEvaluator.class);

	static final String SUGGESTIONS_FIELD = "issue_improvement_suggestions";

	static final String NO_LINKED_PULL_REQUESTS = "No merged pull request references this issue";

	private final StructuredOutputService structuredOutputService;

	private final LinkedPullRequestResolver linkedPullRequestResolver;

	private final TeamHealthProperties properties;

	private final Clock clock;

	private final RubricResponseSchema schema = new RubricResponseSchema(EvaluationCriteria.CONSISTENCY,
			SUGGESTIONS_FIELD);

	public ConsistencyEvaluator(StructuredOutputService structuredOutputService,
			LinkedPullRequestResolver linkedPullRequestResolver, TeamHealthProperties properties, Clock clock) {
		this.structuredOutputService = structuredOutputService;
		this.linkedPullRequestResolver = linkedPullRequestResolver;
		this.properties = properties;
		this.clock = clock;
	}

	/**
	 * @param repository the repository of the issue
	 * @param issue the issue to judge
	 * @return the evaluation, or a skip when no merged pull request references the issue
	 * @throws EvaluationException if GitHub or the model fails, or the reply is invalid
	 */
	public ConsistencyOutcome evaluate(TrackedRepository repository, Issue issue) {
		List<LinkedPullRequest> pullRequests;
		try {
			pullRequests = linkedPullRequestResolver.findLinkedPullRequests(repository, issue.githubNumber());
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			throw new EvaluationException("Fetching linked pull requests failed: " + e.getMessage(),
					RetryingGitHubClient.isRetryable(e), e.isRateLimitError(), e);
		}
		if (pullRequests.isEmpty()) {
			logger.debug("Skipping consistency of issue #{}: no linked pull requests", issue.githubNumber());
			return new ConsistencyOutcome.Skipped(NO_LINKED_PULL_REQUESTS);
		}

		RubricResponse response = structuredOutputService.generateStructuredOutput(
				StructuredOutputRequest.of(schema, buildPrompt(issue, pullRequests), properties));

		List<CategoryScore> categories = EvaluationCriteria.CONSISTENCY.normalize(response);
		ConsistencyScore score = ConsistencyScore.fromCategoryScores(categories);
		List<LinkedPullRequest.Reference> references = pullRequests.stream().map(LinkedPullRequest::toReference).toList();
		return new ConsistencyOutcome.Evaluated(new ConsistencyEvaluation(score, score.grade(), categories,
				response.overallFeedback(), response.suggestions(), references, LocalDateTime.now(clock)));
	}

	String buildPrompt(Issue issue, List<LinkedPullRequest> pullRequests) {
		StringBuilder prs = new StringBuilder();
		for (LinkedPullRequest pr : pullRequests) {
			prs.append("### PR #")
				.append(pr.number())
				.append(": ")
				.append(pr.title())
				.append(" (")
				.append(pr.changedFiles())
				.append(" files, +")
				.append(pr.additions())
				.append("/-")
				.append(pr.deletions())
				.append(")\n\n")
				.append(pr.body() == null || pr.body().isBlank() ? "(no description)" : pr.body())
				.append("\n\n```diff\n")
				.append(pr.diff())
				.append("\n```\n\n");
		}
		String body = issue.body() == null || issue.body().isBlank() ? "(no description)" : issue.body();
		return """
				You compare a GitHub issue with the merged pull requests that implemented it.

				Score each category with an integer between 0 and its maximum:
				%s

				## Issue #%d: %s

				%s

				## Pull requests

				%s
				Reply with a single JSON object and nothing else:
				{"categories": [{"category_id": "<id>", "score": <integer>, "feedback": "<reason>"}],
				 "overall_feedback": "<summary>",
				 "%s": ["<at most three ways to write the issue better>"]}
				""".formatted(EvaluationCriteria.CONSISTENCY.describeCategories(), issue.githubNumber(),
				issue.title(), body, prs, SUGGESTIONS_FIELD);
	}

}
