package org.springaicommunity.github.teamhealth;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Agreement between an issue and the merged pull requests that reference it.
 *
 * <p>
 * Stored per category; {@link #score()} carries the same total as a deduction view.
 *
 * @param score total with the points each category lost as deductions
 * @param grade grade of the total
 * @param categories one entry per rubric category, in rubric order
 * @param overallFeedback summary feedback
 * @param issueImprovementSuggestions at most three suggestions for the issue text
 * @param linkedPullRequests the pull requests that were compared
 * @param evaluatedAt when the evaluation ran
 */
public record ConsistencyEvaluation(ConsistencyScore score, Grade grade, List<CategoryScore> categories,
		String overallFeedback, List<String> issueImprovementSuggestions,
		List<LinkedPullRequest.Reference> linkedPullRequests, LocalDateTime evaluatedAt) {

	public ConsistencyEvaluation {
		categories = List.copyOf(categories);
		issueImprovementSuggestions = List.copyOf(issueImprovementSuggestions);
		linkedPullRequests = List.copyOf(linkedPullRequests);
	}

	public int totalScore() {
		return score.value();
	}

}
