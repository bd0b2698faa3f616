package org.springaicommunity.github.teamhealth;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Description quality of an issue.
 *
 * @param totalScore sum of category points, at most 100
 * @param grade grade of the total
 * @param categories one entry per rubric category, in rubric order
 * @param overallFeedback summary feedback
 * @param improvementSuggestions at most three suggestions
 * @param evaluatedAt when the evaluation ran
 */
public record QualityEvaluation(QualityScore totalScore, Grade grade, List<CategoryScore> categories,
		String overallFeedback, List<String> improvementSuggestions, LocalDateTime evaluatedAt) {

	public QualityEvaluation {
		categories = List.copyOf(categories);
		improvementSuggestions = List.copyOf(improvementSuggestions);
	}

}
