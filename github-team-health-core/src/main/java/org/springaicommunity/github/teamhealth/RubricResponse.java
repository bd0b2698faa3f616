package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * Validated reply of the AI model to a rubric prompt.
 *
 * @param categories per-category assessments as returned by the model, possibly
 * incomplete
 * @param overallFeedback summary feedback
 * @param suggestions improvement suggestions, most valuable first
 */
public record RubricResponse(List<CategoryAssessment> categories, String overallFeedback, List<String> suggestions) {

	public RubricResponse {
		categories = List.copyOf(categories);
		suggestions = List.copyOf(suggestions);
	}

	/**
	 * A single category as scored by the model.
	 *
	 * @param categoryId the rubric category id
	 * @param score points the model awarded
	 * @param feedback the model's reasoning
	 */
	public record CategoryAssessment(String categoryId, int score, String feedback) {
	}

}
