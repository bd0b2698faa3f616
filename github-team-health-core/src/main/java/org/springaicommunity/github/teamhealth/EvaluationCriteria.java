package org.springaicommunity.github.teamhealth;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A fixed rubric: an ordered list of weighted categories summing to 100.
 *
 * @param name rubric name used in logs and prompts
 * @param categories the categories in prompt order
 */
public record EvaluationCriteria(String name, List<EvaluationCategory> categories) {

	static final String NOT_EVALUATED_FEEDBACK = "This category could not be evaluated.";

	/**
	 * Description quality of an issue.
	 */
	public static final EvaluationCriteria QUALITY = new EvaluationCriteria("quality", List.of(
			new EvaluationCategory("context-goal", "Context & Goal", 25,
					"Is it clear why this work is needed? Background, objective and the reason for its priority."),
			new EvaluationCategory("implementation-details", "Implementation Details", 25,
					"Is it clear what has to be done? Requirements, technical constraints and reference links."),
			new EvaluationCategory("acceptance-criteria", "Acceptance Criteria", 30,
					"Is done defined measurably? Checklists, test requirements and quantitative criteria."),
			new EvaluationCategory("structure-clarity", "Structure & Clarity", 20,
					"Can another developer understand it at a glance? Markdown structure, diagrams, concision.")));

	/**
	 * Agreement between an issue and the pull requests that closed it.
	 */
	public static final EvaluationCriteria CONSISTENCY = new EvaluationCriteria("consistency", List.of(
			new EvaluationCategory("issue-evaluability", "Issue Evaluability", 20,
					"Are the issue's requirements clear enough to judge the pull request against? "
							+ "Deduct for vague wording and point out what to improve."),
			new EvaluationCategory("requirement-coverage", "Requirement Coverage", 30,
					"Is every requirement stated in the issue implemented by the pull requests?"),
			new EvaluationCategory("scope-appropriateness", "Scope Appropriateness", 20,
					"Is the change neither short of nor beyond the requested scope? Watch for scope creep."),
			new EvaluationCategory("acceptance-criteria-achievement", "Acceptance Criteria Achievement", 20,
					"Do the pull requests satisfy the issue's acceptance criteria, where they are stated?"),
			new EvaluationCategory("pr-description-clarity", "PR Description Clarity", 10,
					"Do the pull request descriptions explain what changed and why?")));

	public EvaluationCriteria {
		categories = List.copyOf(categories);
		int total = categories.stream().mapToInt(EvaluationCategory::weight).sum();
		if (total != Score.MAX) {
			throw new IllegalArgumentException("Category weights of " + name + " must sum to 100, got " + total);
		}
	}

	public List<String> categoryIds() {
		return categories.stream().map(EvaluationCategory::id).toList();
	}

	/**
	 * Maps a model reply onto every rubric category in rubric order. A category the
	 * model left out scores 0; scores outside a category's range are clamped to it.
	 * @param response the validated model reply
	 * @return one score per rubric category
	 */
	public List<CategoryScore> normalize(RubricResponse response) {
		Map<String, RubricResponse.CategoryAssessment> byId = response.categories()
			.stream()
			.collect(Collectors.toMap(RubricResponse.CategoryAssessment::categoryId, Function.identity(),
					(first, second) -> first));

		List<CategoryScore> scores = new ArrayList<>(categories.size());
		for (EvaluationCategory category : categories) {
			RubricResponse.CategoryAssessment assessment = byId.get(category.id());
			if (assessment == null) {
				scores.add(new CategoryScore(category.id(), category.label(), 0, category.weight(),
						NOT_EVALUATED_FEEDBACK));
			}
			else {
				int clamped = Math.max(0, Math.min(category.weight(), assessment.score()));
				scores.add(new CategoryScore(category.id(), category.label(), clamped, category.weight(),
						assessment.feedback()));
			}
		}
		return scores;
	}

	/**
	 * Category list as rendered into a prompt, one line per category.
	 */
	public String describeCategories() {
		return categories.stream()
			.map(c -> "- " + c.id() + " (" + c.label() + ", max " + c.weight() + " points): " + c.description())
			.collect(Collectors.joining("\n"));
	}

}
