package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Scores how well an issue is written, using an AI model against
 * {@link EvaluationCriteria#QUALITY}.
 */
public class QualityEvaluator {

	private static final Logger logger = LoggerFactory.getLogger(QualityEvaluator.class);

	static final String SUGGESTIONS_FIELD = "improvement_suggestions";

	private final StructuredOutputService structuredOutputService;

	private final TeamHealthProperties properties;

	private final Clock clock;

	private final RubricResponseSchema schema = new RubricResponseSchema(EvaluationCriteria.QUALITY,
			SUGGESTIONS_FIELD);

	public QualityEvaluator(StructuredOutputService structuredOutputService, TeamHealthProperties properties,
			Clock clock) {
		this.structuredOutputService = structuredOutputService;
		this.properties = properties;
		this.clock = clock;
	}

	/**
	 * @param issue the issue to judge
	 * @param assigneeLogin GitHub login of the assignee, null when unassigned or unknown
	 * @return the evaluation
	 * @throws EvaluationException if the model fails or replies with invalid output
	 */
	public QualityEvaluation evaluate(Issue issue, @Nullable String assigneeLogin) {
		logger.debug("Evaluating quality of issue #{}", issue.githubNumber());
		RubricResponse response = structuredOutputService.generateStructuredOutput(
				StructuredOutputRequest.of(schema, buildPrompt(issue, assigneeLogin), properties));

		List<CategoryScore> categories = EvaluationCriteria.QUALITY.normalize(response);
		QualityScore total = QualityScore.fromCategoryScores(categories);
		return new QualityEvaluation(total, total.grade(), categories, response.overallFeedback(),
				response.suggestions(), LocalDateTime.now(clock));
	}

	String buildPrompt(Issue issue, @Nullable String assigneeLogin) {
		String body = issue.body() == null || issue.body().isBlank() ? "(no description)" : issue.body();
		String assignee = assigneeLogin == null || assigneeLogin.isBlank() ? "(unassigned)" : assigneeLogin;
		return """
				You review GitHub issues for a software team. Judge whether the issue below gives a developer,
				or an AI coding assistant, everything needed to implement it without asking questions.

				Score each category with an integer between 0 and its maximum:
				%s

				Issue #%d: %s
				Assignee: %s

				%s

				Reply with a single JSON object and nothing else:
				{"categories": [{"category_id": "<id>", "score": <integer>, "feedback": "<reason>"}],
				 "overall_feedback": "<summary>",
				 "%s": ["<at most three concrete suggestions>"]}
				""".formatted(EvaluationCriteria.QUALITY.describeCategories(), issue.githubNumber(), issue.title(),
				assignee, body, SUGGESTIONS_FIELD);
	}

}
