package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Scores how fast an issue went from creation to close. Deterministic, no AI involved.
 */
public class SpeedEvaluator {

	private final Clock clock;

	public SpeedEvaluator(Clock clock) {
		this.clock = clock;
	}

	/**
	 * @param issue the issue
	 * @return the evaluation, or empty for an open issue or one without a close time
	 * @throws IllegalArgumentException if the issue was closed before it was created
	 */
	public Optional<SpeedEvaluation> evaluate(Issue issue) {
		if (!issue.isClosed()) {
			return Optional.empty();
		}
		return evaluate(issue.githubCreatedAt(), issue.githubClosedAt());
	}

	public Optional<SpeedEvaluation> evaluate(LocalDateTime createdAt, @Nullable LocalDateTime closedAt) {
		if (closedAt == null) {
			return Optional.empty();
		}
		double hours = elapsedHours(createdAt, closedAt);
		SpeedGrade grade = SpeedGrade.forHours(hours);
		return Optional
			.of(new SpeedEvaluation(grade.getScore(), grade, hours, grade.getMessage(), LocalDateTime.now(clock)));
	}

	static double elapsedHours(LocalDateTime createdAt, LocalDateTime closedAt) {
		Duration elapsed = Duration.between(createdAt, closedAt);
		if (elapsed.isNegative()) {
			throw new IllegalArgumentException(
					"Issue closed at " + closedAt + " before it was created at " + createdAt);
		}
		return elapsed.toMillis() / 3_600_000.0;
	}

}
