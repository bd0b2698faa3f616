package org.springaicommunity.github.teamhealth;

import java.time.LocalDateTime;

/**
 * Completion speed of a closed issue.
 *
 * @param score the tier score, up to 120
 * @param grade the tier
 * @param elapsedHours hours from creation to close
 * @param message advice for the tier
 * @param evaluatedAt when the evaluation ran
 */
public record SpeedEvaluation(int score, SpeedGrade grade, double elapsedHours, String message,
		LocalDateTime evaluatedAt) {
}
