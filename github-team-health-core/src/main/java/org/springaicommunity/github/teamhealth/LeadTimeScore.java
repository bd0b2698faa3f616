package org.springaicommunity.github.teamhealth;

import java.time.Duration;

/**
 * Day-based lead-time metric: 2 days or less scores 100, then 80, 60 and 40 for each
 * further day, and 20 beyond 5 days.
 *
 * <p>
 * Kept apart from {@link SpeedGrade}; the two scales are not interchangeable.
 *
 * @param score the lead-time score
 * @param leadTimeDays elapsed days the score was derived from
 */
public record LeadTimeScore(Score score, double leadTimeDays) {

	private static final double[] MAX_DAYS = { 2, 3, 4, 5 };

	private static final int[] SCORES = { 100, 80, 60, 40 };

	private static final int SLOWEST_SCORE = 20;

	public LeadTimeScore {
		if (leadTimeDays < 0) {
			throw new IllegalArgumentException("Lead time must not be negative, got " + leadTimeDays + " days");
		}
	}

	public static LeadTimeScore fromDays(double days) {
		if (days < 0 || Double.isNaN(days)) {
			throw new IllegalArgumentException("Lead time must not be negative, got " + days + " days");
		}
		for (int i = 0; i < MAX_DAYS.length; i++) {
			if (days <= MAX_DAYS[i]) {
				return new LeadTimeScore(Score.of(SCORES[i]), days);
			}
		}
		return new LeadTimeScore(Score.of(SLOWEST_SCORE), days);
	}

	public static LeadTimeScore fromHours(double hours) {
		return fromDays(hours / 24.0);
	}

	public static LeadTimeScore fromDuration(Duration elapsed) {
		return fromHours(elapsed.toMillis() / 3_600_000.0);
	}

	public Grade grade() {
		return score.grade();
	}

}
