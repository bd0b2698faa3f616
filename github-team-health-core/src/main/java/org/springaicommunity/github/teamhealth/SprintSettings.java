package org.springaicommunity.github.teamhealth;

import java.time.LocalDate;

/**
 * Sprint configuration of a tracked repository.
 *
 * @param startDayOfWeek day the sprint starts on, 0 (Sunday) to 6 (Saturday)
 * @param durationWeeks sprint length in weeks, at least 1
 * @param baseDate date inside sprint number 1
 */
public record SprintSettings(int startDayOfWeek, int durationWeeks, LocalDate baseDate) {

	public static final int DEFAULT_START_DAY_OF_WEEK = 6;

	public static final int DEFAULT_DURATION_WEEKS = 1;

	public SprintSettings {
		if (startDayOfWeek < 0 || startDayOfWeek > 6) {
			throw new IllegalArgumentException("startDayOfWeek must be between 0 and 6, got " + startDayOfWeek);
		}
		if (durationWeeks < 1) {
			throw new IllegalArgumentException("durationWeeks must be positive, got " + durationWeeks);
		}
	}

	public int durationDays() {
		return durationWeeks * 7;
	}

}
