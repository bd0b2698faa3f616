package org.springaicommunity.github.teamhealth;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Buckets dates into fixed-length sprints anchored to a weekday and a base date.
 *
 * <p>
 * All timestamps are interpreted as UTC wall-clock times; only their date part matters.
 * Day-of-week numbering follows the 0 (Sunday) to 6 (Saturday) convention used by
 * {@link SprintSettings}.
 */
public class SprintCalculator {

	private final SprintSettings settings;

	private final LocalDate baseSprintStart;

	public SprintCalculator(SprintSettings settings) {
		this.settings = settings;
		this.baseSprintStart = sprintStartDate(settings.baseDate());
	}

	public SprintSettings getSettings() {
		return settings;
	}

	/**
	 * Most recent occurrence of the sprint start weekday on or before the given date.
	 * @param date any date
	 * @return start date of the sprint week containing {@code date}
	 */
	public LocalDate sprintStartDate(LocalDate date) {
		int dayOfWeek = date.getDayOfWeek().getValue() % 7;
		int daysBack = (dayOfWeek - settings.startDayOfWeek() + 7) % 7;
		return date.minusDays(daysBack);
	}

	/**
	 * Sprint number of the given date. Dates before the base sprint yield zero or
	 * negative numbers.
	 * @param date any date
	 * @return the sprint number containing {@code date}
	 */
	public SprintNumber sprintNumber(LocalDate date) {
		long days = ChronoUnit.DAYS.between(baseSprintStart, sprintStartDate(date));
		long buckets = Math.floorDiv(days, (long) settings.durationDays());
		return SprintNumber.allowingZeroOrNegative(Math.toIntExact(buckets + 1));
	}

	public SprintNumber sprintNumber(LocalDateTime dateTime) {
		return sprintNumber(dateTime.toLocalDate());
	}

	public SprintPeriod sprintPeriod(SprintNumber number) {
		LocalDate start = baseSprintStart.plusDays((long) (number.value() - 1) * settings.durationDays());
		LocalDate end = start.plusDays(settings.durationDays() - 1);
		return new SprintPeriod(start, end);
	}

	public Sprint currentSprint(LocalDateTime now) {
		return sprintWithOffset(now, 0);
	}

	public Sprint currentSprint(Clock clock) {
		return currentSprint(LocalDateTime.now(clock));
	}

	/**
	 * Sprint relative to the one containing {@code now}.
	 * @param now reference time
	 * @param offset 0 for the current sprint, -1 for the previous one, 1 for the next
	 * @return the resolved sprint
	 */
	public Sprint sprintWithOffset(LocalDateTime now, int offset) {
		SprintNumber number = sprintNumber(now).plus(offset);
		return new Sprint(number, sprintPeriod(number), offset == 0);
	}

}
