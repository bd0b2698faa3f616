package org.springaicommunity.github.teamhealth;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive date range of a sprint. The end date covers the whole day.
 *
 * @param startDate first day of the sprint
 * @param endDate last day of the sprint
 */
public record SprintPeriod(LocalDate startDate, LocalDate endDate) {

	private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd");

	public SprintPeriod {
		if (endDate.isBefore(startDate)) {
			throw new IllegalArgumentException(
					"Sprint end date " + endDate + " must not be before start date " + startDate);
		}
	}

	public boolean contains(LocalDate date) {
		return !date.isBefore(startDate) && !date.isAfter(endDate);
	}

	public boolean contains(LocalDateTime dateTime) {
		return contains(dateTime.toLocalDate());
	}

	public LocalDateTime startOfPeriod() {
		return startDate.atStartOfDay();
	}

	public LocalDateTime endOfPeriod() {
		return endDate.atTime(LocalTime.MAX);
	}

	public long durationDays() {
		return ChronoUnit.DAYS.between(startDate, endDate) + 1;
	}

	public String format() {
		return DISPLAY_FORMAT.format(startDate) + " - " + DISPLAY_FORMAT.format(endDate);
	}

}
