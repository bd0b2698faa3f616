package org.springaicommunity.github.teamhealth;

/**
 * Points taken off a consistency score, with the reason.
 *
 * @param reason why the points were deducted
 * @param points deducted points, not negative
 */
public record Deduction(String reason, int points) {

	public Deduction {
		if (reason.isBlank()) {
			throw new IllegalArgumentException("Deduction reason must not be blank");
		}
		if (points < 0) {
			throw new IllegalArgumentException("Deduction points must not be negative, got " + points);
		}
	}

}
