package org.springaicommunity.github.teamhealth;

/**
 * Completion speed tiers, ordered by ascending upper bound in hours.
 *
 * <p>
 * Speed scores live on their own open scale (up to 120) and are never mapped onto
 * {@link Grade}.
 */
public enum SpeedGrade {

	S(24, 120, "Small, fast increments. Excellent."),

	A(72, 100, "Very healthy development pace."),

	B(120, 70, "The task may be growing too large. Consider splitting it."),

	C(Double.POSITIVE_INFINITY, 40, "Something is probably blocked. Talk to a mentor.");

	private final double maxHours;

	private final int score;

	private final String message;

	SpeedGrade(double maxHours, int score, String message) {
		this.maxHours = maxHours;
		this.score = score;
		this.message = message;
	}

	/**
	 * First tier whose upper bound is at least {@code hours}.
	 * @param hours elapsed hours, not negative
	 * @return the matching tier
	 */
	public static SpeedGrade forHours(double hours) {
		if (hours < 0 || Double.isNaN(hours)) {
			throw new IllegalArgumentException("Elapsed hours must not be negative, got " + hours);
		}
		for (SpeedGrade grade : values()) {
			if (hours <= grade.maxHours) {
				return grade;
			}
		}
		return C;
	}

	public double getMaxHours() {
		return maxHours;
	}

	public int getScore() {
		return score;
	}

	public String getMessage() {
		return message;
	}

}
