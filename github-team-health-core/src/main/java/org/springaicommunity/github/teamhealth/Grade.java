package org.springaicommunity.github.teamhealth;

/**
 * Five-tier letter grade over the 0 to 100 scale. Ranges are contiguous and do not
 * overlap.
 *
 * <p>
 * Used for quality, consistency and lead-time scores. Completion speed has its own
 * scale, see {@link SpeedGrade}.
 */
public enum Grade {

	A(81, 100, "AI Ready"),

	B(61, 80, "Actionable"),

	C(41, 60, "Developing"),

	D(21, 40, "Needs Refinement"),

	E(0, 20, "Incomplete");

	private final int minScore;

	private final int maxScore;

	private final String label;

	Grade(int minScore, int maxScore, String label) {
		this.minScore = minScore;
		this.maxScore = maxScore;
		this.label = label;
	}

	public static Grade fromScore(int score) {
		if (score < Score.MIN || score > Score.MAX) {
			throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
		}
		for (Grade grade : values()) {
			if (score >= grade.minScore) {
				return grade;
			}
		}
		return E;
	}

	public int getMinScore() {
		return minScore;
	}

	public int getMaxScore() {
		return maxScore;
	}

	public String getLabel() {
		return label;
	}

	public boolean isBetterThan(Grade other) {
		return ordinal() < other.ordinal();
	}

}
