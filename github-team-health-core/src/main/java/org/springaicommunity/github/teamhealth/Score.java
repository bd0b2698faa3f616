package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * Integer score on the 0 to 100 scale shared by quality, consistency and lead-time.
 *
 * @param value the score
 */
public record Score(int value) implements Comparable<Score> {

	public static final int MIN = 0;

	public static final int MAX = 100;

	public Score {
		if (value < MIN || value > MAX) {
			throw new IllegalArgumentException("Score must be between " + MIN + " and " + MAX + ", got " + value);
		}
	}

	public static Score of(int value) {
		return new Score(value);
	}

	public static Score zero() {
		return new Score(MIN);
	}

	public static Score max() {
		return new Score(MAX);
	}

	/**
	 * Rounded mean of the given scores, or zero for an empty list.
	 */
	public static Score average(List<Score> scores) {
		if (scores.isEmpty()) {
			return zero();
		}
		double mean = scores.stream().mapToInt(Score::value).average().orElse(0);
		return new Score((int) Math.round(mean));
	}

	public Grade grade() {
		return Grade.fromScore(value);
	}

	public boolean isHigherThan(Score other) {
		return value > other.value;
	}

	@Override
	public int compareTo(Score other) {
		return Integer.compare(value, other.value);
	}

}
