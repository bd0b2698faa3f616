package org.springaicommunity.github.teamhealth;

/**
 * Ordinal of a sprint counted from the sprint that contains the repository's base date.
 *
 * <p>
 * {@link #of(int)} is the path for sprints a team is working in and requires a value of
 * at least 1. Dates before the base sprint map to zero or negative numbers, which only
 * {@link #allowingZeroOrNegative(int)} accepts.
 *
 * @param value the sprint ordinal
 */
public record SprintNumber(int value) implements Comparable<SprintNumber> {

	public static SprintNumber of(int value) {
		if (value < 1) {
			throw new IllegalArgumentException("Sprint number must be at least 1, got " + value);
		}
		return new SprintNumber(value);
	}

	public static SprintNumber allowingZeroOrNegative(int value) {
		return new SprintNumber(value);
	}

	public SprintNumber next() {
		return new SprintNumber(value + 1);
	}

	public SprintNumber previous() {
		return new SprintNumber(value - 1);
	}

	public SprintNumber plus(int offset) {
		return new SprintNumber(value + offset);
	}

	@Override
	public int compareTo(SprintNumber other) {
		return Integer.compare(value, other.value);
	}

	@Override
	public String toString() {
		return "Sprint " + value;
	}

}
