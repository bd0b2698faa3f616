package org.springaicommunity.github.teamhealth;

import java.util.List;

/**
 * Total of an additive rubric evaluation.
 *
 * @param score the total, 0 to 100
 */
public record QualityScore(Score score) {

	public static QualityScore of(int value) {
		return new QualityScore(Score.of(value));
	}

	/**
	 * Sums category points. A sum above 100 is clamped to exactly 100.
	 * @param categories the category scores
	 * @return the total score
	 */
	public static QualityScore fromCategoryScores(List<CategoryScore> categories) {
		int total = categories.stream().mapToInt(CategoryScore::score).sum();
		return of(Math.min(Score.MAX, total));
	}

	public int value() {
		return score.value();
	}

	public Grade grade() {
		return score.grade();
	}

}
