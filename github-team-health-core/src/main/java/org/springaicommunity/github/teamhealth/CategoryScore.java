package org.springaicommunity.github.teamhealth;

/**
 * Points awarded to one rubric category.
 *
 * @param categoryId the category id
 * @param categoryName the category label
 * @param score awarded points, between 0 and {@code maxScore}
 * @param maxScore the category weight
 * @param feedback explanation of the awarded points
 */
public record CategoryScore(String categoryId, String categoryName, int score, int maxScore, String feedback) {

	public CategoryScore {
		if (maxScore <= 0) {
			throw new IllegalArgumentException("maxScore must be positive for category " + categoryId);
		}
		if (score < 0 || score > maxScore) {
			throw new IllegalArgumentException(
					"Score for category " + categoryId + " must be between 0 and " + maxScore + ", got " + score);
		}
	}

	public int lostPoints() {
		return maxScore - score;
	}

}
