package org.springaicommunity.github.teamhealth;

import java.util.ArrayList;
import java.util.List;

/**
 * Deduction view of a consistency evaluation: 100 minus itemized deductions, floored at
 * 0.
 *
 * <p>
 * Evaluations are scored and stored per category; {@link #fromCategoryScores(List)}
 * derives the deductions from the points each category lost, so both forms land on the
 * same {@link Grade}.
 *
 * @param score the resulting score
 * @param deductions the itemized deductions
 */
public record ConsistencyScore(Score score, List<Deduction> deductions) {

	public ConsistencyScore {
		deductions = List.copyOf(deductions);
	}

	public static ConsistencyScore fromDeductions(List<Deduction> deductions) {
		int total = deductions.stream().mapToInt(Deduction::points).sum();
		return new ConsistencyScore(Score.of(Math.max(0, Score.MAX - total)), deductions);
	}

	public static ConsistencyScore fromCategoryScores(List<CategoryScore> categories) {
		List<Deduction> deductions = new ArrayList<>();
		for (CategoryScore category : categories) {
			if (category.lostPoints() > 0) {
				deductions.add(new Deduction(category.categoryName() + ": " + category.feedback(),
						category.lostPoints()));
			}
		}
		int unscored = Score.MAX - categories.stream().mapToInt(CategoryScore::maxScore).sum();
		if (unscored > 0) {
			deductions.add(new Deduction("Categories not covered by the evaluation", unscored));
		}
		return fromDeductions(deductions);
	}

	public static ConsistencyScore fromScore(int value) {
		return new ConsistencyScore(Score.of(value), List.of());
	}

	public int value() {
		return score.value();
	}

	public int totalDeduction() {
		return deductions.stream().mapToInt(Deduction::points).sum();
	}

	public Grade grade() {
		return score.grade();
	}

}
