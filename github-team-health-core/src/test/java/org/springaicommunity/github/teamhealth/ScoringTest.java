package org.springaicommunity.github.teamhealth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Scoring Tests")
class ScoringTest {

	@Nested
	@DisplayName("Grade Tests")
	class GradeTest {

		@ParameterizedTest(name = "{0} -> {1}")
		@CsvSource({ "0, E", "20, E", "21, D", "40, D", "41, C", "60, C", "61, B", "80, B", "81, A", "100, A" })
		@DisplayName("Grade ranges are contiguous")
		void gradeBoundaries(int score, Grade expected) {
			assertThat(Grade.fromScore(score)).isEqualTo(expected);
		}

		@Test
		@DisplayName("Scores outside 0..100 are rejected")
		void outOfRange() {
			assertThatThrownBy(() -> Grade.fromScore(101)).isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> Score.of(-1)).isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("A is better than E")
		void ordering() {
			assertThat(Grade.A.isBetterThan(Grade.E)).isTrue();
			assertThat(Grade.C.isBetterThan(Grade.B)).isFalse();
			assertThat(Grade.A.getLabel()).isEqualTo("AI Ready");
		}

		@Test
		@DisplayName("Average rounds to the nearest integer")
		void average() {
			assertThat(Score.average(List.of(Score.of(70), Score.of(81)))).isEqualTo(Score.of(76));
			assertThat(Score.average(List.of())).isEqualTo(Score.zero());
		}

	}

	@Nested
	@DisplayName("Quality Rubric Tests")
	class QualityRubricTest {

		@Test
		@DisplayName("Category scores 20, 18, 25 and 15 total 78 (B)")
		void sumsCategories() {
			RubricResponse response = new RubricResponse(List.of(
					new RubricResponse.CategoryAssessment("context-goal", 20, "Clear background"),
					new RubricResponse.CategoryAssessment("implementation-details", 18, "Some gaps"),
					new RubricResponse.CategoryAssessment("acceptance-criteria", 25, "Mostly measurable"),
					new RubricResponse.CategoryAssessment("structure-clarity", 15, "Readable")), "Good", List.of());

			QualityScore score = QualityScore.fromCategoryScores(EvaluationCriteria.QUALITY.normalize(response));

			assertThat(score.value()).isEqualTo(78);
			assertThat(score.grade()).isEqualTo(Grade.B);
		}

		@Test
		@DisplayName("Missing category scores 0 with explanatory feedback")
		void missingCategory() {
			RubricResponse response = new RubricResponse(
					List.of(new RubricResponse.CategoryAssessment("context-goal", 25, "Great")), "Partial",
					List.of());

			List<CategoryScore> scores = EvaluationCriteria.QUALITY.normalize(response);

			assertThat(scores).hasSize(4);
			assertThat(scores).extracting(CategoryScore::categoryId)
				.containsExactly("context-goal", "implementation-details", "acceptance-criteria", "structure-clarity");
			assertThat(scores.get(2).score()).isZero();
			assertThat(scores.get(2).feedback()).isEqualTo(EvaluationCriteria.NOT_EVALUATED_FEEDBACK);
		}

		@Test
		@DisplayName("Out-of-range category scores are clamped to the weight")
		void clampsCategoryScores() {
			RubricResponse response = new RubricResponse(List.of(
					new RubricResponse.CategoryAssessment("context-goal", 40, "Inflated"),
					new RubricResponse.CategoryAssessment("implementation-details", -5, "Negative"),
					new RubricResponse.CategoryAssessment("acceptance-criteria", 30, "Full"),
					new RubricResponse.CategoryAssessment("structure-clarity", 20, "Full")), "", List.of());

			List<CategoryScore> scores = EvaluationCriteria.QUALITY.normalize(response);

			assertThat(scores).extracting(CategoryScore::score).containsExactly(25, 0, 30, 20);
			assertThat(QualityScore.fromCategoryScores(scores).value()).isEqualTo(75);
		}

		@Test
		@DisplayName("Total above 100 is clamped to 100")
		void clampsTotal() {
			List<CategoryScore> inflated = List.of(new CategoryScore("a", "A", 60, 60, ""),
					new CategoryScore("b", "B", 60, 60, ""));

			assertThat(QualityScore.fromCategoryScores(inflated).value()).isEqualTo(100);
		}

		@Test
		@DisplayName("Rubric weights must sum to 100")
		void weightsSumTo100() {
			assertThat(EvaluationCriteria.QUALITY.categories()).extracting(EvaluationCategory::weight)
				.containsExactly(25, 25, 30, 20);
			assertThat(EvaluationCriteria.CONSISTENCY.categories()).extracting(EvaluationCategory::weight)
				.containsExactly(20, 30, 20, 20, 10);
			assertThatThrownBy(() -> new EvaluationCriteria("broken",
					List.of(new EvaluationCategory("only", "Only", 90, "")))).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Consistency Score Tests")
	class ConsistencyScoreTest {

		@Test
		@DisplayName("Deductions are subtracted from 100")
		void fromDeductions() {
			ConsistencyScore score = ConsistencyScore
				.fromDeductions(List.of(new Deduction("Missing tests", 15), new Deduction("Scope creep", 10)));

			assertThat(score.value()).isEqualTo(75);
			assertThat(score.totalDeduction()).isEqualTo(25);
			assertThat(score.grade()).isEqualTo(Grade.B);
		}

		@Test
		@DisplayName("Score is floored at 0")
		void floorsAtZero() {
			ConsistencyScore score = ConsistencyScore.fromDeductions(List.of(new Deduction("Unrelated change", 130)));

			assertThat(score.value()).isZero();
			assertThat(score.grade()).isEqualTo(Grade.E);
		}

		@Test
		@DisplayName("Category view and deduction view agree")
		void categoryAndDeductionViewsAgree() {
			RubricResponse response = new RubricResponse(List.of(
					new RubricResponse.CategoryAssessment("issue-evaluability", 15, "Vague wording"),
					new RubricResponse.CategoryAssessment("requirement-coverage", 30, "All covered"),
					new RubricResponse.CategoryAssessment("scope-appropriateness", 12, "Extra refactoring"),
					new RubricResponse.CategoryAssessment("acceptance-criteria-achievement", 20, "Met"),
					new RubricResponse.CategoryAssessment("pr-description-clarity", 6, "Thin")), "", List.of());
			List<CategoryScore> categories = EvaluationCriteria.CONSISTENCY.normalize(response);

			ConsistencyScore score = ConsistencyScore.fromCategoryScores(categories);

			assertThat(score.value()).isEqualTo(QualityScore.fromCategoryScores(categories).value()).isEqualTo(83);
			assertThat(score.deductions()).extracting(Deduction::points).containsExactly(5, 8, 4);
			assertThat(score.deductions().get(0).reason()).isEqualTo("Issue Evaluability: Vague wording");
		}

		@Test
		@DisplayName("Negative deductions are rejected")
		void negativeDeduction() {
			assertThatThrownBy(() -> new Deduction("x", -1)).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Lead Time Tests")
	class LeadTimeTest {

		@ParameterizedTest(name = "{0} days -> {1}")
		@CsvSource({ "0, 100", "2, 100", "2.5, 80", "3, 80", "4, 60", "5, 40", "5.1, 20", "30, 20" })
		@DisplayName("Lead time maps to the day scale")
		void dayScale(double days, int expected) {
			assertThat(LeadTimeScore.fromDays(days).score().value()).isEqualTo(expected);
		}

		@Test
		@DisplayName("Durations convert through hours")
		void fromDuration() {
			assertThat(LeadTimeScore.fromDuration(Duration.ofHours(72)).score().value()).isEqualTo(80);
			assertThat(LeadTimeScore.fromHours(49).grade()).isEqualTo(Grade.B);
		}

		@Test
		@DisplayName("Negative lead time is rejected")
		void negative() {
			assertThatThrownBy(() -> LeadTimeScore.fromDays(-0.5)).isInstanceOf(IllegalArgumentException.class);
		}

	}

}
