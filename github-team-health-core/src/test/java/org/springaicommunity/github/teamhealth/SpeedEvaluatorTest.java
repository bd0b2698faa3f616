package org.springaicommunity.github.teamhealth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SpeedEvaluator Tests")
class SpeedEvaluatorTest {

	private static final LocalDateTime CREATED = LocalDateTime.of(2024, 1, 8, 9, 0);

	private final SpeedEvaluator evaluator = new SpeedEvaluator(
			Clock.fixed(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC));

	@Nested
	@DisplayName("Tier Tests")
	class TierTest {

		@Test
		@DisplayName("Closed after 23 hours scores 120 (S)")
		void closedWithinADay() {
			SpeedEvaluation evaluation = evaluator.evaluate(CREATED, CREATED.plusHours(23)).orElseThrow();

			assertThat(evaluation.score()).isEqualTo(120);
			assertThat(evaluation.grade()).isEqualTo(SpeedGrade.S);
			assertThat(evaluation.elapsedHours()).isEqualTo(23.0);
			assertThat(evaluation.evaluatedAt()).isEqualTo(LocalDateTime.of(2024, 2, 1, 0, 0));
		}

		@Test
		@DisplayName("Closed after 216 hours scores 40 (C)")
		void closedAfterNineDays() {
			SpeedEvaluation evaluation = evaluator.evaluate(CREATED, CREATED.plusHours(216)).orElseThrow();

			assertThat(evaluation.score()).isEqualTo(40);
			assertThat(evaluation.grade()).isEqualTo(SpeedGrade.C);
			assertThat(evaluation.message()).isEqualTo(SpeedGrade.C.getMessage());
		}

		@ParameterizedTest(name = "{0} minutes -> {1}")
		@CsvSource({ "0, S", "1440, S", "1441, A", "4320, A", "4321, B", "7200, B", "7201, C" })
		@DisplayName("Tier boundaries are inclusive")
		void boundaries(long minutes, SpeedGrade expected) {
			SpeedEvaluation evaluation = evaluator.evaluate(CREATED, CREATED.plusMinutes(minutes)).orElseThrow();

			assertThat(evaluation.grade()).isEqualTo(expected);
		}

		@Test
		@DisplayName("Longer elapsed time never scores higher")
		void monotonic() {
			int previous = Integer.MAX_VALUE;
			for (int hours = 0; hours <= 300; hours++) {
				int score = evaluator.evaluate(CREATED, CREATED.plusHours(hours)).orElseThrow().score();
				assertThat(score).isLessThanOrEqualTo(previous);
				previous = score;
			}
		}

	}

	@Nested
	@DisplayName("Eligibility Tests")
	class EligibilityTest {

		@Test
		@DisplayName("Open issues are not evaluated")
		void openIssue() {
			Issue issue = TestIssues.open(1, CREATED);

			assertThat(evaluator.evaluate(issue)).isEmpty();
		}

		@Test
		@DisplayName("Missing close time is not evaluated")
		void missingCloseTime() {
			Optional<SpeedEvaluation> evaluation = evaluator.evaluate(CREATED, null);

			assertThat(evaluation).isEmpty();
		}

		@Test
		@DisplayName("Closed issue is evaluated from its timestamps")
		void closedIssue() {
			Issue issue = TestIssues.closed(1, CREATED, CREATED.plusHours(50));

			assertThat(evaluator.evaluate(issue)).get().extracting(SpeedEvaluation::grade).isEqualTo(SpeedGrade.A);
		}

		@Test
		@DisplayName("Close before creation is rejected")
		void negativeElapsedTime() {
			assertThatThrownBy(() -> evaluator.evaluate(CREATED, CREATED.minusMinutes(1)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("before it was created");
		}

	}

}
