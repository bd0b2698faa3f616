package org.springaicommunity.github.teamhealth.app.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springaicommunity.github.teamhealth.CategoryScore;
import org.springaicommunity.github.teamhealth.ConsistencyEvaluation;
import org.springaicommunity.github.teamhealth.ConsistencyScore;
import org.springaicommunity.github.teamhealth.Evaluation;
import org.springaicommunity.github.teamhealth.EvaluationType;
import org.springaicommunity.github.teamhealth.Grade;
import org.springaicommunity.github.teamhealth.LinkedPullRequest;
import org.springaicommunity.github.teamhealth.QualityEvaluation;
import org.springaicommunity.github.teamhealth.QualityScore;
import org.springaicommunity.github.teamhealth.SpeedEvaluation;
import org.springaicommunity.github.teamhealth.SpeedGrade;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@Import({ JpaEvaluationStore.class, JpaStoreTestConfiguration.class })
@DisplayName("JpaEvaluationStore Tests")
class JpaEvaluationStoreTest {

	private static final LocalDateTime EVALUATED = LocalDateTime.of(2024, 1, 16, 8, 0);

	@Autowired
	private JpaEvaluationStore store;

	@Autowired
	private EvaluationEntityRepository evaluations;

	private static QualityEvaluation quality(int clarity) {
		List<CategoryScore> categories = List.of(new CategoryScore("clarity", "Clarity", clarity, 25, "Clear"),
				new CategoryScore("scope", "Scope", 18, 25, "Mostly scoped"),
				new CategoryScore("acceptance", "Acceptance criteria", 25, 30, "Testable"),
				new CategoryScore("context", "Context", 15, 20, "Some context"));
		QualityScore total = QualityScore.fromCategoryScores(categories);
		return new QualityEvaluation(total, total.grade(), categories, "Solid issue", List.of("Add a screenshot"),
				EVALUATED);
	}

	@Test
	@DisplayName("Slots of one issue share a row")
	void slotsShareRow() {
		store.saveSpeed(3, new SpeedEvaluation(120, SpeedGrade.S, 23, SpeedGrade.S.getMessage(), EVALUATED));
		store.saveQuality(3, quality(20));

		assertThat(evaluations.count()).isEqualTo(1);
		Evaluation evaluation = store.findByIssueId(3).orElseThrow();
		assertThat(evaluation.speedScore()).isEqualTo(120);
		assertThat(evaluation.speedGrade()).isEqualTo("S");
		assertThat(evaluation.qualityScore()).isEqualTo(78);
		assertThat(evaluation.qualityGrade()).isEqualTo("B");
		assertThat(evaluation.hasScore(EvaluationType.CONSISTENCY)).isFalse();
	}

	@Test
	@DisplayName("Quality details are stored as snake_case JSON")
	void qualityDetailsJson() {
		store.saveQuality(3, quality(20));

		String details = store.findByIssueId(3).orElseThrow().qualityDetails();
		assertThat(details).contains("\"total_score\":78")
			.contains("\"overall_feedback\":\"Solid issue\"")
			.contains("\"category_id\":\"clarity\"")
			.contains("\"improvement_suggestions\":[\"Add a screenshot\"]");
	}

	@Test
	@DisplayName("Re-evaluation overwrites only its own slot")
	void reEvaluationOverwrites() {
		store.saveSpeed(3, new SpeedEvaluation(40, SpeedGrade.C, 216, SpeedGrade.C.getMessage(), EVALUATED));
		store.saveQuality(3, quality(20));
		store.saveQuality(3, quality(25));

		Evaluation evaluation = store.findByIssueId(3).orElseThrow();
		assertThat(evaluation.qualityScore()).isEqualTo(83);
		assertThat(evaluation.qualityGrade()).isEqualTo("A");
		assertThat(evaluation.speedScore()).isEqualTo(40);
	}

	@Test
	@DisplayName("Consistency details carry categories, deductions and compared pull requests")
	void consistencyDetailsJson() {
		List<CategoryScore> categories = List.of(new CategoryScore("requirements", "Requirements", 15, 20, "Partly"),
				new CategoryScore("implementation", "Implementation", 30, 30, "Matches"));
		ConsistencyScore score = ConsistencyScore.fromCategoryScores(categories);
		store.saveConsistency(3,
				new ConsistencyEvaluation(score, score.grade(), categories, "Close match", List.of(),
						List.of(new LinkedPullRequest.Reference(11, "Add login", "https://github.com/acme/app/pull/11")),
						EVALUATED));

		Evaluation evaluation = store.findByIssueId(3).orElseThrow();
		assertThat(evaluation.consistencyScore()).isEqualTo(score.value());
		assertThat(evaluation.consistencyGrade()).isEqualTo(Grade.fromScore(score.value()).name());
		assertThat(evaluation.consistencyDetails()).contains("\"deductions\":[")
			.contains("\"points\":5")
			.contains("\"linked_pull_requests\":[{\"number\":11");
	}

	@Test
	@DisplayName("Lookup by several issue ids")
	void findByIssueIds() {
		store.saveSpeed(3, new SpeedEvaluation(120, SpeedGrade.S, 23, SpeedGrade.S.getMessage(), EVALUATED));
		store.saveSpeed(4, new SpeedEvaluation(100, SpeedGrade.A, 48, SpeedGrade.A.getMessage(), EVALUATED));

		assertThat(store.findByIssueIds(List.of(3L, 4L, 5L))).extracting(Evaluation::issueId)
			.containsExactlyInAnyOrder(3L, 4L);
		assertThat(store.findByIssueIds(List.of())).isEmpty();
	}

}
