package org.springaicommunity.github.teamhealth.app.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springaicommunity.github.teamhealth.CategoryScore;
import org.springaicommunity.github.teamhealth.ConsistencyEvaluation;
import org.springaicommunity.github.teamhealth.Deduction;
import org.springaicommunity.github.teamhealth.Evaluation;
import org.springaicommunity.github.teamhealth.EvaluationStore;
import org.springaicommunity.github.teamhealth.LinkedPullRequest;
import org.springaicommunity.github.teamhealth.QualityEvaluation;
import org.springaicommunity.github.teamhealth.SpeedEvaluation;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Evaluation store backed by JPA. Quality and consistency details are kept as JSON
 * documents next to their score.
 */
@Component
@Transactional
public class JpaEvaluationStore implements EvaluationStore {

	private final EvaluationEntityRepository evaluations;

	private final ObjectMapper objectMapper;

	public JpaEvaluationStore(EvaluationEntityRepository evaluations, ObjectMapper objectMapper) {
		this.evaluations = evaluations;
		this.objectMapper = objectMapper;
	}

	@Override
	@Transactional(readOnly = true)
	public Optional<Evaluation> findByIssueId(long issueId) {
		return evaluations.findByIssueId(issueId).map(EvaluationEntity::toEvaluation);
	}

	@Override
	@Transactional(readOnly = true)
	public List<Evaluation> findByIssueIds(Collection<Long> issueIds) {
		if (issueIds.isEmpty()) {
			return List.of();
		}
		return evaluations.findByIssueIdIn(issueIds).stream().map(EvaluationEntity::toEvaluation).toList();
	}

	@Override
	public void saveSpeed(long issueId, SpeedEvaluation evaluation) {
		EvaluationEntity entity = findOrCreate(issueId);
		entity.setSpeed(evaluation.score(), evaluation.grade().name(), evaluation.evaluatedAt());
		evaluations.save(entity);
	}

	@Override
	public void saveQuality(long issueId, QualityEvaluation evaluation) {
		EvaluationEntity entity = findOrCreate(issueId);
		QualityDetails details = new QualityDetails(evaluation.totalScore().value(), evaluation.grade().name(),
				evaluation.categories(), evaluation.overallFeedback(), evaluation.improvementSuggestions(),
				evaluation.evaluatedAt());
		entity.setQuality(evaluation.totalScore().value(), evaluation.grade().name(), toJson(details),
				evaluation.evaluatedAt());
		evaluations.save(entity);
	}

	@Override
	public void saveConsistency(long issueId, ConsistencyEvaluation evaluation) {
		EvaluationEntity entity = findOrCreate(issueId);
		ConsistencyDetails details = new ConsistencyDetails(evaluation.totalScore(), evaluation.grade().name(),
				evaluation.categories(), evaluation.score().deductions(), evaluation.overallFeedback(),
				evaluation.issueImprovementSuggestions(), evaluation.linkedPullRequests(), evaluation.evaluatedAt());
		entity.setConsistency(evaluation.totalScore(), evaluation.grade().name(), toJson(details),
				evaluation.evaluatedAt());
		evaluations.save(entity);
	}

	private EvaluationEntity findOrCreate(long issueId) {
		return evaluations.findByIssueId(issueId).orElseGet(() -> new EvaluationEntity(issueId));
	}

	private String toJson(Object details) {
		try {
			return objectMapper.writeValueAsString(details);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize evaluation details", e);
		}
	}

	record QualityDetails(int totalScore, String grade, List<CategoryScore> categories, String overallFeedback,
			List<String> improvementSuggestions, LocalDateTime evaluatedAt) {
	}

	record ConsistencyDetails(int totalScore, String grade, List<CategoryScore> categories,
			List<Deduction> deductions, String overallFeedback, List<String> issueImprovementSuggestions,
			List<LinkedPullRequest.Reference> linkedPullRequests, LocalDateTime evaluatedAt) {
	}

}
