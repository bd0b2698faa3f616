package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Evaluates a single issue on one dimension and stores the result.
 *
 * <p>
 * Speed and consistency need a closed issue. Re-evaluating overwrites the previous score
 * of that dimension.
 */
public class EvaluationService {

	private static final Logger logger = LoggerFactory.getLogger(EvaluationService.class);

	private static final BooleanSupplier ALWAYS_STORE = () -> true;

	private final RepositoryStore repositoryStore;

	private final CollaboratorStore collaboratorStore;

	private final IssueStore issueStore;

	private final EvaluationStore evaluationStore;

	private final SpeedEvaluator speedEvaluator;

	private final QualityEvaluator qualityEvaluator;

	private final ConsistencyEvaluator consistencyEvaluator;

	public EvaluationService(RepositoryStore repositoryStore, CollaboratorStore collaboratorStore,
			IssueStore issueStore, EvaluationStore evaluationStore, SpeedEvaluator speedEvaluator,
			QualityEvaluator qualityEvaluator, ConsistencyEvaluator consistencyEvaluator) {
		this.repositoryStore = repositoryStore;
		this.collaboratorStore = collaboratorStore;
		this.issueStore = issueStore;
		this.evaluationStore = evaluationStore;
		this.speedEvaluator = speedEvaluator;
		this.qualityEvaluator = qualityEvaluator;
		this.consistencyEvaluator = consistencyEvaluator;
	}

	public EvaluationOutcome evaluate(long issueId, EvaluationType type) {
		Optional<Issue> found = issueStore.findById(issueId);
		if (found.isEmpty()) {
			return EvaluationOutcome.Failed.permanent("Issue not found: " + issueId);
		}
		return evaluate(found.get(), type);
	}

	public EvaluationOutcome evaluate(Issue issue, EvaluationType type) {
		return evaluate(issue, type, ALWAYS_STORE);
	}

	/**
	 * Evaluate an issue, storing the result only if {@code storeGate} still allows it once
	 * the score is computed.
	 * @param issue the issue
	 * @param type the dimension
	 * @param storeGate asked once, right before the store write; false means the caller
	 * has given up on this evaluation, so nothing is stored and a retryable timeout
	 * failure is returned
	 * @return the outcome
	 */
	public EvaluationOutcome evaluate(Issue issue, EvaluationType type, BooleanSupplier storeGate) {
		try {
			return switch (type) {
				case SPEED -> evaluateSpeed(issue, storeGate);
				case QUALITY -> evaluateQuality(issue, storeGate);
				case CONSISTENCY -> evaluateConsistency(issue, storeGate);
			};
		}
		catch (EvaluationException e) {
			logger.warn("{} evaluation of issue #{} failed: {}", type, issue.githubNumber(), e.getMessage());
			return EvaluationOutcome.Failed.from(e);
		}
		catch (IllegalArgumentException e) {
			logger.warn("{} evaluation of issue #{} rejected: {}", type, issue.githubNumber(), e.getMessage());
			return EvaluationOutcome.Failed.permanent(e.getMessage());
		}
		catch (RuntimeException e) {
			logger.error("{} evaluation of issue #{} failed", type, issue.githubNumber(), e);
			return EvaluationOutcome.Failed.permanent("Failed to store evaluation: " + e.getMessage());
		}
	}

	private EvaluationOutcome evaluateSpeed(Issue issue, BooleanSupplier storeGate) {
		Optional<SpeedEvaluation> evaluation = speedEvaluator.evaluate(issue);
		if (evaluation.isEmpty()) {
			return new EvaluationOutcome.Skipped("Issue is not closed");
		}
		checkGate(storeGate);
		evaluationStore.saveSpeed(issue.id(), evaluation.get());
		return new EvaluationOutcome.Evaluated(evaluation.get().score(), evaluation.get().grade().name());
	}

	private EvaluationOutcome evaluateQuality(Issue issue, BooleanSupplier storeGate) {
		QualityEvaluation evaluation = qualityEvaluator.evaluate(issue, assigneeLogin(issue));
		checkGate(storeGate);
		evaluationStore.saveQuality(issue.id(), evaluation);
		logger.info("Issue #{} quality: {} ({})", issue.githubNumber(), evaluation.totalScore().value(),
				evaluation.grade());
		return new EvaluationOutcome.Evaluated(evaluation.totalScore().value(), evaluation.grade().name());
	}

	private EvaluationOutcome evaluateConsistency(Issue issue, BooleanSupplier storeGate) {
		if (!issue.isClosed()) {
			return new EvaluationOutcome.Skipped("Issue is not closed");
		}
		Optional<TrackedRepository> repository = repositoryStore.findById(issue.repositoryId());
		if (repository.isEmpty()) {
			return EvaluationOutcome.Failed.permanent("Repository not found: " + issue.repositoryId());
		}
		ConsistencyOutcome outcome = consistencyEvaluator.evaluate(repository.get(), issue);
		if (outcome instanceof ConsistencyOutcome.Skipped skipped) {
			return new EvaluationOutcome.Skipped(skipped.reason());
		}
		ConsistencyEvaluation evaluation = ((ConsistencyOutcome.Evaluated) outcome).evaluation();
		checkGate(storeGate);
		evaluationStore.saveConsistency(issue.id(), evaluation);
		logger.info("Issue #{} consistency: {} ({})", issue.githubNumber(), evaluation.totalScore(),
				evaluation.grade());
		return new EvaluationOutcome.Evaluated(evaluation.totalScore(), evaluation.grade().name());
	}

	private @Nullable String assigneeLogin(Issue issue) {
		Long assigneeId = issue.assigneeCollaboratorId();
		if (assigneeId == null) {
			return null;
		}
		return collaboratorStore.findByRepositoryId(issue.repositoryId())
			.stream()
			.filter(c -> c.id() == assigneeId)
			.map(Collaborator::githubUserName)
			.findFirst()
			.orElse(null);
	}

	private static void checkGate(BooleanSupplier storeGate) {
		if (!storeGate.getAsBoolean()) {
			throw EvaluationException.timeout("Evaluation");
		}
	}

}
