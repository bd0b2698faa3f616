package org.springaicommunity.github.teamhealth;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Evaluates the not yet evaluated issues of a repository on one dimension.
 *
 * <p>
 * Issues are processed in groups of {@code batchConcurrency}, with {@code batchDelay}
 * between groups. Each evaluation gets {@code evaluationTimeout}; one that runs longer is
 * cancelled and reported as a retryable failure, and its result is discarded even if the
 * worker ignores the interrupt and finishes later. A rate limit stops the run and the
 * unprocessed issues are reported as remaining.
 */
public class BatchEvaluationService {

	private static final Logger logger = LoggerFactory.getLogger(BatchEvaluationService.class);

	private final RepositoryStore repositoryStore;

	private final IssueStore issueStore;

	private final EvaluationStore evaluationStore;

	private final EvaluationService evaluationService;

	private final TeamHealthProperties properties;

	public BatchEvaluationService(RepositoryStore repositoryStore, IssueStore issueStore,
			EvaluationStore evaluationStore, EvaluationService evaluationService, TeamHealthProperties properties) {
		this.repositoryStore = repositoryStore;
		this.issueStore = issueStore;
		this.evaluationStore = evaluationStore;
		this.evaluationService = evaluationService;
		this.properties = properties;
	}

	/**
	 * @param repositoryId the repository
	 * @param type the dimension to evaluate
	 * @param limit maximum issues to process, or null for the configured default; capped
	 * at {@code maxBatchLimit}
	 * @return counts and per-issue outcomes, or a failure for an unknown repository or a
	 * non-positive limit
	 */
	public OperationResult<BatchEvaluationResult> evaluate(long repositoryId, EvaluationType type,
			@Nullable Integer limit) {
		if (repositoryStore.findById(repositoryId).isEmpty()) {
			return OperationResult.failure(OperationResult.FailureKind.NOT_FOUND,
					"Repository not found: " + repositoryId);
		}
		int effectiveLimit = limit != null ? limit : properties.getBatchLimit();
		if (effectiveLimit < 1) {
			return OperationResult.failure(OperationResult.FailureKind.INVALID_INPUT,
					"Limit must be positive, got " + effectiveLimit);
		}
		effectiveLimit = Math.min(effectiveLimit, properties.getMaxBatchLimit());

		List<Issue> candidates = findCandidates(repositoryId, type);
		List<Issue> selected = candidates.subList(0, Math.min(effectiveLimit, candidates.size()));
		logger.info("Evaluating {} of {} pending issues for {} (repository {})", selected.size(), candidates.size(),
				type, repositoryId);

		List<BatchItemResult> items = new ArrayList<>();
		boolean rateLimited = false;
		int concurrency = Math.max(1, properties.getBatchConcurrency());
		ExecutorService executor = Executors.newFixedThreadPool(concurrency);
		try {
			for (int start = 0; start < selected.size() && !rateLimited; start += concurrency) {
				if (start > 0 && !pause(properties.getBatchDelay())) {
					break;
				}
				List<Issue> group = selected.subList(start, Math.min(start + concurrency, selected.size()));
				List<BatchItemResult> groupResults = runGroup(executor, group, type);
				items.addAll(groupResults);
				rateLimited = groupResults.stream()
					.anyMatch(r -> r.outcome() instanceof EvaluationOutcome.Failed failed && failed.rateLimited());
			}
		}
		finally {
			executor.shutdownNow();
		}

		if (rateLimited) {
			logger.warn("Rate limit reached; stopping {} evaluation after {} issues", type, items.size());
		}
		int remaining = candidates.size() - items.size();
		BatchEvaluationResult result = BatchEvaluationResult.of(type, items, remaining, rateLimited);
		logger.info("{} evaluation done: {} evaluated, {} skipped, {} failed, {} remaining", type, result.evaluated(),
				result.skipped(), result.failed(), result.remaining());
		return OperationResult.success(result);
	}

	/**
	 * Unevaluated issues of the repository, oldest first. Speed and consistency only
	 * consider closed issues.
	 */
	List<Issue> findCandidates(long repositoryId, EvaluationType type) {
		List<Issue> issues = issueStore.findByRepositoryId(repositoryId);
		if (type != EvaluationType.QUALITY) {
			issues = issues.stream().filter(Issue::isClosed).toList();
		}
		Set<Long> evaluated = new HashSet<>();
		if (!issues.isEmpty()) {
			evaluationStore.findByIssueIds(issues.stream().map(Issue::id).toList())
				.stream()
				.filter(e -> e.hasScore(type))
				.forEach(e -> evaluated.add(e.issueId()));
		}
		return issues.stream()
			.filter(issue -> !evaluated.contains(issue.id()))
			.sorted(Comparator.comparingInt(Issue::githubNumber))
			.toList();
	}

	private List<BatchItemResult> runGroup(ExecutorService executor, List<Issue> group, EvaluationType type) {
		List<Future<EvaluationOutcome>> futures = new ArrayList<>();
		List<AtomicBoolean> claims = new ArrayList<>();
		for (Issue issue : group) {
			// whoever sets the claim first decides: the worker stores, or the batch gives up
			AtomicBoolean claim = new AtomicBoolean();
			claims.add(claim);
			futures.add(executor
				.submit(() -> evaluationService.evaluate(issue, type, () -> claim.compareAndSet(false, true))));
		}
		long deadline = System.nanoTime() + properties.getEvaluationTimeout().toNanos();
		List<BatchItemResult> results = new ArrayList<>();
		for (int i = 0; i < group.size(); i++) {
			Issue issue = group.get(i);
			results.add(new BatchItemResult(issue.id(), issue.githubNumber(),
					await(futures.get(i), claims.get(i), deadline)));
		}
		return results;
	}

	private EvaluationOutcome await(Future<EvaluationOutcome> future, AtomicBoolean claim, long deadline) {
		try {
			return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
		}
		catch (TimeoutException e) {
			if (!claim.compareAndSet(false, true)) {
				// the worker is already storing its result
				return awaitStored(future);
			}
			future.cancel(true);
			return EvaluationOutcome.Failed.from(EvaluationException.timeout("Evaluation"));
		}
		catch (ExecutionException e) {
			return failure(e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			if (!claim.compareAndSet(false, true)) {
				return awaitStored(future);
			}
			future.cancel(true);
			return new EvaluationOutcome.Failed("Interrupted", true, false);
		}
	}

	private static EvaluationOutcome awaitStored(Future<EvaluationOutcome> future) {
		boolean interrupted = Thread.interrupted();
		try {
			while (true) {
				try {
					return future.get();
				}
				catch (InterruptedException e) {
					interrupted = true;
				}
				catch (ExecutionException e) {
					return failure(e);
				}
			}
		}
		finally {
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}

	private static EvaluationOutcome failure(ExecutionException e) {
		Throwable cause = e.getCause() != null ? e.getCause() : e;
		return EvaluationOutcome.Failed.permanent(String.valueOf(cause.getMessage()));
	}

	private static boolean pause(Duration delay) {
		if (delay.isZero() || delay.isNegative()) {
			return true;
		}
		try {
			Thread.sleep(delay.toMillis());
			return true;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

}
